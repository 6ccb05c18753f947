package com.sandkev.tradewise.chart;

import com.sandkev.tradewise.ledger.Side;

import java.time.LocalDate;

public record TradeMarker(LocalDate time, Side side, String label) {}
