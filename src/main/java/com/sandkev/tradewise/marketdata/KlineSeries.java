package com.sandkev.tradewise.marketdata;

import org.springframework.lang.Nullable;

import java.util.List;

/** Chronological daily bars for one symbol on one price basis. */
public record KlineSeries(String symbol, @Nullable String name, List<DailyBar> bars) {}
