package com.sandkev.tradewise.chart;

import com.sandkev.tradewise.instrument.InstrumentCategory;

import java.util.List;

public record ChartData(
        String symbol,
        String name,
        InstrumentCategory category,
        List<PriceView> prices,
        List<TradeMarker> markers
) {}
