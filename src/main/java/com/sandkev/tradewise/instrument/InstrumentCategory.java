package com.sandkev.tradewise.instrument;

import java.util.Locale;

public enum InstrumentCategory {
    EQUITY, FUND, FUTURE;

    /** Accepts enum names plus the short forms statements and the SPA use ("stock", "etf"). */
    public static InstrumentCategory parse(String s) {
        if (s == null || s.isBlank()) return EQUITY;
        return switch (s.trim().toLowerCase(Locale.ROOT)) {
            case "equity", "stock" -> EQUITY;
            case "fund", "etf" -> FUND;
            case "future", "futures" -> FUTURE;
            default -> throw new IllegalArgumentException("Unknown instrument category: " + s);
        };
    }
}
