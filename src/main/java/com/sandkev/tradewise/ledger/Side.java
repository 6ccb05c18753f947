package com.sandkev.tradewise.ledger;

import java.util.Locale;
import java.util.Optional;

public enum Side {
    BUY, SELL;

    /** Case-insensitive; anything else (dividend, transfer, fee line) is not a trade. */
    public static Optional<Side> parse(String s) {
        if (s == null) return Optional.empty();
        return switch (s.trim().toLowerCase(Locale.ROOT)) {
            case "buy", "b" -> Optional.of(BUY);
            case "sell", "s" -> Optional.of(SELL);
            default -> Optional.empty();
        };
    }
}
