package com.sandkev.tradewise.price;

import org.springframework.lang.Nullable;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/**
 * One daily bar for one instrument, keyed by (symbol, date).
 * The raw quadruple is always present; adjusted quadruples are absent when the source had none.
 */
public record PricePoint(
        String symbol,
        LocalDate date,
        Ohlc raw,
        @Nullable Ohlc qfq,
        @Nullable Ohlc hfq,
        BigDecimal volume
) {

    public PricePoint {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(raw, "raw");
        if (volume == null) volume = BigDecimal.ZERO;
    }

    @Nullable
    public Ohlc ohlc(PriceBasis basis) {
        return switch (basis) {
            case RAW -> raw;
            case QFQ -> qfq;
            case HFQ -> hfq;
        };
    }

    /** Close on {@code basis}, falling back to the raw close when that basis is missing. */
    public BigDecimal close(PriceBasis basis) {
        Ohlc q = ohlc(basis);
        return (q != null && q.close() != null) ? q.close() : raw.close();
    }
}
