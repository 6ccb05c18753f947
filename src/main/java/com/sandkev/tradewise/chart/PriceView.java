package com.sandkev.tradewise.chart;

import com.sandkev.tradewise.price.Ohlc;
import com.sandkev.tradewise.price.PricePoint;

import java.math.BigDecimal;
import java.time.LocalDate;

/** Flat per-day row for charting; adjusted fields are null where the store has none. */
public record PriceView(
        LocalDate time,
        BigDecimal open, BigDecimal high, BigDecimal low, BigDecimal close,
        BigDecimal qfqOpen, BigDecimal qfqHigh, BigDecimal qfqLow, BigDecimal qfqClose,
        BigDecimal hfqOpen, BigDecimal hfqHigh, BigDecimal hfqLow, BigDecimal hfqClose,
        BigDecimal volume
) {

    static PriceView of(PricePoint p) {
        Ohlc r = p.raw(), q = p.qfq(), h = p.hfq();
        return new PriceView(p.date(),
                r.open(), r.high(), r.low(), r.close(),
                q == null ? null : q.open(), q == null ? null : q.high(),
                q == null ? null : q.low(), q == null ? null : q.close(),
                h == null ? null : h.open(), h == null ? null : h.high(),
                h == null ? null : h.low(), h == null ? null : h.close(),
                p.volume());
    }
}
