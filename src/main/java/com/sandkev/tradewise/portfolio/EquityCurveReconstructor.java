package com.sandkev.tradewise.portfolio;

import com.sandkev.tradewise.ledger.Trade;
import com.sandkev.tradewise.price.PriceBasis;
import com.sandkev.tradewise.price.PriceCursor;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Single ascending sweep over a price calendar.
 * <p>
 * A ledger cursor applies each trade once, when the sweep first reaches its date, so running
 * quantities are never recomputed from scratch. Each nonzero position is priced through the
 * {@link PriceCursor} with carry-forward; a position with no earlier price counts as 0.
 * Every calendar date yields a point, zero-valued ones included.
 */
public final class EquityCurveReconstructor {

    private static final MathContext MC = MathContext.DECIMAL64;

    private static final Comparator<Trade> REPLAY_ORDER = Comparator
            .comparing(Trade::tradeDate)
            .thenComparing(Trade::id, Comparator.nullsLast(Comparator.naturalOrder()));

    private EquityCurveReconstructor() {}

    public static List<EquityPoint> reconstruct(List<Trade> trades,
                                                List<LocalDate> calendar,
                                                PriceCursor prices,
                                                PriceBasis basis) {
        if (trades.isEmpty()) return List.of();

        List<Trade> ordered = new ArrayList<>(trades);
        ordered.sort(REPLAY_ORDER);

        Map<String, BigDecimal> running = new HashMap<>();
        List<EquityPoint> curve = new ArrayList<>(calendar.size());
        int next = 0;

        for (LocalDate d : calendar) {
            while (next < ordered.size() && !ordered.get(next).tradeDate().isAfter(d)) {
                Trade t = ordered.get(next++);
                running.merge(t.symbol(), t.signedQuantity(), BigDecimal::add);
            }

            BigDecimal total = BigDecimal.ZERO;
            for (var e : running.entrySet()) {
                if (e.getValue().signum() == 0) continue;
                var px = prices.latestAtOrBefore(e.getKey(), d);
                if (px.isEmpty()) continue; // not priced yet
                total = total.add(e.getValue().multiply(px.get().close(basis), MC), MC);
            }
            curve.add(new EquityPoint(d, total));
        }
        return curve;
    }
}
