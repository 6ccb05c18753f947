package com.sandkev.tradewise.price;

import java.time.LocalDate;
import java.util.*;

/**
 * Carry-forward price lookup for one ascending date sweep.
 * <p>
 * Each instrument keeps its own position in its series, so a sweep over N calendar dates
 * costs O(N + points) in total rather than a search per date. Queries for a symbol must not
 * go back in time. Instances belong to a single computation and are not thread-safe.
 */
public final class PriceCursor {

    private final Map<String, List<PricePoint>> series;
    private final Map<String, Integer> positions = new HashMap<>();
    private final Map<String, LocalDate> lastAsked = new HashMap<>();

    private PriceCursor(Map<String, List<PricePoint>> series) {
        this.series = series;
    }

    public static PriceCursor over(Map<String, List<PricePoint>> seriesBySymbol) {
        var sorted = new HashMap<String, List<PricePoint>>();
        seriesBySymbol.forEach((sym, pts) -> {
            var copy = new ArrayList<>(pts);
            copy.sort(Comparator.comparing(PricePoint::date));
            sorted.put(sym, copy);
        });
        return new PriceCursor(sorted);
    }

    /** Latest point for {@code symbol} dated on or before {@code date}; empty if none yet. */
    public Optional<PricePoint> latestAtOrBefore(String symbol, LocalDate date) {
        LocalDate prev = lastAsked.get(symbol);
        if (prev != null && date.isBefore(prev)) {
            throw new IllegalArgumentException("Price cursor for " + symbol + " cannot rewind from " + prev + " to " + date);
        }
        lastAsked.put(symbol, date);

        List<PricePoint> pts = series.getOrDefault(symbol, List.of());
        int pos = positions.getOrDefault(symbol, -1);
        while (pos + 1 < pts.size() && !pts.get(pos + 1).date().isAfter(date)) pos++;
        positions.put(symbol, pos);

        return pos < 0 ? Optional.empty() : Optional.of(pts.get(pos));
    }
}
