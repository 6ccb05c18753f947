package com.sandkev.tradewise.price;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Append-only daily price history per instrument. */
public interface PriceStore {

    /**
     * Inserts {@code point} unless its (instrument, date) already exists.
     * @return true if a row was written; false for an existing key (never overwritten)
     */
    boolean upsert(PricePoint point);

    /** Most recent point dated on or before {@code date}. */
    Optional<PricePoint> latestBefore(String symbol, LocalDate date);

    /** Sorted distinct dates with any price, across all instruments, on or after {@code floor}. */
    List<LocalDate> datesUnion(LocalDate floor);

    /** Full ascending series for one instrument. */
    List<PricePoint> series(String symbol);

    /** Ascending series per symbol; symbols without history map to an empty list. */
    Map<String, List<PricePoint>> seriesFor(Collection<String> symbols);

    /** Date of the newest stored point, used as the incremental sync watermark. */
    Optional<LocalDate> latestDate(String symbol);
}
