package com.sandkev.tradewise.sync;

import com.sandkev.tradewise.config.PortfolioProperties;
import com.sandkev.tradewise.instrument.Instrument;
import com.sandkev.tradewise.instrument.InstrumentCategory;
import com.sandkev.tradewise.instrument.InstrumentDirectory;
import com.sandkev.tradewise.marketdata.DailyBar;
import com.sandkev.tradewise.marketdata.KlineSeries;
import com.sandkev.tradewise.marketdata.MarketDataException;
import com.sandkev.tradewise.marketdata.MarketDataProvider;
import com.sandkev.tradewise.price.Ohlc;
import com.sandkev.tradewise.price.PriceBasis;
import com.sandkev.tradewise.price.PricePoint;
import com.sandkev.tradewise.price.PriceStore;
import com.sandkev.tradewise.shared.FiniteNumbers;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Pulls raw, forward-adjusted and backward-adjusted daily bars for a symbol, joins them by
 * date and appends the valid rows to the price store. All three series are fetched before
 * anything is written, so a provider failure changes nothing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PriceSyncService {

    private final MarketDataProvider provider;
    private final InstrumentDirectory instruments;
    private final PriceStore prices;
    private final PortfolioProperties props;

    public SyncResult sync(SyncRequest req) {
        String sym = InstrumentDirectory.normalise(req.symbol());
        Optional<Instrument> existing = instruments.find(sym);
        InstrumentCategory category = req.category() != null
                ? req.category()
                : existing.map(Instrument::getCategory).orElse(InstrumentCategory.EQUITY);
        LocalDate from = startDate(sym, req.start());

        KlineSeries raw, qfq, hfq;
        try {
            raw = provider.dailyBars(sym, category, PriceBasis.RAW, from);
            qfq = provider.dailyBars(sym, category, PriceBasis.QFQ, from);
            hfq = provider.dailyBars(sym, category, PriceBasis.HFQ, from);
        } catch (MarketDataException e) {
            throw new PriceSyncException(sym, "Price source failed for " + sym + ": " + e.getMessage(), e);
        }

        String name = firstNonBlank(req.name(), existing.map(Instrument::getName).orElse(null), raw.name(), qfq.name());
        if (name == null) {
            throw new PriceSyncException(sym, "No display name for " + sym + "; check the symbol and try again");
        }
        Instrument inst = instruments.resolveOrCreate(sym, category, name);

        Map<LocalDate, PricePoint> valid = new TreeMap<>();
        int fetched = 0, rejected = 0;
        for (var e : join(raw, qfq, hfq).entrySet()) {
            fetched++;
            PricePoint p = toPoint(inst.getSymbol(), e.getKey(), e.getValue());
            if (p == null) {
                rejected++;
                log.debug("Rejected invalid bar {}@{}", sym, e.getKey());
            } else {
                valid.put(e.getKey(), p);
            }
        }

        int inserted = 0, skipped = 0;
        try {
            for (PricePoint p : valid.values()) {
                if (prices.upsert(p)) inserted++;
                else skipped++;
            }
        } catch (DataAccessException e) {
            throw new PriceSyncException(sym, "Storing prices for " + sym + " failed after " + inserted + " rows", e);
        }

        if (rejected > 0) log.warn("Sync {}: {} invalid bars rejected", sym, rejected);
        log.info("Sync {} from {}: fetched={} inserted={} existing={} invalid={}",
                sym, from, fetched, inserted, skipped, rejected);
        return new SyncResult(inst.getSymbol(), inst.getName(), from, fetched, inserted, skipped, rejected);
    }

    /** Each symbol on its own; one failing never stops the rest. */
    public BatchSyncResult syncAll(List<SyncRequest> requests) {
        List<SyncResult> synced = new ArrayList<>();
        Map<String, String> failed = new LinkedHashMap<>();
        for (SyncRequest r : requests) {
            try {
                synced.add(sync(r));
            } catch (RuntimeException e) {
                log.warn("Sync of '{}' failed: {}", r.symbol(), e.toString(), e);
                failed.put(String.valueOf(r.symbol()), e.getMessage());
            }
        }
        return new BatchSyncResult(synced, failed);
    }

    // ---- helpers ----

    private LocalDate startDate(String symbol, @Nullable LocalDate explicit) {
        if (explicit != null) return explicit;
        return prices.latestDate(symbol)
                .map(d -> d.plusDays(1))
                .orElseGet(props::defaultSyncStartDate);
    }

    private record Joined(@Nullable DailyBar raw, @Nullable DailyBar qfq, @Nullable DailyBar hfq) {
        Joined with(PriceBasis basis, DailyBar bar) {
            return switch (basis) {
                case RAW -> new Joined(bar, qfq, hfq);
                case QFQ -> new Joined(raw, bar, hfq);
                case HFQ -> new Joined(raw, qfq, bar);
            };
        }
    }

    /** Outer join of the three series on date. */
    private static Map<LocalDate, Joined> join(KlineSeries raw, KlineSeries qfq, KlineSeries hfq) {
        Map<LocalDate, Joined> out = new TreeMap<>();
        put(out, PriceBasis.RAW, raw);
        put(out, PriceBasis.QFQ, qfq);
        put(out, PriceBasis.HFQ, hfq);
        return out;
    }

    private static void put(Map<LocalDate, Joined> out, PriceBasis basis, KlineSeries series) {
        for (DailyBar b : series.bars()) {
            out.merge(b.date(), new Joined(null, null, null).with(basis, b), (old, n) -> old.with(basis, b));
        }
    }

    /** Null when the row fails validation: raw required, every present price > 0, volume >= 0. */
    @Nullable
    private static PricePoint toPoint(String symbol, LocalDate date, Joined j) {
        Ohlc raw = ohlc(j.raw());
        if (raw == null) return null;
        if (j.qfq() != null && ohlc(j.qfq()) == null) return null;
        if (j.hfq() != null && ohlc(j.hfq()) == null) return null;
        if (!FiniteNumbers.isNonNegative(j.raw().volume())) return null;
        return new PricePoint(symbol, date, raw, ohlc(j.qfq()), ohlc(j.hfq()), j.raw().volume());
    }

    @Nullable
    private static Ohlc ohlc(@Nullable DailyBar b) {
        if (b == null) return null;
        Ohlc o = new Ohlc(b.open(), b.high(), b.low(), b.close());
        return o.isPositive() ? o : null;
    }

    @Nullable
    private static String firstNonBlank(String... candidates) {
        for (String c : candidates) {
            if (c != null && !c.isBlank()) return c.trim();
        }
        return null;
    }
}
