package com.sandkev.tradewise.testsupport;

import com.sandkev.tradewise.price.PricePoint;
import com.sandkev.tradewise.price.PriceStore;

import java.time.LocalDate;
import java.util.*;

public class InMemoryPriceStore implements PriceStore {

    private final Map<String, TreeMap<LocalDate, PricePoint>> bySymbol = new HashMap<>();

    public InMemoryPriceStore with(PricePoint... points) {
        for (PricePoint p : points) upsert(p);
        return this;
    }

    @Override
    public boolean upsert(PricePoint p) {
        return bySymbol.computeIfAbsent(p.symbol(), k -> new TreeMap<>()).putIfAbsent(p.date(), p) == null;
    }

    @Override
    public Optional<PricePoint> latestBefore(String symbol, LocalDate date) {
        var s = bySymbol.get(symbol);
        if (s == null) return Optional.empty();
        var e = s.floorEntry(date);
        return e == null ? Optional.empty() : Optional.of(e.getValue());
    }

    @Override
    public List<LocalDate> datesUnion(LocalDate floor) {
        var dates = new TreeSet<LocalDate>();
        bySymbol.values().forEach(s -> dates.addAll(s.tailMap(floor, true).keySet()));
        return new ArrayList<>(dates);
    }

    @Override
    public List<PricePoint> series(String symbol) {
        return new ArrayList<>(bySymbol.getOrDefault(symbol, new TreeMap<>()).values());
    }

    @Override
    public Map<String, List<PricePoint>> seriesFor(Collection<String> symbols) {
        var out = new LinkedHashMap<String, List<PricePoint>>();
        for (String s : symbols) out.put(s, series(s));
        return out;
    }

    @Override
    public Optional<LocalDate> latestDate(String symbol) {
        var s = bySymbol.get(symbol);
        return (s == null || s.isEmpty()) ? Optional.empty() : Optional.of(s.lastKey());
    }
}
