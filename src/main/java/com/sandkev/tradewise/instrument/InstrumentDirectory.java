package com.sandkev.tradewise.instrument;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Keyed lookup-with-upsert over instruments. Symbols are the identity; an unknown symbol
 * is created on first reference and never removed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InstrumentDirectory {

    private final InstrumentRepository repo;
    private final InstrumentWriteLocks locks;

    /**
     * Returns the instrument for {@code symbol}, creating it when unknown.
     * A missing display name is filled from {@code name}; an existing one is kept.
     */
    public Instrument resolveOrCreate(String symbol, InstrumentCategory category, @Nullable String name) {
        String sym = normalise(symbol);
        return locks.withLock(sym, () -> {
            Instrument found = repo.findBySymbol(sym).orElse(null);
            if (found == null) {
                found = create(sym, category, name);
            } else if (!found.hasName() && name != null && !name.isBlank()) {
                found.setName(name.trim());
                found = repo.save(found);
                log.info("Filled display name for {}: {}", sym, found.getName());
            }
            return found;
        });
    }

    public Optional<Instrument> find(String symbol) {
        if (symbol == null || symbol.isBlank()) return Optional.empty();
        return repo.findBySymbol(normalise(symbol));
    }

    public Instrument require(String symbol) {
        return find(symbol).orElseThrow(() -> new InstrumentNotFoundException(symbol));
    }

    public List<Instrument> all() {
        return repo.findAllByOrderBySymbolAsc();
    }

    public List<Instrument> withTrades() {
        return repo.findWithTrades();
    }

    /** Snapshot keyed by symbol, for valuation passes that look up many instruments. */
    public Map<String, Instrument> bySymbol() {
        var out = new LinkedHashMap<String, Instrument>();
        for (Instrument i : all()) out.put(i.getSymbol(), i);
        return out;
    }

    public static String normalise(String symbol) {
        if (symbol == null || symbol.isBlank()) throw new IllegalArgumentException("symbol is required");
        String sym = symbol.trim();
        if (sym.length() > Instrument.MAX_SYMBOL_LENGTH) {
            throw new IllegalArgumentException("symbol longer than " + Instrument.MAX_SYMBOL_LENGTH + " characters: " + sym);
        }
        return sym;
    }

    private Instrument create(String sym, InstrumentCategory category, @Nullable String name) {
        String displayName = (name == null || name.isBlank()) ? null : name.trim();
        try {
            Instrument created = repo.saveAndFlush(new Instrument(sym, displayName, category));
            log.info("Created instrument {} ({}, name={})", sym, category, displayName);
            return created;
        } catch (DataIntegrityViolationException e) {
            // another process inserted the same symbol first
            log.debug("Instrument {} created concurrently, re-reading", sym);
            return repo.findBySymbol(sym).orElseThrow(() -> e);
        }
    }
}
