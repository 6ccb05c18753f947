package com.sandkev.tradewise.instrument;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One write lock per instrument symbol. Trade inserts, price upserts and instrument creation
 * for the same symbol run one at a time; different symbols proceed in parallel.
 * Locks are reentrant, so a writer holding the lock may resolve its instrument again.
 * <p>
 * Locks are weakly held: an entry stays while some writer references it and is collected
 * afterwards, so symbols seen once (including rejected ones) do not accumulate.
 */
@Component
public class InstrumentWriteLocks {

    private final LoadingCache<String, ReentrantLock> locks = Caffeine.newBuilder()
            .weakValues()
            .build(k -> new ReentrantLock());

    public <T> T withLock(String symbol, Supplier<T> work) {
        ReentrantLock lock = locks.get(key(symbol));
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    private static String key(String symbol) {
        if (symbol == null || symbol.isBlank()) throw new IllegalArgumentException("symbol is required");
        return symbol.trim().toUpperCase(Locale.ROOT);
    }
}
