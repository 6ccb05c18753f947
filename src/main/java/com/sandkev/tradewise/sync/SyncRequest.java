package com.sandkev.tradewise.sync;

import com.sandkev.tradewise.instrument.InstrumentCategory;
import org.springframework.lang.Nullable;

import java.time.LocalDate;

/**
 * What to sync. {@code category} null means keep the stored one (EQUITY for new symbols);
 * {@code start} null means continue after the newest stored price.
 */
public record SyncRequest(
        String symbol,
        @Nullable InstrumentCategory category,
        @Nullable String name,
        @Nullable LocalDate start
) {

    public static SyncRequest of(String symbol) {
        return new SyncRequest(symbol, null, null, null);
    }
}
