package com.sandkev.tradewise.sync;

import java.time.LocalDate;

public record SyncResult(
        String symbol,
        String name,
        LocalDate from,
        int fetched,
        int inserted,
        int skippedExisting,
        int rejectedInvalid
) {}
