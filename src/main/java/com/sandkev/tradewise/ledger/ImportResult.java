package com.sandkev.tradewise.ledger;

/** Counters for one import batch. Always a success; per-row problems only move counters. */
public record ImportResult(
        String status,
        int totalRows,
        int imported,
        int skippedDuplicates,
        int filteredNonTrading,
        int rejectedMalformed
) {

    public static ImportResult empty() {
        return new ImportResult("success", 0, 0, 0, 0, 0);
    }
}
