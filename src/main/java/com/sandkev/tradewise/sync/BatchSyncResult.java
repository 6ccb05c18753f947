package com.sandkev.tradewise.sync;

import java.util.List;
import java.util.Map;

/** Per-symbol outcome of a batch: successes in request order, failures keyed by symbol. */
public record BatchSyncResult(List<SyncResult> synced, Map<String, String> failed) {}
