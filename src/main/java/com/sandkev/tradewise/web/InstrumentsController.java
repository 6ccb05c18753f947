package com.sandkev.tradewise.web;

import com.sandkev.tradewise.instrument.Instrument;
import com.sandkev.tradewise.instrument.InstrumentCategory;
import com.sandkev.tradewise.instrument.InstrumentDirectory;
import com.sandkev.tradewise.ledger.TradeLedger;
import com.sandkev.tradewise.sync.BatchSyncResult;
import com.sandkev.tradewise.sync.PriceSyncService;
import com.sandkev.tradewise.sync.SyncRequest;
import com.sandkev.tradewise.sync.SyncResult;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;

/** Instruments ("assets" on the wire) and their price sync. */
@RestController
@RequestMapping("/assets")
@RequiredArgsConstructor
class InstrumentsController {

    private final InstrumentDirectory instruments;
    private final TradeLedger ledger;
    private final PriceSyncService sync;

    record AssetView(Long id, String symbol, String name, InstrumentCategory category) {
        static AssetView of(Instrument i) {
            return new AssetView(i.getId(), i.getSymbol(), i.getName(), i.getCategory());
        }
    }

    record SyncResponse(String status, String message, SyncResult result) {}

    /** Batch item; {@code asset_type} takes the same words as the single-sync query parameter. */
    record SyncItem(String symbol, String assetType, String name, LocalDate start) {
        SyncRequest toRequest() {
            return new SyncRequest(symbol, assetType == null ? null : InstrumentCategory.parse(assetType), name, start);
        }
    }

    @GetMapping
    List<AssetView> all() {
        return instruments.all().stream().map(AssetView::of).toList();
    }

    @GetMapping("/with-transactions")
    List<AssetView> withTransactions() {
        return ledger.instrumentsWithTrades().stream().map(AssetView::of).toList();
    }

    // POST /assets/sync/600519?asset_type=stock&name=...&start=2024-01-01
    @PostMapping("/sync/{symbol}")
    SyncResponse syncOne(@PathVariable("symbol") String symbol,
                         @RequestParam(name = "asset_type", required = false) String assetType,
                         @RequestParam(name = "name", required = false) String name,
                         @RequestParam(name = "start", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start) {
        InstrumentCategory category = assetType == null ? null : InstrumentCategory.parse(assetType);
        SyncResult r = sync.sync(new SyncRequest(symbol, category, name, start));
        return new SyncResponse("success", "Synced " + r.inserted() + " new prices for " + r.symbol(), r);
    }

    @PostMapping("/sync")
    BatchSyncResult syncMany(@RequestBody List<SyncItem> items) {
        return sync.syncAll(items.stream().map(SyncItem::toRequest).toList());
    }
}
