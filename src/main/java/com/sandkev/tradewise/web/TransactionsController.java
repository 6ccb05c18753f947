package com.sandkev.tradewise.web;

import com.sandkev.tradewise.ledger.ImportResult;
import com.sandkev.tradewise.ledger.Trade;
import com.sandkev.tradewise.ledger.TradeCsvReader;
import com.sandkev.tradewise.ledger.TradeLedger;
import com.sandkev.tradewise.ledger.TradeRow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;

@Slf4j
@RestController
@RequestMapping("/transactions")
@RequiredArgsConstructor
class TransactionsController {

    private final TradeLedger ledger;
    private final TradeCsvReader csv;

    @PostMapping(path = "/import", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    ImportResult importCsv(@RequestParam("file") MultipartFile file) {
        if (file == null || file.isEmpty()) return ImportResult.empty();
        log.info("Importing transactions from {} ({} bytes)", file.getOriginalFilename(), file.getSize());
        try (InputStream in = file.getInputStream()) {
            return ledger.importRows(csv.read(in));
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read upload " + file.getOriginalFilename(), e);
        }
    }

    @PostMapping(path = "/import/rows", consumes = MediaType.APPLICATION_JSON_VALUE)
    ImportResult importRows(@RequestBody List<TradeRow> rows) {
        return ledger.importRows(rows);
    }

    @GetMapping
    List<Trade> all() { return ledger.all(); }
}
