package com.sandkev.tradewise.ledger;

import com.sandkev.tradewise.instrument.Instrument;
import com.sandkev.tradewise.instrument.InstrumentCategory;
import com.sandkev.tradewise.instrument.InstrumentDirectory;
import com.sandkev.tradewise.shared.FiniteNumbers;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;

/**
 * Deduplicated record of buys and sells. Imports are idempotent: replaying the same rows
 * leaves the ledger unchanged and reports them as duplicates.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TradeLedger {

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("yyyy/MM/dd"),
            DateTimeFormatter.BASIC_ISO_DATE
    );

    // trade amounts are stored as decimal(38,8)
    private static final int AMOUNT_INTEGER_DIGITS = 30;
    private static final int AMOUNT_SCALE = 8;

    private final TradeDao trades;
    private final InstrumentDirectory instruments;

    public ImportResult importRows(List<TradeRow> rows) {
        if (rows == null || rows.isEmpty()) return ImportResult.empty();

        int imported = 0, duplicates = 0, nonTrading = 0, malformed = 0;
        int line = 0;
        for (TradeRow row : rows) {
            line++;
            if (row.type() == null || row.type().isBlank()) {
                malformed++;
                log.warn("Row {}: rejected row without a type {}", line, row);
                continue;
            }
            Optional<Side> side = Side.parse(row.type());
            if (side.isEmpty()) {
                nonTrading++;
                log.debug("Row {}: non-trading type '{}' filtered", line, row.type());
                continue;
            }

            Valid v = validate(row, side.get());
            if (v == null) {
                malformed++;
                log.warn("Row {}: rejected malformed row {}", line, row);
                continue;
            }

            boolean inserted;
            try {
                Instrument inst = instruments.resolveOrCreate(v.symbol(), InstrumentCategory.EQUITY, null);
                inserted = trades.insertIfAbsent(inst.getSymbol(), v.date(), v.side(), v.quantity(), v.price(), v.fees());
            } catch (DataIntegrityViolationException e) {
                malformed++;
                log.warn("Row {}: storage rejected {}: {}", line, row, e.getMostSpecificCause().getMessage());
                continue;
            }
            if (inserted) {
                imported++;
            } else {
                duplicates++;
                log.debug("Row {}: duplicate {} {} {} on {}", line, v.symbol(), v.side(), v.quantity(), v.date());
            }
        }

        log.info("Trade import: total={} imported={} duplicates={} nonTrading={} malformed={}",
                rows.size(), imported, duplicates, nonTrading, malformed);
        return new ImportResult("success", rows.size(), imported, duplicates, nonTrading, malformed);
    }

    /** Every trade in replay order: date ascending, then insertion. */
    public List<Trade> all() {
        return trades.findAllOrdered();
    }

    public List<Trade> forInstrument(String symbol) {
        return trades.findBySymbol(InstrumentDirectory.normalise(symbol));
    }

    public List<Instrument> instrumentsWithTrades() {
        return instruments.withTrades();
    }

    // ---- validation ----

    private record Valid(String symbol, LocalDate date, Side side, BigDecimal quantity, BigDecimal price, BigDecimal fees) {}

    private static Valid validate(TradeRow row, Side side) {
        if (row.symbol() == null || row.symbol().isBlank()) return null;
        String symbol = row.symbol().trim();
        if (symbol.length() > Instrument.MAX_SYMBOL_LENGTH) return null;

        LocalDate date = parseDate(row.date());
        if (date == null) return null;

        // positivity is checked after rounding to the stored scale
        BigDecimal qty = amount(row.quantity());
        BigDecimal price = amount(row.price());
        if (!FiniteNumbers.isPositive(qty) || !FiniteNumbers.isPositive(price)) return null;

        BigDecimal fees = BigDecimal.ZERO;
        if (row.fees() != null && !row.fees().isBlank()) {
            fees = amount(row.fees());
            if (!FiniteNumbers.isNonNegative(fees)) return null;
        }
        return new Valid(symbol, date, side, qty, price, fees);
    }

    private static BigDecimal amount(String s) {
        return FiniteNumbers.parse(s)
                .flatMap(x -> FiniteNumbers.fitTo(x, AMOUNT_INTEGER_DIGITS, AMOUNT_SCALE))
                .orElse(null);
    }

    static LocalDate parseDate(String s) {
        if (s == null || s.isBlank()) return null;
        String t = s.trim();
        // tolerate exports that append a time component
        int space = t.indexOf(' ');
        if (space > 0) t = t.substring(0, space);
        for (DateTimeFormatter f : DATE_FORMATS) {
            try {
                return LocalDate.parse(t, f);
            } catch (DateTimeParseException ignored) {
                // try next format
            }
        }
        return null;
    }
}
