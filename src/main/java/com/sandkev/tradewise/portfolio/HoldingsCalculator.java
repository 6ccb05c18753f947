package com.sandkev.tradewise.portfolio;

import com.sandkev.tradewise.ledger.Trade;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Signed quantity per instrument from a list of trades. Pure: no storage access, and the
 * result does not depend on the order the trades are given in.
 */
@Component
public class HoldingsCalculator {

    /** Net quantity per symbol over trades dated on or before {@code asOf}; zero and negative kept. */
    public Map<String, BigDecimal> holdingsAsOf(List<Trade> trades, LocalDate asOf) {
        Map<String, BigDecimal> out = new TreeMap<>();
        for (Trade t : trades) {
            if (t.tradeDate().isAfter(asOf)) continue;
            out.merge(t.symbol(), t.signedQuantity(), BigDecimal::add);
        }
        return out;
    }

    /** Open positions only: strictly positive quantities as of {@code today}. */
    public Map<String, BigDecimal> currentHoldings(List<Trade> trades, LocalDate today) {
        Map<String, BigDecimal> out = new TreeMap<>();
        holdingsAsOf(trades, today).forEach((sym, qty) -> {
            if (qty.signum() > 0) out.put(sym, qty);
        });
        return out;
    }

    /** Symbols sold beyond what was bought as of {@code asOf}. */
    public List<String> oversold(List<Trade> trades, LocalDate asOf) {
        return holdingsAsOf(trades, asOf).entrySet().stream()
                .filter(e -> e.getValue().signum() < 0)
                .map(Map.Entry::getKey)
                .toList();
    }
}
