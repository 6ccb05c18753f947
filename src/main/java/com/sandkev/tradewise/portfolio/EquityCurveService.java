package com.sandkev.tradewise.portfolio;

import com.sandkev.tradewise.config.PortfolioProperties;
import com.sandkev.tradewise.ledger.Trade;
import com.sandkev.tradewise.ledger.TradeLedger;
import com.sandkev.tradewise.price.PriceCursor;
import com.sandkev.tradewise.price.PriceStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashSet;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class EquityCurveService {

    private final TradeLedger ledger;
    private final PriceStore prices;
    private final PortfolioProperties props;
    private final Clock clock;

    /** Daily portfolio value from the first trade date up to today. Empty ledger gives an empty curve. */
    public List<EquityPoint> equityCurve() {
        List<Trade> trades = ledger.all();
        if (trades.isEmpty()) return List.of();

        LocalDate today = LocalDate.now(clock);
        LocalDate floor = trades.get(0).tradeDate();
        List<LocalDate> calendar = prices.datesUnion(floor).stream()
                .filter(d -> !d.isAfter(today))
                .toList();

        var symbols = new LinkedHashSet<String>();
        for (Trade t : trades) symbols.add(t.symbol());
        PriceCursor cursor = PriceCursor.over(prices.seriesFor(symbols));

        List<EquityPoint> curve = EquityCurveReconstructor.reconstruct(trades, calendar, cursor, props.valuationBasis());
        log.debug("Equity curve: {} trades, {} dates from {}", trades.size(), curve.size(), floor);
        return curve;
    }
}
