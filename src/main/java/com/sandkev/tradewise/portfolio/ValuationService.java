package com.sandkev.tradewise.portfolio;

import com.sandkev.tradewise.config.PortfolioProperties;
import com.sandkev.tradewise.instrument.Instrument;
import com.sandkev.tradewise.instrument.InstrumentDirectory;
import com.sandkev.tradewise.ledger.Trade;
import com.sandkev.tradewise.ledger.TradeLedger;
import com.sandkev.tradewise.price.PriceBasis;
import com.sandkev.tradewise.price.PricePoint;
import com.sandkev.tradewise.price.PriceStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class ValuationService {

    private static final MathContext MC = MathContext.DECIMAL64;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final TradeLedger ledger;
    private final PriceStore prices;
    private final InstrumentDirectory instruments;
    private final HoldingsCalculator holdings;
    private final PortfolioProperties props;
    private final Clock clock;

    /**
     * Open positions valued at the latest close on or before today.
     * Instruments without a display name are left out of both the items and the total.
     */
    public PortfolioSummary summary() {
        LocalDate today = LocalDate.now(clock);
        List<Trade> trades = ledger.all();
        warnOversold(trades, today);

        Map<String, BigDecimal> open = holdings.currentHoldings(trades, today);
        if (open.isEmpty()) return PortfolioSummary.empty();

        Map<String, Instrument> bySymbol = instruments.bySymbol();
        PriceBasis basis = props.valuationBasis();

        record Valued(String symbol, String name, BigDecimal qty, BigDecimal price, BigDecimal value) {}
        List<Valued> valued = new ArrayList<>();
        BigDecimal total = BigDecimal.ZERO;

        for (var e : open.entrySet()) {
            Instrument inst = bySymbol.get(e.getKey());
            if (inst == null || !inst.hasName()) {
                log.debug("Skipping {} in summary: no display name", e.getKey());
                continue;
            }
            BigDecimal price = priceOf(prices.latestBefore(e.getKey(), today).orElse(null), basis);
            BigDecimal value = e.getValue().multiply(price, MC);
            total = total.add(value, MC);
            valued.add(new Valued(e.getKey(), inst.getName(), e.getValue(), price, value));
        }

        List<AllocationItem> items = new ArrayList<>(valued.size());
        for (Valued v : valued) {
            items.add(new AllocationItem(v.symbol(), v.name(), v.qty(), v.price(), v.value(), percentage(v.value(), total)));
        }
        return new PortfolioSummary(items, total);
    }

    /** Signed holdings as of {@code asOf} (today when null), with oversold symbols listed. */
    public HoldingsReport holdingsReport(@Nullable LocalDate asOf) {
        LocalDate at = asOf != null ? asOf : LocalDate.now(clock);
        List<Trade> trades = ledger.all();
        return new HoldingsReport(at, holdings.holdingsAsOf(trades, at), holdings.oversold(trades, at));
    }

    // ---- helpers ----

    private void warnOversold(List<Trade> trades, LocalDate today) {
        List<String> oversold = holdings.oversold(trades, today);
        if (!oversold.isEmpty()) {
            log.warn("Oversold positions (sold more than bought): {}", oversold);
        }
    }

    private static BigDecimal priceOf(@Nullable PricePoint p, PriceBasis basis) {
        return p == null ? BigDecimal.ZERO : p.close(basis);
    }

    static BigDecimal percentage(BigDecimal value, BigDecimal total) {
        if (total.signum() == 0) return BigDecimal.ZERO;
        return value.divide(total, MC).multiply(HUNDRED, MC);
    }
}
