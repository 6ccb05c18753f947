package com.sandkev.tradewise.chart;

import com.sandkev.tradewise.instrument.Instrument;
import com.sandkev.tradewise.instrument.InstrumentDirectory;
import com.sandkev.tradewise.ledger.Trade;
import com.sandkev.tradewise.ledger.TradeLedger;
import com.sandkev.tradewise.price.PriceStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
public class ChartService {

    private final InstrumentDirectory instruments;
    private final PriceStore prices;
    private final TradeLedger ledger;

    /** Full price history plus one marker per trade, both ascending. */
    public ChartData chart(String symbol) {
        Instrument inst = instruments.require(symbol);

        List<PriceView> series = prices.series(inst.getSymbol()).stream()
                .map(PriceView::of)
                .toList();
        List<TradeMarker> markers = ledger.forInstrument(inst.getSymbol()).stream()
                .map(ChartService::marker)
                .toList();

        return new ChartData(inst.getSymbol(), inst.getName(), inst.getCategory(), series, markers);
    }

    private static TradeMarker marker(Trade t) {
        return new TradeMarker(t.tradeDate(), t.side(), t.side() + " " + t.quantity().stripTrailingZeros().toPlainString());
    }
}
