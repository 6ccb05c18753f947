package com.sandkev.tradewise.marketdata;

import com.sandkev.tradewise.instrument.InstrumentCategory;
import com.sandkev.tradewise.price.PriceBasis;

import java.time.LocalDate;

public interface MarketDataProvider {

    /**
     * Daily bars for {@code symbol} from {@code start} (inclusive) to the latest available day.
     * @throws MarketDataException when the source fails or does not know the symbol
     */
    KlineSeries dailyBars(String symbol, InstrumentCategory category, PriceBasis basis, LocalDate start);
}
