package com.sandkev.tradewise.testsupport;

import com.sandkev.tradewise.instrument.Instrument;
import com.sandkev.tradewise.instrument.InstrumentCategory;
import com.sandkev.tradewise.ledger.Side;
import com.sandkev.tradewise.ledger.Trade;
import com.sandkev.tradewise.price.Ohlc;
import com.sandkev.tradewise.price.PricePoint;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.time.LocalDate;

/** Terse builders for trades, prices and instruments in unit tests. */
public final class Fixtures {

    private Fixtures() {}

    public static Trade buy(long id, String symbol, String date, String qty, String price) {
        return trade(id, symbol, date, Side.BUY, qty, price);
    }

    public static Trade sell(long id, String symbol, String date, String qty, String price) {
        return trade(id, symbol, date, Side.SELL, qty, price);
    }

    public static Trade trade(long id, String symbol, String date, Side side, String qty, String price) {
        return new Trade(id, 1L, symbol, LocalDate.parse(date), side,
                new BigDecimal(qty), new BigDecimal(price), BigDecimal.ZERO);
    }

    /** Flat bar: open = high = low = close. */
    public static PricePoint close(String symbol, String date, String close) {
        var c = new BigDecimal(close);
        return new PricePoint(symbol, LocalDate.parse(date), new Ohlc(c, c, c, c), null, null, BigDecimal.ZERO);
    }

    public static PricePoint closes(String symbol, String date, String raw, String qfq) {
        var r = new BigDecimal(raw);
        var q = new BigDecimal(qfq);
        return new PricePoint(symbol, LocalDate.parse(date), new Ohlc(r, r, r, r), new Ohlc(q, q, q, q), null, BigDecimal.ZERO);
    }

    public static Instrument instrument(long id, String symbol, String name) {
        var i = new Instrument(symbol, name, InstrumentCategory.EQUITY);
        ReflectionTestUtils.setField(i, "id", id);
        return i;
    }
}
