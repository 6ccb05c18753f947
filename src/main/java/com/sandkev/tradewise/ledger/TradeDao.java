package com.sandkev.tradewise.ledger;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

public interface TradeDao {

    /**
     * Inserts a trade unless one with the same (instrument, date, side, quantity, price) exists.
     * Fees are stored but not compared.
     * @return true if a row was written
     */
    boolean insertIfAbsent(String symbol, LocalDate tradeDate, Side side,
                           BigDecimal quantity, BigDecimal price, BigDecimal fees);

    /** All trades by date ascending, then insertion id. */
    List<Trade> findAllOrdered();

    List<Trade> findBySymbol(String symbol);
}
