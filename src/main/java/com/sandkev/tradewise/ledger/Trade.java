package com.sandkev.tradewise.ledger;

import java.math.BigDecimal;
import java.time.LocalDate;

/** A stored buy or sell. Immutable; {@code id} reflects insertion order and breaks same-day ties. */
public record Trade(
        Long id,
        Long instrumentId,
        String symbol,
        LocalDate tradeDate,
        Side side,
        BigDecimal quantity,
        BigDecimal price,
        BigDecimal fees
) {

    /** Quantity with the side applied: positive for buys, negative for sells. */
    public BigDecimal signedQuantity() {
        return side == Side.BUY ? quantity : quantity.negate();
    }
}
