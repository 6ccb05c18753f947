package com.sandkev.tradewise.price;

import com.sandkev.tradewise.shared.FiniteNumbers;

import java.math.BigDecimal;

public record Ohlc(BigDecimal open, BigDecimal high, BigDecimal low, BigDecimal close) {

    public boolean isPositive() {
        return FiniteNumbers.isPositive(open) && FiniteNumbers.isPositive(high)
                && FiniteNumbers.isPositive(low) && FiniteNumbers.isPositive(close);
    }
}
