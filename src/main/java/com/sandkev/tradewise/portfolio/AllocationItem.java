package com.sandkev.tradewise.portfolio;

import java.math.BigDecimal;

public record AllocationItem(
        String symbol,
        String name,
        BigDecimal quantity,
        BigDecimal price,
        BigDecimal value,
        BigDecimal percentage
) {}
