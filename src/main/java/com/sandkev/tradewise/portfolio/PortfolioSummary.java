package com.sandkev.tradewise.portfolio;

import java.math.BigDecimal;
import java.util.List;

public record PortfolioSummary(List<AllocationItem> items, BigDecimal totalValue) {

    public static PortfolioSummary empty() {
        return new PortfolioSummary(List.of(), BigDecimal.ZERO);
    }
}
