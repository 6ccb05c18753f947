package com.sandkev.tradewise.marketdata;

import org.springframework.lang.Nullable;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One daily row as the provider returned it. A field is null when the provider sent
 * something that is not a finite number; validation happens in price sync.
 */
public record DailyBar(
        LocalDate date,
        @Nullable BigDecimal open,
        @Nullable BigDecimal high,
        @Nullable BigDecimal low,
        @Nullable BigDecimal close,
        @Nullable BigDecimal volume
) {}
