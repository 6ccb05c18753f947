package com.sandkev.tradewise.portfolio;

import java.math.BigDecimal;
import java.time.LocalDate;

/** Total portfolio value at the end of one calendar date. */
public record EquityPoint(LocalDate time, BigDecimal value) {}
