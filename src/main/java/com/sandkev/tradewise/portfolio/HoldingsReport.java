package com.sandkev.tradewise.portfolio;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/** Raw signed holdings for diagnostics; includes closed and oversold positions. */
public record HoldingsReport(LocalDate asOf, Map<String, BigDecimal> holdings, List<String> oversold) {}
