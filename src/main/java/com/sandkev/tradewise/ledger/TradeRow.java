package com.sandkev.tradewise.ledger;

import com.fasterxml.jackson.annotation.JsonAlias;

/** One unvalidated import row, as strings straight from a CSV line or JSON body. */
public record TradeRow(
        String date,
        String symbol,
        @JsonAlias("side") String type,
        String quantity,
        String price,
        String fees
) {}
