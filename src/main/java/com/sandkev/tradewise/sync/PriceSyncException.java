package com.sandkev.tradewise.sync;

import lombok.Getter;

@Getter
public class PriceSyncException extends RuntimeException {

    private final String symbol;

    public PriceSyncException(String symbol, String message) {
        super(message);
        this.symbol = symbol;
    }

    public PriceSyncException(String symbol, String message, Throwable cause) {
        super(message, cause);
        this.symbol = symbol;
    }
}
