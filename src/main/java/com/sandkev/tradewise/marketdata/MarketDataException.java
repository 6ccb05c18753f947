package com.sandkev.tradewise.marketdata;

/** Upstream price source failed: transport error, bad status, unknown symbol or unusable payload. */
public class MarketDataException extends RuntimeException {

    public MarketDataException(String message) {
        super(message);
    }

    public MarketDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
