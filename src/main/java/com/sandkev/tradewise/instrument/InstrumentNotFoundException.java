package com.sandkev.tradewise.instrument;

public class InstrumentNotFoundException extends RuntimeException {
    public InstrumentNotFoundException(String symbol) {
        super("Instrument not found: " + symbol);
    }
}
