package com.sandkev.tradewise.price;

/** Adjustment basis of a price quadruple. */
public enum PriceBasis {
    /** As traded. */
    RAW,
    /** Forward-adjusted: history restated relative to today's price. */
    QFQ,
    /** Backward-adjusted: later prices restated relative to the listing price. */
    HFQ
}
