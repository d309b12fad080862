package com.jay.cryptoagent.model.enums;

/** Origin of an executed order, recorded on every trade log row. */
public enum TradeSource {
    SENTINEL,
    USER,
    STOP_LOSS,
    TAKE_PROFIT;

    public String label() {
        return name().toLowerCase();
    }
}
