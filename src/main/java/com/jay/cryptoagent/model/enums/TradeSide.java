package com.jay.cryptoagent.model.enums;

public enum TradeSide {
    BUY,
    SELL;

    public String label() {
        return name().toLowerCase();
    }

    public static TradeSide from(String value) {
        return TradeSide.valueOf(value.trim().toUpperCase());
    }
}
