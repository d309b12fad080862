package com.jay.cryptoagent.model.enums;

public enum Trend {
    BULLISH,
    BEARISH,
    NEUTRAL;

    public String label() {
        return name().toLowerCase();
    }
}
