package com.jay.cryptoagent.model.enums;

public enum PositionStatus {
    OPEN,
    CLOSED,
    STOPPED_OUT,
    TOOK_PROFIT;

    public String label() {
        return name().toLowerCase();
    }
}
