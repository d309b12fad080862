package com.jay.cryptoagent.model.enums;

public enum VolumeTrend {
    INCREASING,
    DECREASING,
    STABLE;

    public String label() {
        return name().toLowerCase();
    }
}
