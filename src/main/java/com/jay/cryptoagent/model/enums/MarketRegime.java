package com.jay.cryptoagent.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Market regime as classified by the daily strategic directive. */
public enum MarketRegime {
    RISK_ON("risk-on"),
    RISK_OFF("risk-off"),
    NEUTRAL("neutral"),
    VOLATILE("volatile");

    private final String label;

    MarketRegime(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static MarketRegime from(String value) {
        if (value == null) return NEUTRAL;
        for (MarketRegime r : values()) {
            if (r.label.equalsIgnoreCase(value.trim())) return r;
        }
        return NEUTRAL;
    }
}
