package com.jay.cryptoagent.model.enums;

public enum PositionSide {
    LONG,
    SHORT
}
