package com.jay.cryptoagent.layer2_analysis;

/** Thrown when a candle series is too short to compute indicators from. */
public class InsufficientDataException extends RuntimeException {

    public InsufficientDataException(String message) {
        super(message);
    }
}
