package com.jay.cryptoagent.model;

import java.time.Instant;

/**
 * Last-trade snapshot for one symbol. Optional fields are null when the exchange does not report them.
 */
public record Ticker(
    String symbol,
    double last,
    Double bid,
    Double ask,
    Double high,
    Double low,
    Double percentage,
    Double baseVolume,
    Instant timestamp
) {}
