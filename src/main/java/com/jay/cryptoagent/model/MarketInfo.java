package com.jay.cryptoagent.model;

public record MarketInfo(
    String symbol,
    String base,
    String quote,
    boolean active,
    double minAmount,
    double amountStep,
    double minCost
) {}
