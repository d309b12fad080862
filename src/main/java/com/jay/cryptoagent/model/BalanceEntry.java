package com.jay.cryptoagent.model;

public record BalanceEntry(String currency, double total, double free) {}
