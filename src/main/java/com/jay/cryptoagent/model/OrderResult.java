package com.jay.cryptoagent.model;

import lombok.Builder;

import java.time.Instant;

/**
 * Exchange order as reported back after create/fetch/cancel.
 * Status is normalised to open, closed, canceled, expired or rejected.
 */
@Builder
public record OrderResult(
    String id,
    String symbol,
    String type,
    String side,
    double amount,
    Double price,
    Double average,
    double filled,
    double remaining,
    Double cost,
    String status,
    Instant timestamp
) {
    public boolean isCanceledOrExpired() {
        return "canceled".equals(status) || "expired".equals(status) || "rejected".equals(status);
    }

    /**
     * Base amount actually executed. Some responses omit the fill count on a completed order,
     * in which case the full order amount (or the requested amount) is assumed.
     */
    public double filledAmount(double requested) {
        if (filled > 0) return filled;
        if ("closed".equals(status)) return amount > 0 ? amount : requested;
        return 0;
    }

    /** Best known fill price: average, then order price, then the supplied fallback. */
    public double fillPrice(double fallback) {
        if (average != null && average > 0) return average;
        if (price != null && price > 0) return price;
        return fallback;
    }
}
