package com.jay.cryptoagent.layer3_signal;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;

/** Number and age formatting shared by the Sentinel and CEO prompts. */
public final class PromptFormat {

    private PromptFormat() {}

    /** "$1234.57" */
    public static String usd(double value) {
        return String.format("$%.2f", value);
    }

    /** "+$12.50" / "-$3.00" */
    public static String signedUsd(double value) {
        return String.format("%s$%.2f", value >= 0 ? "+" : "-", Math.abs(value));
    }

    /** Plain decimal without trailing zeros or exponent: 0.0005, 1.5, 100. */
    public static String amount(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    public static String truncate(String text, int max) {
        if (text == null) return "";
        return text.length() > max ? text.substring(0, max - 3) + "..." : text;
    }

    public static String timeAgo(LocalDateTime then, LocalDateTime now) {
        if (then == null) return "unknown";
        long minutes = Duration.between(then, now).toMinutes();
        if (minutes < 1) return "just now";
        if (minutes < 60) return minutes + "min ago";
        long hours = minutes / 60;
        if (hours < 24) return hours + "h ago";
        return (hours / 24) + "d ago";
    }
}
