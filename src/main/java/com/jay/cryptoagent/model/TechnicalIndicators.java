package com.jay.cryptoagent.model;

import com.jay.cryptoagent.model.enums.Trend;
import com.jay.cryptoagent.model.enums.VolumeTrend;

import java.util.List;

/**
 * Indicator snapshot for one symbol on one timeframe. Serialised as-is into Sentinel run history.
 */
public record TechnicalIndicators(
    String symbol,
    String timeframe,
    double price,
    double sma7,
    double sma20,
    double sma50,
    double ema12,
    double ema26,
    double rsi14,
    double macd,
    double macdSignal,
    double macdHistogram,
    double support,
    double resistance,
    VolumeTrend volumeTrend,
    Trend trend,
    List<String> signals
) {
    public String rsiLabel() {
        return rsi14 < 30 ? "oversold" : rsi14 > 70 ? "overbought" : "neutral";
    }

    public String macdLabel() {
        return macdHistogram > 0 ? "bullish" : "bearish";
    }

    public String coin() {
        int slash = symbol.indexOf('/');
        return slash > 0 ? symbol.substring(0, slash) : symbol;
    }
}
