package com.jay.cryptoagent.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.jay.cryptoagent.model.enums.MarketRegime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Daily strategic directive issued by the CEO overlay and consumed by the Sentinel prompt.
 * Valid for 24h from generation; a new directive replaces the previous one entirely.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CeoDirective {

    private Instant generatedAt;
    private Instant validUntil;
    private String modelUsed;

    @Builder.Default
    private MarketRegime marketRegime = MarketRegime.NEUTRAL;
    @Builder.Default
    private String overallBias = "neutral";   // bullish/bearish/neutral
    @Builder.Default
    private int riskLevel = 5;                // 1-10

    @Builder.Default
    private Map<String, CoinGuidance> coins = new LinkedHashMap<>();      // keyed by coin, e.g. BTC
    @Builder.Default
    private Map<String, KeyLevels> keyLevels = new LinkedHashMap<>();     // keyed by symbol, e.g. BTC/USD

    @Builder.Default
    private String riskGuidelines = "";
    @Builder.Default
    private List<String> avoid = new ArrayList<>();
    @Builder.Default
    private List<String> escalationTriggers = new ArrayList<>();
    @Builder.Default
    private String summary = "";

    public boolean isExpired(Instant now) {
        return validUntil == null || validUntil.isBefore(now);
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CoinGuidance {
        private String bias = "neutral";
        private String action = "";
        private double maxPositionPct;
        private String notes = "";
    }

    /** Zones are [low, high] pairs. */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class KeyLevels {
        private List<Double> buyZone = new ArrayList<>();
        private List<Double> sellZone = new ArrayList<>();

        public Double buyLow() {
            return buyZone != null && !buyZone.isEmpty() ? buyZone.get(0) : null;
        }

        public Double sellHigh() {
            return sellZone != null && sellZone.size() > 1 ? sellZone.get(1) : null;
        }
    }
}
