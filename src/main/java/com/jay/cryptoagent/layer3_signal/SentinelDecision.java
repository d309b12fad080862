package com.jay.cryptoagent.layer3_signal;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Parsed sentinel-output block. Sentiment is kept as raw JSON since its shape is per-coin and
 * only stored, never acted on.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SentinelDecision(
    JsonNode sentiment,
    List<String> signals,
    List<SentinelAction> actions,
    String summary
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SentinelAction(String type, String symbol, Double amount, String reason) {

        public boolean isHold() {
            return type == null || "hold".equalsIgnoreCase(type.trim());
        }
    }
}
