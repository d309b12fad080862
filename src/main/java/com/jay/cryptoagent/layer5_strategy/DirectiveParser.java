package com.jay.cryptoagent.layer5_strategy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jay.cryptoagent.config.AgentConfig;
import com.jay.cryptoagent.layer3_signal.JsonObjects;
import com.jay.cryptoagent.model.CeoDirective;
import com.jay.cryptoagent.model.enums.MarketRegime;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls a directive out of the briefing reply: fenced ceo-directive block, then an object ending
 * after a "marketRegime" member, then the last top-level object carrying any directive key.
 * Missing fields fall back to neutral defaults; validity is always 24h from parsing.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DirectiveParser {

    static final Duration VALIDITY = Duration.ofHours(24);

    private static final Pattern FENCED = Pattern.compile("```ceo-directive\\s*\\n([\\s\\S]*?)\\n```");
    private static final Pattern TRAILING_REGIME =
        Pattern.compile("\\{[\\s\\S]*\"marketRegime\"\\s*:\\s*\"[\\s\\S]*\"\\s*}\\s*$");

    private final ObjectMapper objectMapper;
    private final AgentConfig config;
    private final Clock clock;

    public CeoDirective parse(String text) {
        if (text == null || text.isBlank()) return null;

        Matcher fenced = FENCED.matcher(text);
        if (fenced.find()) {
            JsonNode raw = readTree(fenced.group(1).trim());
            if (raw != null && raw.isObject()) return finalizeParsed(raw);
        }

        Matcher trailing = TRAILING_REGIME.matcher(text);
        if (trailing.find()) {
            JsonNode raw = readTree(trailing.group());
            if (raw != null && raw.isObject()) return finalizeParsed(raw);
        }

        String last = JsonObjects.lastTopLevelObject(text);
        if (last != null) {
            JsonNode raw = readTree(last);
            if (raw != null && (raw.has("marketRegime") || raw.has("overallBias") || raw.has("coins"))) {
                return finalizeParsed(raw);
            }
        }
        return null;
    }

    CeoDirective finalizeParsed(JsonNode raw) {
        Instant now = clock.instant();
        return CeoDirective.builder()
            .generatedAt(now)
            .validUntil(now.plus(VALIDITY))
            .modelUsed(config.reasoning().getCeoModel())
            .marketRegime(MarketRegime.from(text(raw, "marketRegime", "neutral")))
            .overallBias(text(raw, "overallBias", "neutral"))
            .riskLevel(raw.hasNonNull("riskLevel") ? raw.get("riskLevel").asInt(5) : 5)
            .coins(convert(raw.get("coins"), new TypeReference<LinkedHashMap<String, CeoDirective.CoinGuidance>>() {},
                new LinkedHashMap<>()))
            .keyLevels(convert(raw.get("keyLevels"), new TypeReference<LinkedHashMap<String, CeoDirective.KeyLevels>>() {},
                new LinkedHashMap<>()))
            .riskGuidelines(text(raw, "riskGuidelines", ""))
            .avoid(convert(raw.get("avoid"), new TypeReference<ArrayList<String>>() {}, new ArrayList<>()))
            .escalationTriggers(convert(raw.get("escalationTriggers"), new TypeReference<ArrayList<String>>() {},
                new ArrayList<>()))
            .summary(text(raw, "summary", ""))
            .build();
    }

    private JsonNode readTree(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.debug("Directive candidate did not parse: {}", e.getOriginalMessage());
            return null;
        }
    }

    private <T> T convert(JsonNode node, TypeReference<T> type, T fallback) {
        if (node == null || node.isNull()) return fallback;
        try {
            T value = objectMapper.convertValue(node, type);
            return value != null ? value : fallback;
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring malformed directive field: {}", e.getMessage());
            return fallback;
        }
    }

    private static String text(JsonNode raw, String field, String fallback) {
        JsonNode node = raw.get(field);
        if (node == null || node.isNull() || node.asText().isBlank()) return fallback;
        return node.asText();
    }
}
