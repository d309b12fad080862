package com.jay.cryptoagent.layer3_signal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the structured decision from free-form reasoning output. Tried in order: the fenced
 * sentinel-output block, an object that ends with a "summary" member, the last top-level object.
 * Returns null when none of them parse.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SentinelOutputParser {

    private static final Pattern FENCED = Pattern.compile("```sentinel-output\\s*\\n([\\s\\S]*?)\\n```");
    private static final Pattern TRAILING_SUMMARY = Pattern.compile("\\{[\\s\\S]*\"summary\"\\s*:\\s*\"[\\s\\S]*\"\\s*}\\s*$");

    private final ObjectMapper objectMapper;

    public SentinelDecision parse(String text) {
        if (text == null || text.isBlank()) return null;

        Matcher fenced = FENCED.matcher(text);
        if (fenced.find()) {
            SentinelDecision decision = read(fenced.group(1).trim());
            if (decision != null) return decision;
        }

        Matcher trailing = TRAILING_SUMMARY.matcher(text);
        if (trailing.find()) {
            SentinelDecision decision = read(trailing.group());
            if (decision != null) return decision;
        }

        String last = JsonObjects.lastTopLevelObject(text);
        if (last != null) {
            return read(last);
        }
        return null;
    }

    private SentinelDecision read(String json) {
        try {
            return objectMapper.readValue(json, SentinelDecision.class);
        } catch (JsonProcessingException e) {
            log.debug("Sentinel output candidate did not parse: {}", e.getOriginalMessage());
            return null;
        }
    }
}
