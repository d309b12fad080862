package com.jay.cryptoagent.reasoning;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.jay.cryptoagent.config.AgentConfig;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Anthropic Messages API client over OkHttp.
 * Sends a single user turn with a system prompt and returns the concatenated text blocks.
 * Tools are never sent.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnthropicReasoningClient implements ReasoningClient {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final String API_VERSION = "2023-06-01";

    private final AgentConfig config;
    private final ObjectMapper mapper = new ObjectMapper();
    private OkHttpClient httpClient;

    @PostConstruct
    public void init() {
        int timeout = config.reasoning().getTimeoutSeconds();
        this.httpClient = new OkHttpClient.Builder()
            .connectTimeout(10, TimeUnit.SECONDS)
            .readTimeout(timeout, TimeUnit.SECONDS)
            .writeTimeout(30, TimeUnit.SECONDS)
            .build();
    }

    @Override
    public boolean isConfigured() {
        String key = config.reasoning().getApiKey();
        return key != null && !key.isBlank();
    }

    @Override
    public String generate(String model, String systemPrompt, String userPrompt, int historyLimit, boolean toolsAllowed) {
        if (!isConfigured()) {
            throw new ReasoningException("No reasoning API key configured");
        }
        if (toolsAllowed) {
            log.debug("Tool use requested but not supported, sending without tools");
        }

        ObjectNode body = mapper.createObjectNode()
            .put("model", model)
            .put("max_tokens", config.reasoning().getMaxTokens())
            .put("system", systemPrompt);
        ArrayNode messages = body.putArray("messages");
        messages.addObject().put("role", "user").put("content", userPrompt);

        Request request = new Request.Builder()
            .url(config.reasoning().getBaseUrl() + "/v1/messages")
            .header("x-api-key", config.reasoning().getApiKey())
            .header("anthropic-version", API_VERSION)
            .post(RequestBody.create(body.toString(), JSON))
            .build();

        long start = System.currentTimeMillis();
        try (Response response = httpClient.newCall(request).execute()) {
            String raw = response.body() != null ? response.body().string() : "";
            if (!response.isSuccessful()) {
                throw new ReasoningException("Reasoning service HTTP " + response.code() + ": " + truncate(raw, 300));
            }
            String text = extractText(mapper.readTree(raw));
            log.info("Reasoning reply from {} in {} ms ({} chars)", model, System.currentTimeMillis() - start, text.length());
            return text;
        } catch (IOException e) {
            throw new ReasoningException("Reasoning request failed: " + e.getMessage(), e);
        }
    }

    static String extractText(JsonNode root) {
        StringBuilder sb = new StringBuilder();
        for (JsonNode block : root.path("content")) {
            if ("text".equals(block.path("type").asText())) {
                sb.append(block.path("text").asText(""));
            }
        }
        return sb.toString();
    }

    private static String truncate(String s, int max) {
        return s.length() > max ? s.substring(0, max) : s;
    }
}
