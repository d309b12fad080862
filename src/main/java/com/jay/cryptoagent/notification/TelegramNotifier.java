package com.jay.cryptoagent.notification;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jay.cryptoagent.config.AgentConfig;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.*;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Telegram Bot API client.
 * Sends notifications via sendMessage and polls for commands via getUpdates.
 * All interaction uses OkHttp — no Telegram SDK dependency.
 *
 * Messages longer than Telegram's limit are cut to 4000 characters. Without a bot token and chat
 * id every call is a no-op.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TelegramNotifier implements Notifier {

    private static final String API_BASE = "https://api.telegram.org/bot";
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    static final int MAX_LENGTH = 4000;
    // Persists the update offset so a restart does not replay old commands
    private static final Path OFFSET_FILE =
        Path.of(System.getProperty("user.home"), ".crypto-agent-telegram-offset");

    private final AgentConfig config;
    private final ObjectMapper mapper = new ObjectMapper();
    private OkHttpClient httpClient;
    private long lastUpdateId = 0;

    private final List<Consumer<TelegramMessage>> messageHandlers = new CopyOnWriteArrayList<>();

    public record TelegramMessage(long chatId, long messageId, String text, String username) {}

    @PostConstruct
    public void init() {
        this.httpClient = new OkHttpClient.Builder()
            .connectTimeout(10, TimeUnit.SECONDS)
            .readTimeout(30, TimeUnit.SECONDS)
            .build();
        try {
            if (Files.exists(OFFSET_FILE)) {
                lastUpdateId = Long.parseLong(Files.readString(OFFSET_FILE).trim());
                log.info("TelegramNotifier: restored update offset {} from disk", lastUpdateId);
            }
        } catch (Exception e) {
            log.warn("TelegramNotifier: could not read offset file ({}), starting from 0", e.getMessage());
        }
        log.info("TelegramNotifier initialized. Bot configured: {}", isConfigured());
    }

    public boolean isConfigured() {
        String token = config.telegram().getBotToken();
        String chatId = config.telegram().getChatId();
        return token != null && !token.isBlank() && chatId != null && !chatId.isBlank();
    }

    // ── Sending ────────────────────────────────────────────────────────────────

    @Override
    public void send(String message) {
        if (!isConfigured()) {
            log.debug("Telegram not configured, notification dropped: {}", firstLine(message));
            return;
        }
        sendMessageTo(config.telegram().getChatId(), truncate(message));
    }

    static String truncate(String text) {
        if (text == null) return "";
        return text.length() > MAX_LENGTH ? text.substring(0, MAX_LENGTH - 3) + "..." : text;
    }

    private boolean sendMessageTo(String chatId, String text) {
        try {
            // Plain text: messages carry model output that may contain stray markup
            String payload = mapper.createObjectNode()
                .put("chat_id", chatId)
                .put("text", text)
                .toString();

            Request request = new Request.Builder()
                .url(API_BASE + config.telegram().getBotToken() + "/sendMessage")
                .post(RequestBody.create(payload, JSON))
                .build();

            try (Response response = httpClient.newCall(request).execute()) {
                if (response.isSuccessful()) {
                    log.debug("Telegram message sent successfully");
                    return true;
                }
                log.error("Telegram sendMessage failed: {} {}",
                    response.code(), response.body() != null ? response.body().string() : "");
                return false;
            }
        } catch (IOException e) {
            log.error("Telegram sendMessage exception: {}", e.getMessage());
            return false;
        }
    }

    // ── Receiving (Long-Polling) ───────────────────────────────────────────────

    /** Registers a handler for incoming messages from the configured chat. */
    public void addMessageHandler(Consumer<TelegramMessage> handler) {
        messageHandlers.add(handler);
    }

    /** Polls Telegram for new messages. Called by TradingScheduler on a fixed delay. */
    public void pollForMessages() {
        if (!isConfigured()) return;

        String url = API_BASE + config.telegram().getBotToken()
            + "/getUpdates?offset=" + (lastUpdateId + 1) + "&timeout=2";
        Request request = new Request.Builder().url(url).get().build();

        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful() || response.body() == null) return;

            JsonNode root = mapper.readTree(response.body().string());
            if (!root.path("ok").asBoolean()) return;

            long highestId = lastUpdateId;
            for (JsonNode update : root.path("result")) {
                long updateId = update.path("update_id").asLong();
                if (updateId > highestId) highestId = updateId;

                JsonNode msg = update.path("message");
                if (msg.isMissingNode()) continue;

                long chatId = msg.path("chat").path("id").asLong();
                // Commands are only accepted from the configured chat
                if (!String.valueOf(chatId).equals(config.telegram().getChatId().trim())) continue;

                String text = msg.path("text").asText("").trim();
                if (text.isBlank()) continue;

                TelegramMessage telegramMsg = new TelegramMessage(chatId, msg.path("message_id").asLong(),
                    text, msg.path("from").path("username").asText(""));
                messageHandlers.forEach(h -> {
                    try {
                        h.accept(telegramMsg);
                    } catch (Exception e) {
                        log.error("Message handler error: {}", e.getMessage());
                    }
                });
            }
            if (highestId > lastUpdateId) {
                lastUpdateId = highestId;
                try {
                    Files.writeString(OFFSET_FILE, String.valueOf(lastUpdateId));
                } catch (Exception e) {
                    log.warn("TelegramNotifier: could not persist offset: {}", e.getMessage());
                }
            }
        } catch (IOException e) {
            log.debug("Telegram poll error (may be normal): {}", e.getMessage());
        }
    }

    private static String firstLine(String message) {
        if (message == null) return "";
        int nl = message.indexOf('\n');
        return nl > 0 ? message.substring(0, nl) : message;
    }
}
