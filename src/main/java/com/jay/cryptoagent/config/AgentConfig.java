package com.jay.cryptoagent.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;
import org.springframework.util.PropertyPlaceholderHelper;

import java.io.InputStream;
import java.util.List;

/**
 * Loads and exposes all trading configuration from config.yaml.
 * Values are read once at startup and cached. Edit config.yaml and restart to apply changes.
 * Secrets are written as ${ENV_VAR:default} placeholders and resolved from the Spring Environment.
 */
@Slf4j
@Component
public class AgentConfig {

    @Value("${agent.config-file:config.yaml}")
    private String configFile;

    @Autowired
    private Environment env;

    private static final PropertyPlaceholderHelper PLACEHOLDER_HELPER =
        new PropertyPlaceholderHelper("${", "}", ":", true);

    /** Resolves ${VAR:default} placeholders using Spring Environment (env vars / system props). */
    private String resolve(String value) {
        if (value == null) return null;
        if (env == null) return value;
        return PLACEHOLDER_HELPER.replacePlaceholders(value, key -> env.getProperty(key));
    }

    // ── Sections ──────────────────────────────────────────────────────────────
    private Exchange exchange = new Exchange();
    private Trading trading = new Trading();
    private Sentinel sentinel = new Sentinel();
    private Guardian guardian = new Guardian();
    private Ceo ceo = new Ceo();
    private Reasoning reasoning = new Reasoning();
    private Sources sources = new Sources();
    private Telegram telegram = new Telegram();

    @PostConstruct
    public void load() {
        try {
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
            mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            InputStream is = getClass().getClassLoader().getResourceAsStream(configFile);
            if (is == null) {
                log.warn("Config file '{}' not found on classpath, using defaults", configFile);
                return;
            }
            ConfigRoot root;
            try (is) {
                root = mapper.readValue(is, ConfigRoot.class);
            }
            apply(root);
            log.info("AgentConfig loaded from '{}'. Exchange: {} | Sandbox: {} | Trading enabled: {}",
                configFile, exchange.getId(), exchange.isSandboxMode(), trading.isEnabled());
        } catch (Exception e) {
            log.error("Failed to load {}, agent will use defaults: {}", configFile, e.getMessage());
        }
    }

    void apply(ConfigRoot root) {
        if (root.getExchange() != null)  this.exchange  = root.getExchange();
        if (root.getTrading() != null)   this.trading   = root.getTrading();
        if (root.getSentinel() != null)  this.sentinel  = root.getSentinel();
        if (root.getGuardian() != null)  this.guardian  = root.getGuardian();
        if (root.getCeo() != null)       this.ceo       = root.getCeo();
        if (root.getReasoning() != null) this.reasoning = root.getReasoning();
        if (root.getSources() != null)   this.sources   = root.getSources();
        if (root.getTelegram() != null)  this.telegram  = root.getTelegram();

        // Resolve ${VAR:default} placeholders that Jackson reads as literal strings
        exchange.setApiKey(resolve(exchange.getApiKey()));
        exchange.setApiSecret(resolve(exchange.getApiSecret()));
        reasoning.setApiKey(resolve(reasoning.getApiKey()));
        sources.setCryptoPanicApiKey(resolve(sources.getCryptoPanicApiKey()));
        telegram.setBotToken(resolve(telegram.getBotToken()));
        telegram.setChatId(resolve(telegram.getChatId()));
    }

    // ── Accessors ─────────────────────────────────────────────────────────────
    public Exchange exchange()   { return exchange; }
    public Trading trading()     { return trading; }
    public Sentinel sentinel()   { return sentinel; }
    public Guardian guardian()   { return guardian; }
    public Ceo ceo()             { return ceo; }
    public Reasoning reasoning() { return reasoning; }
    public Sources sources()     { return sources; }
    public Telegram telegram()   { return telegram; }

    /**
     * Tracked coins expanded to exchange symbols: "BTC" becomes "BTC/USD",
     * entries already in BASE/QUOTE form are kept.
     */
    public List<String> trackedSymbols() {
        return sentinel.getCoins().stream()
            .map(String::trim)
            .filter(c -> !c.isEmpty())
            .map(this::toSymbol)
            .toList();
    }

    public String toSymbol(String coin) {
        return coin.contains("/") ? coin.toUpperCase() : coin.toUpperCase() + "/" + sentinel.getQuoteCurrency();
    }

    // ── Config POJOs ──────────────────────────────────────────────────────────

    @Data public static class ConfigRoot {
        private Exchange exchange = new Exchange();
        private Trading trading = new Trading();
        private Sentinel sentinel = new Sentinel();
        private Guardian guardian = new Guardian();
        private Ceo ceo = new Ceo();
        private Reasoning reasoning = new Reasoning();
        private Sources sources = new Sources();
        private Telegram telegram = new Telegram();
    }

    @Data public static class Exchange {
        private String id = "binance";
        private String apiKey = "";
        private String apiSecret = "";
        private boolean sandboxMode = true;
    }

    @Data public static class Trading {
        private boolean enabled = false;
        private double maxTradeUsd = 100;
        private double defaultStopLossPct = 5;
        private double defaultTakeProfitPct = 10;
        private boolean trailingStopEnabled = false;
        private double trailingStopPct = 3;
    }

    @Data public static class Sentinel {
        private boolean enabled = false;
        private boolean autoConfirm = false;
        private List<String> coins = List.of("BTC", "ETH");
        private String quoteCurrency = "USD";
        private int maxTradesPerDay = 5;
        private double dailyLossLimitUsd = 50;
        private String timeframe = "1h";
        private int candleLimit = 60;
        private int previousRuns = 3;
        private int recentTrades = 10;
        private String strategy = "";
    }

    @Data public static class Guardian {
        private boolean enabled = true;
    }

    @Data public static class Ceo {
        private boolean enabled = false;
        private int briefingHour = 6;
        private boolean escalationEnabled = true;
        private double escalationDebounceHours = 4;
    }

    @Data public static class Reasoning {
        private String apiKey = "";
        private String baseUrl = "https://api.anthropic.com";
        private String sentinelModel = "claude-3-5-haiku-latest";
        private String ceoModel = "claude-sonnet-4-20250514";
        private int maxTokens = 4096;
        private int timeoutSeconds = 60;
    }

    @Data public static class Sources {
        private String cryptoPanicApiKey = "";
        private int webResultsPerCoin = 3;
        private int timeoutSeconds = 10;
    }

    @Data public static class Telegram {
        private String botToken = "";
        private String chatId = "";
    }
}
