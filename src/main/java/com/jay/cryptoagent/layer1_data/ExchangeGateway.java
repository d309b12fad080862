package com.jay.cryptoagent.layer1_data;

import com.jay.cryptoagent.config.AgentConfig;
import com.jay.cryptoagent.model.BalanceEntry;
import com.jay.cryptoagent.model.MarketInfo;
import com.jay.cryptoagent.model.OHLCVBar;
import com.jay.cryptoagent.model.OrderResult;
import com.jay.cryptoagent.model.Ticker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Layer 1 — Exchange Gateway.
 * Single point of contact with the market. Owns the cached, authenticated exchange client and
 * rebuilds it when the exchange id or credentials change.
 *
 * Sandbox mode is verified, never assumed: when config asks for it the client must accept
 * setSandboxMode(true) AND report isSandbox() afterwards, otherwise no client is handed out.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExchangeGateway {

    private final AgentConfig config;
    private final ExchangeClientFactory clientFactory;

    private ExchangeClient cachedClient;
    private String cachedKey;

    // ── Client Lifecycle ───────────────────────────────────────────────────────

    public synchronized ExchangeClient getClient() {
        AgentConfig.Exchange ex = config.exchange();
        String exchangeId = ex.getId() == null ? "" : ex.getId().trim().toLowerCase();
        String apiKey = nullToEmpty(ex.getApiKey());
        // Secrets pasted into a single-line env var arrive with literal "\n" sequences
        String apiSecret = nullToEmpty(ex.getApiSecret()).replace("\\n", "\n");

        String cacheKey = exchangeId + ":" + fingerprint(apiKey, apiSecret) + ":" + ex.isSandboxMode();
        if (cachedClient != null && cacheKey.equals(cachedKey)) {
            return cachedClient;
        }

        if (!clientFactory.supports(exchangeId)) {
            throw new ExchangeConfigurationException("Unsupported exchange: \"" + exchangeId
                + "\". Supported: " + String.join(", ", clientFactory.supportedIds()));
        }
        if (apiKey.isBlank() || apiSecret.isBlank()) {
            throw new ExchangeConfigurationException("No API credentials configured for " + exchangeId);
        }

        ExchangeClient client = clientFactory.create(exchangeId, apiKey, apiSecret);

        if (ex.isSandboxMode()) {
            try {
                client.setSandboxMode(true);
            } catch (RuntimeException e) {
                log.error("CRITICAL: Failed to enable sandbox mode for {}. Refusing to create a client "
                    + "to prevent accidental live trades: {}", exchangeId, e.getMessage());
                throw new ExchangeConfigurationException("Cannot enable sandbox mode on " + exchangeId
                    + ". Either disable sandbox mode (REAL MONEY trades) or use an exchange with a testnet.", e);
            }
            if (!client.isSandbox()) {
                log.error("CRITICAL: setSandboxMode() did not activate sandbox on {}", exchangeId);
                throw new ExchangeConfigurationException("Sandbox mode failed to activate on " + exchangeId);
            }
        } else {
            log.warn("Exchange client for {} created in LIVE mode, orders move real money", exchangeId);
        }

        cachedClient = client;
        cachedKey = cacheKey;
        log.info("Exchange client ready: {} ({})", exchangeId, client.isSandbox() ? "sandbox" : "live");
        return client;
    }

    /** Drops the cached client, e.g. after credentials change. */
    public synchronized void clearCache() {
        cachedClient = null;
        cachedKey = null;
    }

    // ── Settings Helpers ───────────────────────────────────────────────────────

    public boolean isTradingEnabled() {
        return config.trading().isEnabled();
    }

    public double getMaxTradeUsd() {
        return config.trading().getMaxTradeUsd();
    }

    public boolean isSandbox() {
        return getClient().isSandbox();
    }

    // ── Pass-through Primitives ────────────────────────────────────────────────

    public Ticker fetchTicker(String symbol) {
        return call("fetchTicker " + symbol, () -> getClient().fetchTicker(symbol));
    }

    /**
     * Best-effort batch price fetch. Symbols that fail are logged and left out of the result;
     * only an unusable client (configuration error) is thrown.
     */
    public Map<String, Double> fetchPrices(List<String> symbols) {
        ExchangeClient client = getClient();
        Map<String, Double> prices = new LinkedHashMap<>();
        for (String symbol : new LinkedHashSet<>(symbols)) {
            try {
                Ticker t = client.fetchTicker(symbol);
                if (t != null && t.last() > 0) {
                    prices.put(symbol, t.last());
                } else {
                    log.warn("No price data for {}", symbol);
                }
            } catch (RuntimeException e) {
                log.warn("Failed to fetch price for {}: {}", symbol, e.getMessage());
            }
        }
        return prices;
    }

    public Map<String, BalanceEntry> fetchBalance() {
        return call("fetchBalance", () -> getClient().fetchBalance());
    }

    public List<OHLCVBar> fetchOhlcv(String symbol, String timeframe, int limit) {
        return call("fetchOhlcv " + symbol, () -> getClient().fetchOhlcv(symbol, timeframe, limit));
    }

    public Map<String, MarketInfo> loadMarkets() {
        return call("loadMarkets", () -> getClient().loadMarkets());
    }

    public OrderResult createOrder(String symbol, String type, String side, double amount, Double price) {
        log.info("Placing {} {} order: {} {} ({})", type, side, amount, symbol,
            config.exchange().isSandboxMode() ? "sandbox" : "LIVE");
        return call("createOrder " + symbol, () -> getClient().createOrder(symbol, type, side, amount, price));
    }

    public OrderResult fetchOrder(String orderId, String symbol) {
        return call("fetchOrder " + orderId, () -> getClient().fetchOrder(orderId, symbol));
    }

    public OrderResult cancelOrder(String orderId, String symbol) {
        return call("cancelOrder " + orderId, () -> getClient().cancelOrder(orderId, symbol));
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private <T> T call(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (ExchangeException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ExchangeException(operation + " failed: " + e.getMessage(), e);
        }
    }

    static String fingerprint(String apiKey, String apiSecret) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest((apiKey + "\u0000" + apiSecret).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash, 0, 8);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
