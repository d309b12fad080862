package com.jay.cryptoagent.layer1_data;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jay.cryptoagent.model.BalanceEntry;
import com.jay.cryptoagent.model.MarketInfo;
import com.jay.cryptoagent.model.OHLCVBar;
import com.jay.cryptoagent.model.OrderResult;
import com.jay.cryptoagent.model.Ticker;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Layer 1 — Binance spot REST client.
 * Public market data plus HMAC-SHA256 signed account and order endpoints, directly via OkHttp.
 *
 * API base: https://api.binance.com (testnet: https://testnet.binance.vision)
 */
@Slf4j
public class BinanceClient implements ExchangeClient {

    static final String MAIN_URL = "https://api.binance.com";
    static final String TEST_URL = "https://testnet.binance.vision";
    private static final MediaType FORM = MediaType.get("application/x-www-form-urlencoded");
    private static final long RECV_WINDOW_MS = 5000;

    private final String apiKey;
    private final String apiSecret;
    private final OkHttpClient http;
    private final ObjectMapper mapper;

    private String baseUrl = MAIN_URL;
    private boolean sandbox = false;

    public BinanceClient(String apiKey, String apiSecret, OkHttpClient http, ObjectMapper mapper) {
        this.apiKey = apiKey;
        this.apiSecret = apiSecret;
        this.http = http;
        this.mapper = mapper;
    }

    @Override
    public String id() {
        return "binance";
    }

    @Override
    public void setSandboxMode(boolean enabled) {
        this.baseUrl = enabled ? TEST_URL : MAIN_URL;
        this.sandbox = enabled;
    }

    @Override
    public boolean isSandbox() {
        return sandbox;
    }

    // ── Market Data ────────────────────────────────────────────────────────────

    @Override
    public Ticker fetchTicker(String symbol) {
        JsonNode t = getPublic("/api/v3/ticker/24hr", Map.of("symbol", toMarketId(symbol)));
        double last = t.path("lastPrice").asDouble(0);
        if (last <= 0) {
            throw new ExchangeException("No last price for " + symbol);
        }
        return new Ticker(
            symbol,
            last,
            optDouble(t, "bidPrice"),
            optDouble(t, "askPrice"),
            optDouble(t, "highPrice"),
            optDouble(t, "lowPrice"),
            optDouble(t, "priceChangePercent"),
            optDouble(t, "volume"),
            t.has("closeTime") ? Instant.ofEpochMilli(t.path("closeTime").asLong()) : Instant.now()
        );
    }

    @Override
    public List<OHLCVBar> fetchOhlcv(String symbol, String timeframe, int limit) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", toMarketId(symbol));
        params.put("interval", timeframe);
        params.put("limit", String.valueOf(limit));
        JsonNode arr = getPublic("/api/v3/klines", params);

        List<OHLCVBar> bars = new ArrayList<>();
        for (JsonNode c : arr) {
            bars.add(OHLCVBar.builder()
                .timestamp(Instant.ofEpochMilli(c.get(0).asLong()))
                .open(c.get(1).asDouble())
                .high(c.get(2).asDouble())
                .low(c.get(3).asDouble())
                .close(c.get(4).asDouble())
                .volume(c.get(5).asDouble())
                .build());
        }
        return bars;
    }

    @Override
    public Map<String, MarketInfo> loadMarkets() {
        JsonNode info = getPublic("/api/v3/exchangeInfo", Map.of());
        Map<String, MarketInfo> markets = new LinkedHashMap<>();
        for (JsonNode s : info.path("symbols")) {
            String base = s.path("baseAsset").asText();
            String quote = s.path("quoteAsset").asText();
            double minQty = 0, stepSize = 0, minNotional = 0;
            for (JsonNode f : s.path("filters")) {
                switch (f.path("filterType").asText()) {
                    case "LOT_SIZE" -> {
                        minQty = f.path("minQty").asDouble(0);
                        stepSize = f.path("stepSize").asDouble(0);
                    }
                    case "NOTIONAL", "MIN_NOTIONAL" -> minNotional = f.path("minNotional").asDouble(0);
                    default -> { }
                }
            }
            String symbol = base + "/" + quote;
            markets.put(symbol, new MarketInfo(symbol, base, quote,
                "TRADING".equalsIgnoreCase(s.path("status").asText()), minQty, stepSize, minNotional));
        }
        return markets;
    }

    // ── Account ────────────────────────────────────────────────────────────────

    @Override
    public Map<String, BalanceEntry> fetchBalance() {
        JsonNode account = signed("GET", "/api/v3/account", new LinkedHashMap<>());
        Map<String, BalanceEntry> out = new LinkedHashMap<>();
        for (JsonNode b : account.path("balances")) {
            double free = b.path("free").asDouble(0);
            double locked = b.path("locked").asDouble(0);
            if (free + locked > 0) {
                String asset = b.path("asset").asText();
                out.put(asset, new BalanceEntry(asset, free + locked, free));
            }
        }
        return out;
    }

    // ── Orders ─────────────────────────────────────────────────────────────────

    @Override
    public OrderResult createOrder(String symbol, String type, String side, double amount, Double price) {
        Map<String, String> p = new LinkedHashMap<>();
        p.put("symbol", toMarketId(symbol));
        p.put("side", side.toUpperCase());
        p.put("type", type.toUpperCase());
        p.put("quantity", strip(amount));
        if ("limit".equalsIgnoreCase(type)) {
            if (price == null) throw new ExchangeException("Limit order requires a price");
            p.put("price", strip(price));
            p.put("timeInForce", "GTC");
        }
        p.put("newOrderRespType", "FULL");
        return toOrder(signed("POST", "/api/v3/order", p), symbol);
    }

    @Override
    public OrderResult fetchOrder(String orderId, String symbol) {
        Map<String, String> p = new LinkedHashMap<>();
        p.put("symbol", toMarketId(symbol));
        p.put("orderId", orderId);
        return toOrder(signed("GET", "/api/v3/order", p), symbol);
    }

    @Override
    public OrderResult cancelOrder(String orderId, String symbol) {
        Map<String, String> p = new LinkedHashMap<>();
        p.put("symbol", toMarketId(symbol));
        p.put("orderId", orderId);
        return toOrder(signed("DELETE", "/api/v3/order", p), symbol);
    }

    OrderResult toOrder(JsonNode o, String symbol) {
        double amount = o.path("origQty").asDouble(0);
        double filled = o.path("executedQty").asDouble(0);
        double quoteQty = o.path("cummulativeQuoteQty").asDouble(0);
        Double average = filled > 0 && quoteQty > 0 ? quoteQty / filled : null;
        Double price = o.path("price").asDouble(0) > 0 ? o.path("price").asDouble() : null;
        long ts = o.has("transactTime") ? o.path("transactTime").asLong() : o.path("time").asLong(System.currentTimeMillis());
        return OrderResult.builder()
            .id(o.path("orderId").asText())
            .symbol(symbol)
            .type(o.path("type").asText("").toLowerCase())
            .side(o.path("side").asText("").toLowerCase())
            .amount(amount)
            .price(price)
            .average(average)
            .filled(filled)
            .remaining(Math.max(0, amount - filled))
            .cost(quoteQty > 0 ? quoteQty : null)
            .status(normaliseStatus(o.path("status").asText("")))
            .timestamp(Instant.ofEpochMilli(ts))
            .build();
    }

    static String normaliseStatus(String status) {
        return switch (status) {
            case "NEW", "PARTIALLY_FILLED", "PENDING_NEW" -> "open";
            case "FILLED" -> "closed";
            case "CANCELED", "PENDING_CANCEL" -> "canceled";
            case "EXPIRED", "EXPIRED_IN_MATCH" -> "expired";
            case "REJECTED" -> "rejected";
            default -> status.toLowerCase();
        };
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    /** BTC/USD → BTCUSDT. Binance spot quotes dollars in USDT. */
    static String toMarketId(String symbol) {
        String[] parts = symbol.toUpperCase().split("/");
        if (parts.length != 2) {
            throw new ExchangeException("Invalid symbol '" + symbol + "', expected BASE/QUOTE");
        }
        String quote = parts[1].equals("USD") ? "USDT" : parts[1];
        return parts[0] + quote;
    }

    private JsonNode getPublic(String path, Map<String, String> params) {
        HttpUrl.Builder url = HttpUrl.get(baseUrl + path).newBuilder();
        params.forEach(url::addQueryParameter);
        return execute(new Request.Builder().url(url.build()).get().build());
    }

    private JsonNode signed(String method, String path, Map<String, String> params) {
        if (apiKey == null || apiKey.isBlank() || apiSecret == null || apiSecret.isBlank()) {
            throw new ExchangeConfigurationException("Binance API key/secret not configured");
        }
        params.put("recvWindow", String.valueOf(RECV_WINDOW_MS));
        params.put("timestamp", String.valueOf(System.currentTimeMillis()));
        String query = params.entrySet().stream()
            .map(e -> e.getKey() + "=" + e.getValue())
            .collect(Collectors.joining("&"));
        String url = baseUrl + path + "?" + query + "&signature=" + hmac(query);

        Request.Builder builder = new Request.Builder().url(url).header("X-MBX-APIKEY", apiKey);
        switch (method) {
            case "POST" -> builder.post(RequestBody.create("", FORM));
            case "DELETE" -> builder.delete();
            default -> builder.get();
        }
        return execute(builder.build());
    }

    private JsonNode execute(Request request) {
        try (Response response = http.newCall(request).execute()) {
            String body = response.body() != null ? response.body().string() : "";
            if (!response.isSuccessful()) {
                String msg = body;
                try {
                    JsonNode err = mapper.readTree(body);
                    if (err.has("msg")) msg = err.path("code").asText() + " " + err.path("msg").asText();
                } catch (IOException parseError) {
                    log.debug("Binance error body is not JSON: {}", parseError.getMessage());
                }
                throw new ExchangeException("Binance HTTP " + response.code() + ": " + msg);
            }
            return mapper.readTree(body);
        } catch (IOException e) {
            throw new ExchangeException("Binance request failed: " + e.getMessage(), e);
        }
    }

    private String hmac(String data) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(apiSecret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            byte[] h = mac.doFinal(data.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder();
            for (byte b : h) sb.append(String.format("%02x", b));
            return sb.toString();
        } catch (Exception e) {
            throw new ExchangeConfigurationException("Could not sign Binance request", e);
        }
    }

    private static Double optDouble(JsonNode node, String field) {
        return node.hasNonNull(field) ? node.path(field).asDouble() : null;
    }

    private static String strip(double v) {
        return BigDecimal.valueOf(v).stripTrailingZeros().toPlainString();
    }
}
