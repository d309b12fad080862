package com.jay.cryptoagent.layer1_data;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import org.springframework.stereotype.Component;
import okhttp3.OkHttpClient;

import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Builds unauthenticated-until-used exchange clients by exchange id.
 * One shared OkHttp connection pool backs every client it creates.
 */
@Component
public class ExchangeClientFactory {

    private static final Set<String> SUPPORTED = Set.of("binance");

    private final ObjectMapper mapper = new ObjectMapper();
    private OkHttpClient http;

    @PostConstruct
    public void init() {
        this.http = new OkHttpClient.Builder()
            .connectTimeout(10, TimeUnit.SECONDS)
            .readTimeout(30, TimeUnit.SECONDS)
            .callTimeout(30, TimeUnit.SECONDS)
            .build();
    }

    public Set<String> supportedIds() {
        return SUPPORTED;
    }

    public boolean supports(String exchangeId) {
        return exchangeId != null && SUPPORTED.contains(exchangeId.toLowerCase());
    }

    public ExchangeClient create(String exchangeId, String apiKey, String apiSecret) {
        if (!supports(exchangeId)) {
            throw new ExchangeConfigurationException(
                "Unsupported exchange: \"" + exchangeId + "\". Supported: " + String.join(", ", SUPPORTED));
        }
        if (http == null) init();
        return new BinanceClient(apiKey, apiSecret, http, mapper);
    }
}
