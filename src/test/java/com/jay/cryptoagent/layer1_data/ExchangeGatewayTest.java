package com.jay.cryptoagent.layer1_data;

import com.jay.cryptoagent.config.AgentConfig;
import com.jay.cryptoagent.model.Ticker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ExchangeGatewayTest {

    @Mock
    private ExchangeClientFactory clientFactory;

    @Mock
    private ExchangeClient client;

    private AgentConfig config;
    private ExchangeGateway gateway;

    @BeforeEach
    void setUp() {
        config = new AgentConfig();
        config.exchange().setId("binance");
        config.exchange().setApiKey("key");
        config.exchange().setApiSecret("secret");
        config.exchange().setSandboxMode(true);
        gateway = new ExchangeGateway(config, clientFactory);
    }

    @Test
    void getClient_verifiesSandboxAndCaches() {
        when(clientFactory.supports("binance")).thenReturn(true);
        when(clientFactory.create("binance", "key", "secret")).thenReturn(client);
        when(client.isSandbox()).thenReturn(true);

        ExchangeClient first = gateway.getClient();
        ExchangeClient second = gateway.getClient();

        assertSame(client, first);
        assertSame(first, second);
        verify(client).setSandboxMode(true);
        verify(clientFactory, times(1)).create(anyString(), anyString(), anyString());
    }

    @Test
    void getClient_sandboxNotActive_refusesClient() {
        when(clientFactory.supports("binance")).thenReturn(true);
        when(clientFactory.create("binance", "key", "secret")).thenReturn(client);
        when(client.isSandbox()).thenReturn(false);

        assertThrows(ExchangeConfigurationException.class, () -> gateway.getClient());
    }

    @Test
    void getClient_sandboxUnsupported_refusesClient() {
        when(clientFactory.supports("binance")).thenReturn(true);
        when(clientFactory.create("binance", "key", "secret")).thenReturn(client);
        doThrow(new UnsupportedOperationException("no testnet")).when(client).setSandboxMode(true);

        ExchangeConfigurationException e = assertThrows(ExchangeConfigurationException.class, () -> gateway.getClient());
        assertTrue(e.getMessage().startsWith("Cannot enable sandbox mode on binance"));
    }

    @Test
    void getClient_liveMode_skipsSandboxSwitch() {
        config.exchange().setSandboxMode(false);
        when(clientFactory.supports("binance")).thenReturn(true);
        when(clientFactory.create("binance", "key", "secret")).thenReturn(client);

        assertSame(client, gateway.getClient());
        verify(client, never()).setSandboxMode(anyBoolean());
    }

    @Test
    void getClient_missingCredentials_throws() {
        config.exchange().setApiSecret("");
        when(clientFactory.supports("binance")).thenReturn(true);

        assertThrows(ExchangeConfigurationException.class, () -> gateway.getClient());
        verify(clientFactory, never()).create(anyString(), anyString(), anyString());
    }

    @Test
    void getClient_unsupportedExchange_listsSupported() {
        config.exchange().setId("kraken");
        when(clientFactory.supports("kraken")).thenReturn(false);
        when(clientFactory.supportedIds()).thenReturn(Set.of("binance"));

        ExchangeConfigurationException e = assertThrows(ExchangeConfigurationException.class, () -> gateway.getClient());
        assertEquals("Unsupported exchange: \"kraken\". Supported: binance", e.getMessage());
    }

    @Test
    void getClient_credentialChange_rebuildsClient() {
        ExchangeClient other = mock(ExchangeClient.class);
        when(clientFactory.supports("binance")).thenReturn(true);
        when(clientFactory.create(eq("binance"), anyString(), anyString())).thenReturn(client, other);
        when(client.isSandbox()).thenReturn(true);
        when(other.isSandbox()).thenReturn(true);

        gateway.getClient();
        config.exchange().setApiKey("rotated");

        assertSame(other, gateway.getClient());
    }

    @Test
    void fetchPrices_skipsFailingSymbols() {
        readyClient();
        when(client.fetchTicker("BTC/USD")).thenReturn(ticker("BTC/USD", 60000));
        when(client.fetchTicker("ETH/USD")).thenThrow(new ExchangeException("timeout"));

        Map<String, Double> prices = gateway.fetchPrices(List.of("BTC/USD", "ETH/USD", "BTC/USD"));

        assertEquals(Map.of("BTC/USD", 60000.0), prices);
        verify(client, times(1)).fetchTicker("BTC/USD");
    }

    @Test
    void primitives_wrapUnexpectedFailures() {
        readyClient();
        when(client.fetchTicker("BTC/USD")).thenThrow(new IllegalStateException("boom"));

        ExchangeException e = assertThrows(ExchangeException.class, () -> gateway.fetchTicker("BTC/USD"));
        assertEquals("fetchTicker BTC/USD failed: boom", e.getMessage());
    }

    @Test
    void fingerprint_isStableAndShort() {
        String a = ExchangeGateway.fingerprint("key", "secret");

        assertEquals(16, a.length());
        assertEquals(a, ExchangeGateway.fingerprint("key", "secret"));
        assertNotEquals(a, ExchangeGateway.fingerprint("key", "other"));
    }

    private void readyClient() {
        when(clientFactory.supports("binance")).thenReturn(true);
        when(clientFactory.create("binance", "key", "secret")).thenReturn(client);
        when(client.isSandbox()).thenReturn(true);
    }

    private static Ticker ticker(String symbol, double last) {
        return new Ticker(symbol, last, null, null, null, null, null, null, null);
    }
}
