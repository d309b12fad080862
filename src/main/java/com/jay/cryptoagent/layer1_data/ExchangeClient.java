package com.jay.cryptoagent.layer1_data;

import com.jay.cryptoagent.model.BalanceEntry;
import com.jay.cryptoagent.model.MarketInfo;
import com.jay.cryptoagent.model.OHLCVBar;
import com.jay.cryptoagent.model.OrderResult;
import com.jay.cryptoagent.model.Ticker;

import java.util.List;
import java.util.Map;

/**
 * Authenticated connection to one exchange account.
 * Symbols are always BASE/QUOTE (e.g. BTC/USD); implementations map them to the venue's format.
 * Every method throws {@link ExchangeException} on failure.
 */
public interface ExchangeClient {

    String id();

    /** Switches the client to the venue's testnet. Throws if the venue has no sandbox. */
    void setSandboxMode(boolean enabled);

    boolean isSandbox();

    Ticker fetchTicker(String symbol);

    /** Balances keyed by currency, only currencies with a non-zero total. */
    Map<String, BalanceEntry> fetchBalance();

    List<OHLCVBar> fetchOhlcv(String symbol, String timeframe, int limit);

    Map<String, MarketInfo> loadMarkets();

    /**
     * @param type  market or limit
     * @param side  buy or sell
     * @param price limit price, ignored for market orders
     */
    OrderResult createOrder(String symbol, String type, String side, double amount, Double price);

    OrderResult fetchOrder(String orderId, String symbol);

    OrderResult cancelOrder(String orderId, String symbol);
}
