package com.jay.cryptoagent.layer6_execution;

import com.jay.cryptoagent.config.AgentConfig;
import com.jay.cryptoagent.layer1_data.ExchangeGateway;
import com.jay.cryptoagent.layer4_risk.TradingGate;
import com.jay.cryptoagent.model.BalanceEntry;
import com.jay.cryptoagent.model.MarketInfo;
import com.jay.cryptoagent.model.OHLCVBar;
import com.jay.cryptoagent.model.OrderResult;
import com.jay.cryptoagent.model.PositionSummary;
import com.jay.cryptoagent.model.Ticker;
import com.jay.cryptoagent.model.enums.TradeSide;
import com.jay.cryptoagent.model.enums.TradeSource;
import com.jay.cryptoagent.notification.Notifier;
import lombok.Builder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Layer 6 — Manual trade path.
 * Two-step order placement for a human operator: {@link #preview} validates and prices an order
 * without touching the exchange's order book; {@link #confirm} re-validates, applies the daily
 * limits and places it through the shared {@link TradeExecutor}.
 *
 * Validation failures raise IllegalArgumentException; trading disabled or a daily limit reached
 * raise IllegalStateException.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ManualTradeService {

    private static final Pattern SYMBOL = Pattern.compile("^[A-Z0-9]{2,10}/[A-Z0-9]{2,10}$");

    private final ExchangeGateway gateway;
    private final TradeExecutor executor;
    private final TradingGate gate;
    private final PositionLedger ledger;
    private final Notifier notifier;
    private final AgentConfig config;

    @Builder
    public record OrderRequest(
        String symbol,
        String side,          // buy/sell
        String orderType,     // market/limit, defaults to market
        Double amount,        // base currency
        Double quoteAmount,   // quote currency to spend, alternative to amount
        Double price,         // limit price
        String source,        // defaults to user
        Double stopLoss,
        Double takeProfit,
        String reasoning
    ) {}

    public record OrderPreview(
        String side,
        String symbol,
        String orderType,
        double amount,
        double estimatedPrice,
        double estimatedValue,
        Double limitPrice,
        boolean sandbox
    ) {}

    private record ValidatedOrder(String symbol, TradeSide side, String orderType, double amount,
                                  double estimatedPrice, double estimatedValue) {}

    // ── Orders ────────────────────────────────────────────────────────────────

    public OrderPreview preview(OrderRequest request) {
        ValidatedOrder order = validate(request);
        log.info("Order preview: {} {} {} (~${})", order.side().label(), order.amount(), order.symbol(),
            String.format("%.2f", order.estimatedValue()));
        return new OrderPreview(order.side().label(), order.symbol(), order.orderType(), order.amount(),
            order.estimatedPrice(), order.estimatedValue(), request.price(), gateway.isSandbox());
    }

    public TradeExecutor.Execution confirm(OrderRequest request) {
        ValidatedOrder order = validate(request);

        TradingGate.Decision decision = gate.evaluateManual();
        if (!decision.permitted()) {
            throw new IllegalStateException(decision.description());
        }

        TradeExecutor.Execution exec = executor.execute(TradeExecutor.TradeRequest.builder()
            .symbol(order.symbol())
            .side(order.side())
            .orderType(order.orderType())
            .amount(order.amount())
            .limitPrice("limit".equals(order.orderType()) ? request.price() : null)
            .referencePrice(order.estimatedPrice())
            .source(parseSource(request.source()))
            .reasoning(request.reasoning())
            .stopLoss(request.stopLoss())
            .takeProfit(request.takeProfit())
            .build());

        StringBuilder message = new StringBuilder(String.format("[Trade] %s %s %s @ $%.2f | Status: %s | %s",
            exec.side().name(), plain(exec.filledAmount() > 0 ? exec.filledAmount() : exec.requestedAmount()),
            exec.symbol(), exec.fillPrice(), exec.orderStatus(), exec.sandbox() ? "SANDBOX" : "LIVE"));
        if (exec.positionClosed()) {
            message.append(String.format("%nPosition closed | P&L: %s$%.2f", exec.realizedPnl() >= 0 ? "+" : "-",
                Math.abs(exec.realizedPnl())));
        } else if (exec.side() == TradeSide.BUY && exec.positionId() != null) {
            message.append("\nPosition opened: ").append(exec.positionId());
        }
        notifier.send(message.toString());
        return exec;
    }

    private ValidatedOrder validate(OrderRequest request) {
        if (request.symbol() == null || request.side() == null) {
            throw new IllegalArgumentException("symbol and side are required");
        }
        String symbol = request.symbol().trim().toUpperCase(Locale.ROOT);
        if (!SYMBOL.matcher(symbol).matches()) {
            throw new IllegalArgumentException("Invalid symbol format \"" + request.symbol()
                + "\". Use BASE/QUOTE format like BTC/USD or ETH/USDT.");
        }
        TradeSide side;
        try {
            side = TradeSide.from(request.side());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("side must be buy or sell");
        }
        String orderType = request.orderType() == null ? "market" : request.orderType().trim().toLowerCase(Locale.ROOT);
        if (!"market".equals(orderType) && !"limit".equals(orderType)) {
            throw new IllegalArgumentException("orderType must be market or limit");
        }

        if (request.amount() == null && request.quoteAmount() == null) {
            throw new IllegalArgumentException("Either amount (base currency) or quoteAmount (quote currency) is required");
        }
        requirePositiveFinite(request.amount(), "amount");
        requirePositiveFinite(request.quoteAmount(), "quoteAmount");
        requirePositiveFinite(request.price(), "price");
        if ("limit".equals(orderType) && request.price() == null) {
            throw new IllegalArgumentException("price is required for limit orders");
        }

        if (!gateway.isTradingEnabled()) {
            throw new IllegalStateException("Trading is disabled. Enable it in config.yaml before placing orders.");
        }

        double estimatedPrice = gateway.fetchTicker(symbol).last();
        double amount;
        double estimatedValue;
        if (request.quoteAmount() != null) {
            if (estimatedPrice <= 0) {
                throw new IllegalStateException("Cannot determine current price to convert quoteAmount to base amount.");
            }
            estimatedValue = request.quoteAmount();
            amount = request.quoteAmount() / estimatedPrice;
        } else {
            amount = request.amount();
            estimatedValue = estimatedPrice * amount;
        }

        double maxUsd = gateway.getMaxTradeUsd();
        if (estimatedValue > maxUsd) {
            throw new IllegalArgumentException(String.format("Trade value ~$%.2f exceeds your maximum of $%s",
                estimatedValue, plain(maxUsd)));
        }
        return new ValidatedOrder(symbol, side, orderType, amount, estimatedPrice, estimatedValue);
    }

    private static void requirePositiveFinite(Double value, String field) {
        if (value != null && (value <= 0 || !Double.isFinite(value))) {
            throw new IllegalArgumentException(field + " must be a positive finite number");
        }
    }

    private static TradeSource parseSource(String source) {
        if (source == null || source.isBlank()) return TradeSource.USER;
        try {
            return TradeSource.valueOf(source.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown trade source: " + source);
        }
    }

    // ── Market Queries ────────────────────────────────────────────────────────

    public Ticker getPrice(String symbol) {
        return gateway.fetchTicker(normalise(symbol));
    }

    /** Non-zero balances. */
    public List<BalanceEntry> getPortfolio() {
        return gateway.fetchBalance().values().stream()
            .filter(b -> b.total() > 0)
            .toList();
    }

    public OrderResult getOrderStatus(String orderId, String symbol) {
        if (orderId == null || orderId.isBlank()) throw new IllegalArgumentException("orderId is required");
        return gateway.fetchOrder(orderId, normalise(symbol));
    }

    public OrderResult cancelOrder(String orderId, String symbol) {
        if (orderId == null || orderId.isBlank()) throw new IllegalArgumentException("orderId is required");
        OrderResult result = gateway.cancelOrder(orderId, normalise(symbol));
        log.info("Order {} on {} cancelled", orderId, symbol);
        return result;
    }

    public List<OHLCVBar> getPriceHistory(String symbol, String timeframe, Integer limit) {
        return gateway.fetchOhlcv(normalise(symbol), timeframe != null ? timeframe : "1h", limit != null ? limit : 24);
    }

    public Optional<MarketInfo> getMarketInfo(String symbol) {
        return Optional.ofNullable(gateway.loadMarkets().get(normalise(symbol)));
    }

    public List<PositionSummary> getPositions() {
        return ledger.getOpenPositionSummaries();
    }

    private String normalise(String symbol) {
        if (symbol == null || symbol.isBlank()) throw new IllegalArgumentException("symbol is required");
        return config.toSymbol(symbol.trim());
    }

    private static String plain(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
