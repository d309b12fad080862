package com.jay.cryptoagent.layer6_execution;

import com.jay.cryptoagent.config.AgentConfig;
import com.jay.cryptoagent.entity.Position;
import com.jay.cryptoagent.layer1_data.ExchangeException;
import com.jay.cryptoagent.layer1_data.ExchangeGateway;
import com.jay.cryptoagent.layer4_risk.DailyRiskStateService;
import com.jay.cryptoagent.model.OrderResult;
import com.jay.cryptoagent.model.enums.PositionSide;
import com.jay.cryptoagent.model.enums.PositionStatus;
import com.jay.cryptoagent.model.enums.TradeSide;
import com.jay.cryptoagent.model.enums.TradeSource;
import lombok.Builder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Layer 6 — Trade Executor.
 * The single path by which an order reaches the exchange and the books: place order, verify it
 * was not rejected, log the trade, open or close the position, then apply the daily delta.
 *
 * Gate checks are the caller's job. This class only refuses what the books cannot represent
 * (a second open position on one symbol, an exit from a position that is no longer open).
 *
 * Executions on one symbol run one at a time: the position check, the order and the bookkeeping
 * all happen under that symbol's lock, and every ledger write commits before it is released.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TradeExecutor {

    /** Below this share of the position a sell is booked as a partial exit. */
    static final double FULL_FILL_RATIO = 0.95;

    private final ExchangeGateway gateway;
    private final TradeLogService tradeLog;
    private final PositionLedger ledger;
    private final DailyRiskStateService dailyState;
    private final AgentConfig config;

    private final ConcurrentMap<String, ReentrantLock> symbolLocks = new ConcurrentHashMap<>();

    @Builder
    public record TradeRequest(
        String symbol,
        TradeSide side,
        String orderType,            // market/limit, defaults to market
        double amount,
        Double limitPrice,
        double referencePrice,       // fill price when the exchange reports none
        TradeSource source,
        String reasoning,
        String sentinelRunId,
        String positionId,           // sell: the position to exit, else the symbol's open position
        PositionStatus closeStatus,  // sell: status for a full exit, defaults to CLOSED
        Double stopLoss,
        Double takeProfit
    ) {}

    public record Execution(
        String tradeId,
        String orderId,
        String symbol,
        TradeSide side,
        double requestedAmount,
        double filledAmount,
        double fillPrice,
        double cost,
        String orderStatus,
        String positionId,
        boolean positionClosed,
        boolean partialFill,
        double realizedPnl,
        boolean sandbox
    ) {}

    public Execution execute(TradeRequest req) {
        ReentrantLock lock = symbolLocks.computeIfAbsent(req.symbol(), s -> new ReentrantLock());
        lock.lock();
        try {
            return executeLocked(req);
        } finally {
            lock.unlock();
        }
    }

    private Execution executeLocked(TradeRequest req) {
        String orderType = req.orderType() != null ? req.orderType() : "market";

        // No stacking: refuse before any money moves
        if (req.side() == TradeSide.BUY && ledger.findOpenPosition(req.symbol()).isPresent()) {
            throw new IllegalStateException("Position already open for " + req.symbol() + ", not stacking a second buy");
        }
        Optional<Position> exiting = req.side() == TradeSide.SELL ? resolveExitPosition(req) : Optional.empty();
        if (req.positionId() != null && exiting.isEmpty()) {
            throw new IllegalStateException("Position " + req.positionId() + " is no longer open, not selling");
        }
        // A targeted exit never sells more than the position still holds
        double amount = req.positionId() != null ? Math.min(req.amount(), exiting.get().getAmount()) : req.amount();

        boolean sandbox = config.exchange().isSandboxMode();
        log.info("Executing {} {} {} @ ~${} ({}) [{}]", req.side().label(), amount, req.symbol(),
            String.format("%.2f", req.referencePrice()), sandbox ? "sandbox" : "LIVE", source(req).label());

        OrderResult order = gateway.createOrder(req.symbol(), orderType, req.side().label(), amount, req.limitPrice());
        if (order.isCanceledOrExpired()) {
            throw new ExchangeException(String.format("%s order %s for %s was %s", req.side().label(), order.id(),
                req.symbol(), order.status()));
        }

        double filled = order.filledAmount(amount);
        double fillPrice = order.fillPrice(req.referencePrice());
        double cost = order.cost() != null && order.cost() > 0 ? order.cost() : fillPrice * filled;

        String tradeId = UUID.randomUUID().toString();
        String positionId = req.side() == TradeSide.BUY
            ? (filled > 0 ? UUID.randomUUID().toString() : null)
            : exiting.map(Position::getId).orElse(null);

        tradeLog.logTrade(TradeLogService.TradeLogEntry.builder()
            .id(tradeId)
            .symbol(req.symbol())
            .side(req.side())
            .orderType(orderType)
            .amount(filled > 0 ? filled : amount)
            .price(fillPrice)
            .cost(cost)
            .orderId(order.id())
            .source(source(req))
            .reasoning(req.reasoning())
            .sentinelRunId(req.sentinelRunId())
            .positionId(positionId)
            .sandbox(sandbox)
            .build());

        boolean closed = false;
        boolean partial = false;
        double realized = 0;
        try {
            if (req.side() == TradeSide.BUY && filled > 0) {
                ledger.openPosition(PositionLedger.OpenPositionRequest.builder()
                    .id(positionId)
                    .symbol(req.symbol())
                    .side(PositionSide.LONG)
                    .entryPrice(fillPrice)
                    .amount(filled)
                    .costBasis(cost)
                    .stopLoss(req.stopLoss())
                    .takeProfit(req.takeProfit())
                    .entryTradeId(tradeId)
                    .build());
            } else if (req.side() == TradeSide.SELL && exiting.isPresent() && filled > 0) {
                Position position = exiting.get();
                if (filled < position.getAmount() * FULL_FILL_RATIO) {
                    partial = true;
                    log.warn("Partial fill on {} for {}: {}/{}. Remainder stays open for the next tick.",
                        source(req).label(), req.symbol(), filled, position.getAmount());
                    realized = ledger.reducePosition(position.getId(), filled, fillPrice);
                } else {
                    PositionStatus status = req.closeStatus() != null ? req.closeStatus() : PositionStatus.CLOSED;
                    realized = ledger.closePosition(position.getId(), tradeId, fillPrice, status)
                        .map(p -> p.getRealizedPnl() != null ? p.getRealizedPnl() : 0.0)
                        .orElse(0.0);
                    closed = true;
                }
            }
        } catch (RuntimeException e) {
            // The order is already on the exchange, so the trade still counts
            log.error("Position bookkeeping failed after {} {} (trade {}): {}", req.side().label(), req.symbol(),
                tradeId, e.getMessage());
        }

        dailyState.applyDelta(1, realized);

        log.info("Trade executed: {} {} {} @ ${} | status {}", req.side().label(), filled, req.symbol(),
            String.format("%.2f", fillPrice), order.status());
        return new Execution(tradeId, order.id(), req.symbol(), req.side(), amount, filled, fillPrice, cost,
            order.status(), positionId, closed, partial, realized, sandbox);
    }

    private Optional<Position> resolveExitPosition(TradeRequest req) {
        if (req.positionId() != null) {
            return ledger.findById(req.positionId()).filter(Position::isOpen);
        }
        return ledger.findOpenPosition(req.symbol());
    }

    private static TradeSource source(TradeRequest req) {
        return req.source() != null ? req.source() : TradeSource.USER;
    }
}
