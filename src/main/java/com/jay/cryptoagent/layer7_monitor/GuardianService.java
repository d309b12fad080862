package com.jay.cryptoagent.layer7_monitor;

import com.jay.cryptoagent.config.AgentConfig;
import com.jay.cryptoagent.entity.Position;
import com.jay.cryptoagent.layer1_data.ExchangeGateway;
import com.jay.cryptoagent.layer6_execution.PositionLedger;
import com.jay.cryptoagent.layer6_execution.TradeExecutor;
import com.jay.cryptoagent.model.enums.PositionSide;
import com.jay.cryptoagent.model.enums.PositionStatus;
import com.jay.cryptoagent.model.enums.TradeSide;
import com.jay.cryptoagent.model.enums.TradeSource;
import com.jay.cryptoagent.notification.Notifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Layer 7 — Guardian.
 * Watches every open position on a short fixed delay and enforces its protective levels.
 *
 * Responsibilities:
 * - Trailing stop management (high-water mark only moves UP)
 * - Stop-loss breach → market sell, status stopped_out (no approval required for exits)
 * - Take-profit hit → market sell, status took_profit
 * - Consecutive price-feed outages → CRITICAL log, protection may be offline
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GuardianService {

    static final int CRITICAL_FAILURES = 3;

    private final PositionLedger ledger;
    private final ExchangeGateway gateway;
    private final TradeExecutor executor;
    private final Notifier notifier;
    private final AgentConfig config;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger consecutiveFailures = new AtomicInteger();

    /** Outcome of one tick, mainly for logging and tests. */
    public enum TickResult { SKIPPED, NO_POSITIONS, CLIENT_FAILURE, NO_PRICES, CHECKED }

    /**
     * One monitoring pass. Called by TradingScheduler; a tick that overlaps a still-running one
     * returns immediately.
     */
    public TickResult tick() {
        if (!config.guardian().isEnabled()) return TickResult.SKIPPED;
        if (!running.compareAndSet(false, true)) {
            log.debug("Guardian tick skipped, previous tick still running");
            return TickResult.SKIPPED;
        }
        try {
            return runTick();
        } finally {
            running.set(false);
        }
    }

    private TickResult runTick() {
        List<Position> positions = ledger.getOpenPositions();
        if (positions.isEmpty()) return TickResult.NO_POSITIONS;

        try {
            gateway.getClient();
        } catch (RuntimeException e) {
            recordFailure("Cannot get exchange client: " + e.getMessage());
            return TickResult.CLIENT_FAILURE;
        }

        List<String> symbols = List.copyOf(new LinkedHashSet<>(positions.stream().map(Position::getSymbol).toList()));
        Map<String, Double> prices;
        try {
            prices = gateway.fetchPrices(symbols);
        } catch (RuntimeException e) {
            recordFailure("Price fetch failed: " + e.getMessage());
            return TickResult.NO_PRICES;
        }
        if (prices.isEmpty()) {
            recordFailure("No prices fetched");
            return TickResult.NO_PRICES;
        }
        consecutiveFailures.set(0);

        for (Position position : positions) {
            Double price = prices.get(position.getSymbol());
            if (price == null) continue;
            try {
                checkPosition(position, price);
            } catch (Exception e) {
                log.error("Guardian check failed for {}: {}", position.getSymbol(), e.getMessage());
            }
        }
        return TickResult.CHECKED;
    }

    // ── Protective Levels ──────────────────────────────────────────────────────

    void checkPosition(Position position, double price) {
        if (position.getSide() != PositionSide.LONG) return;

        // Trailing stop: ratchet the high-water mark
        Double trail = position.getTrailingStopPct();
        double hwm = position.getHighWaterMark() != null ? position.getHighWaterMark() : position.getEntryPrice();
        if (trail != null && trail > 0 && price > hwm) {
            ledger.updatePositionLevels(position.getId(), null, null, null, price);
            position.setHighWaterMark(price);
            hwm = price;
            log.debug("Trailing HWM for {} raised to ${}", position.getSymbol(), price);
        }

        Double effectiveSl = effectiveStopLoss(position.getStopLoss(), trail, hwm);

        if (effectiveSl != null && price <= effectiveSl) {
            log.warn("STOP-LOSS triggered for {}: price ${} <= SL ${}", position.getSymbol(), price,
                String.format("%.2f", effectiveSl));
            executeProtectiveExit(position, price, TradeSource.STOP_LOSS, PositionStatus.STOPPED_OUT);
            return;
        }

        if (position.getTakeProfit() != null && price >= position.getTakeProfit()) {
            log.info("TAKE-PROFIT triggered for {}: price ${} >= TP ${}", position.getSymbol(), price,
                String.format("%.2f", position.getTakeProfit()));
            executeProtectiveExit(position, price, TradeSource.TAKE_PROFIT, PositionStatus.TOOK_PROFIT);
        }
    }

    /** max(stop-loss, HWM × (1 − trail%)); either part may be absent. */
    static Double effectiveStopLoss(Double stopLoss, Double trailingPct, double highWaterMark) {
        Double effective = stopLoss;
        if (trailingPct != null && trailingPct > 0) {
            double trailingSl = highWaterMark * (1 - trailingPct / 100);
            if (effective == null || trailingSl > effective) effective = trailingSl;
        }
        return effective;
    }

    private void executeProtectiveExit(Position position, double triggerPrice, TradeSource source, PositionStatus status) {
        String label = source == TradeSource.STOP_LOSS ? "STOP-LOSS" : "TAKE-PROFIT";
        try {
            TradeExecutor.Execution exec = executor.execute(TradeExecutor.TradeRequest.builder()
                .symbol(position.getSymbol())
                .side(TradeSide.SELL)
                .orderType("market")
                .amount(position.getAmount())
                .referencePrice(triggerPrice)
                .source(source)
                .reasoning(String.format("%s triggered at $%.2f", source == TradeSource.STOP_LOSS ? "Stop-loss" : "Take-profit", triggerPrice))
                .positionId(position.getId())
                .closeStatus(status)
                .build());

            String pnl = String.format("%s$%.2f", exec.realizedPnl() >= 0 ? "+" : "-", Math.abs(exec.realizedPnl()));
            String message = String.format("[Guardian] %s %s: Sold %s @ $%.2f | P&L: %s | %s",
                label, position.getSymbol(), formatAmount(exec.filledAmount()), exec.fillPrice(), pnl,
                exec.sandbox() ? "SANDBOX" : "LIVE");
            if (exec.partialFill()) {
                message += String.format("%nPartial fill: %s of %s sold, remainder re-checked next tick",
                    formatAmount(exec.filledAmount()), formatAmount(position.getAmount()));
            }
            notifier.send(message);
        } catch (Exception e) {
            log.error("Failed to execute {} for {}: {}", source.label(), position.getSymbol(), e.getMessage());
            notifier.send(String.format("[Guardian] FAILED %s for %s: %s", source.name(), position.getSymbol(), e.getMessage()));
        }
    }

    private void recordFailure(String reason) {
        int failures = consecutiveFailures.incrementAndGet();
        log.error("Guardian: {} (failure #{})", reason, failures);
        if (failures >= CRITICAL_FAILURES) {
            log.error("CRITICAL: {}+ consecutive Guardian failures. SL/TP protection may be offline!", CRITICAL_FAILURES);
        }
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }

    public boolean isRunning() {
        return running.get();
    }

    private static String formatAmount(double amount) {
        return BigDecimal.valueOf(amount).stripTrailingZeros().toPlainString();
    }
}
