package com.jay.cryptoagent.layer6_execution;

import com.jay.cryptoagent.config.AgentConfig;
import com.jay.cryptoagent.entity.Position;
import com.jay.cryptoagent.layer1_data.ExchangeGateway;
import com.jay.cryptoagent.model.PositionSummary;
import com.jay.cryptoagent.model.enums.PositionSide;
import com.jay.cryptoagent.model.enums.PositionStatus;
import com.jay.cryptoagent.repository.PositionRepository;
import lombok.Builder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Layer 6 — Position Ledger.
 * Owns the lifecycle of positions: open with default protective levels, adjust levels, reduce after
 * a partial exit, and close exactly once with realised P&L.
 *
 * At most one OPEN position exists per symbol. Opening a second one is rejected. Writers on one
 * symbol are serialized by {@link TradeExecutor}; each method here commits on return, so the next
 * holder of the symbol lock sees its effect. A concurrent stale write fails on the version check.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PositionLedger {

    private final PositionRepository positionRepo;
    private final ExchangeGateway gateway;
    private final AgentConfig config;
    private final Clock clock;

    @Builder
    public record OpenPositionRequest(
        String id,
        String symbol,
        PositionSide side,
        double entryPrice,
        double amount,
        double costBasis,
        Double stopLoss,
        Double takeProfit,
        Double trailingStopPct,
        String entryTradeId
    ) {}

    // ── Open ──────────────────────────────────────────────────────────────────

    @Transactional
    public Position openPosition(OpenPositionRequest req) {
        if (positionRepo.existsBySymbolAndStatus(req.symbol(), PositionStatus.OPEN)) {
            throw new IllegalStateException("An open position already exists for " + req.symbol());
        }

        AgentConfig.Trading trading = config.trading();
        double slPct = trading.getDefaultStopLossPct();
        double tpPct = trading.getDefaultTakeProfitPct();

        Double stopLoss = req.stopLoss() != null ? req.stopLoss()
            : slPct > 0 ? req.entryPrice() * (1 - slPct / 100) : null;
        Double takeProfit = req.takeProfit() != null ? req.takeProfit()
            : tpPct > 0 ? req.entryPrice() * (1 + tpPct / 100) : null;
        Double trailing = req.trailingStopPct() != null ? req.trailingStopPct()
            : trading.isTrailingStopEnabled() ? trading.getTrailingStopPct() : null;

        LocalDateTime now = LocalDateTime.now(clock);
        Position position = Position.builder()
            .id(req.id() != null ? req.id() : UUID.randomUUID().toString())
            .symbol(req.symbol())
            .side(req.side() != null ? req.side() : PositionSide.LONG)
            .entryPrice(req.entryPrice())
            .amount(req.amount())
            .costBasis(req.costBasis())
            .stopLoss(stopLoss)
            .takeProfit(takeProfit)
            .trailingStopPct(trailing)
            .highWaterMark(req.entryPrice())
            .status(PositionStatus.OPEN)
            .entryTradeId(req.entryTradeId())
            .createdAt(now)
            .updatedAt(now)
            .build();
        positionRepo.save(position);

        log.info("Position opened: {} {} @ ${} | SL: {} | TP: {} | trail: {}",
            position.getSymbol(), position.getAmount(), position.getEntryPrice(),
            stopLoss == null ? "none" : String.format("$%.2f", stopLoss),
            takeProfit == null ? "none" : String.format("$%.2f", takeProfit),
            trailing == null ? "off" : trailing + "%");
        return position;
    }

    // ── Close ─────────────────────────────────────────────────────────────────

    /**
     * Closes the position and books realised P&L. A missing or already-closed position is left
     * untouched and returned as stored, so a repeated close is harmless.
     */
    @Transactional
    public Optional<Position> closePosition(String positionId, String exitTradeId,
                                                         double exitPrice, PositionStatus status) {
        Optional<Position> found = positionRepo.findById(positionId);
        if (found.isEmpty()) {
            log.warn("closePosition: position {} not found", positionId);
            return Optional.empty();
        }
        Position p = found.get();
        if (!p.isOpen()) {
            log.debug("closePosition: position {} already {}", positionId, p.getStatus().label());
            return found;
        }

        double pnl = p.getSide() == PositionSide.LONG
            ? (exitPrice - p.getEntryPrice()) * p.getAmount()
            : (p.getEntryPrice() - exitPrice) * p.getAmount();

        LocalDateTime now = LocalDateTime.now(clock);
        p.setStatus(status == null || status == PositionStatus.OPEN ? PositionStatus.CLOSED : status);
        p.setExitTradeId(exitTradeId);
        p.setRealizedPnl(pnl);
        p.setClosedAt(now);
        p.setUpdatedAt(now);
        positionRepo.save(p);

        log.info("Position closed: {} {} @ ${} | P&L: ${}", p.getSymbol(), p.getStatus().label(),
            exitPrice, String.format("%.2f", pnl));
        return Optional.of(p);
    }

    // ── Adjust ────────────────────────────────────────────────────────────────

    /** Only non-null arguments are applied. Closed positions are ignored. */
    @Transactional
    public void updatePositionLevels(String positionId, Double stopLoss, Double takeProfit,
                                                  Double trailingStopPct, Double highWaterMark) {
        positionRepo.findById(positionId).filter(Position::isOpen).ifPresent(p -> {
            if (stopLoss != null) p.setStopLoss(stopLoss);
            if (takeProfit != null) p.setTakeProfit(takeProfit);
            if (trailingStopPct != null) p.setTrailingStopPct(trailingStopPct);
            if (highWaterMark != null) p.setHighWaterMark(highWaterMark);
            p.setUpdatedAt(LocalDateTime.now(clock));
            positionRepo.save(p);
        });
    }

    /**
     * Books a partial exit: the sold amount leaves the position, the cost basis shrinks in
     * proportion and the remainder stays OPEN. Returns the realised P&L of the sold part.
     */
    @Transactional
    public double reducePosition(String positionId, double soldAmount, double exitPrice) {
        Optional<Position> found = positionRepo.findById(positionId).filter(Position::isOpen);
        if (found.isEmpty() || soldAmount <= 0) return 0;
        Position p = found.get();

        double sold = Math.min(soldAmount, p.getAmount());
        double pnl = p.getSide() == PositionSide.LONG
            ? (exitPrice - p.getEntryPrice()) * sold
            : (p.getEntryPrice() - exitPrice) * sold;
        double remaining = p.getAmount() - sold;
        double remainingCost = p.getAmount() > 0 ? p.getCostBasis() * (remaining / p.getAmount()) : 0;

        p.setAmount(remaining);
        p.setCostBasis(remainingCost);
        p.setUpdatedAt(LocalDateTime.now(clock));
        positionRepo.save(p);

        log.warn("Position {} reduced by {} to {} {} (partial exit, P&L ${})",
            p.getId(), sold, remaining, p.getSymbol(), String.format("%.2f", pnl));
        return pnl;
    }

    // ── Queries ───────────────────────────────────────────────────────────────

    public List<Position> getOpenPositions() {
        return positionRepo.findByStatusOrderByCreatedAtAsc(PositionStatus.OPEN);
    }

    public Optional<Position> findOpenPosition(String symbol) {
        return positionRepo.findFirstBySymbolAndStatus(symbol, PositionStatus.OPEN);
    }

    public Optional<Position> findById(String positionId) {
        return positionRepo.findById(positionId);
    }

    /**
     * Open positions with live P&L. Prices are fetched best-effort; when the exchange is not
     * usable the summaries are returned without live fields.
     */
    public List<PositionSummary> getOpenPositionSummaries() {
        List<Position> open = getOpenPositions();
        if (open.isEmpty()) return List.of();

        Map<String, Double> prices = Map.of();
        try {
            prices = gateway.fetchPrices(List.copyOf(new LinkedHashSet<>(open.stream().map(Position::getSymbol).toList())));
        } catch (Exception e) {
            log.error("Failed to fetch prices for position summaries: {}", e.getMessage());
        }

        Map<String, Double> live = prices;
        return open.stream().map(p -> PositionSummary.of(p, live.get(p.getSymbol()))).toList();
    }

    public Optional<PositionSummary> getPositionForSymbol(String symbol) {
        return getOpenPositionSummaries().stream()
            .filter(s -> s.symbol().equals(symbol))
            .findFirst();
    }
}
