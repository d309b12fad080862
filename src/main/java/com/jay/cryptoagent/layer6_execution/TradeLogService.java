package com.jay.cryptoagent.layer6_execution;

import com.jay.cryptoagent.entity.Position;
import com.jay.cryptoagent.entity.TradeLog;
import com.jay.cryptoagent.model.DailyTradeStats;
import com.jay.cryptoagent.model.enums.TradeSide;
import com.jay.cryptoagent.model.enums.TradeSource;
import com.jay.cryptoagent.repository.PositionRepository;
import com.jay.cryptoagent.repository.TradeLogRepository;
import lombok.Builder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Layer 6 — Trade Log.
 * Append-only record of every executed order plus the daily and since-directive aggregates
 * the prompts are built from.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TradeLogService {

    private final TradeLogRepository tradeRepo;
    private final PositionRepository positionRepo;
    private final Clock clock;

    @Builder
    public record TradeLogEntry(
        String id,
        String symbol,
        TradeSide side,
        String orderType,
        double amount,
        Double price,
        Double cost,
        String orderId,
        TradeSource source,
        String reasoning,
        String sentinelRunId,
        String positionId,
        boolean sandbox
    ) {}

    public record Performance(int tradesSince, double pnlSince) {}

    /** Inserts one trade row and returns its id. */
    public String logTrade(TradeLogEntry entry) {
        String reasoning = entry.reasoning();
        if (reasoning != null && reasoning.length() > 1000) reasoning = reasoning.substring(0, 1000);

        TradeLog row = TradeLog.builder()
            .id(entry.id() != null ? entry.id() : UUID.randomUUID().toString())
            .symbol(entry.symbol())
            .side(entry.side())
            .orderType(entry.orderType() != null ? entry.orderType() : "market")
            .amount(entry.amount())
            .price(entry.price())
            .cost(entry.cost())
            .exchangeOrderId(entry.orderId())
            .source(entry.source() != null ? entry.source() : TradeSource.USER)
            .reasoning(reasoning)
            .sentinelRunId(entry.sentinelRunId())
            .positionId(entry.positionId())
            .sandbox(entry.sandbox())
            .createdAt(LocalDateTime.now(clock))
            .build();
        tradeRepo.save(row);
        log.info("Trade logged: {} {} {} @ {} [{}]", row.getSide().label(), row.getAmount(), row.getSymbol(),
            row.getPrice(), row.getSource().label());
        return row.getId();
    }

    public List<TradeLog> getRecentTrades(int limit) {
        return tradeRepo.findAllByOrderByCreatedAtDesc(PageRequest.of(0, Math.max(1, limit)));
    }

    public List<TradeLog> getTradesForSymbol(String symbol, int limit) {
        return tradeRepo.findBySymbolOrderByCreatedAtDesc(symbol, PageRequest.of(0, Math.max(1, limit)));
    }

    // ── Aggregates ────────────────────────────────────────────────────────────

    public DailyTradeStats getDailyTradeStats() {
        LocalDateTime todayStart = LocalDate.now(clock).atStartOfDay();

        List<TradeLog> today = tradeRepo.findByCreatedAtGreaterThanEqual(todayStart);
        double volume = today.stream().mapToDouble(t -> t.getCost() != null ? t.getCost() : 0).sum();

        double realized = 0;
        int winners = 0;
        int losers = 0;
        for (Position p : positionRepo.findClosedSince(todayStart)) {
            double pnl = p.getRealizedPnl() != null ? p.getRealizedPnl() : 0;
            realized += pnl;
            if (pnl > 0) winners++;
            else if (pnl < 0) losers++;
        }
        return new DailyTradeStats(today.size(), volume, realized, winners, losers);
    }

    /** Trades placed and P&L realised since the given moment. */
    public Performance getPerformanceSince(LocalDateTime since) {
        long trades = tradeRepo.countSince(since);
        double pnl = positionRepo.findClosedSince(since).stream()
            .mapToDouble(p -> p.getRealizedPnl() != null ? p.getRealizedPnl() : 0)
            .sum();
        return new Performance((int) trades, pnl);
    }
}
