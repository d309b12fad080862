package com.jay.cryptoagent.layer4_risk;

import com.jay.cryptoagent.config.AgentConfig;
import com.jay.cryptoagent.entity.DailyRiskState;
import com.jay.cryptoagent.repository.DailyRiskStateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Layer 4 — Daily Risk State.
 * Today's trade count and realised P&L, shared by every trade-executing path.
 *
 * The stored row is only trusted when its reset date is today; otherwise a fresh zero state is
 * returned (read never writes). Every mutation goes through {@link #applyDelta} which holds a
 * process-wide lock around read-modify-write, so concurrent loops cannot lose updates.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DailyRiskStateService {

    private final DailyRiskStateRepository repo;
    private final AgentConfig config;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();

    public record DailyState(int tradesToday, double pnlToday, LocalDate lastResetDate) {}

    public DailyState read() {
        LocalDate today = LocalDate.now(clock);
        return repo.findById(DailyRiskState.SINGLETON_ID)
            .filter(s -> today.equals(s.getLastResetDate()))
            .map(s -> new DailyState(s.getTradesToday(), s.getPnlToday(), s.getLastResetDate()))
            .orElseGet(() -> new DailyState(0, 0, today));
    }

    public void write(DailyState state) {
        DailyRiskState row = repo.findById(DailyRiskState.SINGLETON_ID).orElseGet(DailyRiskState::new);
        row.setId(DailyRiskState.SINGLETON_ID);
        row.setTradesToday(state.tradesToday());
        row.setPnlToday(state.pnlToday());
        row.setLastResetDate(state.lastResetDate());
        repo.save(row);
    }

    /** Adds a delta under the lock and returns the state written. */
    public DailyState applyDelta(int trades, double pnl) {
        lock.lock();
        try {
            DailyState current = read();
            DailyState next = new DailyState(current.tradesToday() + trades, current.pnlToday() + pnl,
                current.lastResetDate());
            write(next);
            log.info("Daily state: trades {} | P&L ${}", next.tradesToday(), String.format("%.2f", next.pnlToday()));
            return next;
        } finally {
            lock.unlock();
        }
    }

    // ── Gate Helpers ──────────────────────────────────────────────────────────

    public boolean isTradeLimitReached() {
        return read().tradesToday() >= config.sentinel().getMaxTradesPerDay();
    }

    public boolean isLossLimitReached() {
        return read().pnlToday() <= -config.sentinel().getDailyLossLimitUsd();
    }
}
