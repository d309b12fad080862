package com.jay.cryptoagent.scheduler;

import com.jay.cryptoagent.layer3_signal.SentinelService;
import com.jay.cryptoagent.layer5_strategy.CeoBriefingService;
import com.jay.cryptoagent.layer7_monitor.GuardianService;
import com.jay.cryptoagent.notification.TelegramNotifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Trading Scheduler — drives the three control loops.
 *
 *   Guardian : every 2 min — protective exits on open positions
 *   Sentinel : every 30 min (first after 10 s) — tactical analysis and trades
 *   CEO      : hourly check (first after 30 s) — daily strategic briefing
 *   Telegram : every 2 seconds — poll for read-only commands
 *
 * All loops are fixed-delay, so a slow tick delays the next one rather than overlapping it.
 * Each service also guards itself against manual triggers running concurrently.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TradingScheduler {

    private final GuardianService guardian;
    private final SentinelService sentinel;
    private final CeoBriefingService ceo;
    private final TelegramNotifier telegram;

    // ── Guardian ──────────────────────────────────────────────────────────────

    @Scheduled(fixedDelayString = "${agent.guardian.interval-ms:120000}")
    public void guardianTick() {
        try {
            GuardianService.TickResult result = guardian.tick();
            log.debug("Guardian tick: {}", result);
        } catch (Exception e) {
            log.error("Guardian tick failed: {}", e.getMessage());
        }
    }

    // ── Sentinel ──────────────────────────────────────────────────────────────

    @Scheduled(fixedDelayString = "${agent.sentinel.interval-ms:1800000}", initialDelayString = "${agent.sentinel.initial-delay-ms:10000}")
    public void sentinelTick() {
        try {
            sentinel.tick();
        } catch (Exception e) {
            log.error("Sentinel tick failed: {}", e.getMessage());
        }
    }

    // ── CEO ───────────────────────────────────────────────────────────────────

    @Scheduled(fixedDelayString = "${agent.ceo.check-interval-ms:3600000}", initialDelayString = "${agent.ceo.initial-delay-ms:30000}")
    public void ceoCheck() {
        try {
            ceo.schedulerCheck();
        } catch (Exception e) {
            log.error("CEO scheduler check failed: {}", e.getMessage());
        }
    }

    // ── Telegram Polling (every 2 seconds) ───────────────────────────────────

    @Scheduled(fixedDelayString = "${agent.telegram-poll-ms:2000}")
    public void pollTelegram() {
        try {
            telegram.pollForMessages();
        } catch (Exception e) {
            log.debug("Telegram poll error: {}", e.getMessage());
        }
    }
}
