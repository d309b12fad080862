package com.jay.cryptoagent.layer5_strategy;

import com.jay.cryptoagent.config.AgentConfig;
import com.jay.cryptoagent.layer3_signal.SentinelContext;
import com.jay.cryptoagent.layer3_signal.SentinelContextGatherer;
import com.jay.cryptoagent.layer4_risk.DailyRiskStateService;
import com.jay.cryptoagent.layer6_execution.TradeLogService;
import com.jay.cryptoagent.model.CeoDirective;
import com.jay.cryptoagent.model.TechnicalIndicators;
import com.jay.cryptoagent.notification.Notifier;
import com.jay.cryptoagent.reasoning.ReasoningClient;
import com.jay.cryptoagent.repository.SentinelRunRepository;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Layer 5 — CEO Overlay.
 * Once a day (after the configured hour) asks the stronger reasoning model for a strategic
 * directive covering the next 24 hours. The Sentinel reads that directive on every tick and may
 * escalate back here when the market leaves the directive's assumptions.
 *
 * Escalation triggers, first match wins:
 * - directive expired
 * - price more than 10% below a buy zone or 10% above a sell zone
 * - today's P&L at or past half the daily loss limit
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CeoBriefingService {

    static final double BELOW_BUY_ZONE = 0.9;
    static final double ABOVE_SELL_ZONE = 1.1;
    static final double LOSS_LIMIT_SHARE = 0.5;

    private final SentinelContextGatherer contextGatherer;
    private final SentinelRunRepository runRepository;
    private final DirectiveStore directiveStore;
    private final DirectiveParser parser;
    private final CeoPromptBuilder promptBuilder;
    private final TradeLogService tradeLog;
    private final DailyRiskStateService dailyState;
    private final ReasoningClient reasoning;
    private final Notifier notifier;
    private final AgentConfig config;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final ExecutorService escalationExecutor = Executors.newSingleThreadExecutor();
    private volatile LocalDate lastBriefingDate;

    public record BriefingResult(boolean success, CeoDirective directive, String error) {

        static BriefingResult failed(String error) {
            return new BriefingResult(false, null, error);
        }
    }

    public record EscalationCheck(boolean escalate, String reason) {

        static final EscalationCheck NONE = new EscalationCheck(false, "");
    }

    // ── Briefing ──────────────────────────────────────────────────────────────

    public BriefingResult runBriefing() {
        if (!running.compareAndSet(false, true)) {
            return BriefingResult.failed("CEO briefing already in progress");
        }
        long start = System.currentTimeMillis();
        try {
            log.info("CEO briefing starting");
            if (!reasoning.isConfigured()) {
                throw new IllegalStateException("No AI API key configured. Cannot run CEO briefing.");
            }

            CeoContext ctx = gatherContext();
            CeoPromptBuilder.CeoPrompt prompt = promptBuilder.build(ctx);
            String reply = reasoning.generate(config.reasoning().getCeoModel(), prompt.systemPrompt(),
                prompt.userPrompt(), 0, false);
            log.info("CEO analysis completed in {}s", String.format("%.1f", (System.currentTimeMillis() - start) / 1000.0));

            CeoDirective directive = parser.parse(reply);
            if (directive == null) {
                log.error("Failed to parse directive. Raw reply (first 500 chars): {}",
                    reply == null ? "" : reply.substring(0, Math.min(500, reply.length())));
                return BriefingResult.failed("Failed to parse directive from reasoning response");
            }

            directiveStore.save(directive);
            lastBriefingDate = LocalDate.now(clock);
            log.info("Directive saved: {} / {} / risk {}/10", directive.getMarketRegime().label(),
                directive.getOverallBias(), directive.getRiskLevel());
            notifier.send(String.format("[CEO] CEO Briefing complete. Regime: %s, Bias: %s, Risk: %d/10. %s",
                directive.getMarketRegime().label(), directive.getOverallBias(), directive.getRiskLevel(),
                directive.getSummary()));
            return new BriefingResult(true, directive, null);
        } catch (Exception e) {
            log.error("CEO briefing failed: {}", e.getMessage());
            return BriefingResult.failed(e.getMessage());
        } finally {
            running.set(false);
        }
    }

    private CeoContext gatherContext() {
        SentinelContext base = contextGatherer.gather();
        LocalDateTime now = LocalDateTime.now(clock);
        var runs = runRepository.findByCreatedAtGreaterThanEqualOrderByCreatedAtDesc(now.minusHours(24));
        CeoDirective current = directiveStore.getDirective().orElse(null);
        TradeLogService.Performance performance = null;
        if (current != null && current.getGeneratedAt() != null) {
            performance = tradeLog.getPerformanceSince(LocalDateTime.ofInstant(current.getGeneratedAt(), clock.getZone()));
        }
        return new CeoContext(base, runs, current, performance);
    }

    // ── Daily Schedule ────────────────────────────────────────────────────────

    /** Hourly check from TradingScheduler. */
    public void schedulerCheck() {
        if (!shouldRunBriefing()) return;
        log.info("Scheduled CEO briefing triggered");
        runBriefing();
    }

    boolean shouldRunBriefing() {
        if (!config.ceo().isEnabled()) return false;
        if (!reasoning.isConfigured()) return false;

        LocalDate today = LocalDate.now(clock);
        if (today.equals(lastBriefingDate)) return false;
        Optional<LocalDateTime> stored = directiveStore.getLastRunAt();
        if (stored.isPresent() && today.equals(stored.get().toLocalDate())) {
            lastBriefingDate = today;
            return false;
        }
        return LocalDateTime.now(clock).getHour() >= config.ceo().getBriefingHour();
    }

    // ── Escalation ────────────────────────────────────────────────────────────

    public EscalationCheck shouldEscalate(Map<String, TechnicalIndicators> indicators, CeoDirective directive) {
        if (directive.isExpired(clock.instant())) {
            return new EscalationCheck(true, "Directive expired");
        }

        for (Map.Entry<String, TechnicalIndicators> entry : indicators.entrySet()) {
            TechnicalIndicators ta = entry.getValue();
            String coin = ta.coin();
            if (!directive.getCoins().containsKey(coin) || ta.price() <= 0) continue;

            CeoDirective.KeyLevels levels = directive.getKeyLevels().get(entry.getKey());
            if (levels == null) continue;
            Double buyLow = levels.buyLow();
            Double sellHigh = levels.sellHigh();
            if (buyLow != null && ta.price() < buyLow * BELOW_BUY_ZONE) {
                return new EscalationCheck(true, String.format("%s at $%.0f - crashed >10%% below buy zone ($%.0f)",
                    coin, ta.price(), buyLow));
            }
            if (sellHigh != null && ta.price() > sellHigh * ABOVE_SELL_ZONE) {
                return new EscalationCheck(true, String.format("%s at $%.0f - surged >10%% above sell zone ($%.0f)",
                    coin, ta.price(), sellHigh));
            }
        }

        double pnlToday = dailyState.read().pnlToday();
        if (pnlToday <= -(config.sentinel().getDailyLossLimitUsd() * LOSS_LIMIT_SHARE)) {
            return new EscalationCheck(true, String.format("Daily P&L at $%.2f - breached 50%% of loss limit", pnlToday));
        }
        return EscalationCheck.NONE;
    }

    /**
     * Starts an out-of-schedule briefing in the background unless one ran within the debounce
     * window. Returns whether a briefing was started.
     */
    public boolean escalateIfDue(EscalationCheck check) {
        if (!check.escalate()) return false;
        Optional<LocalDateTime> lastRun = directiveStore.getLastRunAt();
        if (lastRun.isPresent()) {
            double hoursSince = Duration.between(lastRun.get(), LocalDateTime.now(clock)).toMinutes() / 60.0;
            if (hoursSince < config.ceo().getEscalationDebounceHours()) {
                log.info("CEO escalation needed ({}) but debounced (last run {}h ago)", check.reason(),
                    String.format("%.1f", hoursSince));
                return false;
            }
        }
        log.info("CEO escalation triggered: {}", check.reason());
        escalationExecutor.submit(() -> {
            BriefingResult result = runBriefing();
            if (!result.success()) log.error("CEO escalation failed: {}", result.error());
        });
        return true;
    }

    // ── Queries ───────────────────────────────────────────────────────────────

    public Optional<CeoDirective> getCurrentDirective() {
        return directiveStore.getDirective();
    }

    public String formatDirectiveForSentinel(CeoDirective directive) {
        return DirectiveFormatter.formatForSentinel(directive, clock.instant());
    }

    public boolean isRunning() {
        return running.get();
    }

    @PreDestroy
    public void shutdown() {
        escalationExecutor.shutdown();
    }
}
