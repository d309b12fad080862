package com.jay.cryptoagent.layer3_signal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jay.cryptoagent.config.AgentConfig;
import com.jay.cryptoagent.entity.SentinelRun;
import com.jay.cryptoagent.layer1_data.ExchangeGateway;
import com.jay.cryptoagent.layer4_risk.TradingGate;
import com.jay.cryptoagent.layer5_strategy.CeoBriefingService;
import com.jay.cryptoagent.layer6_execution.TradeExecutor;
import com.jay.cryptoagent.model.CeoDirective;
import com.jay.cryptoagent.model.enums.TradeSide;
import com.jay.cryptoagent.model.enums.TradeSource;
import com.jay.cryptoagent.notification.Notifier;
import com.jay.cryptoagent.reasoning.ReasoningClient;
import com.jay.cryptoagent.repository.SentinelRunRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Layer 3 — Sentinel.
 * The tactical loop: gather context, ask the reasoning service for a decision, record the run,
 * execute the recommended trades that pass the gate, check whether the CEO should be woken up,
 * then send one summary notification.
 *
 * Pipeline per tick:
 *   gather → prompt → reason → parse → persist run → execute → escalate → notify
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SentinelService {

    static final String DEGRADED_CONTEXT = "Degraded context: no portfolio or indicator data";
    private static final int RAW_SUMMARY_MAX = 1000;
    private static final int SUMMARY_MAX = 4000;
    private static final int ERROR_MAX = 1000;

    private final SentinelContextGatherer contextGatherer;
    private final SentinelPromptBuilder promptBuilder;
    private final SentinelOutputParser outputParser;
    private final ReasoningClient reasoning;
    private final TradingGate gate;
    private final TradeExecutor executor;
    private final ExchangeGateway gateway;
    private final CeoBriefingService ceo;
    private final SentinelRunRepository runRepository;
    private final Notifier notifier;
    private final AgentConfig config;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);

    /** Scheduled entry point. Returns the recorded run, or null when skipped. */
    public SentinelRun tick() {
        if (!config.sentinel().isEnabled()) return null;
        if (!running.compareAndSet(false, true)) {
            log.debug("Sentinel tick skipped, previous run still in progress");
            return null;
        }
        try {
            return run();
        } finally {
            running.set(false);
        }
    }

    /** Manual trigger; runs even when the scheduled loop is disabled. */
    public SentinelRun runNow() {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Sentinel run already in progress");
        }
        try {
            return run();
        } finally {
            running.set(false);
        }
    }

    private SentinelRun run() {
        long start = System.currentTimeMillis();
        String runId = UUID.randomUUID().toString();
        log.info("Sentinel run {} starting", runId);
        SentinelRun recorded = null;
        try {
            SentinelContext ctx = contextGatherer.gather();
            if (ctx.isDegraded()) {
                log.warn("Sentinel aborting: {}", DEGRADED_CONTEXT);
                return runRepository.save(SentinelRun.builder()
                    .id(runId)
                    .indicatorsJson(toJson(ctx.indicators()))
                    .portfolioJson(toJson(ctx.portfolio()))
                    .error(DEGRADED_CONTEXT)
                    .durationMs(System.currentTimeMillis() - start)
                    .createdAt(LocalDateTime.now(clock))
                    .build());
            }

            SentinelPromptBuilder.SentinelPrompt prompt = promptBuilder.build(ctx, gate.evaluateAutomated());
            String text = reasoning.generate(config.reasoning().getSentinelModel(), prompt.systemPrompt(),
                prompt.userPrompt(), 0, false);
            SentinelDecision decision = outputParser.parse(text);
            if (decision == null) {
                log.warn("Sentinel output could not be parsed, recording raw text only");
            }

            String summary = decision != null && decision.summary() != null && !decision.summary().isBlank()
                ? truncate(decision.summary(), SUMMARY_MAX)
                : truncate(text, RAW_SUMMARY_MAX);
            recorded = runRepository.save(SentinelRun.builder()
                .id(runId)
                .indicatorsJson(toJson(ctx.indicators()))
                .portfolioJson(toJson(ctx.portfolio()))
                .sentimentJson(decision != null && decision.sentiment() != null ? toJson(decision.sentiment()) : null)
                .signalsJson(decision != null && decision.signals() != null ? toJson(decision.signals()) : null)
                .actionsJson(decision != null && decision.actions() != null ? toJson(decision.actions()) : null)
                .summary(summary)
                .durationMs(System.currentTimeMillis() - start)
                .createdAt(LocalDateTime.now(clock))
                .build());
            log.info("Sentinel run {} recorded ({} ms)", runId, recorded.getDurationMs());

            List<String> executed = new ArrayList<>();
            List<String> failed = new ArrayList<>();
            if (decision != null && decision.actions() != null) {
                executeActions(decision.actions(), runId, executed, failed);
            }

            checkEscalation(ctx);
            notifyOutcome(summary, text, executed, failed);
            return recorded;
        } catch (Exception e) {
            log.error("Sentinel run {} failed: {}", runId, e.getMessage());
            String error = truncate(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), ERROR_MAX);
            if (recorded != null) {
                // Keep the recorded decision, only add the failure
                recorded.setError(error);
                return runRepository.save(recorded);
            }
            return runRepository.save(SentinelRun.builder()
                .id(runId)
                .error(error)
                .durationMs(System.currentTimeMillis() - start)
                .createdAt(LocalDateTime.now(clock))
                .build());
        }
    }

    // ── Execution ─────────────────────────────────────────────────────────────

    private void executeActions(List<SentinelDecision.SentinelAction> actions, String runId,
                                List<String> executed, List<String> failed) {
        for (SentinelDecision.SentinelAction action : actions) {
            if (action == null || action.isHold()) continue;

            // Re-checked per action: an earlier trade may have hit a limit
            TradingGate.Decision decision = gate.evaluateAutomated();
            if (!decision.permitted()) {
                log.info("Sentinel action {} {} not executed: {}", action.type(), action.symbol(), decision.description());
                break;
            }

            try {
                executed.add(executeAction(action, runId));
            } catch (Exception e) {
                log.error("Sentinel action {} {} failed: {}", action.type(), action.symbol(), e.getMessage());
                failed.add(action.type() + " " + action.symbol() + " (" + e.getMessage() + ")");
            }
        }
    }

    private String executeAction(SentinelDecision.SentinelAction action, String runId) {
        if (action.symbol() == null || action.symbol().isBlank()) {
            throw new IllegalArgumentException("Action has no symbol");
        }
        TradeSide side = TradeSide.from(action.type());
        String symbol = config.toSymbol(action.symbol().trim());
        double price = gateway.fetchTicker(symbol).last();
        if (price <= 0) {
            throw new IllegalStateException("No valid price for " + symbol);
        }

        double maxUsd = gateway.getMaxTradeUsd();
        double amount = action.amount() != null && action.amount() > 0
            ? action.amount()
            : Math.floor(maxUsd / price * 1e8) / 1e8;
        double estimatedUsd = amount * price;
        if (estimatedUsd > maxUsd) {
            throw new IllegalArgumentException(String.format("Estimated $%.2f exceeds max trade $%s",
                estimatedUsd, PromptFormat.amount(maxUsd)));
        }

        TradeExecutor.Execution exec = executor.execute(TradeExecutor.TradeRequest.builder()
            .symbol(symbol)
            .side(side)
            .orderType("market")
            .amount(amount)
            .referencePrice(price)
            .source(TradeSource.SENTINEL)
            .reasoning(action.reason())
            .sentinelRunId(runId)
            .build());
        return String.format("%s %s %s @ %s", side.name(), PromptFormat.amount(exec.filledAmount()), symbol,
            PromptFormat.usd(exec.fillPrice()));
    }

    // ── Escalation & Notification ─────────────────────────────────────────────

    private void checkEscalation(SentinelContext ctx) {
        AgentConfig.Ceo ceoConfig = config.ceo();
        if (!ceoConfig.isEnabled() || !ceoConfig.isEscalationEnabled()) return;
        try {
            Optional<CeoDirective> directive = ceo.getCurrentDirective();
            if (directive.isEmpty()) return;
            ceo.escalateIfDue(ceo.shouldEscalate(ctx.indicators(), directive.get()));
        } catch (Exception e) {
            log.error("CEO escalation check failed: {}", e.getMessage());
        }
    }

    private void notifyOutcome(String summary, String text, List<String> executed, List<String> failed) {
        String body = summary != null && !summary.isBlank() ? summary
            : text != null && !text.isBlank() ? truncate(text, RAW_SUMMARY_MAX)
            : "Analysis complete";
        StringBuilder message = new StringBuilder("[Crypto Sentinel] ").append(body);
        if (!executed.isEmpty()) {
            message.append("\n\nTrades executed: ").append(String.join(", ", executed));
        }
        if (!failed.isEmpty()) {
            message.append("\n\nTrades failed: ").append(String.join(", ", failed));
        }
        notifier.send(message.toString());
    }

    // ── Queries ───────────────────────────────────────────────────────────────

    public List<SentinelRun> getRecentRuns(int limit) {
        return runRepository.findAllByOrderByCreatedAtDesc(PageRequest.of(0, Math.max(1, limit)));
    }

    public Optional<SentinelRun> getRun(String id) {
        return runRepository.findById(id);
    }

    public boolean isRunning() {
        return running.get();
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialise run field: {}", e.getMessage());
            return null;
        }
    }

    private static String truncate(String text, int max) {
        if (text == null) return null;
        return text.length() > max ? text.substring(0, max) : text;
    }
}
