package com.jay.cryptoagent.controller;

import com.jay.cryptoagent.config.AgentConfig;
import com.jay.cryptoagent.entity.SentinelRun;
import com.jay.cryptoagent.entity.TradeLog;
import com.jay.cryptoagent.layer3_signal.SentinelService;
import com.jay.cryptoagent.layer4_risk.DailyRiskStateService;
import com.jay.cryptoagent.layer4_risk.TradingGate;
import com.jay.cryptoagent.layer5_strategy.CeoBriefingService;
import com.jay.cryptoagent.layer6_execution.PositionLedger;
import com.jay.cryptoagent.layer6_execution.TradeLogService;
import com.jay.cryptoagent.layer7_monitor.GuardianService;
import com.jay.cryptoagent.model.CeoDirective;
import com.jay.cryptoagent.model.DailyTradeStats;
import com.jay.cryptoagent.model.PositionSummary;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST API — Agent Status & Monitoring.
 *
 * Endpoints:
 *   GET  /api/status               — Loop states, gate decision and daily counters
 *   GET  /api/positions            — Open positions with live P&L
 *   GET  /api/trades               — Recent trade log (optionally per symbol)
 *   GET  /api/daily-state          — Today's risk counters and trade stats
 *   GET  /api/sentinel/runs        — Recent Sentinel runs
 *   GET  /api/sentinel/runs/{id}   — One Sentinel run
 *   POST /api/sentinel/run         — Run the Sentinel now
 *   GET  /api/ceo/directive        — Current CEO directive
 *   POST /api/ceo/briefing         — Run a CEO briefing now
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class AgentStatusController {

    private final AgentConfig config;
    private final TradingGate gate;
    private final DailyRiskStateService dailyState;
    private final PositionLedger ledger;
    private final TradeLogService tradeLog;
    private final SentinelService sentinel;
    private final GuardianService guardian;
    private final CeoBriefingService ceo;
    private final Clock clock;

    // ── GET /api/status ────────────────────────────────────────────────────────

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        DailyRiskStateService.DailyState state = dailyState.read();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "RUNNING");
        body.put("timestamp", LocalDateTime.now(clock).toString());
        body.put("exchange", config.exchange().getId());
        body.put("sandbox", config.exchange().isSandboxMode());
        body.put("tradingEnabled", config.trading().isEnabled());
        body.put("gate", gate.evaluateAutomated().name());
        body.put("tradesToday", state.tradesToday());
        body.put("pnlToday", state.pnlToday());
        body.put("openPositions", ledger.getOpenPositions().size());
        body.put("guardian", Map.of(
            "enabled", config.guardian().isEnabled(),
            "running", guardian.isRunning(),
            "consecutiveFailures", guardian.getConsecutiveFailures()));
        body.put("sentinel", Map.of(
            "enabled", config.sentinel().isEnabled(),
            "autoConfirm", config.sentinel().isAutoConfirm(),
            "running", sentinel.isRunning()));
        body.put("ceo", Map.of(
            "enabled", config.ceo().isEnabled(),
            "running", ceo.isRunning()));
        return ResponseEntity.ok(body);
    }

    // ── GET /api/positions ─────────────────────────────────────────────────────

    @GetMapping("/positions")
    public ResponseEntity<List<PositionSummary>> openPositions() {
        return ResponseEntity.ok(ledger.getOpenPositionSummaries());
    }

    // ── GET /api/trades ────────────────────────────────────────────────────────

    @GetMapping("/trades")
    public ResponseEntity<List<TradeLog>> trades(
            @RequestParam(defaultValue = "50") int limit,
            @RequestParam(required = false) String symbol) {
        if (symbol != null && !symbol.isBlank()) {
            return ResponseEntity.ok(tradeLog.getTradesForSymbol(config.toSymbol(symbol.trim()), limit));
        }
        return ResponseEntity.ok(tradeLog.getRecentTrades(limit));
    }

    // ── GET /api/daily-state ───────────────────────────────────────────────────

    @GetMapping("/daily-state")
    public ResponseEntity<Map<String, Object>> dailyState() {
        DailyRiskStateService.DailyState state = dailyState.read();
        DailyTradeStats stats = tradeLog.getDailyTradeStats();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("tradesToday", state.tradesToday());
        body.put("pnlToday", state.pnlToday());
        body.put("lastResetDate", state.lastResetDate().toString());
        body.put("maxTradesPerDay", config.sentinel().getMaxTradesPerDay());
        body.put("dailyLossLimitUsd", config.sentinel().getDailyLossLimitUsd());
        body.put("stats", stats);
        return ResponseEntity.ok(body);
    }

    // ── Sentinel ───────────────────────────────────────────────────────────────

    @GetMapping("/sentinel/runs")
    public ResponseEntity<List<SentinelRun>> sentinelRuns(@RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(sentinel.getRecentRuns(limit));
    }

    @GetMapping("/sentinel/runs/{id}")
    public ResponseEntity<SentinelRun> sentinelRun(@PathVariable String id) {
        return sentinel.getRun(id)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/sentinel/run")
    public ResponseEntity<SentinelRun> runSentinel() {
        return ResponseEntity.ok(sentinel.runNow());
    }

    // ── CEO ────────────────────────────────────────────────────────────────────

    @GetMapping("/ceo/directive")
    public ResponseEntity<CeoDirective> directive() {
        return ceo.getCurrentDirective()
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/ceo/briefing")
    public ResponseEntity<CeoBriefingService.BriefingResult> runBriefing() {
        CeoBriefingService.BriefingResult result = ceo.runBriefing();
        if (result.success()) return ResponseEntity.ok(result);
        HttpStatus status = ceo.isRunning() || "CEO briefing already in progress".equals(result.error())
            ? HttpStatus.CONFLICT : HttpStatus.BAD_GATEWAY;
        return ResponseEntity.status(status).body(result);
    }
}
