package com.jay.cryptoagent.notification;

import com.jay.cryptoagent.config.AgentConfig;
import com.jay.cryptoagent.entity.SentinelRun;
import com.jay.cryptoagent.layer3_signal.SentinelService;
import com.jay.cryptoagent.layer4_risk.DailyRiskStateService;
import com.jay.cryptoagent.layer4_risk.TradingGate;
import com.jay.cryptoagent.layer5_strategy.CeoBriefingService;
import com.jay.cryptoagent.layer6_execution.PositionLedger;
import com.jay.cryptoagent.layer7_monitor.GuardianService;
import com.jay.cryptoagent.model.PositionSummary;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Read-only Telegram commands: STATUS, POSITIONS, DIRECTIVE, SENTINEL.
 * Nothing here places or changes orders.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TelegramCommandHandler {

    private final TelegramNotifier telegram;
    private final PositionLedger ledger;
    private final DailyRiskStateService dailyState;
    private final TradingGate gate;
    private final CeoBriefingService ceo;
    private final SentinelService sentinel;
    private final GuardianService guardian;
    private final AgentConfig config;

    @PostConstruct
    public void init() {
        telegram.addMessageHandler(this::handleMessage);
        log.info("TelegramCommandHandler initialized, listening for STATUS/POSITIONS/DIRECTIVE/SENTINEL");
    }

    void handleMessage(TelegramNotifier.TelegramMessage msg) {
        if (msg.text() == null) return;
        String command = msg.text().trim().toUpperCase(Locale.ROOT);
        if (command.startsWith("/")) command = command.substring(1);

        switch (command) {
            case "STATUS" -> telegram.send(buildStatusMessage());
            case "POSITIONS" -> telegram.send(buildPositionsMessage());
            case "DIRECTIVE" -> telegram.send(buildDirectiveMessage());
            case "SENTINEL" -> telegram.send(buildSentinelMessage());
            default -> log.debug("Ignoring Telegram message from {}: {}", msg.username(), msg.text());
        }
    }

    String buildStatusMessage() {
        DailyRiskStateService.DailyState state = dailyState.read();
        return String.format(
            "Crypto Agent Status%n"
                + "Mode: %s | Trading: %s%n"
                + "Gate: %s%n"
                + "Trades today: %d/%d | P&L today: $%.2f%n"
                + "Open positions: %d%n"
                + "Guardian: %s (failures: %d) | Sentinel: %s | CEO: %s",
            config.exchange().isSandboxMode() ? "SANDBOX" : "LIVE",
            config.trading().isEnabled() ? "ENABLED" : "DISABLED",
            gate.evaluateAutomated().description(),
            state.tradesToday(), config.sentinel().getMaxTradesPerDay(), state.pnlToday(),
            ledger.getOpenPositions().size(),
            config.guardian().isEnabled() ? "on" : "off", guardian.getConsecutiveFailures(),
            config.sentinel().isEnabled() ? "on" : "off",
            config.ceo().isEnabled() ? "on" : "off");
    }

    String buildPositionsMessage() {
        List<PositionSummary> positions = ledger.getOpenPositionSummaries();
        if (positions.isEmpty()) return "No open positions.";
        StringBuilder sb = new StringBuilder("Open positions (" + positions.size() + "):");
        for (PositionSummary p : positions) {
            sb.append(String.format("%n- %s %s | %s @ $%.2f", p.symbol(), p.side().toUpperCase(Locale.ROOT),
                p.amount(), p.entryPrice()));
            if (p.currentPrice() != null) sb.append(String.format(" | Now $%.2f", p.currentPrice()));
            if (p.unrealizedPnl() != null) {
                sb.append(String.format(" | P&L %s$%.2f", p.unrealizedPnl() >= 0 ? "+" : "-", Math.abs(p.unrealizedPnl())));
            }
            sb.append(p.stopLoss() != null ? String.format(" | SL $%.2f", p.stopLoss()) : " | SL none");
            sb.append(p.takeProfit() != null ? String.format(" | TP $%.2f", p.takeProfit()) : " | TP none");
        }
        return sb.toString();
    }

    String buildDirectiveMessage() {
        return ceo.getCurrentDirective()
            .map(ceo::formatDirectiveForSentinel)
            .map(String::trim)
            .orElse("No CEO directive yet.");
    }

    String buildSentinelMessage() {
        List<SentinelRun> runs = sentinel.getRecentRuns(1);
        if (runs.isEmpty()) return "No Sentinel runs yet.";
        SentinelRun last = runs.get(0);
        String body = last.getError() != null ? "Error: " + last.getError()
            : last.getSummary() != null ? last.getSummary() : "No summary";
        return String.format("Last Sentinel run (%s, %d ms)%n%s", last.getCreatedAt(), last.getDurationMs(), body);
    }
}
