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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TelegramCommandHandlerTest {

    @Mock
    private TelegramNotifier telegram;

    @Mock
    private PositionLedger ledger;

    @Mock
    private DailyRiskStateService dailyState;

    @Mock
    private TradingGate gate;

    @Mock
    private CeoBriefingService ceo;

    @Mock
    private SentinelService sentinel;

    @Mock
    private GuardianService guardian;

    private TelegramCommandHandler handler;

    @BeforeEach
    void setUp() {
        AgentConfig config = new AgentConfig();
        config.trading().setEnabled(true);
        handler = new TelegramCommandHandler(telegram, ledger, dailyState, gate, ceo, sentinel, guardian, config);
    }

    @Test
    void status_reportsModeLimitsAndGate() {
        when(dailyState.read()).thenReturn(new DailyRiskStateService.DailyState(2, -12.5, LocalDate.of(2024, 5, 1)));
        when(gate.evaluateAutomated()).thenReturn(TradingGate.Decision.PREVIEW_ONLY);
        when(ledger.getOpenPositions()).thenReturn(List.of());

        String status = handler.buildStatusMessage();

        assertTrue(status.contains("Mode: SANDBOX | Trading: ENABLED"));
        assertTrue(status.contains("Trades today: 2/5 | P&L today: $-12.50"));
        assertTrue(status.contains("PREVIEW ONLY"));
    }

    @Test
    void slashCommand_isCaseInsensitive() {
        when(ledger.getOpenPositionSummaries()).thenReturn(List.of());

        handler.handleMessage(new TelegramNotifier.TelegramMessage(42, 1, "/positions", "trader"));

        verify(telegram).send("No open positions.");
    }

    @Test
    void positions_listLiveFigures() {
        PositionSummary p = new PositionSummary("p-1", "BTC/USD", "long", 60000, 0.5, 30000, 57000.0, null, null,
            60000.0, "open", "t-1", LocalDateTime.of(2024, 5, 1, 9, 0), 62000.0, 1000.0, 3.33, 8.06, null);
        when(ledger.getOpenPositionSummaries()).thenReturn(List.of(p));

        String message = handler.buildPositionsMessage();

        assertTrue(message.startsWith("Open positions (1):"));
        assertTrue(message.contains("BTC/USD LONG | 0.5 @ $60000.00 | Now $62000.00 | P&L +$1000.00 | SL $57000.00 | TP none"));
    }

    @Test
    void directive_missing() {
        when(ceo.getCurrentDirective()).thenReturn(Optional.empty());

        handler.handleMessage(new TelegramNotifier.TelegramMessage(42, 2, "DIRECTIVE", "trader"));

        verify(telegram).send("No CEO directive yet.");
    }

    @Test
    void sentinel_showsLastRunOrError() {
        SentinelRun run = SentinelRun.builder()
            .id("r-1")
            .error("Reasoning API returned 529")
            .durationMs(1200)
            .createdAt(LocalDateTime.of(2024, 5, 1, 9, 30))
            .build();
        when(sentinel.getRecentRuns(1)).thenReturn(List.of(run));

        String message = handler.buildSentinelMessage();

        assertTrue(message.startsWith("Last Sentinel run (2024-05-01T09:30, 1200 ms)"));
        assertTrue(message.endsWith("Error: Reasoning API returned 529"));
    }

    @Test
    void unknownText_isIgnored() {
        handler.handleMessage(new TelegramNotifier.TelegramMessage(42, 3, "buy BTC now", "trader"));

        verify(telegram, never()).send(anyString());
    }
}
