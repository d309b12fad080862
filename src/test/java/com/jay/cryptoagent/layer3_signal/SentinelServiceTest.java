package com.jay.cryptoagent.layer3_signal;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jay.cryptoagent.config.AgentConfig;
import com.jay.cryptoagent.entity.SentinelRun;
import com.jay.cryptoagent.layer1_data.ExchangeGateway;
import com.jay.cryptoagent.layer4_risk.TradingGate;
import com.jay.cryptoagent.layer5_strategy.CeoBriefingService;
import com.jay.cryptoagent.layer6_execution.TradeExecutor;
import com.jay.cryptoagent.model.BalanceEntry;
import com.jay.cryptoagent.model.CeoDirective;
import com.jay.cryptoagent.model.DailyTradeStats;
import com.jay.cryptoagent.model.TechnicalIndicators;
import com.jay.cryptoagent.model.Ticker;
import com.jay.cryptoagent.model.enums.TradeSide;
import com.jay.cryptoagent.model.enums.TradeSource;
import com.jay.cryptoagent.model.enums.Trend;
import com.jay.cryptoagent.model.enums.VolumeTrend;
import com.jay.cryptoagent.notification.Notifier;
import com.jay.cryptoagent.reasoning.ReasoningClient;
import com.jay.cryptoagent.reasoning.ReasoningException;
import com.jay.cryptoagent.repository.SentinelRunRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SentinelServiceTest {

    @Mock
    private SentinelContextGatherer contextGatherer;

    @Mock
    private SentinelPromptBuilder promptBuilder;

    @Mock
    private ReasoningClient reasoning;

    @Mock
    private TradingGate gate;

    @Mock
    private TradeExecutor executor;

    @Mock
    private ExchangeGateway gateway;

    @Mock
    private CeoBriefingService ceo;

    @Mock
    private SentinelRunRepository runRepository;

    @Mock
    private Notifier notifier;

    private AgentConfig config;
    private SentinelService service;

    @BeforeEach
    void setUp() {
        config = new AgentConfig();
        config.sentinel().setEnabled(true);
        ObjectMapper mapper = new ObjectMapper();
        Clock clock = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);
        service = new SentinelService(contextGatherer, promptBuilder, new SentinelOutputParser(mapper), reasoning,
            gate, executor, gateway, ceo, runRepository, notifier, config, mapper, clock);
        lenient().when(runRepository.save(any(SentinelRun.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    void tick_disabled_returnsNull() {
        config.sentinel().setEnabled(false);

        assertNull(service.tick());
        verifyNoInteractions(contextGatherer, reasoning);
    }

    @Test
    void degradedContext_recordsErrorWithoutReasoning() {
        when(contextGatherer.gather()).thenReturn(context(List.of(), Map.of()));

        SentinelRun run = service.tick();

        assertEquals(SentinelService.DEGRADED_CONTEXT, run.getError());
        verifyNoInteractions(reasoning, executor, notifier);
    }

    @Test
    void unparseableOutput_recordsRawSummaryAndTradesNothing() {
        stubPipeline("The market is choppy. I would sit on my hands today.");
        when(gate.evaluateAutomated()).thenReturn(TradingGate.Decision.PERMITTED);

        SentinelRun run = service.tick();

        assertNull(run.getActionsJson());
        assertNull(run.getSentimentJson());
        assertEquals("The market is choppy. I would sit on my hands today.", run.getSummary());
        assertNull(run.getError());
        verifyNoInteractions(executor);
        verify(notifier).send("[Crypto Sentinel] The market is choppy. I would sit on my hands today.");
    }

    @Test
    void buyAction_isExecutedAndReported() {
        stubPipeline(output("[{\"type\": \"buy\", \"symbol\": \"BTC\", \"amount\": 0.001, \"reason\": \"bounce\"}]"));
        when(gate.evaluateAutomated()).thenReturn(TradingGate.Decision.PERMITTED);
        when(gateway.fetchTicker("BTC/USD")).thenReturn(ticker("BTC/USD", 60000));
        when(gateway.getMaxTradeUsd()).thenReturn(100.0);
        when(executor.execute(any())).thenReturn(new TradeExecutor.Execution("t-1", "o-1", "BTC/USD", TradeSide.BUY,
            0.001, 0.001, 60000, 60, "closed", "p-1", false, false, 0, true));

        SentinelRun run = service.tick();

        ArgumentCaptor<TradeExecutor.TradeRequest> req = ArgumentCaptor.forClass(TradeExecutor.TradeRequest.class);
        verify(executor).execute(req.capture());
        assertEquals("BTC/USD", req.getValue().symbol());
        assertEquals(TradeSide.BUY, req.getValue().side());
        assertEquals(TradeSource.SENTINEL, req.getValue().source());
        assertEquals(run.getId(), req.getValue().sentinelRunId());
        assertNotNull(run.getActionsJson());
        verify(notifier).send("[Crypto Sentinel] Buying BTC.\n\nTrades executed: BUY 0.001 BTC/USD @ $60000.00");
    }

    @Test
    void actionWithoutAmount_spendsMaxTradeSize() {
        stubPipeline(output("[{\"type\": \"buy\", \"symbol\": \"BTC\"}]"));
        when(gate.evaluateAutomated()).thenReturn(TradingGate.Decision.PERMITTED);
        when(gateway.fetchTicker("BTC/USD")).thenReturn(ticker("BTC/USD", 50000));
        when(gateway.getMaxTradeUsd()).thenReturn(100.0);
        when(executor.execute(any())).thenReturn(new TradeExecutor.Execution("t-1", "o-1", "BTC/USD", TradeSide.BUY,
            0.002, 0.002, 50000, 100, "closed", "p-1", false, false, 0, true));

        service.tick();

        ArgumentCaptor<TradeExecutor.TradeRequest> req = ArgumentCaptor.forClass(TradeExecutor.TradeRequest.class);
        verify(executor).execute(req.capture());
        assertEquals(0.002, req.getValue().amount(), 1e-12);
    }

    @Test
    void oversizedAction_isReportedAsFailed() {
        stubPipeline(output("[{\"type\": \"buy\", \"symbol\": \"BTC\", \"amount\": 1.0}]"));
        when(gate.evaluateAutomated()).thenReturn(TradingGate.Decision.PERMITTED);
        when(gateway.fetchTicker("BTC/USD")).thenReturn(ticker("BTC/USD", 60000));
        when(gateway.getMaxTradeUsd()).thenReturn(100.0);

        service.tick();

        verifyNoInteractions(executor);
        ArgumentCaptor<String> message = ArgumentCaptor.forClass(String.class);
        verify(notifier).send(message.capture());
        assertTrue(message.getValue().contains("Trades failed: buy BTC (Estimated $60000.00 exceeds max trade $100)"));
    }

    @Test
    void gateClosed_actionsAreNotExecuted() {
        stubPipeline(output("[{\"type\": \"sell\", \"symbol\": \"ETH\", \"amount\": 0.01}]"));
        when(gate.evaluateAutomated()).thenReturn(TradingGate.Decision.PREVIEW_ONLY);

        SentinelRun run = service.tick();

        assertNotNull(run.getActionsJson());
        verifyNoInteractions(executor, gateway);
    }

    @Test
    void holdActions_areSkipped() {
        stubPipeline(output("[{\"type\": \"hold\", \"symbol\": \"BTC\"}]"));
        when(gate.evaluateAutomated()).thenReturn(TradingGate.Decision.PERMITTED);

        service.tick();

        verifyNoInteractions(executor, gateway);
        verify(gate, times(1)).evaluateAutomated();
    }

    @Test
    void reasoningFailure_isRecordedOnTheRun() {
        when(contextGatherer.gather()).thenReturn(healthyContext());
        when(gate.evaluateAutomated()).thenReturn(TradingGate.Decision.DISABLED);
        when(promptBuilder.build(any(), any())).thenReturn(
            new SentinelPromptBuilder.SentinelPrompt("system", "user", TradingGate.Decision.DISABLED));
        when(reasoning.generate(anyString(), anyString(), anyString(), anyInt(), anyBoolean()))
            .thenThrow(new ReasoningException("Reasoning API returned 529"));

        SentinelRun run = service.tick();

        assertEquals("Reasoning API returned 529", run.getError());
        verifyNoInteractions(notifier, executor);
    }

    @Test
    void ceoEnabled_escalationIsChecked() {
        config.ceo().setEnabled(true);
        stubPipeline(output("[]"));
        when(gate.evaluateAutomated()).thenReturn(TradingGate.Decision.PERMITTED);
        CeoDirective directive = CeoDirective.builder().build();
        CeoBriefingService.EscalationCheck check = new CeoBriefingService.EscalationCheck(true, "Directive expired");
        when(ceo.getCurrentDirective()).thenReturn(Optional.of(directive));
        when(ceo.shouldEscalate(anyMap(), eq(directive))).thenReturn(check);

        service.tick();

        verify(ceo).escalateIfDue(check);
    }

    @Test
    void failureAfterRecording_keepsDecisionAndAddsError() {
        stubPipeline(output("[{\"type\": \"hold\", \"symbol\": \"BTC\"}]"));
        when(gate.evaluateAutomated()).thenReturn(TradingGate.Decision.PERMITTED);
        doThrow(new IllegalStateException("notifier down")).when(notifier).send(anyString());

        SentinelRun run = service.tick();

        assertEquals("notifier down", run.getError());
        assertEquals("Buying BTC.", run.getSummary());
        assertNotNull(run.getActionsJson());
        assertNotNull(run.getIndicatorsJson());
        ArgumentCaptor<SentinelRun> saved = ArgumentCaptor.forClass(SentinelRun.class);
        verify(runRepository, times(2)).save(saved.capture());
        assertSame(saved.getAllValues().get(0), saved.getAllValues().get(1));
    }

    @Test
    void runNow_whileRunning_isRejected() {
        when(contextGatherer.gather()).thenAnswer(inv -> {
            assertThrows(IllegalStateException.class, () -> service.runNow());
            return context(List.of(), Map.of());
        });

        service.runNow();

        assertFalse(service.isRunning());
    }

    // ── Fixtures ──────────────────────────────────────────────────────────────

    private void stubPipeline(String reply) {
        when(contextGatherer.gather()).thenReturn(healthyContext());
        when(promptBuilder.build(any(), any())).thenReturn(
            new SentinelPromptBuilder.SentinelPrompt("system", "user", TradingGate.Decision.PERMITTED));
        when(reasoning.generate(anyString(), eq("system"), eq("user"), eq(0), eq(false))).thenReturn(reply);
    }

    private static String output(String actions) {
        return "Analysis below.\n\n```sentinel-output\n{\"signals\": [], \"actions\": " + actions
            + ", \"summary\": \"Buying BTC.\"}\n```\n";
    }

    private static SentinelContext healthyContext() {
        TechnicalIndicators btc = new TechnicalIndicators("BTC/USD", "1h", 60000, 59000, 58000, 57000, 59500, 59000,
            55, 100, 80, 20, 58000, 62000, VolumeTrend.STABLE, Trend.BULLISH, List.of());
        return context(List.of(new BalanceEntry("USD", 1000, 1000)), Map.of("BTC/USD", btc));
    }

    private static SentinelContext context(List<BalanceEntry> portfolio, Map<String, TechnicalIndicators> indicators) {
        return new SentinelContext(List.of("BTC"), portfolio, List.of(), indicators, List.of(), List.of(),
            DailyTradeStats.empty(), List.of(), List.of(), List.of());
    }

    private static Ticker ticker(String symbol, double last) {
        return new Ticker(symbol, last, null, null, null, null, null, null, null);
    }
}
