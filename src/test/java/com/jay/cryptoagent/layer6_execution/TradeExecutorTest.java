package com.jay.cryptoagent.layer6_execution;

import com.jay.cryptoagent.config.AgentConfig;
import com.jay.cryptoagent.entity.Position;
import com.jay.cryptoagent.layer1_data.ExchangeException;
import com.jay.cryptoagent.layer1_data.ExchangeGateway;
import com.jay.cryptoagent.layer4_risk.DailyRiskStateService;
import com.jay.cryptoagent.model.OrderResult;
import com.jay.cryptoagent.model.enums.PositionStatus;
import com.jay.cryptoagent.model.enums.TradeSide;
import com.jay.cryptoagent.model.enums.TradeSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TradeExecutorTest {

    @Mock
    private ExchangeGateway gateway;

    @Mock
    private TradeLogService tradeLog;

    @Mock
    private PositionLedger ledger;

    @Mock
    private DailyRiskStateService dailyState;

    private TradeExecutor executor;

    @BeforeEach
    void setUp() {
        AgentConfig config = new AgentConfig();
        config.exchange().setSandboxMode(true);
        executor = new TradeExecutor(gateway, tradeLog, ledger, dailyState, config);
    }

    @Test
    void buy_opensPositionAndCountsTrade() {
        when(ledger.findOpenPosition("BTC/USD")).thenReturn(Optional.empty());
        when(gateway.createOrder("BTC/USD", "market", "buy", 0.01, null))
            .thenReturn(order("o-1", "closed", 0.01, 60100.0, 601.0));

        TradeExecutor.Execution exec = executor.execute(buy("BTC/USD", 0.01, 60000));

        assertEquals("o-1", exec.orderId());
        assertEquals(0.01, exec.filledAmount(), 1e-12);
        assertEquals(60100.0, exec.fillPrice(), 1e-9);
        assertNotNull(exec.positionId());
        assertTrue(exec.sandbox());

        ArgumentCaptor<PositionLedger.OpenPositionRequest> opened =
            ArgumentCaptor.forClass(PositionLedger.OpenPositionRequest.class);
        verify(ledger).openPosition(opened.capture());
        assertEquals(exec.positionId(), opened.getValue().id());
        assertEquals(exec.tradeId(), opened.getValue().entryTradeId());
        assertEquals(601.0, opened.getValue().costBasis(), 1e-9);

        ArgumentCaptor<TradeLogService.TradeLogEntry> logged = ArgumentCaptor.forClass(TradeLogService.TradeLogEntry.class);
        verify(tradeLog).logTrade(logged.capture());
        assertEquals(exec.tradeId(), logged.getValue().id());
        assertEquals(exec.positionId(), logged.getValue().positionId());
        assertEquals(TradeSource.SENTINEL, logged.getValue().source());
        verify(dailyState).applyDelta(1, 0.0);
    }

    @Test
    void buy_withOpenPosition_isRefusedBeforeOrdering() {
        when(ledger.findOpenPosition("BTC/USD"))
            .thenReturn(Optional.of(PositionLedgerTest.open("pos-1", "BTC/USD", 60000, 0.1)));

        assertThrows(IllegalStateException.class, () -> executor.execute(buy("BTC/USD", 0.01, 60000)));
        verifyNoInteractions(gateway, tradeLog, dailyState);
    }

    @Test
    void canceledOrder_throwsAndBooksNothing() {
        when(ledger.findOpenPosition("BTC/USD")).thenReturn(Optional.empty());
        when(gateway.createOrder(anyString(), anyString(), anyString(), anyDouble(), any()))
            .thenReturn(order("o-2", "canceled", 0, null, null));

        assertThrows(ExchangeException.class, () -> executor.execute(buy("BTC/USD", 0.01, 60000)));
        verifyNoInteractions(tradeLog, dailyState);
        verify(ledger, never()).openPosition(any());
    }

    @Test
    void restingLimitBuy_logsTradeWithoutOpeningPosition() {
        when(ledger.findOpenPosition("BTC/USD")).thenReturn(Optional.empty());
        when(gateway.createOrder("BTC/USD", "limit", "buy", 0.01, 55000.0))
            .thenReturn(order("o-3", "open", 0, 55000.0, null));

        TradeExecutor.Execution exec = executor.execute(TradeExecutor.TradeRequest.builder()
            .symbol("BTC/USD").side(TradeSide.BUY).orderType("limit").amount(0.01).limitPrice(55000.0)
            .referencePrice(60000).source(TradeSource.USER).build());

        assertNull(exec.positionId());
        assertEquals("open", exec.orderStatus());
        verify(ledger, never()).openPosition(any());
        verify(tradeLog).logTrade(any());
        verify(dailyState).applyDelta(1, 0.0);
    }

    @Test
    void fullSell_closesPositionWithRequestedStatus() {
        Position position = PositionLedgerTest.open("pos-1", "BTC/USD", 60000, 0.5);
        when(ledger.findById("pos-1")).thenReturn(Optional.of(position));
        when(gateway.createOrder("BTC/USD", "market", "sell", 0.5, null))
            .thenReturn(order("o-4", "closed", 0.5, 56900.0, null));
        Position closed = PositionLedgerTest.open("pos-1", "BTC/USD", 60000, 0.5);
        closed.setStatus(PositionStatus.STOPPED_OUT);
        closed.setRealizedPnl(-1550.0);
        when(ledger.closePosition(eq("pos-1"), anyString(), eq(56900.0), eq(PositionStatus.STOPPED_OUT)))
            .thenReturn(Optional.of(closed));

        TradeExecutor.Execution exec = executor.execute(TradeExecutor.TradeRequest.builder()
            .symbol("BTC/USD").side(TradeSide.SELL).amount(0.5).referencePrice(57000)
            .source(TradeSource.STOP_LOSS).positionId("pos-1").closeStatus(PositionStatus.STOPPED_OUT).build());

        assertTrue(exec.positionClosed());
        assertFalse(exec.partialFill());
        assertEquals(-1550.0, exec.realizedPnl(), 1e-9);
        assertEquals(28450.0, exec.cost(), 1e-6);
        verify(dailyState).applyDelta(1, -1550.0);
    }

    @Test
    void partialSell_reducesPositionAndLeavesItOpen() {
        Position position = PositionLedgerTest.open("pos-1", "BTC/USD", 60000, 1.0);
        when(ledger.findOpenPosition("BTC/USD")).thenReturn(Optional.of(position));
        when(gateway.createOrder("BTC/USD", "market", "sell", 1.0, null))
            .thenReturn(order("o-5", "closed", 0.6, 61000.0, null));
        when(ledger.reducePosition("pos-1", 0.6, 61000.0)).thenReturn(600.0);

        TradeExecutor.Execution exec = executor.execute(TradeExecutor.TradeRequest.builder()
            .symbol("BTC/USD").side(TradeSide.SELL).amount(1.0).referencePrice(61000)
            .source(TradeSource.USER).build());

        assertTrue(exec.partialFill());
        assertFalse(exec.positionClosed());
        assertEquals(600.0, exec.realizedPnl(), 1e-9);
        verify(ledger, never()).closePosition(anyString(), anyString(), anyDouble(), any());
        verify(dailyState).applyDelta(1, 600.0);
    }

    @Test
    void exitOfPositionNoLongerOpen_isRefusedBeforeOrdering() {
        Position closed = PositionLedgerTest.open("pos-1", "BTC/USD", 60000, 0.5);
        closed.setStatus(PositionStatus.CLOSED);
        when(ledger.findById("pos-1")).thenReturn(Optional.of(closed));

        assertThrows(IllegalStateException.class, () -> executor.execute(TradeExecutor.TradeRequest.builder()
            .symbol("BTC/USD").side(TradeSide.SELL).amount(0.5).referencePrice(57000)
            .source(TradeSource.STOP_LOSS).positionId("pos-1").closeStatus(PositionStatus.STOPPED_OUT).build()));
        verifyNoInteractions(gateway, tradeLog, dailyState);
    }

    @Test
    void targetedExit_sellsNoMoreThanPositionHolds() {
        Position reduced = PositionLedgerTest.open("pos-1", "BTC/USD", 60000, 0.2);
        when(ledger.findById("pos-1")).thenReturn(Optional.of(reduced));
        when(gateway.createOrder("BTC/USD", "market", "sell", 0.2, null))
            .thenReturn(order("o-7", "closed", 0.2, 66000.0, null));
        when(ledger.closePosition(eq("pos-1"), anyString(), eq(66000.0), eq(PositionStatus.TOOK_PROFIT)))
            .thenReturn(Optional.of(reduced));

        TradeExecutor.Execution exec = executor.execute(TradeExecutor.TradeRequest.builder()
            .symbol("BTC/USD").side(TradeSide.SELL).amount(0.5).referencePrice(66000)
            .source(TradeSource.TAKE_PROFIT).positionId("pos-1").closeStatus(PositionStatus.TOOK_PROFIT).build());

        assertEquals(0.2, exec.requestedAmount(), 1e-12);
        assertTrue(exec.positionClosed());
        verify(gateway).createOrder("BTC/USD", "market", "sell", 0.2, null);
    }

    @Test
    void concurrentBuys_sameSymbol_placeOneOrder() throws Exception {
        AtomicReference<Position> open = new AtomicReference<>();
        when(ledger.findOpenPosition("BTC/USD")).thenAnswer(inv -> Optional.ofNullable(open.get()));
        when(ledger.openPosition(any())).thenAnswer(inv -> {
            PositionLedger.OpenPositionRequest req = inv.getArgument(0);
            Position p = PositionLedgerTest.open(req.id(), req.symbol(), req.entryPrice(), req.amount());
            open.set(p);
            return p;
        });
        when(gateway.createOrder("BTC/USD", "market", "buy", 0.001, null)).thenAnswer(inv -> {
            Thread.sleep(200);
            return order("o-8", "closed", 0.001, 60000.0, 60.0);
        });

        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<TradeExecutor.Execution>> results = new ArrayList<>();
        try {
            for (int i = 0; i < 2; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return executor.execute(buy("BTC/USD", 0.001, 60000));
                }));
            }
            start.countDown();

            int executed = 0;
            int refused = 0;
            for (Future<TradeExecutor.Execution> result : results) {
                try {
                    assertNotNull(result.get(5, TimeUnit.SECONDS).positionId());
                    executed++;
                } catch (ExecutionException e) {
                    assertInstanceOf(IllegalStateException.class, e.getCause());
                    refused++;
                }
            }
            assertEquals(1, executed);
            assertEquals(1, refused);
        } finally {
            pool.shutdownNow();
        }
        verify(gateway, times(1)).createOrder(anyString(), anyString(), anyString(), anyDouble(), any());
        verify(ledger, times(1)).openPosition(any());
        verify(dailyState, times(1)).applyDelta(1, 0.0);
    }

    @Test
    void bookkeepingFailure_stillCountsTheTrade() {
        when(ledger.findOpenPosition("ETH/USD")).thenReturn(Optional.empty());
        when(gateway.createOrder("ETH/USD", "market", "buy", 1.0, null))
            .thenReturn(order("o-6", "closed", 1.0, 3000.0, null));
        when(ledger.openPosition(any())).thenThrow(new IllegalStateException("db down"));

        TradeExecutor.Execution exec = executor.execute(buy("ETH/USD", 1.0, 3000));

        assertEquals("o-6", exec.orderId());
        verify(dailyState).applyDelta(1, 0.0);
    }

    private static TradeExecutor.TradeRequest buy(String symbol, double amount, double price) {
        return TradeExecutor.TradeRequest.builder()
            .symbol(symbol)
            .side(TradeSide.BUY)
            .amount(amount)
            .referencePrice(price)
            .source(TradeSource.SENTINEL)
            .sentinelRunId("run-1")
            .build();
    }

    private static OrderResult order(String id, String status, double filled, Double average, Double cost) {
        return OrderResult.builder()
            .id(id)
            .status(status)
            .filled(filled)
            .average(average)
            .cost(cost)
            .build();
    }
}
