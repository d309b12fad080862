package com.jay.cryptoagent.layer6_execution;

import com.jay.cryptoagent.entity.Position;
import com.jay.cryptoagent.layer1_data.ExchangeGateway;
import com.jay.cryptoagent.model.OrderResult;
import com.jay.cryptoagent.model.enums.PositionStatus;
import com.jay.cryptoagent.model.enums.TradeSide;
import com.jay.cryptoagent.model.enums.TradeSource;
import com.jay.cryptoagent.repository.DailyRiskStateRepository;
import com.jay.cryptoagent.repository.PositionRepository;
import com.jay.cryptoagent.repository.TradeLogRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/** Runs the real executor, ledger and daily state against H2 with a slow exchange. */
@SpringBootTest
class TradeExecutorConcurrencyTest {

    @MockBean
    private ExchangeGateway gateway;

    @Autowired
    private TradeExecutor executor;

    @Autowired
    private PositionRepository positionRepo;

    @Autowired
    private TradeLogRepository tradeLogRepo;

    @Autowired
    private DailyRiskStateRepository dailyRepo;

    @AfterEach
    void cleanUp() {
        positionRepo.deleteAll();
        tradeLogRepo.deleteAll();
        dailyRepo.deleteAll();
    }

    @Test
    void simultaneousBuys_openExactlyOnePosition() throws Exception {
        when(gateway.createOrder(eq("BTC/USD"), eq("market"), eq("buy"), anyDouble(), isNull()))
            .thenAnswer(inv -> slowFill("buy-order", 0.001, 60000.0));

        Outcome outcome = runTwice(() -> executor.execute(TradeExecutor.TradeRequest.builder()
            .symbol("BTC/USD").side(TradeSide.BUY).amount(0.001).referencePrice(60000)
            .source(TradeSource.SENTINEL).build()));

        assertThat(outcome.executed()).isEqualTo(1);
        assertThat(outcome.refused()).isEqualTo(1);
        verify(gateway, times(1)).createOrder(anyString(), anyString(), anyString(), anyDouble(), any());
        assertThat(positionRepo.findByStatusOrderByCreatedAtAsc(PositionStatus.OPEN)).hasSize(1);
        assertThat(tradeLogRepo.count()).isEqualTo(1);
    }

    @Test
    void simultaneousExits_ofOnePosition_sellOnce() throws Exception {
        when(gateway.createOrder(eq("ETH/USD"), eq("market"), eq("buy"), anyDouble(), isNull()))
            .thenReturn(OrderResult.builder().id("entry").status("closed").filled(1.0).average(3000.0).build());
        String positionId = executor.execute(TradeExecutor.TradeRequest.builder()
            .symbol("ETH/USD").side(TradeSide.BUY).amount(1.0).referencePrice(3000)
            .source(TradeSource.USER).build()).positionId();
        when(gateway.createOrder(eq("ETH/USD"), eq("market"), eq("sell"), anyDouble(), isNull()))
            .thenAnswer(inv -> slowFill("exit-order", 1.0, 2800.0));

        Outcome outcome = runTwice(() -> executor.execute(TradeExecutor.TradeRequest.builder()
            .symbol("ETH/USD").side(TradeSide.SELL).amount(1.0).referencePrice(2800)
            .source(TradeSource.STOP_LOSS).positionId(positionId).closeStatus(PositionStatus.STOPPED_OUT).build()));

        assertThat(outcome.executed()).isEqualTo(1);
        assertThat(outcome.refused()).isEqualTo(1);
        verify(gateway, times(1)).createOrder(eq("ETH/USD"), anyString(), eq("sell"), anyDouble(), any());
        Position closed = positionRepo.findById(positionId).orElseThrow();
        assertThat(closed.getStatus()).isEqualTo(PositionStatus.STOPPED_OUT);
        assertThat(closed.getRealizedPnl()).isEqualTo(-200.0);
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private static OrderResult slowFill(String id, double filled, double price) throws InterruptedException {
        Thread.sleep(200);
        return OrderResult.builder().id(id).status("closed").filled(filled).average(price).build();
    }

    private record Outcome(int executed, int refused) {}

    private static Outcome runTwice(Callable<TradeExecutor.Execution> call) throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<TradeExecutor.Execution>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < 2; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return call.call();
                }));
            }
            start.countDown();

            int executed = 0;
            int refused = 0;
            for (Future<TradeExecutor.Execution> future : futures) {
                try {
                    future.get(10, TimeUnit.SECONDS);
                    executed++;
                } catch (ExecutionException e) {
                    assertThat(e.getCause()).isInstanceOf(IllegalStateException.class);
                    refused++;
                }
            }
            return new Outcome(executed, refused);
        } finally {
            pool.shutdownNow();
        }
    }
}
