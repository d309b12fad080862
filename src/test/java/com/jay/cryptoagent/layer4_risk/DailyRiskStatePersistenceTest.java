package com.jay.cryptoagent.layer4_risk;

import com.jay.cryptoagent.config.AgentConfig;
import com.jay.cryptoagent.entity.DailyRiskState;
import com.jay.cryptoagent.repository.DailyRiskStateRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/** Daily state against a real H2 row; every save commits on its own. */
@DataJpaTest
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class DailyRiskStatePersistenceTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 5, 1);

    @Autowired
    private DailyRiskStateRepository repo;

    private DailyRiskStateService service;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);
        service = new DailyRiskStateService(repo, new AgentConfig(), clock);
    }

    @AfterEach
    void cleanUp() {
        repo.deleteAll();
    }

    @Test
    void concurrentDeltas_areNeverLost() throws Exception {
        int threads = 8;
        int perThread = 25;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        service.applyDelta(1, -0.5);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        DailyRiskStateService.DailyState state = service.read();
        assertThat(state.tradesToday()).isEqualTo(threads * perThread);
        assertThat(state.pnlToday()).isCloseTo(-0.5 * threads * perThread, within(1e-9));
        assertThat(repo.count()).isEqualTo(1);
    }

    @Test
    void writeOfRead_leavesStateUnchanged() {
        service.applyDelta(3, -12.5);
        DailyRiskStateService.DailyState before = service.read();

        service.write(service.read());

        assertThat(service.read()).isEqualTo(before);
        DailyRiskState row = repo.findById(DailyRiskState.SINGLETON_ID).orElseThrow();
        assertThat(row.getTradesToday()).isEqualTo(3);
        assertThat(row.getPnlToday()).isEqualTo(-12.5);
        assertThat(row.getLastResetDate()).isEqualTo(TODAY);
    }

    @Test
    void writeOfRead_onEmptyStore_writesZeroStateForToday() {
        service.write(service.read());

        assertThat(service.read()).isEqualTo(new DailyRiskStateService.DailyState(0, 0, TODAY));
    }
}
