package com.jay.cryptoagent.layer4_risk;

import com.jay.cryptoagent.config.AgentConfig;
import com.jay.cryptoagent.entity.DailyRiskState;
import com.jay.cryptoagent.repository.DailyRiskStateRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DailyRiskStateServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 5, 1);

    @Mock
    private DailyRiskStateRepository repo;

    private AgentConfig config;
    private DailyRiskStateService service;

    @BeforeEach
    void setUp() {
        config = new AgentConfig();
        config.sentinel().setMaxTradesPerDay(5);
        config.sentinel().setDailyLossLimitUsd(50);
        Clock clock = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);
        service = new DailyRiskStateService(repo, config, clock);
    }

    @Test
    void read_noRow_returnsZeroStateForToday() {
        when(repo.findById(DailyRiskState.SINGLETON_ID)).thenReturn(Optional.empty());

        DailyRiskStateService.DailyState state = service.read();

        assertEquals(0, state.tradesToday());
        assertEquals(0.0, state.pnlToday());
        assertEquals(TODAY, state.lastResetDate());
    }

    @Test
    void read_staleRow_isTreatedAsFreshDayWithoutWriting() {
        when(repo.findById(DailyRiskState.SINGLETON_ID)).thenReturn(Optional.of(row(4, -30, TODAY.minusDays(1))));

        DailyRiskStateService.DailyState state = service.read();

        assertEquals(0, state.tradesToday());
        assertEquals(0.0, state.pnlToday());
        assertEquals(TODAY, state.lastResetDate());
        verify(repo, never()).save(any());
    }

    @Test
    void read_todayRow_isReturnedAsStored() {
        when(repo.findById(DailyRiskState.SINGLETON_ID)).thenReturn(Optional.of(row(3, -12.5, TODAY)));

        DailyRiskStateService.DailyState state = service.read();

        assertEquals(3, state.tradesToday());
        assertEquals(-12.5, state.pnlToday());
    }

    @Test
    void applyDelta_addsToTodaysState() {
        when(repo.findById(DailyRiskState.SINGLETON_ID)).thenReturn(Optional.of(row(2, -10, TODAY)));

        DailyRiskStateService.DailyState next = service.applyDelta(1, -5);

        assertEquals(3, next.tradesToday());
        assertEquals(-15.0, next.pnlToday(), 1e-9);
        ArgumentCaptor<DailyRiskState> saved = ArgumentCaptor.forClass(DailyRiskState.class);
        verify(repo).save(saved.capture());
        assertEquals(3, saved.getValue().getTradesToday());
        assertEquals(TODAY, saved.getValue().getLastResetDate());
    }

    @Test
    void applyDelta_onStaleRow_startsFromZero() {
        when(repo.findById(DailyRiskState.SINGLETON_ID)).thenReturn(Optional.of(row(5, -80, TODAY.minusDays(1))));

        DailyRiskStateService.DailyState next = service.applyDelta(1, 0);

        assertEquals(1, next.tradesToday());
        assertEquals(0.0, next.pnlToday());
        assertEquals(TODAY, next.lastResetDate());
    }

    @Test
    void limits_reflectConfig() {
        when(repo.findById(DailyRiskState.SINGLETON_ID)).thenReturn(Optional.of(row(5, -50, TODAY)));

        assertTrue(service.isTradeLimitReached());
        assertTrue(service.isLossLimitReached());
    }

    @Test
    void limits_notReachedBelowThresholds() {
        when(repo.findById(DailyRiskState.SINGLETON_ID)).thenReturn(Optional.of(row(4, -49.99, TODAY)));

        assertFalse(service.isTradeLimitReached());
        assertFalse(service.isLossLimitReached());
    }

    private static DailyRiskState row(int trades, double pnl, LocalDate date) {
        return DailyRiskState.builder()
            .id(DailyRiskState.SINGLETON_ID)
            .tradesToday(trades)
            .pnlToday(pnl)
            .lastResetDate(date)
            .build();
    }
}
