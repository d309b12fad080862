package com.jay.cryptoagent.repository;

import com.jay.cryptoagent.entity.Position;
import com.jay.cryptoagent.model.enums.PositionSide;
import com.jay.cryptoagent.model.enums.PositionStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class PositionRepositoryTest {

    private static final LocalDateTime MORNING = LocalDateTime.of(2024, 5, 1, 8, 0);

    @Autowired
    private PositionRepository repo;

    @Test
    void openPositionLookups() {
        repo.save(position("p-1", "BTC/USD", PositionStatus.OPEN, null));
        repo.save(position("p-2", "ETH/USD", PositionStatus.CLOSED, MORNING.plusHours(1)));

        assertThat(repo.existsBySymbolAndStatus("BTC/USD", PositionStatus.OPEN)).isTrue();
        assertThat(repo.existsBySymbolAndStatus("ETH/USD", PositionStatus.OPEN)).isFalse();
        assertThat(repo.findFirstBySymbolAndStatus("BTC/USD", PositionStatus.OPEN)).map(Position::getId).contains("p-1");
        assertThat(repo.findByStatusOrderByCreatedAtAsc(PositionStatus.OPEN)).extracting(Position::getId)
            .containsExactly("p-1");
    }

    @Test
    void findClosedSince_excludesOpenAndOlderExits() {
        repo.save(position("p-1", "BTC/USD", PositionStatus.OPEN, null));
        repo.save(position("p-2", "ETH/USD", PositionStatus.STOPPED_OUT, MORNING.plusHours(2)));
        repo.save(position("p-3", "SOL/USD", PositionStatus.TOOK_PROFIT, MORNING.minusDays(1)));

        List<Position> closed = repo.findClosedSince(MORNING);

        assertThat(closed).extracting(Position::getId).containsExactly("p-2");
    }

    private static Position position(String id, String symbol, PositionStatus status, LocalDateTime closedAt) {
        return Position.builder()
            .id(id)
            .symbol(symbol)
            .side(PositionSide.LONG)
            .entryPrice(100)
            .amount(1)
            .costBasis(100)
            .status(status)
            .realizedPnl(closedAt != null ? 5.0 : null)
            .createdAt(MORNING.minusDays(2))
            .closedAt(closedAt)
            .build();
    }
}
