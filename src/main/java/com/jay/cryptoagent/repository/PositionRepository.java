package com.jay.cryptoagent.repository;

import com.jay.cryptoagent.entity.Position;
import com.jay.cryptoagent.model.enums.PositionStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface PositionRepository extends JpaRepository<Position, String> {

    List<Position> findByStatusOrderByCreatedAtAsc(PositionStatus status);

    Optional<Position> findFirstBySymbolAndStatus(String symbol, PositionStatus status);

    boolean existsBySymbolAndStatus(String symbol, PositionStatus status);

    @Query("SELECT p FROM Position p WHERE p.status <> com.jay.cryptoagent.model.enums.PositionStatus.OPEN "
        + "AND p.closedAt IS NOT NULL AND p.closedAt >= :since")
    List<Position> findClosedSince(@Param("since") LocalDateTime since);
}
