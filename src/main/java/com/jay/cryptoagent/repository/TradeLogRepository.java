package com.jay.cryptoagent.repository;

import com.jay.cryptoagent.entity.TradeLog;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface TradeLogRepository extends JpaRepository<TradeLog, String> {

    List<TradeLog> findAllByOrderByCreatedAtDesc(Pageable pageable);

    List<TradeLog> findBySymbolOrderByCreatedAtDesc(String symbol, Pageable pageable);

    List<TradeLog> findByCreatedAtGreaterThanEqual(LocalDateTime since);

    @Query("SELECT COUNT(t) FROM TradeLog t WHERE t.createdAt >= :since")
    long countSince(@Param("since") LocalDateTime since);
}
