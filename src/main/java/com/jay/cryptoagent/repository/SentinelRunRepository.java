package com.jay.cryptoagent.repository;

import com.jay.cryptoagent.entity.SentinelRun;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface SentinelRunRepository extends JpaRepository<SentinelRun, String> {

    List<SentinelRun> findAllByOrderByCreatedAtDesc(Pageable pageable);

    List<SentinelRun> findByCreatedAtGreaterThanEqualOrderByCreatedAtDesc(LocalDateTime since);
}
