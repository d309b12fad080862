package com.jay.cryptoagent.repository;

import com.jay.cryptoagent.entity.DailyRiskState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface DailyRiskStateRepository extends JpaRepository<DailyRiskState, String> {
}
