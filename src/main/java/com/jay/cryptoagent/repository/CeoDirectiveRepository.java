package com.jay.cryptoagent.repository;

import com.jay.cryptoagent.entity.CeoDirectiveRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface CeoDirectiveRepository extends JpaRepository<CeoDirectiveRecord, String> {
}
