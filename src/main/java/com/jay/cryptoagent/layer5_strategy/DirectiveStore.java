package com.jay.cryptoagent.layer5_strategy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jay.cryptoagent.entity.CeoDirectiveRecord;
import com.jay.cryptoagent.model.CeoDirective;
import com.jay.cryptoagent.repository.CeoDirectiveRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Persists the single current directive as Jackson JSON. Saving replaces the previous directive
 * entirely; the last writer wins.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DirectiveStore {

    private final CeoDirectiveRepository repo;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public Optional<CeoDirective> getDirective() {
        return repo.findById(CeoDirectiveRecord.SINGLETON_ID)
            .filter(r -> r.getPayload() != null && !r.getPayload().isBlank())
            .flatMap(r -> {
                try {
                    return Optional.of(objectMapper.readValue(r.getPayload(), CeoDirective.class));
                } catch (JsonProcessingException e) {
                    log.error("Stored CEO directive is unreadable: {}", e.getMessage());
                    return Optional.empty();
                }
            });
    }

    /** Replaces the directive and stamps the last successful briefing time. */
    public void save(CeoDirective directive) {
        CeoDirectiveRecord row = repo.findById(CeoDirectiveRecord.SINGLETON_ID).orElseGet(CeoDirectiveRecord::new);
        try {
            row.setPayload(objectMapper.writeValueAsString(directive));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise CEO directive: " + e.getMessage(), e);
        }
        LocalDateTime now = LocalDateTime.now(clock);
        row.setId(CeoDirectiveRecord.SINGLETON_ID);
        row.setLastRunAt(now);
        row.setUpdatedAt(now);
        repo.save(row);
    }

    public Optional<LocalDateTime> getLastRunAt() {
        return repo.findById(CeoDirectiveRecord.SINGLETON_ID).map(CeoDirectiveRecord::getLastRunAt);
    }
}
