package com.jay.cryptoagent.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/** One Sentinel tick. Structured fields hold Jackson-encoded JSON. */
@Entity
@Table(name = "sentinel_runs", indexes = {
    @Index(name = "idx_sentinel_runs_created", columnList = "createdAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SentinelRun {

    @Id
    @Column(length = 36)
    private String id;

    @Lob
    @Column(columnDefinition = "CLOB")
    private String indicatorsJson;

    @Lob
    @Column(columnDefinition = "CLOB")
    private String portfolioJson;

    @Lob
    @Column(columnDefinition = "CLOB")
    private String sentimentJson;

    @Lob
    @Column(columnDefinition = "CLOB")
    private String signalsJson;

    // Null when the reasoning output could not be parsed
    @Lob
    @Column(columnDefinition = "CLOB")
    private String actionsJson;

    @Column(length = 4000)
    private String summary;

    private long durationMs;

    @Column(length = 1000)
    private String error;

    private LocalDateTime createdAt;
}
