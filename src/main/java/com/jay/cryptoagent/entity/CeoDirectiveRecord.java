package com.jay.cryptoagent.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/** Singleton row: the current CEO directive as JSON plus the last successful briefing time. */
@Entity
@Table(name = "ceo_directive")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CeoDirectiveRecord {

    public static final String SINGLETON_ID = "current";

    @Id
    @Column(length = 10)
    @Builder.Default
    private String id = SINGLETON_ID;

    @Lob
    @Column(columnDefinition = "CLOB")
    private String payload;

    private LocalDateTime lastRunAt;
    private LocalDateTime updatedAt;
}
