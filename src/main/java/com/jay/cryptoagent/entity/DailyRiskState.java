package com.jay.cryptoagent.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/** Singleton row holding today's trade count and realised P&L. */
@Entity
@Table(name = "daily_risk_state")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DailyRiskState {

    public static final String SINGLETON_ID = "daily";

    @Id
    @Column(length = 10)
    @Builder.Default
    private String id = SINGLETON_ID;

    private int tradesToday;
    private double pnlToday;
    private LocalDate lastResetDate;
}
