package com.jay.cryptoagent.entity;

import com.jay.cryptoagent.model.enums.PositionSide;
import com.jay.cryptoagent.model.enums.PositionStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(name = "positions", indexes = {
    @Index(name = "idx_positions_symbol_status", columnList = "symbol,status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Position {

    @Id
    @Column(length = 36)
    private String id;

    @Column(nullable = false, length = 20)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private PositionSide side;

    private double entryPrice;
    private double amount;
    private double costBasis;

    // Protective levels (null when not set)
    private Double stopLoss;
    private Double takeProfit;
    private Double trailingStopPct;
    private Double highWaterMark;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 15)
    private PositionStatus status;

    @Column(length = 36)
    private String entryTradeId;
    @Column(length = 36)
    private String exitTradeId;

    // Set once, on close
    private Double realizedPnl;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private LocalDateTime closedAt;

    @Version
    private Long version;

    public boolean isOpen() {
        return status == PositionStatus.OPEN;
    }
}
