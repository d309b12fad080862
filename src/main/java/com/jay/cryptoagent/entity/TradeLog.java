package com.jay.cryptoagent.entity;

import com.jay.cryptoagent.model.enums.TradeSide;
import com.jay.cryptoagent.model.enums.TradeSource;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.LocalDateTime;

/**
 * One executed order. Rows are append-only: every field, including the position link,
 * is supplied at insert time and nothing is written afterwards.
 */
@Entity
@Table(name = "trade_log", indexes = {
    @Index(name = "idx_trade_log_created", columnList = "createdAt"),
    @Index(name = "idx_trade_log_symbol", columnList = "symbol")
})
@Getter
@ToString
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradeLog {

    @Id
    @Column(length = 36)
    private String id;

    @Column(nullable = false, length = 20)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 4)
    private TradeSide side;

    @Column(length = 10)
    private String orderType;    // market/limit

    private double amount;
    private Double price;
    private Double cost;

    @Column(length = 64)
    private String exchangeOrderId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 12)
    private TradeSource source;

    @Column(length = 1000)
    private String reasoning;

    @Column(length = 36)
    private String sentinelRunId;
    @Column(length = 36)
    private String positionId;

    private boolean sandbox;

    @Column(updatable = false)
    private LocalDateTime createdAt;
}
