package com.riskmonitor.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the trade_outcomes table. One row per closed position.
 */
@Entity
@Table(
        name = "trade_outcomes",
        indexes = @Index(name = "idx_trade_outcomes_trader_close", columnList = "trader_id, close_time"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TradeOutcomeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "trader_id", nullable = false, length = 64)
    private String traderId;

    @Column(length = 32)
    private String symbol;

    @Column(length = 8)
    private String side;

    private double pnl;

    @Column(name = "pnl_pct")
    private double pnlPct;

    @Column(name = "duration_minutes")
    private double durationMinutes;

    @Column(name = "open_time")
    private LocalDateTime openTime;

    @Column(name = "close_time")
    private LocalDateTime closeTime;
}
