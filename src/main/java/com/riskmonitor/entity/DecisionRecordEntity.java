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
 * JPA entity for the decision_records table.
 * One row per decision cycle of a trader, written by the trading runtime and read by the monitor.
 */
@Entity
@Table(
        name = "decision_records",
        indexes = @Index(name = "idx_decision_records_trader_ts", columnList = "trader_id, timestamp"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DecisionRecordEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "trader_id", nullable = false, length = 64)
    private String traderId;

    @Column(nullable = false)
    private LocalDateTime timestamp;

    @Column(name = "total_balance")
    private double totalBalance;

    @Column(name = "available_balance")
    private double availableBalance;

    @Column(name = "total_unrealized_profit")
    private double totalUnrealizedProfit;

    @Column(name = "margin_used_pct")
    private double marginUsedPct;

    @Column(name = "position_count")
    private int positionCount;

    private boolean success;
}
