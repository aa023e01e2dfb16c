package com.riskmonitor.domain.model;

import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * All indicators computed by one refresh cycle of a {@link com.riskmonitor.monitor.MonitorEngine}.
 *
 * <p>Immutable: the engine swaps whole instances, so a reader always sees fields derived
 * from the same batch of records. Fields not yet computed hold zero; {@code lastUpdated}
 * is null until the first successful cycle.
 *
 * <p>Percentages are expressed on a 0-100 scale. Currency amounts are in the account
 * currency of the trader.
 */
@Value
@Builder(toBuilder = true)
public class MetricsSnapshot {

    // ==================== Trade Statistics ====================

    int totalTrades;

    /** Winning trades as percentage of total trades. */
    double winRate;

    double profitFactor;

    double sharpeRatio;

    // ==================== Drawdown ====================

    /** Largest peak-to-trough decline observed in the balance sequence (%). */
    double maxDrawdown;

    /** Decline of the latest balance from the running peak (%). Never above maxDrawdown. */
    double currentDrawdown;

    // ==================== Risk ====================

    /** Value at Risk at 95% confidence (currency units). */
    double var95;

    /** Value at Risk at 99% confidence (currency units). */
    double var99;

    /**
     * Additive composite risk score. Nominally 0-100 but not clamped: simultaneous
     * tier triggers can sum past 100.
     */
    int riskScore;

    double marginUsageRate;

    /** Distance to liquidation as percentage of margin headroom left. */
    double liquidationRisk;

    // ==================== Live State ====================

    double currentBalance;

    double availableBalance;

    double unrealizedPnl;

    double totalPnl;

    // ==================== Trading Frequency ====================

    double tradesPerHour;

    /** Average holding time of closed trades in minutes. */
    double avgHoldingTime;

    /** Discrete overtrading band: 10, 40, 70 or 100. */
    int overTradingScore;

    // ==================== System Health ====================

    /** Average API latency in milliseconds. */
    double apiLatency;

    /** Average decision latency in milliseconds. */
    double decisionLatency;

    /** Failed decision cycles as percentage of the record batch. */
    double errorRate;

    /** Hours since the monitor was last started. */
    double systemUptime;

    LocalDateTime lastUpdated;

    public static MetricsSnapshot empty() {
        return MetricsSnapshot.builder().build();
    }
}
