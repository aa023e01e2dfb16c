package com.riskmonitor.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Trade performance aggregates supplied by the decision history provider.
 * The Sharpe ratio is taken as-is; the monitor never recomputes it.
 */
@Value
@Builder
public class PerformanceSummary {

    int totalTrades;

    /** Winning trades as a percentage of total trades. */
    double winRate;

    /** Gross profit divided by gross loss. */
    double profitFactor;

    double sharpeRatio;

    /** Average holding time of closed trades in minutes. */
    double avgHoldingMinutes;

    public static PerformanceSummary empty() {
        return PerformanceSummary.builder().build();
    }
}
