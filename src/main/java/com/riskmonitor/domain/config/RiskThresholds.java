package com.riskmonitor.domain.config;

import lombok.Builder;
import lombok.Value;

/**
 * Tier boundaries used by the risk score and the alert rules.
 * Percentages are on a 0-100 scale.
 */
@Value
@Builder(toBuilder = true)
public class RiskThresholds {

    // ==================== Risk Score Tiers ====================

    double marginHigh;
    double marginMedium;

    double drawdownCritical;
    double drawdownHigh;
    double drawdownMedium;

    double sharpeLow;
    double sharpePoor;

    double winRateLow;

    // ==================== Alert Triggers ====================

    /** Risk score at or above which a CRITICAL risk alert is raised. */
    int riskScoreCritical;

    /** Risk score at or above which a WARNING risk alert is raised. */
    int riskScoreHigh;

    /** Margin usage (%) at or above which a CRITICAL risk alert is raised. */
    double marginCritical;

    /** Overtrading score at or above which a trade alert is raised. */
    int overTradingAlert;

    double apiLatencyHighMs;

    double errorRateHigh;

    /** Minimum trade count before the win-rate alert is considered meaningful. */
    int minTradesForStats;
}
