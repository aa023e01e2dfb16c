package com.riskmonitor.domain.enums;

/**
 * Category of a monitoring alert. Together with {@link AlertLevel} it forms the
 * deduplication key: only one open alert may exist per (type, level) pair.
 */
public enum AlertType {

    /** Account-level risk: risk score, margin usage, drawdown. */
    RISK,

    /** Strategy performance: Sharpe ratio, win rate. */
    PERFORMANCE,

    /** Infrastructure health: API latency, decision error rate. */
    SYSTEM,

    /** Trading behaviour: overtrading. */
    TRADE
}
