package com.riskmonitor.domain.enums;

/**
 * Severity level of a monitoring alert.
 */
public enum AlertLevel {

    /** Informational, no action required. */
    INFO,

    /** Threshold breached, trader should review. */
    WARNING,

    /** Dangerous condition, reduce exposure or stop trading. */
    CRITICAL
}
