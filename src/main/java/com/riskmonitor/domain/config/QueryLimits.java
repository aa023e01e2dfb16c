package com.riskmonitor.domain.config;

import lombok.Builder;
import lombok.Value;

/**
 * Row limits used by one refresh cycle when reading decision history.
 */
@Value
@Builder(toBuilder = true)
public class QueryLimits {

    /** Largest accepted value for either limit. */
    public static final int MAX_LIMIT = 10_000;

    /** Lookback passed to the performance analysis. */
    int performanceLimit;

    /** Number of most recent balance records fed to the risk math. */
    int monitoringLimit;
}
