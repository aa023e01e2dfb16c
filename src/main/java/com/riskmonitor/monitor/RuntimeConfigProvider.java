package com.riskmonitor.monitor;

import com.riskmonitor.domain.config.QueryLimits;
import com.riskmonitor.domain.config.RiskScores;
import com.riskmonitor.domain.config.RiskThresholds;

/**
 * Source of the monitor's tunable limits, thresholds and score weights.
 *
 * <p>Values may be changed externally at any time. The engine reads them fresh on
 * every refresh cycle and never caches them across cycles.
 */
public interface RuntimeConfigProvider {

    QueryLimits queryLimits();

    RiskThresholds riskThresholds();

    RiskScores riskScores();
}
