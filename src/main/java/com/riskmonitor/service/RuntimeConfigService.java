package com.riskmonitor.service;

import com.riskmonitor.domain.config.QueryLimits;
import com.riskmonitor.domain.config.RiskScores;
import com.riskmonitor.domain.config.RiskThresholds;
import com.riskmonitor.exception.InvalidConfigurationException;
import com.riskmonitor.monitor.RuntimeConfigProvider;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Hot-reloadable runtime configuration for all monitor engines.
 *
 * <p>Starts from the property-backed defaults and can be replaced at runtime through the
 * configuration API. Updates are applied to the current group and validated before the
 * group is swapped as a whole via {@link AtomicReference}, so an engine reading mid-update
 * sees either the old or the new group, never a mix. Engines pick up a change on their next
 * refresh cycle.
 */
@Service
public class RuntimeConfigService implements RuntimeConfigProvider {

    private static final Logger log = LoggerFactory.getLogger(RuntimeConfigService.class);

    private final AtomicReference<QueryLimits> queryLimits;
    private final AtomicReference<RiskThresholds> riskThresholds;
    private final AtomicReference<RiskScores> riskScores;

    public RuntimeConfigService(
            QueryLimits defaultQueryLimits, RiskThresholds defaultRiskThresholds, RiskScores defaultRiskScores) {
        this.queryLimits = new AtomicReference<>(defaultQueryLimits);
        this.riskThresholds = new AtomicReference<>(defaultRiskThresholds);
        this.riskScores = new AtomicReference<>(defaultRiskScores);
    }

    @Override
    public QueryLimits queryLimits() {
        return queryLimits.get();
    }

    @Override
    public RiskThresholds riskThresholds() {
        return riskThresholds.get();
    }

    @Override
    public RiskScores riskScores() {
        return riskScores.get();
    }

    public QueryLimits updateQueryLimits(QueryLimits updated) {
        return updateQueryLimits(current -> updated);
    }

    /**
     * Applies {@code change} to the current query limits and swaps in the result if it is valid.
     */
    public synchronized QueryLimits updateQueryLimits(UnaryOperator<QueryLimits> change) {
        QueryLimits updated = change.apply(queryLimits.get());
        if (updated.getPerformanceLimit() <= 0
                || updated.getMonitoringLimit() <= 0
                || updated.getPerformanceLimit() > QueryLimits.MAX_LIMIT
                || updated.getMonitoringLimit() > QueryLimits.MAX_LIMIT) {
            throw new InvalidConfigurationException(
                    "Query limits must be between 1 and " + QueryLimits.MAX_LIMIT,
                    Map.of(
                            "performanceLimit", updated.getPerformanceLimit(),
                            "monitoringLimit", updated.getMonitoringLimit()));
        }
        QueryLimits previous = queryLimits.getAndSet(updated);
        log.info("Query limits updated: {} -> {}", previous, updated);
        return updated;
    }

    public RiskThresholds updateRiskThresholds(RiskThresholds updated) {
        return updateRiskThresholds(current -> updated);
    }

    /**
     * Applies {@code change} to the current thresholds and swaps in the result if the tiers are
     * ordered and the alert triggers are positive.
     */
    public synchronized RiskThresholds updateRiskThresholds(UnaryOperator<RiskThresholds> change) {
        RiskThresholds updated = change.apply(riskThresholds.get());
        if (updated.getMarginMedium() > updated.getMarginHigh()
                || updated.getDrawdownMedium() > updated.getDrawdownHigh()
                || updated.getDrawdownHigh() > updated.getDrawdownCritical()
                || updated.getSharpePoor() < updated.getSharpeLow()
                || updated.getRiskScoreHigh() > updated.getRiskScoreCritical()) {
            throw new InvalidConfigurationException(
                    "Risk threshold tiers are out of order", Map.of("thresholds", updated.toString()));
        }
        if (updated.getRiskScoreHigh() <= 0
                || updated.getMarginCritical() <= 0
                || updated.getOverTradingAlert() <= 0
                || updated.getApiLatencyHighMs() <= 0
                || updated.getMinTradesForStats() < 0) {
            throw new InvalidConfigurationException(
                    "Alert triggers must be positive", Map.of("thresholds", updated.toString()));
        }
        RiskThresholds previous = riskThresholds.getAndSet(updated);
        log.info("Risk thresholds updated: {} -> {}", previous, updated);
        return updated;
    }

    public RiskScores updateRiskScores(RiskScores updated) {
        return updateRiskScores(current -> updated);
    }

    /**
     * Applies {@code change} to the current score points and swaps in the result if no point
     * value is negative.
     */
    public synchronized RiskScores updateRiskScores(UnaryOperator<RiskScores> change) {
        RiskScores updated = change.apply(riskScores.get());
        Map<String, Object> negative = new LinkedHashMap<>();
        putIfNegative(negative, "marginHighScore", updated.getMarginHighScore());
        putIfNegative(negative, "marginMediumScore", updated.getMarginMediumScore());
        putIfNegative(negative, "drawdownCriticalScore", updated.getDrawdownCriticalScore());
        putIfNegative(negative, "drawdownHighScore", updated.getDrawdownHighScore());
        putIfNegative(negative, "drawdownMediumScore", updated.getDrawdownMediumScore());
        putIfNegative(negative, "sharpeLowScore", updated.getSharpeLowScore());
        putIfNegative(negative, "sharpePoorScore", updated.getSharpePoorScore());
        if (!negative.isEmpty()) {
            throw new InvalidConfigurationException("Risk score points must not be negative", negative);
        }
        RiskScores previous = riskScores.getAndSet(updated);
        log.info("Risk scores updated: {} -> {}", previous, updated);
        return updated;
    }

    private static void putIfNegative(Map<String, Object> details, String field, int value) {
        if (value < 0) {
            details.put(field, value);
        }
    }
}
