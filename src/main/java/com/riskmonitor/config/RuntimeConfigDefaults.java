package com.riskmonitor.config;

import com.riskmonitor.domain.config.QueryLimits;
import com.riskmonitor.domain.config.RiskScores;
import com.riskmonitor.domain.config.RiskThresholds;
import java.time.Clock;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Seeds the runtime configuration from application.properties.
 *
 * <p>These beans are only the starting point: {@link com.riskmonitor.service.RuntimeConfigService}
 * copies them on startup and replaces its copies when the configuration API is called.
 *
 * <p>Properties prefixes: {@code riskmonitor.query.*}, {@code riskmonitor.thresholds.*},
 * {@code riskmonitor.scores.*}
 */
@Configuration
public class RuntimeConfigDefaults {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public QueryLimits defaultQueryLimits(
            @Value("${riskmonitor.query.performance-limit:100}") int performanceLimit,
            @Value("${riskmonitor.query.monitoring-limit:50}") int monitoringLimit) {
        return QueryLimits.builder()
                .performanceLimit(performanceLimit)
                .monitoringLimit(monitoringLimit)
                .build();
    }

    @Bean
    public RiskThresholds defaultRiskThresholds(
            @Value("${riskmonitor.thresholds.margin-high:50.0}") double marginHigh,
            @Value("${riskmonitor.thresholds.margin-medium:20.0}") double marginMedium,
            @Value("${riskmonitor.thresholds.drawdown-critical:30.0}") double drawdownCritical,
            @Value("${riskmonitor.thresholds.drawdown-high:20.0}") double drawdownHigh,
            @Value("${riskmonitor.thresholds.drawdown-medium:10.0}") double drawdownMedium,
            @Value("${riskmonitor.thresholds.sharpe-low:-0.5}") double sharpeLow,
            @Value("${riskmonitor.thresholds.sharpe-poor:0.0}") double sharpePoor,
            @Value("${riskmonitor.thresholds.win-rate-low:30.0}") double winRateLow,
            @Value("${riskmonitor.thresholds.risk-score-critical:80}") int riskScoreCritical,
            @Value("${riskmonitor.thresholds.risk-score-high:60}") int riskScoreHigh,
            @Value("${riskmonitor.thresholds.margin-critical:80.0}") double marginCritical,
            @Value("${riskmonitor.thresholds.over-trading-alert:70}") int overTradingAlert,
            @Value("${riskmonitor.thresholds.api-latency-high-ms:5000}") double apiLatencyHighMs,
            @Value("${riskmonitor.thresholds.error-rate-high:10.0}") double errorRateHigh,
            @Value("${riskmonitor.thresholds.min-trades-for-stats:10}") int minTradesForStats) {
        return RiskThresholds.builder()
                .marginHigh(marginHigh)
                .marginMedium(marginMedium)
                .drawdownCritical(drawdownCritical)
                .drawdownHigh(drawdownHigh)
                .drawdownMedium(drawdownMedium)
                .sharpeLow(sharpeLow)
                .sharpePoor(sharpePoor)
                .winRateLow(winRateLow)
                .riskScoreCritical(riskScoreCritical)
                .riskScoreHigh(riskScoreHigh)
                .marginCritical(marginCritical)
                .overTradingAlert(overTradingAlert)
                .apiLatencyHighMs(apiLatencyHighMs)
                .errorRateHigh(errorRateHigh)
                .minTradesForStats(minTradesForStats)
                .build();
    }

    @Bean
    public RiskScores defaultRiskScores(
            @Value("${riskmonitor.scores.margin-high:20}") int marginHigh,
            @Value("${riskmonitor.scores.margin-medium:10}") int marginMedium,
            @Value("${riskmonitor.scores.drawdown-critical:30}") int drawdownCritical,
            @Value("${riskmonitor.scores.drawdown-high:20}") int drawdownHigh,
            @Value("${riskmonitor.scores.drawdown-medium:10}") int drawdownMedium,
            @Value("${riskmonitor.scores.sharpe-low:20}") int sharpeLow,
            @Value("${riskmonitor.scores.sharpe-poor:10}") int sharpePoor) {
        return RiskScores.builder()
                .marginHighScore(marginHigh)
                .marginMediumScore(marginMedium)
                .drawdownCriticalScore(drawdownCritical)
                .drawdownHighScore(drawdownHigh)
                .drawdownMediumScore(drawdownMedium)
                .sharpeLowScore(sharpeLow)
                .sharpePoorScore(sharpePoor)
                .build();
    }
}
