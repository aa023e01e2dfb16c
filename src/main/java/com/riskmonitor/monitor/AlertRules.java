package com.riskmonitor.monitor;

import com.riskmonitor.domain.config.RiskThresholds;
import com.riskmonitor.domain.enums.AlertLevel;
import com.riskmonitor.domain.enums.AlertType;
import com.riskmonitor.domain.model.Alert;
import com.riskmonitor.domain.model.MetricsSnapshot;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Evaluates the alert rules against a freshly computed snapshot.
 *
 * <p>Rules are evaluated in a fixed order and every firing rule yields one candidate.
 * Candidates are not deduplicated here; the {@link AlertLedger} does that on admission,
 * so when two rules share a (type, level) in one cycle the first one wins.
 *
 * <p>Rule order:
 * <ol>
 *   <li>Risk score at or above the critical level (CRITICAL / RISK)</li>
 *   <li>Risk score at or above the high level but below critical (WARNING / RISK)</li>
 *   <li>Margin usage at or above the critical level (CRITICAL / RISK)</li>
 *   <li>Max drawdown at or above the critical drawdown (CRITICAL / RISK)</li>
 *   <li>Sharpe ratio below the low threshold (WARNING / PERFORMANCE)</li>
 *   <li>Win rate below the low threshold with enough trades (WARNING / PERFORMANCE)</li>
 *   <li>Overtrading score at or above the alert level (WARNING / TRADE)</li>
 *   <li>API latency above the limit (WARNING / SYSTEM)</li>
 *   <li>Error rate above the high threshold (WARNING / SYSTEM)</li>
 * </ol>
 */
@Component
public class AlertRules {

    /**
     * Returns the candidate alerts for the snapshot, in rule order.
     */
    public List<Alert> evaluate(String traderId, MetricsSnapshot metrics, RiskThresholds thresholds, LocalDateTime now) {
        List<Alert> candidates = new ArrayList<>();
        AlertFactory alerts = new AlertFactory(traderId, now);

        if (metrics.getRiskScore() >= thresholds.getRiskScoreCritical()) {
            candidates.add(alerts.create(
                    "risk_score",
                    AlertType.RISK,
                    AlertLevel.CRITICAL,
                    "Extreme Risk Warning",
                    String.format(
                            "Risk score reached %d/100, reduce positions or stop trading immediately",
                            metrics.getRiskScore())));
        } else if (metrics.getRiskScore() >= thresholds.getRiskScoreHigh()) {
            candidates.add(alerts.create(
                    "risk_score",
                    AlertType.RISK,
                    AlertLevel.WARNING,
                    "High Risk Warning",
                    String.format("Risk score reached %d/100, trade with caution", metrics.getRiskScore())));
        }

        if (metrics.getMarginUsageRate() >= thresholds.getMarginCritical()) {
            candidates.add(alerts.create(
                    "margin_usage",
                    AlertType.RISK,
                    AlertLevel.CRITICAL,
                    "Margin Usage Too High",
                    String.format("Margin usage at %.1f%%, close to liquidation", metrics.getMarginUsageRate())));
        }

        if (metrics.getMaxDrawdown() >= thresholds.getDrawdownCritical()) {
            candidates.add(alerts.create(
                    "max_drawdown",
                    AlertType.RISK,
                    AlertLevel.CRITICAL,
                    "Max Drawdown Too Large",
                    String.format("Max drawdown reached %.1f%%, consider pausing trading", metrics.getMaxDrawdown())));
        }

        if (metrics.getSharpeRatio() < thresholds.getSharpeLow()) {
            candidates.add(alerts.create(
                    "sharpe_ratio",
                    AlertType.PERFORMANCE,
                    AlertLevel.WARNING,
                    "Sharpe Ratio Too Low",
                    String.format("Sharpe ratio %.2f, strategy is underperforming", metrics.getSharpeRatio())));
        }

        if (metrics.getWinRate() < thresholds.getWinRateLow()
                && metrics.getTotalTrades() >= thresholds.getMinTradesForStats()) {
            candidates.add(alerts.create(
                    "win_rate",
                    AlertType.PERFORMANCE,
                    AlertLevel.WARNING,
                    "Win Rate Too Low",
                    String.format("Win rate only %.1f%%, strategy needs tuning", metrics.getWinRate())));
        }

        if (metrics.getOverTradingScore() >= thresholds.getOverTradingAlert()) {
            candidates.add(alerts.create(
                    "overtrading",
                    AlertType.TRADE,
                    AlertLevel.WARNING,
                    "Overtrading Warning",
                    String.format("%.1f trades per hour, possible overtrading", metrics.getTradesPerHour())));
        }

        if (metrics.getApiLatency() > thresholds.getApiLatencyHighMs()) {
            candidates.add(alerts.create(
                    "api_latency",
                    AlertType.SYSTEM,
                    AlertLevel.WARNING,
                    "API Latency Too High",
                    String.format("API latency %.0f ms, order execution may be affected", metrics.getApiLatency())));
        }

        if (metrics.getErrorRate() > thresholds.getErrorRateHigh()) {
            candidates.add(alerts.create(
                    "error_rate",
                    AlertType.SYSTEM,
                    AlertLevel.WARNING,
                    "System Error Rate Too High",
                    String.format("Error rate %.1f%%, the trading system may be unhealthy", metrics.getErrorRate())));
        }

        return candidates;
    }

    private static final class AlertFactory {

        private final String traderId;
        private final LocalDateTime now;
        private final long epochSecond;

        AlertFactory(String traderId, LocalDateTime now) {
            this.traderId = traderId;
            this.now = now;
            this.epochSecond = now.toEpochSecond(ZoneOffset.UTC);
        }

        Alert create(String ruleKey, AlertType type, AlertLevel level, String title, String message) {
            return Alert.builder()
                    .id(ruleKey + "_" + epochSecond)
                    .traderId(traderId)
                    .type(type)
                    .level(level)
                    .title(title)
                    .message(message)
                    .raisedAt(now)
                    .build();
        }
    }
}
