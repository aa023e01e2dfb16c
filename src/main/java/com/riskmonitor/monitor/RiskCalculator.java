package com.riskmonitor.monitor;

import com.riskmonitor.domain.config.RiskScores;
import com.riskmonitor.domain.config.RiskThresholds;
import com.riskmonitor.domain.model.BalanceRecord;
import com.riskmonitor.domain.model.MetricsSnapshot;
import com.riskmonitor.domain.model.PerformanceSummary;
import java.time.Duration;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Derives drawdown, Value at Risk, the composite risk score and trading-frequency
 * metrics from a batch of balance records.
 *
 * <p>Stateless and deterministic: the same inputs always produce the same snapshot.
 * Fields that cannot be computed from the batch (VaR below {@value #MIN_SAMPLES_FOR_VAR}
 * samples, frequency below two records) keep the values of the previous snapshot.
 *
 * <p><b>Known asymmetries:</b>
 * <ul>
 *   <li>The risk score is a plain sum of tier points and is not clamped to 100.</li>
 *   <li>VaR is {@code |mean - z * std| * balance}. With a positive mean return the
 *       95% figure can exceed the 99% figure.</li>
 * </ul>
 */
@Component
public class RiskCalculator {

    /** Risk score reported when there are no records to judge from. */
    public static final int DEFAULT_RISK_SCORE = 50;

    public static final int MIN_SAMPLES_FOR_VAR = 10;

    /** Fixed points added when the win rate is below its threshold. */
    public static final int LOW_WIN_RATE_SCORE = 10;

    private static final double Z_95 = 1.645;
    private static final double Z_99 = 2.326;
    private static final double MILLIS_PER_HOUR = 3_600_000.0;

    /**
     * Computes a new snapshot from the given batch.
     *
     * @param records     balance records ordered oldest to newest
     * @param performance trade aggregates for the same refresh cycle
     * @param thresholds  tier boundaries for the risk score
     * @param scores      tier points for the risk score
     * @param previous    snapshot of the prior cycle, source of carried-over fields
     * @return the new snapshot; {@code lastUpdated} and system-health fields are left to the caller
     */
    public MetricsSnapshot compute(
            List<BalanceRecord> records,
            PerformanceSummary performance,
            RiskThresholds thresholds,
            RiskScores scores,
            MetricsSnapshot previous) {
        MetricsSnapshot.MetricsSnapshotBuilder builder = previous.toBuilder()
                .totalTrades(performance.getTotalTrades())
                .winRate(performance.getWinRate())
                .profitFactor(performance.getProfitFactor())
                .sharpeRatio(performance.getSharpeRatio())
                .avgHoldingTime(performance.getAvgHoldingMinutes());

        if (records.isEmpty()) {
            return builder.riskScore(DEFAULT_RISK_SCORE).build();
        }

        double[] balances = records.stream().mapToDouble(BalanceRecord::getTotalBalance).toArray();
        BalanceRecord oldest = records.get(0);
        BalanceRecord latest = records.get(records.size() - 1);

        double maxDrawdown = maxDrawdown(balances);
        double marginUsage = latest.getMarginUsedPct();

        builder.maxDrawdown(maxDrawdown)
                .currentDrawdown(currentDrawdown(balances))
                .currentBalance(latest.getTotalBalance())
                .availableBalance(latest.getAvailableBalance())
                .unrealizedPnl(latest.getUnrealizedPnl())
                .totalPnl(latest.getTotalBalance() - oldest.getTotalBalance())
                .marginUsageRate(marginUsage)
                .liquidationRisk(Math.max(0, 100 - marginUsage))
                .errorRate(errorRate(records));

        if (balances.length >= MIN_SAMPLES_FOR_VAR) {
            ValueAtRisk var = valueAtRisk(balances, latest.getTotalBalance());
            builder.var95(var.var95()).var99(var.var99());
        }

        builder.riskScore(riskScore(
                marginUsage,
                maxDrawdown,
                performance.getSharpeRatio(),
                performance.getWinRate(),
                thresholds,
                scores));

        if (records.size() >= 2) {
            double hours = Duration.between(oldest.getTimestamp(), latest.getTimestamp())
                            .toMillis()
                    / MILLIS_PER_HOUR;
            double tradesPerHour = hours > 0 ? performance.getTotalTrades() / hours : previous.getTradesPerHour();
            builder.tradesPerHour(tradesPerHour).overTradingScore(overTradingScore(tradesPerHour));
        }

        return builder.build();
    }

    // ========================
    // DRAWDOWN
    // ========================

    /**
     * Largest decline from a running peak, in percent. Zero for fewer than two samples.
     */
    public double maxDrawdown(double[] balances) {
        if (balances.length < 2) {
            return 0;
        }

        double peak = balances[0];
        double maxDrawdown = 0;
        for (double balance : balances) {
            if (balance > peak) {
                peak = balance;
            }
            double drawdown = drawdownFrom(peak, balance);
            if (drawdown > maxDrawdown) {
                maxDrawdown = drawdown;
            }
        }
        return maxDrawdown;
    }

    /**
     * Decline of the last sample from the peak of the whole sequence, in percent.
     */
    public double currentDrawdown(double[] balances) {
        if (balances.length == 0) {
            return 0;
        }

        double peak = balances[0];
        for (double balance : balances) {
            peak = Math.max(peak, balance);
        }
        return drawdownFrom(peak, balances[balances.length - 1]);
    }

    private double drawdownFrom(double peak, double balance) {
        // a non-positive peak has no meaningful percentage decline
        if (peak <= 0) {
            return 0;
        }
        return (peak - balance) / peak * 100;
    }

    // ========================
    // VALUE AT RISK
    // ========================

    /**
     * Gaussian VaR over the step returns of the balance sequence.
     * Steps starting from a zero balance count as a zero return.
     */
    public ValueAtRisk valueAtRisk(double[] balances, double currentBalance) {
        double[] returns = new double[Math.max(0, balances.length - 1)];
        for (int i = 1; i < balances.length; i++) {
            double base = balances[i - 1];
            returns[i - 1] = base == 0 ? 0 : (balances[i] - base) / base;
        }

        double mean = mean(returns);
        double std = populationStd(returns, mean);

        return new ValueAtRisk(
                Math.abs(mean - Z_95 * std) * currentBalance, Math.abs(mean - Z_99 * std) * currentBalance);
    }

    private double mean(double[] values) {
        if (values.length == 0) {
            return 0;
        }
        double sum = 0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.length;
    }

    private double populationStd(double[] values, double mean) {
        if (values.length == 0) {
            return 0;
        }
        double sumSquares = 0;
        for (double value : values) {
            sumSquares += (value - mean) * (value - mean);
        }
        return Math.sqrt(sumSquares / values.length);
    }

    // ========================
    // SCORING
    // ========================

    /**
     * Additive risk score. Each factor contributes at most one tier, the highest that applies.
     */
    public int riskScore(
            double marginUsage,
            double maxDrawdown,
            double sharpeRatio,
            double winRate,
            RiskThresholds thresholds,
            RiskScores scores) {
        int score = 0;

        if (marginUsage > thresholds.getMarginHigh()) {
            score += scores.getMarginHighScore();
        } else if (marginUsage > thresholds.getMarginMedium()) {
            score += scores.getMarginMediumScore();
        }

        if (maxDrawdown > thresholds.getDrawdownCritical()) {
            score += scores.getDrawdownCriticalScore();
        } else if (maxDrawdown > thresholds.getDrawdownHigh()) {
            score += scores.getDrawdownHighScore();
        } else if (maxDrawdown > thresholds.getDrawdownMedium()) {
            score += scores.getDrawdownMediumScore();
        }

        if (sharpeRatio < thresholds.getSharpeLow()) {
            score += scores.getSharpeLowScore();
        } else if (sharpeRatio < thresholds.getSharpePoor()) {
            score += scores.getSharpePoorScore();
        }

        if (winRate < thresholds.getWinRateLow()) {
            score += LOW_WIN_RATE_SCORE;
        }

        return score;
    }

    /**
     * Step function of trade frequency: above 2/h is 100, above 1/h is 70, above 0.5/h is 40, else 10.
     */
    public int overTradingScore(double tradesPerHour) {
        if (tradesPerHour > 2) {
            return 100;
        } else if (tradesPerHour > 1) {
            return 70;
        } else if (tradesPerHour > 0.5) {
            return 40;
        }
        return 10;
    }

    private double errorRate(List<BalanceRecord> records) {
        long failed = records.stream().filter(r -> !r.isSuccess()).count();
        return failed * 100.0 / records.size();
    }

    /**
     * VaR pair in currency units.
     */
    public record ValueAtRisk(double var95, double var99) {}
}
