package com.riskmonitor.unit.monitor;

import static com.riskmonitor.support.MonitorFixtures.T0;
import static com.riskmonitor.support.MonitorFixtures.defaultScores;
import static com.riskmonitor.support.MonitorFixtures.defaultThresholds;
import static com.riskmonitor.support.MonitorFixtures.hourlyRecords;
import static com.riskmonitor.support.MonitorFixtures.record;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.riskmonitor.domain.config.RiskScores;
import com.riskmonitor.domain.model.BalanceRecord;
import com.riskmonitor.domain.model.MetricsSnapshot;
import com.riskmonitor.domain.model.PerformanceSummary;
import com.riskmonitor.monitor.RiskCalculator;
import com.riskmonitor.monitor.RiskCalculator.ValueAtRisk;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class RiskCalculatorTest {

    private RiskCalculator riskCalculator;

    @BeforeEach
    void setUp() {
        riskCalculator = new RiskCalculator();
    }

    private MetricsSnapshot compute(List<BalanceRecord> records, PerformanceSummary performance) {
        return riskCalculator.compute(
                records, performance, defaultThresholds(), defaultScores(), MetricsSnapshot.empty());
    }

    @Nested
    @DisplayName("Drawdown")
    class Drawdown {

        @Test
        @DisplayName("Peak 1200 then trough 900 gives 25% max and 20.83% current drawdown")
        void peakAndTrough() {
            double[] balances = {1000, 1200, 900, 950};

            assertThat(riskCalculator.maxDrawdown(balances)).isCloseTo(25.0, within(1e-9));
            assertThat(riskCalculator.currentDrawdown(balances)).isCloseTo(20.8333, within(1e-4));
        }

        @Test
        @DisplayName("Monotonically rising balances have no drawdown")
        void risingBalances() {
            double[] balances = {1000, 1010, 1050, 1100};

            assertThat(riskCalculator.maxDrawdown(balances)).isZero();
            assertThat(riskCalculator.currentDrawdown(balances)).isZero();
        }

        @Test
        @DisplayName("Current drawdown never exceeds max drawdown")
        void currentNeverAboveMax() {
            double[][] sequences = {
                {1000, 800, 1200, 1100},
                {500, 400, 300, 450, 600, 100},
                {1000, 1000, 1000},
                {100, 50}
            };

            for (double[] balances : sequences) {
                assertThat(riskCalculator.currentDrawdown(balances))
                        .isLessThanOrEqualTo(riskCalculator.maxDrawdown(balances) + 1e-9);
            }
        }

        @Test
        @DisplayName("Single sample has zero max drawdown")
        void singleSample() {
            assertThat(riskCalculator.maxDrawdown(new double[] {1000})).isZero();
            assertThat(riskCalculator.currentDrawdown(new double[] {1000})).isZero();
        }

        @Test
        @DisplayName("Non-positive peak yields zero instead of dividing by zero")
        void nonPositivePeak() {
            double[] balances = {0, -10, -20};

            assertThat(riskCalculator.maxDrawdown(balances)).isZero();
            assertThat(riskCalculator.currentDrawdown(balances)).isZero();
        }
    }

    @Nested
    @DisplayName("Value at Risk")
    class ValueAtRiskCalculation {

        @Test
        @DisplayName("Flat balances give zero VaR")
        void flatBalances() {
            double[] balances = new double[12];
            Arrays.fill(balances, 1000);

            ValueAtRisk var = riskCalculator.valueAtRisk(balances, 1000);

            assertThat(var.var95()).isZero();
            assertThat(var.var99()).isZero();
        }

        @Test
        @DisplayName("Steady growth without dispersion gives |mean| * balance at both levels")
        void steadyGrowth() {
            double[] balances = new double[10];
            balances[0] = 1000;
            for (int i = 1; i < balances.length; i++) {
                balances[i] = balances[i - 1] * 1.1;
            }
            double current = balances[balances.length - 1];

            ValueAtRisk var = riskCalculator.valueAtRisk(balances, current);

            assertThat(var.var95()).isCloseTo(0.1 * current, within(1e-6));
            assertThat(var.var99()).isCloseTo(0.1 * current, within(1e-6));
        }

        @Test
        @DisplayName("Zero mean return gives z * std * balance")
        void zeroMeanReturn() {
            // returns +10%, -10%: mean 0, population std 0.1
            double[] balances = {1000, 1100, 990};

            ValueAtRisk var = riskCalculator.valueAtRisk(balances, 990);

            assertThat(var.var95()).isCloseTo(1.645 * 0.1 * 990, within(1e-6));
            assertThat(var.var99()).isCloseTo(2.326 * 0.1 * 990, within(1e-6));
        }

        @Test
        @DisplayName("A strongly positive mean can put VaR95 above VaR99")
        void positiveMeanInvertsLevels() {
            // returns +5%, +15%: mean 0.1, population std 0.05
            double[] balances = {1000, 1050, 1207.5};

            ValueAtRisk var = riskCalculator.valueAtRisk(balances, 1207.5);

            assertThat(var.var95()).isCloseTo(Math.abs(0.1 - 1.645 * 0.05) * 1207.5, within(1e-6));
            assertThat(var.var99()).isCloseTo(Math.abs(0.1 - 2.326 * 0.05) * 1207.5, within(1e-6));
            assertThat(var.var95()).isGreaterThan(var.var99());
        }

        @Test
        @DisplayName("A step from a zero balance counts as a zero return")
        void zeroBase() {
            ValueAtRisk var = riskCalculator.valueAtRisk(new double[] {0, 100}, 100);

            assertThat(var.var95()).isZero();
            assertThat(var.var99()).isZero();
        }

        @Test
        @DisplayName("Fewer than ten records keep the previous VaR")
        void tooFewSamplesKeepsPrevious() {
            MetricsSnapshot previous =
                    MetricsSnapshot.empty().toBuilder().var95(12.5).var99(20.0).build();

            MetricsSnapshot next = riskCalculator.compute(
                    hourlyRecords(10, 1000, 900, 950),
                    PerformanceSummary.empty(),
                    defaultThresholds(),
                    defaultScores(),
                    previous);

            assertThat(next.getVar95()).isEqualTo(12.5);
            assertThat(next.getVar99()).isEqualTo(20.0);
        }
    }

    @Nested
    @DisplayName("Risk score")
    class RiskScore {

        @Test
        @DisplayName("Each factor contributes its highest applicable tier")
        void tiersAdd() {
            // margin > 50 -> 20, drawdown > 20 -> 20, sharpe < -0.5 -> 20, win rate < 30 -> 10
            int score = riskCalculator.riskScore(60, 25, -1.0, 20, defaultThresholds(), defaultScores());

            assertThat(score).isEqualTo(70);
        }

        @Test
        @DisplayName("Healthy account scores zero")
        void healthy() {
            int score = riskCalculator.riskScore(10, 5, 1.5, 60, defaultThresholds(), defaultScores());

            assertThat(score).isZero();
        }

        @Test
        @DisplayName("Medium tiers use their own points")
        void mediumTiers() {
            // margin > 20 -> 10, drawdown > 10 -> 10, sharpe < 0 -> 10
            int score = riskCalculator.riskScore(30, 15, -0.2, 50, defaultThresholds(), defaultScores());

            assertThat(score).isEqualTo(30);
        }

        @Test
        @DisplayName("Score is not clamped to 100")
        void notClamped() {
            RiskScores heavy = RiskScores.builder()
                    .marginHighScore(60)
                    .marginMediumScore(10)
                    .drawdownCriticalScore(60)
                    .drawdownHighScore(20)
                    .drawdownMediumScore(10)
                    .sharpeLowScore(20)
                    .sharpePoorScore(10)
                    .build();

            int score = riskCalculator.riskScore(90, 40, -1.0, 10, defaultThresholds(), heavy);

            assertThat(score).isEqualTo(150);
        }

        @Test
        @DisplayName("Score never drops as margin usage rises")
        void monotonicInMargin() {
            int previous = Integer.MIN_VALUE;
            for (double margin = 0; margin <= 100; margin += 0.5) {
                int score = riskCalculator.riskScore(margin, 15, 0.5, 50, defaultThresholds(), defaultScores());
                assertThat(score).as("margin %.1f", margin).isGreaterThanOrEqualTo(previous);
                previous = score;
            }
            assertThat(previous).isEqualTo(30);
        }

        @Test
        @DisplayName("Score never drops as max drawdown rises")
        void monotonicInDrawdown() {
            int previous = Integer.MIN_VALUE;
            for (double drawdown = 0; drawdown <= 100; drawdown += 0.5) {
                int score = riskCalculator.riskScore(30, drawdown, 0.5, 50, defaultThresholds(), defaultScores());
                assertThat(score).as("drawdown %.1f", drawdown).isGreaterThanOrEqualTo(previous);
                previous = score;
            }
            assertThat(previous).isEqualTo(40);
        }

        @Test
        @DisplayName("Score never drops as the Sharpe ratio falls")
        void monotonicInFallingSharpe() {
            int previous = Integer.MIN_VALUE;
            for (int step = 30; step >= -30; step--) {
                double sharpe = step / 10.0;
                int score = riskCalculator.riskScore(30, 15, sharpe, 50, defaultThresholds(), defaultScores());
                assertThat(score).as("sharpe %.1f", sharpe).isGreaterThanOrEqualTo(previous);
                previous = score;
            }
            assertThat(previous).isEqualTo(40);
        }

        @Test
        @DisplayName("No records yields the default score of 50")
        void noRecords() {
            MetricsSnapshot snapshot = compute(List.of(), PerformanceSummary.empty());

            assertThat(snapshot.getRiskScore()).isEqualTo(RiskCalculator.DEFAULT_RISK_SCORE);
        }
    }

    @Nested
    @DisplayName("Trading frequency")
    class Frequency {

        @Test
        @DisplayName("Three trades over two hours is 1.5 per hour and scores 70")
        void moderateFrequency() {
            List<BalanceRecord> records = List.of(record(T0, 1000, 10), record(T0.plusHours(2), 1000, 10));
            PerformanceSummary performance =
                    PerformanceSummary.builder().totalTrades(3).build();

            MetricsSnapshot snapshot = compute(records, performance);

            assertThat(snapshot.getTradesPerHour()).isCloseTo(1.5, within(1e-9));
            assertThat(snapshot.getOverTradingScore()).isEqualTo(70);
        }

        @Test
        @DisplayName("Score bands")
        void bands() {
            assertThat(riskCalculator.overTradingScore(3)).isEqualTo(100);
            assertThat(riskCalculator.overTradingScore(2)).isEqualTo(70);
            assertThat(riskCalculator.overTradingScore(0.8)).isEqualTo(40);
            assertThat(riskCalculator.overTradingScore(0.5)).isEqualTo(10);
            assertThat(riskCalculator.overTradingScore(0)).isEqualTo(10);
        }

        @Test
        @DisplayName("Records sharing one timestamp keep the previous frequency")
        void zeroSpanKeepsPrevious() {
            MetricsSnapshot previous = MetricsSnapshot.empty().toBuilder()
                    .tradesPerHour(0.75)
                    .overTradingScore(40)
                    .build();
            List<BalanceRecord> records = List.of(record(T0, 1000, 10), record(T0, 1000, 10));

            MetricsSnapshot next = riskCalculator.compute(
                    records,
                    PerformanceSummary.builder().totalTrades(50).build(),
                    defaultThresholds(),
                    defaultScores(),
                    previous);

            assertThat(next.getTradesPerHour()).isEqualTo(0.75);
            assertThat(next.getOverTradingScore()).isEqualTo(40);
        }
    }

    @Nested
    @DisplayName("Snapshot assembly")
    class Assembly {

        @Test
        @DisplayName("Live state comes from the newest record, total P&L from the whole batch")
        void liveState() {
            List<BalanceRecord> records = new ArrayList<>(hourlyRecords(35, 1000, 1200, 900));
            records.add(BalanceRecord.builder()
                    .timestamp(T0.plusHours(3))
                    .totalBalance(950)
                    .availableBalance(600)
                    .unrealizedPnl(-25)
                    .marginUsedPct(35)
                    .positionCount(2)
                    .success(false)
                    .build());

            MetricsSnapshot snapshot = compute(records, PerformanceSummary.empty());

            assertThat(snapshot.getCurrentBalance()).isEqualTo(950);
            assertThat(snapshot.getAvailableBalance()).isEqualTo(600);
            assertThat(snapshot.getUnrealizedPnl()).isEqualTo(-25);
            assertThat(snapshot.getTotalPnl()).isEqualTo(-50);
            assertThat(snapshot.getMarginUsageRate()).isEqualTo(35);
            assertThat(snapshot.getLiquidationRisk()).isEqualTo(65);
            assertThat(snapshot.getErrorRate()).isEqualTo(25);
            assertThat(snapshot.getMaxDrawdown()).isCloseTo(25.0, within(1e-9));
        }

        @Test
        @DisplayName("Trade statistics are copied from the performance summary")
        void tradeStatistics() {
            PerformanceSummary performance = PerformanceSummary.builder()
                    .totalTrades(42)
                    .winRate(55.5)
                    .profitFactor(1.8)
                    .sharpeRatio(0.9)
                    .avgHoldingMinutes(45)
                    .build();

            MetricsSnapshot snapshot = compute(hourlyRecords(10, 1000, 1010), performance);

            assertThat(snapshot.getTotalTrades()).isEqualTo(42);
            assertThat(snapshot.getWinRate()).isEqualTo(55.5);
            assertThat(snapshot.getProfitFactor()).isEqualTo(1.8);
            assertThat(snapshot.getSharpeRatio()).isEqualTo(0.9);
            assertThat(snapshot.getAvgHoldingTime()).isEqualTo(45);
        }

        @Test
        @DisplayName("An empty batch keeps the previous risk fields")
        void emptyBatchKeepsPrevious() {
            MetricsSnapshot previous = MetricsSnapshot.empty().toBuilder()
                    .maxDrawdown(12.0)
                    .currentBalance(980)
                    .marginUsageRate(33)
                    .build();

            MetricsSnapshot next = riskCalculator.compute(
                    List.of(), PerformanceSummary.empty(), defaultThresholds(), defaultScores(), previous);

            assertThat(next.getMaxDrawdown()).isEqualTo(12.0);
            assertThat(next.getCurrentBalance()).isEqualTo(980);
            assertThat(next.getMarginUsageRate()).isEqualTo(33);
            assertThat(next.getRiskScore()).isEqualTo(50);
        }
    }
}
