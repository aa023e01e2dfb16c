package com.riskmonitor.history;

import com.riskmonitor.domain.model.PerformanceSummary;
import com.riskmonitor.domain.model.TradeOutcome;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Aggregates closed trades into a {@link PerformanceSummary}.
 *
 * <p>Win rate counts trades with positive P&L. Profit factor is gross profit over gross loss,
 * capped at {@value #NO_LOSS_PROFIT_FACTOR} when there is profit but no loss. The Sharpe ratio
 * is the mean per-trade return divided by the population standard deviation of returns,
 * unannualized; it is zero with fewer than two trades or no dispersion.
 */
@Component
public class TradePerformanceCalculator {

    static final double NO_LOSS_PROFIT_FACTOR = 999.99;

    public PerformanceSummary summarize(List<TradeOutcome> trades) {
        if (trades.isEmpty()) {
            return PerformanceSummary.empty();
        }

        int total = trades.size();
        long winning = trades.stream().filter(t -> t.getPnl() > 0).count();
        double winRate = (double) winning / total * 100.0;

        double grossProfit = trades.stream()
                .mapToDouble(TradeOutcome::getPnl)
                .filter(pnl -> pnl > 0)
                .sum();
        double grossLoss = trades.stream()
                .mapToDouble(TradeOutcome::getPnl)
                .filter(pnl -> pnl < 0)
                .map(Math::abs)
                .sum();

        double profitFactor;
        if (grossLoss > 0) {
            profitFactor = grossProfit / grossLoss;
        } else {
            profitFactor = grossProfit > 0 ? NO_LOSS_PROFIT_FACTOR : 0;
        }

        double avgHolding = trades.stream()
                .mapToDouble(TradeOutcome::getDurationMinutes)
                .average()
                .orElse(0);

        return PerformanceSummary.builder()
                .totalTrades(total)
                .winRate(winRate)
                .profitFactor(profitFactor)
                .sharpeRatio(sharpeRatio(trades))
                .avgHoldingMinutes(avgHolding)
                .build();
    }

    /** Public for testability. */
    public double sharpeRatio(List<TradeOutcome> trades) {
        if (trades.size() < 2) {
            return 0;
        }
        double mean = trades.stream()
                .mapToDouble(TradeOutcome::getPnlPct)
                .average()
                .orElse(0);
        double variance = trades.stream()
                .mapToDouble(t -> Math.pow(t.getPnlPct() - mean, 2))
                .average()
                .orElse(0);
        double stdDev = Math.sqrt(variance);
        if (stdDev == 0) {
            return 0;
        }
        return mean / stdDev;
    }
}
