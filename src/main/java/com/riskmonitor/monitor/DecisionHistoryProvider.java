package com.riskmonitor.monitor;

import com.riskmonitor.domain.model.BalanceRecord;
import com.riskmonitor.domain.model.PerformanceSummary;
import com.riskmonitor.exception.HistoryAccessException;
import java.util.List;

/**
 * Read-only access to a trader's decision history.
 *
 * <p>Implementations signal an unreadable store with {@link HistoryAccessException};
 * the monitor then skips the refresh cycle.
 */
public interface DecisionHistoryProvider {

    /**
     * Aggregates trade performance over the given lookback.
     *
     * @param traderId trader whose history is read
     * @param limit    lookback in decision cycles
     */
    PerformanceSummary analyzePerformance(String traderId, int limit);

    /**
     * Returns up to {@code limit} most recent records, ordered oldest to newest.
     */
    List<BalanceRecord> latestRecords(String traderId, int limit);
}
