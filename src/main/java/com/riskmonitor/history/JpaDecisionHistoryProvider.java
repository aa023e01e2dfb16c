package com.riskmonitor.history;

import com.riskmonitor.domain.model.BalanceRecord;
import com.riskmonitor.domain.model.PerformanceSummary;
import com.riskmonitor.domain.model.TradeOutcome;
import com.riskmonitor.exception.HistoryAccessException;
import com.riskmonitor.mapper.DecisionHistoryMapper;
import com.riskmonitor.monitor.DecisionHistoryProvider;
import com.riskmonitor.repository.jpa.DecisionRecordJpaRepository;
import com.riskmonitor.repository.jpa.TradeOutcomeJpaRepository;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Reads decision history from the decision_records and trade_outcomes tables.
 *
 * <p>The performance lookback is expressed in decision cycles; a cycle closes at most a
 * handful of positions, so up to {@value #TRADES_PER_CYCLE} trades per cycle are read.
 * Any Spring {@link DataAccessException} surfaces as {@link HistoryAccessException}.
 */
@Service
@Transactional(readOnly = true)
public class JpaDecisionHistoryProvider implements DecisionHistoryProvider {

    private static final Logger log = LoggerFactory.getLogger(JpaDecisionHistoryProvider.class);

    static final int TRADES_PER_CYCLE = 10;

    /** Upper bound on trade rows read per analysis. */
    static final int MAX_TRADE_ROWS = 100_000;

    private final DecisionRecordJpaRepository decisionRecordJpaRepository;
    private final TradeOutcomeJpaRepository tradeOutcomeJpaRepository;
    private final DecisionHistoryMapper decisionHistoryMapper;
    private final TradePerformanceCalculator tradePerformanceCalculator;

    public JpaDecisionHistoryProvider(
            DecisionRecordJpaRepository decisionRecordJpaRepository,
            TradeOutcomeJpaRepository tradeOutcomeJpaRepository,
            DecisionHistoryMapper decisionHistoryMapper,
            TradePerformanceCalculator tradePerformanceCalculator) {
        this.decisionRecordJpaRepository = decisionRecordJpaRepository;
        this.tradeOutcomeJpaRepository = tradeOutcomeJpaRepository;
        this.decisionHistoryMapper = decisionHistoryMapper;
        this.tradePerformanceCalculator = tradePerformanceCalculator;
    }

    @Override
    public PerformanceSummary analyzePerformance(String traderId, int limit) {
        try {
            List<TradeOutcome> trades = decisionHistoryMapper.toTradeOutcomes(
                    tradeOutcomeJpaRepository.findByTraderIdOrderByCloseTimeDesc(
                            traderId, PageRequest.of(0, tradePageSize(limit))));
            PerformanceSummary summary = tradePerformanceCalculator.summarize(trades);
            log.debug("[{}] Analyzed {} closed trades", traderId, summary.getTotalTrades());
            return summary;
        } catch (DataAccessException e) {
            throw new HistoryAccessException("Failed to read trade outcomes for trader " + traderId, e);
        }
    }

    @Override
    public List<BalanceRecord> latestRecords(String traderId, int limit) {
        try {
            List<BalanceRecord> newestFirst = decisionHistoryMapper.toBalanceRecords(
                    decisionRecordJpaRepository.findByTraderIdOrderByTimestampDesc(traderId, PageRequest.of(0, limit)));
            List<BalanceRecord> oldestFirst = new ArrayList<>(newestFirst);
            Collections.reverse(oldestFirst);
            return oldestFirst;
        } catch (DataAccessException e) {
            throw new HistoryAccessException("Failed to read decision records for trader " + traderId, e);
        }
    }

    /**
     * Trade rows to read for a lookback of {@code limit} cycles, capped at {@link #MAX_TRADE_ROWS}.
     */
    private static int tradePageSize(int limit) {
        return (int) Math.min(Math.max(1L, (long) limit * TRADES_PER_CYCLE), MAX_TRADE_ROWS);
    }
}
