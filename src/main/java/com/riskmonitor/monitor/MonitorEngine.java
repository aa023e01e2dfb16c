package com.riskmonitor.monitor;

import com.riskmonitor.domain.config.QueryLimits;
import com.riskmonitor.domain.config.RiskScores;
import com.riskmonitor.domain.config.RiskThresholds;
import com.riskmonitor.domain.enums.MonitorState;
import com.riskmonitor.domain.model.Alert;
import com.riskmonitor.domain.model.BalanceRecord;
import com.riskmonitor.domain.model.MetricsSnapshot;
import com.riskmonitor.domain.model.MonitorStatus;
import com.riskmonitor.domain.model.PerformanceSummary;
import com.riskmonitor.exception.AlertNotFoundException;
import com.riskmonitor.exception.HistoryAccessException;
import com.riskmonitor.observability.MonitorMetrics;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodically derives risk and performance metrics for one trader and raises
 * deduplicated alerts.
 *
 * <p>Each refresh cycle:
 * <ol>
 *   <li>Re-reads query limits, thresholds and score weights from the {@link RuntimeConfigProvider}</li>
 *   <li>Fetches performance aggregates and the latest balance records (no lock held)</li>
 *   <li>Computes the next snapshot with the {@link RiskCalculator}</li>
 *   <li>Under one write-lock acquisition: replaces the snapshot and admits firing alerts</li>
 *   <li>Dispatches each admitted alert to every handler as an independent task</li>
 * </ol>
 * If the history cannot be read the cycle is skipped and the previous snapshot,
 * including its {@code lastUpdated}, stays authoritative.
 *
 * <p><b>Concurrency model:</b> the snapshot, the {@link AlertLedger} and the handler list
 * share a single {@link ReentrantReadWriteLock}. Readers ({@link #snapshot()},
 * {@link #alerts(int)}, {@link #status()}) take the read lock; the cycle commit,
 * {@link #resolveAlert(String)} and {@link #registerHandler(AlertHandler)} take the write lock.
 * Cycles run on a dedicated single-thread scheduler with a fixed delay, so they never overlap.
 *
 * <p><b>Lifecycle:</b> STOPPED → RUNNING → STOPPED. Repeated start/stop calls are no-ops.
 * {@link #stop()} cancels the schedule without interrupting and returns once an in-flight
 * cycle has finished.
 */
public class MonitorEngine {

    private static final Logger log = LoggerFactory.getLogger(MonitorEngine.class);

    private static final double MILLIS_PER_HOUR = 3_600_000.0;

    private final String traderId;
    private final DecisionHistoryProvider historyProvider;
    private final RuntimeConfigProvider configProvider;
    private final RiskCalculator riskCalculator;
    private final AlertRules alertRules;
    private final Executor handlerExecutor;
    private final MonitorMetrics monitorMetrics;
    private final Clock clock;
    private final Duration refreshInterval;

    /** Guards snapshot, ledger and handlers. */
    private final ReadWriteLock stateLock = new ReentrantReadWriteLock();

    private MetricsSnapshot snapshot = MetricsSnapshot.empty();
    private final AlertLedger ledger = new AlertLedger();
    private final List<AlertHandler> handlers = new ArrayList<>();

    /** Held for the duration of a refresh cycle; stop() acquires it to wait for the in-flight one. */
    private final ReentrantLock cycleLock = new ReentrantLock();

    private final Object lifecycleMonitor = new Object();
    private volatile MonitorState state = MonitorState.STOPPED;
    private volatile LocalDateTime startedAt;
    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> refreshTask;

    private final LatencyTracker apiLatency = new LatencyTracker();
    private final LatencyTracker decisionLatency = new LatencyTracker();

    public MonitorEngine(
            String traderId,
            DecisionHistoryProvider historyProvider,
            RuntimeConfigProvider configProvider,
            RiskCalculator riskCalculator,
            AlertRules alertRules,
            Executor handlerExecutor,
            MonitorMetrics monitorMetrics,
            Clock clock,
            Duration refreshInterval) {
        this.traderId = traderId;
        this.historyProvider = historyProvider;
        this.configProvider = configProvider;
        this.riskCalculator = riskCalculator;
        this.alertRules = alertRules;
        this.handlerExecutor = handlerExecutor;
        this.monitorMetrics = monitorMetrics;
        this.clock = clock;
        this.refreshInterval = refreshInterval;
    }

    // ========================
    // LIFECYCLE
    // ========================

    /**
     * Starts the periodic refresh loop. Returns immediately; the first cycle runs
     * one refresh interval later. No-op when already running.
     */
    public void start() {
        synchronized (lifecycleMonitor) {
            if (state == MonitorState.RUNNING) {
                log.debug("[{}] Monitor already running", traderId);
                return;
            }
            if (scheduler == null) {
                scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                    Thread thread = new Thread(r, "monitor-" + traderId);
                    thread.setDaemon(true);
                    return thread;
                });
            }

            startedAt = LocalDateTime.now(clock);
            state = MonitorState.RUNNING;
            long intervalMillis = refreshInterval.toMillis();
            refreshTask = scheduler.scheduleWithFixedDelay(
                    this::runScheduledCycle, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        }
        log.info("[{}] Monitor started, refresh every {}s", traderId, refreshInterval.toSeconds());
    }

    /**
     * Stops the refresh loop. Waits for an in-flight cycle to complete but does not
     * interrupt it; the engine reports STOPPED only once that cycle has committed.
     * No-op when already stopped.
     */
    public void stop() {
        synchronized (lifecycleMonitor) {
            if (state == MonitorState.STOPPED) {
                log.debug("[{}] Monitor already stopped", traderId);
                return;
            }
            if (refreshTask != null) {
                refreshTask.cancel(false);
                refreshTask = null;
            }
            cycleLock.lock();
            try {
                state = MonitorState.STOPPED;
            } finally {
                cycleLock.unlock();
            }
        }
        log.info("[{}] Monitor stopped", traderId);
    }

    /**
     * Stops the loop and releases the scheduler thread. The engine cannot be restarted afterwards.
     */
    public void shutdown() {
        stop();
        synchronized (lifecycleMonitor) {
            if (scheduler != null) {
                scheduler.shutdown();
            }
        }
    }

    public boolean isRunning() {
        return state == MonitorState.RUNNING;
    }

    private void runScheduledCycle() {
        // state is re-checked under the cycle lock so no cycle starts once stop() has returned
        cycleLock.lock();
        try {
            if (state == MonitorState.RUNNING) {
                refresh();
            }
        } finally {
            cycleLock.unlock();
        }
    }

    // ========================
    // REFRESH CYCLE
    // ========================

    /**
     * Runs a single refresh cycle on the calling thread. Called by the scheduler; public
     * so that tests and operators can trigger a cycle without waiting for the timer.
     */
    public void refresh() {
        cycleLock.lock();
        try {
            runCycle();
        } catch (RuntimeException e) {
            // an exception escaping a fixed-delay task would cancel the schedule
            log.error("[{}] Unexpected error in refresh cycle", traderId, e);
            monitorMetrics.refreshFailed(traderId);
        } finally {
            cycleLock.unlock();
        }
    }

    private void runCycle() {
        long startNanos = System.nanoTime();
        QueryLimits limits = configProvider.queryLimits();

        PerformanceSummary performance;
        List<BalanceRecord> records;
        try {
            performance = historyProvider.analyzePerformance(traderId, limits.getPerformanceLimit());
            records = historyProvider.latestRecords(traderId, limits.getMonitoringLimit());
        } catch (HistoryAccessException e) {
            log.warn("[{}] Skipping refresh cycle, decision history unavailable: {}", traderId, e.getMessage());
            monitorMetrics.refreshFailed(traderId);
            return;
        }

        RiskThresholds thresholds = configProvider.riskThresholds();
        RiskScores scores = configProvider.riskScores();
        LocalDateTime now = LocalDateTime.now(clock);

        MetricsSnapshot previous = snapshot();
        MetricsSnapshot next = riskCalculator
                .compute(records, performance, thresholds, scores, previous)
                .toBuilder()
                .apiLatency(apiLatency.drainAverage(previous.getApiLatency()))
                .decisionLatency(decisionLatency.drainAverage(previous.getDecisionLatency()))
                .systemUptime(uptimeHours(now))
                .lastUpdated(now)
                .build();
        List<Alert> candidates = alertRules.evaluate(traderId, next, thresholds, now);

        List<Alert> admitted = new ArrayList<>();
        List<AlertHandler> handlersSnapshot;
        stateLock.writeLock().lock();
        try {
            snapshot = next;
            for (Alert candidate : candidates) {
                if (ledger.admit(candidate)) {
                    admitted.add(candidate);
                } else {
                    monitorMetrics.alertDeduplicated(traderId);
                }
            }
            handlersSnapshot = List.copyOf(handlers);
        } finally {
            stateLock.writeLock().unlock();
        }

        for (Alert alert : admitted) {
            log.warn("[{}] {} alert raised: {} - {}", traderId, alert.getLevel(), alert.getTitle(), alert.getMessage());
            monitorMetrics.alertRaised(traderId);
            dispatch(alert, handlersSnapshot);
        }

        monitorMetrics.refreshSucceeded(traderId, Duration.ofNanos(System.nanoTime() - startNanos));
        log.info(
                "[{}] Metrics updated - records: {}, win rate: {}%, sharpe: {}, risk score: {}",
                traderId,
                records.size(),
                String.format("%.1f", next.getWinRate()),
                String.format("%.2f", next.getSharpeRatio()),
                next.getRiskScore());
    }

    private double uptimeHours(LocalDateTime now) {
        LocalDateTime started = startedAt;
        if (started == null) {
            return 0;
        }
        return Duration.between(started, now).toMillis() / MILLIS_PER_HOUR;
    }

    // ========================
    // ALERT DISPATCH
    // ========================

    private void dispatch(Alert alert, List<AlertHandler> targets) {
        for (AlertHandler handler : targets) {
            try {
                handlerExecutor.execute(() -> deliver(handler, alert));
            } catch (RejectedExecutionException e) {
                log.warn(
                        "[{}] Alert {} not dispatched to {}: executor rejected the task",
                        traderId,
                        alert.getId(),
                        handler.getClass().getSimpleName());
                monitorMetrics.handlerFailed(traderId);
            }
        }
    }

    private void deliver(AlertHandler handler, Alert alert) {
        try {
            handler.handle(alert);
        } catch (Exception e) {
            log.warn(
                    "[{}] Alert handler {} failed for {}: {}",
                    traderId,
                    handler.getClass().getSimpleName(),
                    alert.getId(),
                    e.getMessage());
            monitorMetrics.handlerFailed(traderId);
        }
    }

    // ========================
    // ACCESSORS
    // ========================

    /**
     * Returns the current snapshot. Snapshots are immutable, so the returned value is
     * safe to keep after the engine moves on.
     */
    public MetricsSnapshot snapshot() {
        stateLock.readLock().lock();
        try {
            return snapshot;
        } finally {
            stateLock.readLock().unlock();
        }
    }

    /**
     * Returns alerts newest first.
     *
     * @param limit maximum number of alerts; zero or negative returns all
     */
    public List<Alert> alerts(int limit) {
        stateLock.readLock().lock();
        try {
            return ledger.list(limit);
        } finally {
            stateLock.readLock().unlock();
        }
    }

    /**
     * Resolves the alert with the given id.
     *
     * @throws AlertNotFoundException if no alert with that id exists
     */
    public Alert resolveAlert(String alertId) {
        stateLock.writeLock().lock();
        try {
            Alert resolved = ledger.resolve(alertId, LocalDateTime.now(clock));
            log.info("[{}] Alert {} resolved", traderId, alertId);
            return resolved;
        } finally {
            stateLock.writeLock().unlock();
        }
    }

    /**
     * Adds a handler. It receives alerts admitted from now on; earlier alerts are not replayed.
     */
    public void registerHandler(AlertHandler handler) {
        stateLock.writeLock().lock();
        try {
            handlers.add(handler);
        } finally {
            stateLock.writeLock().unlock();
        }
    }

    public MonitorStatus status() {
        stateLock.readLock().lock();
        try {
            return MonitorStatus.builder()
                    .traderId(traderId)
                    .enabled(isRunning())
                    .lastUpdated(snapshot.getLastUpdated())
                    .alertCount(ledger.size())
                    .riskScore(snapshot.getRiskScore())
                    .build();
        } finally {
            stateLock.readLock().unlock();
        }
    }

    /**
     * Records the latency of one exchange API call. Averaged into the next snapshot.
     */
    public void recordApiLatency(long millis) {
        apiLatency.record(millis);
    }

    /**
     * Records the latency of one decision cycle. Averaged into the next snapshot.
     */
    public void recordDecisionLatency(long millis) {
        decisionLatency.record(millis);
    }

    public String getTraderId() {
        return traderId;
    }
}
