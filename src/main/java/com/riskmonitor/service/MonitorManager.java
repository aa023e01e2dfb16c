package com.riskmonitor.service;

import com.riskmonitor.config.MonitorProperties;
import com.riskmonitor.domain.model.MonitorStatus;
import com.riskmonitor.exception.ResourceNotFoundException;
import com.riskmonitor.monitor.AlertHandler;
import com.riskmonitor.monitor.AlertRules;
import com.riskmonitor.monitor.DecisionHistoryProvider;
import com.riskmonitor.monitor.MonitorEngine;
import com.riskmonitor.monitor.RiskCalculator;
import com.riskmonitor.monitor.RuntimeConfigProvider;
import com.riskmonitor.observability.MonitorMetrics;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Owns one {@link MonitorEngine} per trader.
 *
 * <p>Engines are created on first use with every {@link AlertHandler} bean registered,
 * started for the traders listed in {@code riskmonitor.monitor.auto-start-traders} once the
 * application is ready, and shut down with the application context. The registry is a
 * {@link ConcurrentHashMap}; {@code computeIfAbsent} guarantees a single engine per trader.
 */
@Service
public class MonitorManager {

    private static final Logger log = LoggerFactory.getLogger(MonitorManager.class);

    private final ConcurrentHashMap<String, MonitorEngine> engines = new ConcurrentHashMap<>();

    private final DecisionHistoryProvider decisionHistoryProvider;
    private final RuntimeConfigProvider runtimeConfigProvider;
    private final RiskCalculator riskCalculator;
    private final AlertRules alertRules;
    private final Executor alertExecutor;
    private final MonitorMetrics monitorMetrics;
    private final List<AlertHandler> alertHandlers;
    private final MonitorProperties monitorProperties;
    private final Clock clock;

    public MonitorManager(
            DecisionHistoryProvider decisionHistoryProvider,
            RuntimeConfigProvider runtimeConfigProvider,
            RiskCalculator riskCalculator,
            AlertRules alertRules,
            @Qualifier("alertExecutor") Executor alertExecutor,
            MonitorMetrics monitorMetrics,
            List<AlertHandler> alertHandlers,
            MonitorProperties monitorProperties,
            Clock clock) {
        this.decisionHistoryProvider = decisionHistoryProvider;
        this.runtimeConfigProvider = runtimeConfigProvider;
        this.riskCalculator = riskCalculator;
        this.alertRules = alertRules;
        this.alertExecutor = alertExecutor;
        this.monitorMetrics = monitorMetrics;
        this.alertHandlers = alertHandlers;
        this.monitorProperties = monitorProperties;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startConfiguredTraders() {
        for (String traderId : monitorProperties.getAutoStartTraders()) {
            if (traderId != null && !traderId.isBlank()) {
                start(traderId.trim());
            }
        }
    }

    /**
     * Returns the engine for the trader, creating it (stopped) if needed.
     */
    public MonitorEngine getOrCreate(String traderId) {
        return engines.computeIfAbsent(traderId, this::createEngine);
    }

    /**
     * Returns an existing engine.
     *
     * @throws ResourceNotFoundException if no engine was created for the trader
     */
    public MonitorEngine get(String traderId) {
        MonitorEngine engine = engines.get(traderId);
        if (engine == null) {
            throw new ResourceNotFoundException("Monitor", traderId);
        }
        return engine;
    }

    public MonitorEngine start(String traderId) {
        MonitorEngine engine = getOrCreate(traderId);
        engine.start();
        return engine;
    }

    public MonitorEngine stop(String traderId) {
        MonitorEngine engine = get(traderId);
        engine.stop();
        return engine;
    }

    /**
     * Stops the trader's engine and discards it together with its snapshot and alerts.
     */
    public void remove(String traderId) {
        MonitorEngine engine = engines.remove(traderId);
        if (engine != null) {
            engine.shutdown();
            log.info("Monitor for trader {} removed", traderId);
        }
    }

    public List<MonitorStatus> statuses() {
        return engines.values().stream()
                .map(MonitorEngine::status)
                .sorted(Comparator.comparing(MonitorStatus::getTraderId))
                .toList();
    }

    public int getEngineCount() {
        return engines.size();
    }

    @PreDestroy
    public void shutdownAll() {
        engines.values().forEach(MonitorEngine::shutdown);
        log.info("Shut down {} monitor engines", engines.size());
        engines.clear();
    }

    private MonitorEngine createEngine(String traderId) {
        MonitorEngine engine = new MonitorEngine(
                traderId,
                decisionHistoryProvider,
                runtimeConfigProvider,
                riskCalculator,
                alertRules,
                alertExecutor,
                monitorMetrics,
                clock,
                monitorProperties.getRefreshInterval());
        alertHandlers.forEach(engine::registerHandler);
        log.info("Monitor created for trader {} with {} alert handlers", traderId, alertHandlers.size());
        return engine;
    }
}
