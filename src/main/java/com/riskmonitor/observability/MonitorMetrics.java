package com.riskmonitor.observability;

import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import org.springframework.stereotype.Service;

/**
 * Micrometer meters for the monitor engines, tagged per trader.
 *
 * <ul>
 *   <li><b>monitor.refresh.success</b> (counter): refresh cycles that replaced the snapshot</li>
 *   <li><b>monitor.refresh.failure</b> (counter): cycles skipped because history was unreadable</li>
 *   <li><b>monitor.refresh.duration</b> (timer): wall time of a completed refresh cycle</li>
 *   <li><b>monitor.alerts.raised</b> (counter): alerts admitted to the ledger</li>
 *   <li><b>monitor.alerts.deduplicated</b> (counter): candidates dropped by deduplication</li>
 *   <li><b>monitor.handler.failures</b> (counter): alert handler invocations that threw</li>
 * </ul>
 */
@Service
public class MonitorMetrics {

    private static final String TRADER_TAG = "trader";

    private final MeterRegistry meterRegistry;

    public MonitorMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public void refreshSucceeded(String traderId, Duration elapsed) {
        meterRegistry.counter("monitor.refresh.success", TRADER_TAG, traderId).increment();
        meterRegistry.timer("monitor.refresh.duration", TRADER_TAG, traderId).record(elapsed);
    }

    public void refreshFailed(String traderId) {
        meterRegistry.counter("monitor.refresh.failure", TRADER_TAG, traderId).increment();
    }

    public void alertRaised(String traderId) {
        meterRegistry.counter("monitor.alerts.raised", TRADER_TAG, traderId).increment();
    }

    public void alertDeduplicated(String traderId) {
        meterRegistry.counter("monitor.alerts.deduplicated", TRADER_TAG, traderId).increment();
    }

    public void handlerFailed(String traderId) {
        meterRegistry.counter("monitor.handler.failures", TRADER_TAG, traderId).increment();
    }
}
