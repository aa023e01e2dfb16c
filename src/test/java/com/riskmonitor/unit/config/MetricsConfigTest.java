package com.riskmonitor.unit.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.riskmonitor.config.MetricsConfig;
import com.riskmonitor.observability.MonitorMetrics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.Collection;
import org.junit.jupiter.api.Test;

class MetricsConfigTest {

    @Test
    void monitorMeters_getApplicationTagAndBoundedTraderCardinality() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        new MetricsConfig().monitorMeterCustomizer("risk-monitor", 2).customize(registry);
        MonitorMetrics monitorMetrics = new MonitorMetrics(registry);

        monitorMetrics.alertRaised("trader-a");
        monitorMetrics.alertRaised("trader-b");
        monitorMetrics.alertRaised("trader-c");

        Collection<Counter> counters = registry.find("monitor.alerts.raised").counters();
        assertThat(counters).hasSize(2);
        assertThat(counters).allSatisfy(counter ->
                assertThat(counter.getId().getTag("application")).isEqualTo("risk-monitor"));
    }
}
