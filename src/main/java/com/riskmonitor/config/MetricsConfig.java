package com.riskmonitor.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.config.MeterFilter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Common tags and cardinality guard for the meters defined in
 * {@link com.riskmonitor.observability.MonitorMetrics}.
 *
 * <p>Monitor meters are tagged per trader; past {@code riskmonitor.metrics.max-traders}
 * distinct trader values new series are denied so that a runaway client creating monitors
 * cannot exhaust the registry.
 */
@Configuration
public class MetricsConfig {

    static final String MONITOR_METER_PREFIX = "monitor.";
    static final String TRADER_TAG = "trader";

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> monitorMeterCustomizer(
            @Value("${spring.application.name:risk-monitor}") String applicationName,
            @Value("${riskmonitor.metrics.max-traders:200}") int maxTraders) {
        return registry -> registry.config()
                .commonTags("application", applicationName)
                .meterFilter(MeterFilter.maximumAllowableTags(
                        MONITOR_METER_PREFIX, TRADER_TAG, maxTraders, MeterFilter.deny()));
    }
}
