package com.riskmonitor.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Loop settings for the monitor engines.
 *
 * <pre>
 * riskmonitor.monitor.refresh-interval=30s
 * riskmonitor.monitor.auto-start-traders=trader-a,trader-b
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "riskmonitor.monitor")
public class MonitorProperties {

    private Duration refreshInterval = Duration.ofSeconds(30);

    /** Traders whose monitors are started once the application is ready. */
    private List<String> autoStartTraders = new ArrayList<>();
}
