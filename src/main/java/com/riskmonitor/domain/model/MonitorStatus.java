package com.riskmonitor.domain.model;

import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * Lightweight engine summary for status polling.
 */
@Value
@Builder
public class MonitorStatus {

    String traderId;
    boolean enabled;
    LocalDateTime lastUpdated;
    int alertCount;
    int riskScore;
}
