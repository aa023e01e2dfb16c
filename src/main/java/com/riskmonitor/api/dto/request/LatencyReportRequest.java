package com.riskmonitor.api.dto.request;

import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

/**
 * Latency samples reported by the trading runtime. Either field may be omitted.
 */
@Data
public class LatencyReportRequest {

    @PositiveOrZero
    private Long apiLatencyMs;

    @PositiveOrZero
    private Long decisionLatencyMs;
}
