package com.riskmonitor.api.dto.request;

import lombok.Data;

/**
 * Partial update of the risk thresholds. Null fields keep their current value.
 */
@Data
public class RiskThresholdsUpdateRequest {

    private Double marginHigh;
    private Double marginMedium;

    private Double drawdownCritical;
    private Double drawdownHigh;
    private Double drawdownMedium;

    private Double sharpeLow;
    private Double sharpePoor;

    private Double winRateLow;

    private Integer riskScoreCritical;
    private Integer riskScoreHigh;
    private Double marginCritical;
    private Integer overTradingAlert;
    private Double apiLatencyHighMs;
    private Double errorRateHigh;
    private Integer minTradesForStats;
}
