package com.riskmonitor.api.dto.request;

import lombok.Data;

/**
 * Partial update of the risk score points. Null fields keep their current value.
 */
@Data
public class RiskScoresUpdateRequest {

    private Integer marginHighScore;
    private Integer marginMediumScore;

    private Integer drawdownCriticalScore;
    private Integer drawdownHighScore;
    private Integer drawdownMediumScore;

    private Integer sharpeLowScore;
    private Integer sharpePoorScore;
}
