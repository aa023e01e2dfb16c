package com.riskmonitor.domain.config;

import lombok.Builder;
import lombok.Value;

/**
 * Points contributed to the composite risk score by each threshold tier.
 */
@Value
@Builder(toBuilder = true)
public class RiskScores {

    int marginHighScore;
    int marginMediumScore;

    int drawdownCriticalScore;
    int drawdownHighScore;
    int drawdownMediumScore;

    int sharpeLowScore;
    int sharpePoorScore;
}
