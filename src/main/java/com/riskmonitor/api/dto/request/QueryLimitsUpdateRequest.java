package com.riskmonitor.api.dto.request;

import lombok.Data;

/**
 * Partial update of the history query limits. Null fields keep their current value.
 */
@Data
public class QueryLimitsUpdateRequest {

    private Integer performanceLimit;
    private Integer monitoringLimit;
}
