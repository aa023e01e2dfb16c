package com.riskmonitor.mapper;

import com.riskmonitor.api.dto.request.QueryLimitsUpdateRequest;
import com.riskmonitor.api.dto.request.RiskScoresUpdateRequest;
import com.riskmonitor.api.dto.request.RiskThresholdsUpdateRequest;
import com.riskmonitor.domain.config.QueryLimits;
import com.riskmonitor.domain.config.RiskScores;
import com.riskmonitor.domain.config.RiskThresholds;
import org.mapstruct.BeanMapping;
import org.mapstruct.Mapper;
import org.mapstruct.MappingTarget;
import org.mapstruct.NullValuePropertyMappingStrategy;

/**
 * Applies partial configuration updates onto the current config groups.
 * Only the fields present in the request are copied; the rest come from the current group.
 */
@Mapper
public interface RuntimeConfigMapper {

    default RiskThresholds merge(RiskThresholds current, RiskThresholdsUpdateRequest request) {
        RiskThresholds.RiskThresholdsBuilder builder = current.toBuilder();
        updateThresholds(request, builder);
        return builder.build();
    }

    default RiskScores merge(RiskScores current, RiskScoresUpdateRequest request) {
        RiskScores.RiskScoresBuilder builder = current.toBuilder();
        updateScores(request, builder);
        return builder.build();
    }

    default QueryLimits merge(QueryLimits current, QueryLimitsUpdateRequest request) {
        QueryLimits.QueryLimitsBuilder builder = current.toBuilder();
        updateQueryLimits(request, builder);
        return builder.build();
    }

    @BeanMapping(nullValuePropertyMappingStrategy = NullValuePropertyMappingStrategy.IGNORE)
    void updateThresholds(RiskThresholdsUpdateRequest request, @MappingTarget RiskThresholds.RiskThresholdsBuilder builder);

    @BeanMapping(nullValuePropertyMappingStrategy = NullValuePropertyMappingStrategy.IGNORE)
    void updateScores(RiskScoresUpdateRequest request, @MappingTarget RiskScores.RiskScoresBuilder builder);

    @BeanMapping(nullValuePropertyMappingStrategy = NullValuePropertyMappingStrategy.IGNORE)
    void updateQueryLimits(QueryLimitsUpdateRequest request, @MappingTarget QueryLimits.QueryLimitsBuilder builder);
}
