package com.riskmonitor.api.controller;

import com.riskmonitor.api.dto.request.QueryLimitsUpdateRequest;
import com.riskmonitor.api.dto.request.RiskScoresUpdateRequest;
import com.riskmonitor.api.dto.request.RiskThresholdsUpdateRequest;
import com.riskmonitor.domain.config.QueryLimits;
import com.riskmonitor.domain.config.RiskScores;
import com.riskmonitor.domain.config.RiskThresholds;
import com.riskmonitor.mapper.RuntimeConfigMapper;
import com.riskmonitor.service.RuntimeConfigService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Reads and replaces the runtime configuration shared by all monitors.
 * A PUT changes only the fields present in the body; the merged group is validated and
 * running monitors apply it on their next cycle.
 */
@RestController
@RequestMapping("/api/monitor/config")
public class RuntimeConfigController {

    private final RuntimeConfigService runtimeConfigService;
    private final RuntimeConfigMapper runtimeConfigMapper;

    public RuntimeConfigController(RuntimeConfigService runtimeConfigService, RuntimeConfigMapper runtimeConfigMapper) {
        this.runtimeConfigService = runtimeConfigService;
        this.runtimeConfigMapper = runtimeConfigMapper;
    }

    @GetMapping("/thresholds")
    public ResponseEntity<RiskThresholds> getThresholds() {
        return ResponseEntity.ok(runtimeConfigService.riskThresholds());
    }

    @PutMapping("/thresholds")
    public ResponseEntity<RiskThresholds> updateThresholds(@RequestBody RiskThresholdsUpdateRequest request) {
        return ResponseEntity.ok(
                runtimeConfigService.updateRiskThresholds(current -> runtimeConfigMapper.merge(current, request)));
    }

    @GetMapping("/scores")
    public ResponseEntity<RiskScores> getScores() {
        return ResponseEntity.ok(runtimeConfigService.riskScores());
    }

    @PutMapping("/scores")
    public ResponseEntity<RiskScores> updateScores(@RequestBody RiskScoresUpdateRequest request) {
        return ResponseEntity.ok(
                runtimeConfigService.updateRiskScores(current -> runtimeConfigMapper.merge(current, request)));
    }

    @GetMapping("/query-limits")
    public ResponseEntity<QueryLimits> getQueryLimits() {
        return ResponseEntity.ok(runtimeConfigService.queryLimits());
    }

    @PutMapping("/query-limits")
    public ResponseEntity<QueryLimits> updateQueryLimits(@RequestBody QueryLimitsUpdateRequest request) {
        return ResponseEntity.ok(
                runtimeConfigService.updateQueryLimits(current -> runtimeConfigMapper.merge(current, request)));
    }
}
