package com.riskmonitor.api.controller;

import com.riskmonitor.api.dto.request.LatencyReportRequest;
import com.riskmonitor.domain.model.Alert;
import com.riskmonitor.domain.model.MetricsSnapshot;
import com.riskmonitor.domain.model.MonitorStatus;
import com.riskmonitor.monitor.MonitorEngine;
import com.riskmonitor.service.MonitorManager;
import jakarta.validation.Valid;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for per-trader monitors.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/monitor -- status of every monitor</li>
 *   <li>POST /api/monitor/{traderId}/start -- create if needed and start</li>
 *   <li>POST /api/monitor/{traderId}/stop -- stop the refresh loop</li>
 *   <li>POST /api/monitor/{traderId}/refresh -- run one refresh cycle now</li>
 *   <li>DELETE /api/monitor/{traderId} -- stop and discard the monitor</li>
 *   <li>GET /api/monitor/{traderId}/status -- summary for polling</li>
 *   <li>GET /api/monitor/{traderId}/metrics -- latest metrics snapshot</li>
 *   <li>GET /api/monitor/{traderId}/alerts?limit=20 -- alerts, newest first</li>
 *   <li>POST /api/monitor/{traderId}/alerts/{alertId}/resolve -- resolve one alert</li>
 *   <li>POST /api/monitor/{traderId}/latency -- report latency samples</li>
 * </ul>
 * Unknown traders yield 404 everywhere except start.
 */
@RestController
@RequestMapping("/api/monitor")
public class MonitorController {

    private static final Logger log = LoggerFactory.getLogger(MonitorController.class);

    private final MonitorManager monitorManager;

    public MonitorController(MonitorManager monitorManager) {
        this.monitorManager = monitorManager;
    }

    @GetMapping
    public ResponseEntity<List<MonitorStatus>> listMonitors() {
        return ResponseEntity.ok(monitorManager.statuses());
    }

    @PostMapping("/{traderId}/start")
    public ResponseEntity<MonitorStatus> start(@PathVariable String traderId) {
        log.info("Monitor start requested for trader {}", traderId);
        return ResponseEntity.ok(monitorManager.start(traderId).status());
    }

    @PostMapping("/{traderId}/stop")
    public ResponseEntity<MonitorStatus> stop(@PathVariable String traderId) {
        log.info("Monitor stop requested for trader {}", traderId);
        return ResponseEntity.ok(monitorManager.stop(traderId).status());
    }

    @PostMapping("/{traderId}/refresh")
    public ResponseEntity<MetricsSnapshot> refresh(@PathVariable String traderId) {
        MonitorEngine engine = monitorManager.get(traderId);
        engine.refresh();
        return ResponseEntity.ok(engine.snapshot());
    }

    @DeleteMapping("/{traderId}")
    public ResponseEntity<Void> remove(@PathVariable String traderId) {
        monitorManager.get(traderId);
        monitorManager.remove(traderId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{traderId}/status")
    public ResponseEntity<MonitorStatus> getStatus(@PathVariable String traderId) {
        return ResponseEntity.ok(monitorManager.get(traderId).status());
    }

    @GetMapping("/{traderId}/metrics")
    public ResponseEntity<MetricsSnapshot> getMetrics(@PathVariable String traderId) {
        return ResponseEntity.ok(monitorManager.get(traderId).snapshot());
    }

    @GetMapping("/{traderId}/alerts")
    public ResponseEntity<List<Alert>> getAlerts(
            @PathVariable String traderId, @RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(monitorManager.get(traderId).alerts(limit));
    }

    @PostMapping("/{traderId}/alerts/{alertId}/resolve")
    public ResponseEntity<Alert> resolveAlert(@PathVariable String traderId, @PathVariable String alertId) {
        return ResponseEntity.ok(monitorManager.get(traderId).resolveAlert(alertId));
    }

    @PostMapping("/{traderId}/latency")
    public ResponseEntity<Void> reportLatency(
            @PathVariable String traderId, @Valid @RequestBody LatencyReportRequest request) {
        MonitorEngine engine = monitorManager.get(traderId);
        if (request.getApiLatencyMs() != null) {
            engine.recordApiLatency(request.getApiLatencyMs());
        }
        if (request.getDecisionLatencyMs() != null) {
            engine.recordDecisionLatency(request.getDecisionLatencyMs());
        }
        return ResponseEntity.accepted().build();
    }
}
