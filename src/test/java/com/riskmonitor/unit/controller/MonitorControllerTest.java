package com.riskmonitor.unit.controller;

import static com.riskmonitor.support.MonitorFixtures.T0;
import static com.riskmonitor.support.MonitorFixtures.alert;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.riskmonitor.api.ApiResponseAdvice;
import com.riskmonitor.api.controller.MonitorController;
import com.riskmonitor.domain.enums.AlertLevel;
import com.riskmonitor.domain.enums.AlertType;
import com.riskmonitor.domain.model.Alert;
import com.riskmonitor.domain.model.MetricsSnapshot;
import com.riskmonitor.domain.model.MonitorStatus;
import com.riskmonitor.exception.AlertNotFoundException;
import com.riskmonitor.exception.GlobalExceptionHandler;
import com.riskmonitor.exception.ResourceNotFoundException;
import com.riskmonitor.monitor.MonitorEngine;
import com.riskmonitor.service.MonitorManager;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class MonitorControllerTest {

    private MockMvc mockMvc;

    @Mock
    private MonitorManager monitorManager;

    private MonitorEngine engine;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        engine = mock(MonitorEngine.class);
        MonitorController controller = new MonitorController(monitorManager);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler(), new ApiResponseAdvice())
                .build();
    }

    private MonitorStatus statusOf(boolean enabled) {
        return MonitorStatus.builder()
                .traderId("trader-1")
                .enabled(enabled)
                .lastUpdated(T0)
                .alertCount(2)
                .riskScore(30)
                .build();
    }

    @Test
    void listMonitors_wrapsStatusesInEnvelope() throws Exception {
        when(monitorManager.statuses()).thenReturn(List.of(statusOf(true)));

        mockMvc.perform(get("/api/monitor"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.data[0].traderId").value("trader-1"))
                .andExpect(jsonPath("$.data[0].enabled").value(true));
    }

    @Test
    void start_returnsRunningStatus() throws Exception {
        when(monitorManager.start("trader-1")).thenReturn(engine);
        when(engine.status()).thenReturn(statusOf(true));

        mockMvc.perform(post("/api/monitor/trader-1/start"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.enabled").value(true));
    }

    @Test
    void stop_unknownTrader_returns404() throws Exception {
        when(monitorManager.stop("ghost")).thenThrow(new ResourceNotFoundException("Monitor", "ghost"));

        mockMvc.perform(post("/api/monitor/ghost/stop"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.code").value("NOT_FOUND"))
                .andExpect(jsonPath("$.status").value(404))
                .andExpect(jsonPath("$.details.id").value("ghost"))
                .andExpect(jsonPath("$.path").value("/api/monitor/ghost/stop"));
    }

    @Test
    void getMetrics_returnsSnapshot() throws Exception {
        when(monitorManager.get("trader-1")).thenReturn(engine);
        when(engine.snapshot()).thenReturn(MetricsSnapshot.empty().toBuilder()
                .riskScore(45)
                .maxDrawdown(12.5)
                .lastUpdated(T0)
                .build());

        mockMvc.perform(get("/api/monitor/trader-1/metrics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.riskScore").value(45))
                .andExpect(jsonPath("$.data.maxDrawdown").value(12.5));
    }

    @Test
    void getAlerts_defaultsToTwenty() throws Exception {
        Alert alert = alert("margin_usage_1", AlertType.RISK, AlertLevel.CRITICAL, T0);
        when(monitorManager.get("trader-1")).thenReturn(engine);
        when(engine.alerts(20)).thenReturn(List.of(alert));

        mockMvc.perform(get("/api/monitor/trader-1/alerts"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].id").value("margin_usage_1"))
                .andExpect(jsonPath("$.data[0].level").value("CRITICAL"));

        verify(engine).alerts(20);
    }

    @Test
    void getAlerts_nonNumericLimit_returns400() throws Exception {
        mockMvc.perform(get("/api/monitor/trader-1/alerts").param("limit", "abc"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"))
                .andExpect(jsonPath("$.details.limit").value("abc"));
    }

    @Test
    void resolveAlert_unknownId_returns404() throws Exception {
        when(monitorManager.get("trader-1")).thenReturn(engine);
        when(engine.resolveAlert("nope")).thenThrow(new AlertNotFoundException("nope"));

        mockMvc.perform(post("/api/monitor/trader-1/alerts/nope/resolve"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }

    @Test
    void resolveAlert_returnsResolvedAlert() throws Exception {
        Alert resolved = alert("margin_usage_1", AlertType.RISK, AlertLevel.CRITICAL, T0).resolve(T0.plusMinutes(1));
        when(monitorManager.get("trader-1")).thenReturn(engine);
        when(engine.resolveAlert("margin_usage_1")).thenReturn(resolved);

        mockMvc.perform(post("/api/monitor/trader-1/alerts/margin_usage_1/resolve"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.resolved").value(true));
    }

    @Test
    void reportLatency_recordsSamples() throws Exception {
        when(monitorManager.get("trader-1")).thenReturn(engine);

        mockMvc.perform(post("/api/monitor/trader-1/latency")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"apiLatencyMs\": 120}"))
                .andExpect(status().isAccepted());

        verify(engine).recordApiLatency(120);
        verify(engine, never()).recordDecisionLatency(anyLong());
    }

    @Test
    void reportLatency_negative_returns400() throws Exception {
        mockMvc.perform(post("/api/monitor/trader-1/latency")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"apiLatencyMs\": -5}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.details.apiLatencyMs").exists());
    }

    @Test
    void remove_returnsNoContent() throws Exception {
        when(monitorManager.get("trader-1")).thenReturn(engine);

        mockMvc.perform(delete("/api/monitor/trader-1")).andExpect(status().isNoContent());

        verify(monitorManager).remove("trader-1");
    }
}
