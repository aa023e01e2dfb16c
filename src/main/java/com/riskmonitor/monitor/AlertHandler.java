package com.riskmonitor.monitor;

import com.riskmonitor.domain.model.Alert;
import com.riskmonitor.exception.AlertHandlerException;

/**
 * Receives every alert admitted by a {@link MonitorEngine}.
 *
 * <p>Invoked asynchronously, once per admitted alert. A failure is logged by the engine
 * and affects neither the refresh loop nor other handlers.
 */
@FunctionalInterface
public interface AlertHandler {

    void handle(Alert alert) throws AlertHandlerException;
}
