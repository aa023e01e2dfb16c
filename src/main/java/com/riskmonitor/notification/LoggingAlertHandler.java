package com.riskmonitor.notification;

import com.riskmonitor.domain.model.Alert;
import com.riskmonitor.monitor.AlertHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes every admitted alert to a dedicated {@code ALERTS} logger so that alert history
 * can be routed to its own appender.
 */
@Component
public class LoggingAlertHandler implements AlertHandler {

    private static final Logger alertLog = LoggerFactory.getLogger("ALERTS");

    @Override
    public void handle(Alert alert) {
        switch (alert.getLevel()) {
            case CRITICAL -> alertLog.error(format(alert));
            case WARNING -> alertLog.warn(format(alert));
            case INFO -> alertLog.info(format(alert));
        }
    }

    /** Public for testability. */
    public String format(Alert alert) {
        return String.format(
                "[%s] %s %s/%s %s: %s",
                alert.getTraderId(),
                alert.getId(),
                alert.getType(),
                alert.getLevel(),
                alert.getTitle(),
                alert.getMessage());
    }
}
