package com.riskmonitor.exception;

/**
 * Thrown when resolving an alert id that was never raised by the engine.
 */
public class AlertNotFoundException extends ResourceNotFoundException {

    public AlertNotFoundException(String alertId) {
        super("Alert", alertId);
    }
}
