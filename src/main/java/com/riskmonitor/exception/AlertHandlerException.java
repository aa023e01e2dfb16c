package com.riskmonitor.exception;

/**
 * An alert handler failed to deliver an alert. Logged by the engine, never retried.
 */
public class AlertHandlerException extends BaseException {

    public AlertHandlerException(String message) {
        super(ErrorCode.HANDLER_ERROR, message);
    }

    public AlertHandlerException(String message, Throwable cause) {
        super(ErrorCode.HANDLER_ERROR, message, cause);
    }
}
