package com.riskmonitor.exception;

import java.util.Map;

/**
 * A runtime configuration update was rejected.
 */
public class InvalidConfigurationException extends BaseException {

    public InvalidConfigurationException(String message, Map<String, Object> details) {
        super(ErrorCode.VALIDATION_ERROR, message, details);
    }
}
