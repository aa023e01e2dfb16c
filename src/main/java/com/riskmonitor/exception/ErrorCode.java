package com.riskmonitor.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Error codes surfaced by the monitor API. The enum name is the code clients see.
 */
@Getter
public enum ErrorCode {
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST),
    BAD_REQUEST(HttpStatus.BAD_REQUEST),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    HANDLER_ERROR(HttpStatus.BAD_GATEWAY),
    DATA_ACCESS_ERROR(HttpStatus.SERVICE_UNAVAILABLE),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus httpStatus;

    ErrorCode(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public String getCode() {
        return name();
    }
}
