package com.riskmonitor.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.riskmonitor.exception.ErrorCode;
import java.time.LocalDateTime;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Envelope for failed API responses, produced by the global exception handler.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class ApiErrorResponse {

    @Builder.Default
    boolean success = false;

    String code;
    int status;
    String message;
    Map<String, Object> details;
    String path;
    LocalDateTime timestamp;

    public static ApiErrorResponse from(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        return ApiErrorResponse.builder()
                .code(errorCode.getCode())
                .status(errorCode.getHttpStatus().value())
                .message(message)
                .details(details)
                .path(path)
                .timestamp(LocalDateTime.now())
                .build();
    }
}
