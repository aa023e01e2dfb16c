package com.riskmonitor.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.LocalDateTime;
import java.util.Collection;
import lombok.Value;

/**
 * Envelope for successful API responses. Collection payloads also carry their size.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    boolean success;
    T data;
    Integer count;
    LocalDateTime timestamp;

    public static <T> ApiResponse<T> of(T data) {
        Integer count = data instanceof Collection<?> collection ? collection.size() : null;
        return new ApiResponse<>(true, data, count, LocalDateTime.now());
    }
}
