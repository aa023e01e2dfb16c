package com.riskmonitor.api;

import com.riskmonitor.api.dto.response.ApiErrorResponse;
import com.riskmonitor.api.dto.response.ApiResponse;
import org.springframework.core.MethodParameter;
import org.springframework.http.MediaType;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.http.converter.json.AbstractJackson2HttpMessageConverter;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyAdvice;

/**
 * Wraps JSON payloads of the monitor controllers in {@link ApiResponse}.
 *
 * <p>Scoped to the controller package, so actuator and the Boot error endpoint are left alone.
 * Empty bodies (202/204) and bodies that already are envelopes pass through unchanged.
 */
@RestControllerAdvice(basePackages = "com.riskmonitor.api.controller")
public class ApiResponseAdvice implements ResponseBodyAdvice<Object> {

    @Override
    public boolean supports(MethodParameter returnType, Class<? extends HttpMessageConverter<?>> converterType) {
        return AbstractJackson2HttpMessageConverter.class.isAssignableFrom(converterType);
    }

    @Override
    public Object beforeBodyWrite(
            Object body,
            MethodParameter returnType,
            MediaType selectedContentType,
            Class<? extends HttpMessageConverter<?>> selectedConverterType,
            ServerHttpRequest request,
            ServerHttpResponse response) {
        if (body == null || isEnvelope(body)) {
            return body;
        }
        return ApiResponse.of(body);
    }

    private static boolean isEnvelope(Object body) {
        return body instanceof ApiResponse<?> || body instanceof ApiErrorResponse;
    }
}
