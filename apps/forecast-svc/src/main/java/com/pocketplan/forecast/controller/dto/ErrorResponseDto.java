package com.pocketplan.forecast.controller.dto;

import java.util.Map;

/**
 * Uniform error body. {@code details} is never null so clients can always index into it.
 */
public record ErrorResponseDto(String code, String message, Map<String, Object> details, String traceId) {

    public ErrorResponseDto {
        details = details == null ? Map.of() : details;
    }

    public static ErrorResponseDto withoutDetails(String code, String message, String traceId) {
        return new ErrorResponseDto(code, message, Map.of(), traceId);
    }
}
