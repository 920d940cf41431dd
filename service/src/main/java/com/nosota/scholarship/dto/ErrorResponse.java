package com.nosota.scholarship.dto;

import org.slf4j.MDC;

import java.time.LocalDateTime;

/**
 * Error body returned by every failed request.
 *
 * @param code Machine readable error code, e.g. ALREADY_PROCESSED
 */
public record ErrorResponse(
        LocalDateTime timestamp,
        int status,
        String error,
        String code,
        String message,
        String path,
        String correlationId
) {

    public static ErrorResponse of(int status, String error, String code, String message, String path) {
        return new ErrorResponse(LocalDateTime.now(), status, error, code, message, path, MDC.get("correlationId"));
    }
}
