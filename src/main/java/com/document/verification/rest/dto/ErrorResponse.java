package com.document.verification.rest.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

/**
 * Standardized error response DTO.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        int status,
        String error,
        String message,
        String path,
        Instant timestamp,
        Map<String, String> details
) {
    public ErrorResponse(int status, String error, String message, String path) {
        this(status, error, message, path, Instant.now(), null);
    }

    public ErrorResponse(int status, String error, String message, String path,
                         Map<String, String> details) {
        this(status, error, message, path, Instant.now(), details);
    }

    public static ErrorResponse badRequest(String message, String path) {
        return new ErrorResponse(400, "Bad Request", message, path);
    }

    /**
     * Bad request tied to one item of a batch, identified by its position.
     */
    public static ErrorResponse badRequest(String message, String path, int index) {
        return new ErrorResponse(400, "Bad Request", message, path, Map.of("index", String.valueOf(index)));
    }

    public static ErrorResponse internalError(String message, String path) {
        return new ErrorResponse(500, "Internal Server Error", message, path);
    }

    public static ErrorResponse internalError(String message, String path, int index) {
        return new ErrorResponse(500, "Internal Server Error", message, path, Map.of("index", String.valueOf(index)));
    }
}
