package com.radarsync.infrastructure.api.dto;

/**
 * Response DTO for error responses.
 * {@code phase} is set only for failures of a reconciliation run.
 */
public record ErrorResponse(
        String errorCode,
        String message,
        String phase
) {
    public ErrorResponse(String errorCode, String message) {
        this(errorCode, message, null);
    }
}
