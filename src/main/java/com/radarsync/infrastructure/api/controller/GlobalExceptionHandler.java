package com.radarsync.infrastructure.api.controller;

import com.radarsync.core.exception.ConfigurationException;
import com.radarsync.core.exception.InvalidBatchSizeException;
import com.radarsync.core.exception.ReconciliationCancelledException;
import com.radarsync.core.exception.ReconciliationException;
import com.radarsync.core.exception.RemoteFetchException;
import com.radarsync.core.exception.RemoteWriteException;
import com.radarsync.core.exception.ResourceNotFoundException;
import com.radarsync.infrastructure.api.dto.ErrorResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * Global exception handler for REST API.
 * Failures of a run carry the phase they happened in.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<ErrorResponse> handleConfiguration(ConfigurationException ex) {
        return failure(HttpStatus.UNPROCESSABLE_ENTITY, "CONFIGURATION_ERROR", ex);
    }

    @ExceptionHandler(RemoteFetchException.class)
    public ResponseEntity<ErrorResponse> handleRemoteFetch(RemoteFetchException ex) {
        if (ex.getCause() instanceof ResourceNotFoundException notFound) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(new ErrorResponse("NOT_FOUND", notFound.getMessage(), ex.getPhase().name()));
        }
        return failure(HttpStatus.BAD_GATEWAY, "REMOTE_FETCH_FAILED", ex);
    }

    @ExceptionHandler(RemoteWriteException.class)
    public ResponseEntity<ErrorResponse> handleRemoteWrite(RemoteWriteException ex) {
        return failure(HttpStatus.BAD_GATEWAY, "REMOTE_WRITE_FAILED", ex);
    }

    @ExceptionHandler(ReconciliationCancelledException.class)
    public ResponseEntity<ErrorResponse> handleCancelled(ReconciliationCancelledException ex) {
        return failure(HttpStatus.CONFLICT, "CANCELLED", ex);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(ResourceNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse("NOT_FOUND", ex.getMessage()));
    }

    @ExceptionHandler(InvalidBatchSizeException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBatchSize(InvalidBatchSizeException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("INVALID_BATCH_SIZE", ex.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("INVALID_REQUEST", ex.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("VALIDATION_ERROR", message));
    }

    private static ResponseEntity<ErrorResponse> failure(HttpStatus status, String errorCode, ReconciliationException ex) {
        return ResponseEntity.status(status)
                .body(new ErrorResponse(errorCode, ex.getMessage(), ex.getPhase().name()));
    }
}
