package com.radarsync.core.exception;

/**
 * Raised by catalog adapters when a remote call fails or returns an unreadable body.
 */
public class CatalogException extends RuntimeException {

    private final String operation;

    public CatalogException(String operation, String message, Throwable cause) {
        super(operation + ": " + message, cause);
        this.operation = operation;
    }

    public CatalogException(String operation, String message) {
        super(operation + ": " + message);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
