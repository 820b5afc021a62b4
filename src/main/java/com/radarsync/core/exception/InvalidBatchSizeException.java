package com.radarsync.core.exception;

/**
 * Thrown when a batch of identifiers is empty or exceeds the ceiling of its remote operation.
 */
public class InvalidBatchSizeException extends RuntimeException {

    private final int requestedSize;

    public InvalidBatchSizeException(int requestedSize, String message) {
        super(message);
        this.requestedSize = requestedSize;
    }

    public int getRequestedSize() {
        return requestedSize;
    }
}
