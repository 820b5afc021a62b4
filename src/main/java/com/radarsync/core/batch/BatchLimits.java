package com.radarsync.core.batch;

import com.radarsync.core.exception.InvalidBatchSizeException;

/**
 * Per-operation batch ceilings of the remote catalog.
 */
public final class BatchLimits {

    private BatchLimits() {
    }

    /**
     * @param kind the remote operation
     * @return the maximum number of identifiers one call accepts
     * @throws IllegalArgumentException if {@code kind} is null
     */
    public static int limitFor(OperationKind kind) {
        if (kind == null) {
            throw new IllegalArgumentException("Operation kind must not be null");
        }
        return kind.limit();
    }

    /**
     * A batch is valid when it holds at least one and at most {@link #limitFor} identifiers.
     */
    public static boolean isValid(OperationKind kind, Integer count) {
        if (count == null) {
            return false;
        }
        return count >= 1 && count <= limitFor(kind);
    }

    public static void requireValid(OperationKind kind, int count) {
        if (!isValid(kind, count)) {
            throw new InvalidBatchSizeException(count, "Batch of " + count + " is invalid for " + kind
                    + ". Valid range is 1 to " + limitFor(kind));
        }
    }
}
