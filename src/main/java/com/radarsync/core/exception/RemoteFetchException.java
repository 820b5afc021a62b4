package com.radarsync.core.exception;

import com.radarsync.core.model.ReconciliationPhase;

/**
 * Domain exception thrown when a paginated or batch read against the catalog fails.
 */
public class RemoteFetchException extends ReconciliationException {

    private final String identifier;

    public RemoteFetchException(ReconciliationPhase phase, String identifier, Throwable cause) {
        super(phase, "Failed to read " + identifier + " during " + phase, cause);
        this.identifier = identifier;
    }

    public RemoteFetchException(ReconciliationPhase phase, String identifier, String detail) {
        super(phase, "Failed to read " + identifier + " during " + phase + ": " + detail);
        this.identifier = identifier;
    }

    public String getIdentifier() {
        return identifier;
    }
}
