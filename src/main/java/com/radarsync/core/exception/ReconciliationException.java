package com.radarsync.core.exception;

import com.radarsync.core.model.ReconciliationPhase;

/**
 * Base class for failures of a reconciliation run.
 * Carries the phase the run was in when it failed.
 */
public abstract class ReconciliationException extends RuntimeException {

    private final ReconciliationPhase phase;

    protected ReconciliationException(ReconciliationPhase phase, String message) {
        super(message);
        this.phase = phase;
    }

    protected ReconciliationException(ReconciliationPhase phase, String message, Throwable cause) {
        super(message, cause);
        this.phase = phase;
    }

    public ReconciliationPhase getPhase() {
        return phase;
    }
}
