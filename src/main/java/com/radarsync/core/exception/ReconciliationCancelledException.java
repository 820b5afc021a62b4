package com.radarsync.core.exception;

import com.radarsync.core.model.ReconciliationPhase;

/**
 * Thrown when the caller cancels a run between two remote calls.
 */
public class ReconciliationCancelledException extends ReconciliationException {

    public ReconciliationCancelledException(ReconciliationPhase phase) {
        super(phase, "Reconciliation cancelled during " + phase);
    }
}
