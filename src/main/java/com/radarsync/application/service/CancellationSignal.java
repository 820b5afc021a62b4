package com.radarsync.application.service;

import com.radarsync.core.exception.ReconciliationCancelledException;
import com.radarsync.core.model.ReconciliationPhase;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Caller-owned cancellation flag, checked by long-running services between remote calls.
 */
public final class CancellationSignal {

    private static final CancellationSignal NONE = new CancellationSignal();

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static CancellationSignal create() {
        return new CancellationSignal();
    }

    /**
     * A signal nobody holds; it is never cancelled.
     */
    public static CancellationSignal none() {
        return NONE;
    }

    public void cancel() {
        if (this == NONE) {
            throw new UnsupportedOperationException("The shared no-op signal cannot be cancelled");
        }
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled(ReconciliationPhase phase) {
        if (cancelled.get()) {
            throw new ReconciliationCancelledException(phase);
        }
    }
}
