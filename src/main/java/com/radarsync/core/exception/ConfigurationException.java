package com.radarsync.core.exception;

import com.radarsync.core.model.ReconciliationPhase;

/**
 * Domain exception thrown when the run is configured against a collection it must never write to,
 * or when configuration values are invalid. Never retried.
 */
public class ConfigurationException extends ReconciliationException {

    public ConfigurationException(ReconciliationPhase phase, String message) {
        super(phase, message);
    }

    public ConfigurationException(String message) {
        super(ReconciliationPhase.RESOLVING_COLLECTIONS, message);
    }
}
