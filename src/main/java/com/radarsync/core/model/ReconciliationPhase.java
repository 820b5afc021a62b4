package com.radarsync.core.model;

/**
 * States of a single reconciliation run, in execution order.
 * {@link #FAILED} is reachable from every other state.
 */
public enum ReconciliationPhase {
    RESOLVING_COLLECTIONS,
    EXPANDING_ALBUMS,
    FILTERING,
    DIFFING,
    WRITING_CHUNKS,
    WIPING_SOURCE,
    DONE,
    FAILED
}
