package com.radarsync.core.model;

import java.util.List;

/**
 * Summary of a completed reconciliation run.
 */
public record ReconciliationResult(
        String referenceCollectionId,
        String targetCollectionId,
        int referenceTrackCount,
        int albumCount,
        int candidateCount,
        int filteredCount,
        int duplicatesDropped,
        List<String> writtenTrackIds,
        int chunksWritten,
        int wipedCount,
        ReconciliationPhase finalPhase
) {
    public ReconciliationResult {
        writtenTrackIds = List.copyOf(writtenTrackIds);
    }
}
