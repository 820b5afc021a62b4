package com.radarsync.infrastructure.api.dto;

import java.util.List;

/**
 * Response DTO summarizing a finished reconciliation run.
 */
public record ReconciliationResponse(
        String referencePlaylistId,
        String targetPlaylistId,
        int referenceTrackCount,
        int albumCount,
        int candidateCount,
        int filteredCount,
        int duplicatesDropped,
        List<String> writtenTrackIds,
        int chunksWritten,
        int wipedCount,
        String phase
) {}
