package com.radarsync.infrastructure.api.dto;

import java.util.List;

/**
 * Response DTO for a playlist comparison.
 */
public record MissingTracksResponse(
        String playlistId,
        String comparedWith,
        List<TrackResponse> missing,
        int missingCount
) {}
