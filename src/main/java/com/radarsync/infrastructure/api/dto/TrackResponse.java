package com.radarsync.infrastructure.api.dto;

import java.util.List;

/**
 * Response DTO for a single track.
 */
public record TrackResponse(
        String id,
        String title,
        List<String> artists,
        String albumId,
        long durationMs,
        String isrc
) {}
