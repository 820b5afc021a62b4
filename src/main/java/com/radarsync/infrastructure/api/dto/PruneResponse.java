package com.radarsync.infrastructure.api.dto;

import java.util.List;

public record PruneResponse(
        String playlistId,
        List<String> removedTrackIds,
        int removedCount
) {}
