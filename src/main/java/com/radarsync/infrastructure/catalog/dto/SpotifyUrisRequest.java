package com.radarsync.infrastructure.catalog.dto;

import java.util.List;

/**
 * Request body for replacing or adding playlist items.
 */
public record SpotifyUrisRequest(
        List<String> uris
) {}
