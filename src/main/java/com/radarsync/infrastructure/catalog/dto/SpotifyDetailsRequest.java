package com.radarsync.infrastructure.catalog.dto;

/**
 * Request body for changing playlist details.
 */
public record SpotifyDetailsRequest(
        String description
) {}
