package com.radarsync.infrastructure.catalog.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Simplified album embedded in a track.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SpotifyAlbumRef(
        String id,
        String name
) {}
