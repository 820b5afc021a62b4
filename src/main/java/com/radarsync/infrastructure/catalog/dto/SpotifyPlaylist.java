package com.radarsync.infrastructure.catalog.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Playlist metadata, requested with a field filter so no items are included.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SpotifyPlaylist(
        String id,
        String name,
        @JsonProperty("snapshot_id") String snapshotId,
        SpotifyPaging<Object> tracks
) {}
