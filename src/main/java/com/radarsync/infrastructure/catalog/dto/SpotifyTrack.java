package com.radarsync.infrastructure.catalog.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Track object, full or simplified. Simplified tracks (album listings) carry no album
 * and no external ids. Playlist items may also hold episodes in this shape.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SpotifyTrack(
        String id,
        String name,
        String type,
        @JsonProperty("duration_ms") long durationMs,
        List<SpotifyArtist> artists,
        SpotifyAlbumRef album,
        @JsonProperty("external_ids") Map<String, String> externalIds,
        @JsonProperty("is_local") boolean local
) {}
