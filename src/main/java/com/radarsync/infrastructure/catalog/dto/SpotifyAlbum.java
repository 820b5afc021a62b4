package com.radarsync.infrastructure.catalog.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Full album with the first page of its track listing.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SpotifyAlbum(
        String id,
        String name,
        SpotifyPaging<SpotifyTrack> tracks
) {}
