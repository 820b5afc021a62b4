package com.radarsync.infrastructure.catalog.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SpotifyFollowedArtistsResponse(
        SpotifyPaging<SpotifyArtist> artists
) {}
