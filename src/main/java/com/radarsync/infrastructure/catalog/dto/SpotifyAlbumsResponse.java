package com.radarsync.infrastructure.catalog.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Response of the several-albums endpoint. Unknown ids come back as null entries.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SpotifyAlbumsResponse(
        List<SpotifyAlbum> albums
) {}
