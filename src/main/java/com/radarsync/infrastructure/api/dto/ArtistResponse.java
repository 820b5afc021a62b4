package com.radarsync.infrastructure.api.dto;

public record ArtistResponse(
        String id,
        String name
) {}
