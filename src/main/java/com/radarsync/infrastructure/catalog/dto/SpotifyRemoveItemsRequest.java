package com.radarsync.infrastructure.catalog.dto;

import java.util.List;

/**
 * Request body for removing every occurrence of the given items.
 */
public record SpotifyRemoveItemsRequest(
        List<Item> tracks
) {
    public record Item(String uri) {}
}
