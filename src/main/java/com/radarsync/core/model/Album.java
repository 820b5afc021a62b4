package com.radarsync.core.model;

import java.util.List;
import java.util.Objects;

/**
 * An album with the first page of its track listing.
 * {@code tracksNextCursor} is set when the listing continues on further pages.
 */
public record Album(
        String id,
        String name,
        List<Track> tracks,
        String tracksNextCursor
) {
    public Album {
        Objects.requireNonNull(id, "id must not be null");
        tracks = tracks == null ? List.of() : List.copyOf(tracks);
    }

    public boolean hasMoreTracks() {
        return tracksNextCursor != null;
    }
}
