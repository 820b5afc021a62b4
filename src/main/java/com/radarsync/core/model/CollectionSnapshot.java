package com.radarsync.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Point-in-time view of a remote collection with full track metadata.
 */
public record CollectionSnapshot(
        String id,
        String name,
        String snapshotId,
        List<Track> tracks
) {
    public CollectionSnapshot {
        Objects.requireNonNull(id, "id must not be null");
        tracks = tracks == null ? List.of() : List.copyOf(tracks);
    }

    public List<String> trackIds() {
        return tracks.stream().map(Track::id).toList();
    }

    public int size() {
        return tracks.size();
    }
}
