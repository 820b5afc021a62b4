package com.radarsync.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Domain value representing a single catalog track.
 * Every catalog representation (playlist item, album listing, full track) is
 * normalized into this one shape at the adapter boundary.
 * Pure domain object with no framework dependencies.
 */
public record Track(
        String id,
        String title,
        List<ArtistRef> artists,
        String albumId,
        long durationMs,
        String isrc
) {
    public Track {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(title, "title must not be null");
        artists = artists == null ? List.of() : List.copyOf(artists);
    }

    /**
     * @return the industry recording code, if the catalog supplied one
     */
    public Optional<String> catalogCode() {
        return isrc == null || isrc.isBlank() ? Optional.empty() : Optional.of(isrc);
    }

    /**
     * @return the first credited artist, if any
     */
    public Optional<ArtistRef> leadArtist() {
        return artists.isEmpty() ? Optional.empty() : Optional.of(artists.get(0));
    }
}
