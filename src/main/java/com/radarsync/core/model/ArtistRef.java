package com.radarsync.core.model;

import java.util.Objects;

/**
 * A credited artist as the catalog reports it.
 * The catalog id may be missing for local or unlinked artists.
 */
public record ArtistRef(
        String id,
        String name
) {
    public ArtistRef {
        Objects.requireNonNull(name, "name must not be null");
    }

    public boolean hasId() {
        return id != null && !id.isBlank();
    }
}
