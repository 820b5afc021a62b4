package com.radarsync.application.port;

import com.radarsync.core.model.ArtistRef;

/**
 * Read-only membership check against the artist blacklist.
 */
public interface BlacklistStore {

    /**
     * @param artist the artist to check; matched by catalog id, or by normalized name when the id is missing
     * @return true if the artist is blacklisted
     */
    boolean contains(ArtistRef artist);
}
