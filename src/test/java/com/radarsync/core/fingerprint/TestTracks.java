package com.radarsync.core.fingerprint;

import com.radarsync.core.model.ArtistRef;
import com.radarsync.core.model.Track;

import java.util.Arrays;

/**
 * Track builders shared by the fingerprint tests.
 */
final class TestTracks {

    private TestTracks() {
    }

    static Track track(String id, String title, String isrc, long durationMs, String... artists) {
        return new Track(id, title,
                Arrays.stream(artists).map(name -> new ArtistRef("id-" + name, name)).toList(),
                "album-1", durationMs, isrc);
    }
}
