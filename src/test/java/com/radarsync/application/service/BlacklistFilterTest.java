package com.radarsync.application.service;

import com.radarsync.application.port.BlacklistStore;
import com.radarsync.core.model.ArtistRef;
import com.radarsync.core.model.Track;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BlacklistFilterTest {

    private static final ArtistRef BANNED = new ArtistRef("banned-id", "Banned");
    private static final ArtistRef ALLOWED = new ArtistRef("allowed-id", "Allowed");

    private final BlacklistStore store = artist -> "banned-id".equals(artist.id());
    private final BlacklistFilter filter = new BlacklistFilter(store);

    private static Track track(String id, ArtistRef... artists) {
        return new Track(id, "Title " + id, List.of(artists), "album", 180_000, "CODE" + id);
    }

    @Test
    void dropsTracksLedByBlacklistedArtistsAndKeepsOrder() {
        List<Track> kept = filter.apply(List.of(
                track("1", ALLOWED),
                track("2", BANNED),
                track("3", ALLOWED),
                track("4", BANNED, ALLOWED)
        ));

        assertThat(kept).extracting(Track::id).containsExactly("1", "3");
    }

    @Test
    void featuredBlacklistedArtistDoesNotExclude() {
        assertThat(filter.isExcluded(track("1", ALLOWED, BANNED))).isFalse();
    }

    @Test
    void tracksWithoutArtistsAreKept() {
        assertThat(filter.apply(List.of(track("1")))).hasSize(1);
    }

    @Test
    void emptyInputGivesEmptyOutput() {
        assertThat(filter.apply(List.of())).isEmpty();
    }
}
