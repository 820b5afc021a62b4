package com.radarsync.application.service;

import com.radarsync.application.port.MusicCatalogPort;
import com.radarsync.core.exception.CatalogException;
import com.radarsync.core.exception.RemoteFetchException;
import com.radarsync.core.model.ArtistRef;
import com.radarsync.core.model.Track;
import com.radarsync.core.paging.Page;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class UserLibraryServiceTest {

    @Mock
    private MusicCatalogPort catalog;

    @Test
    void walksFollowedArtistPages() {
        when(catalog.fetchFollowedArtists(null)).thenReturn(Page.of(List.of(new ArtistRef("1", "One")), "after-1"));
        when(catalog.fetchFollowedArtists("after-1")).thenReturn(Page.last(List.of(new ArtistRef("2", "Two"))));

        List<ArtistRef> artists = new UserLibraryService(catalog).followedArtists();

        assertThat(artists).extracting(ArtistRef::name).containsExactly("One", "Two");
    }

    @Test
    void walksSavedTrackPages() {
        Track track = new Track("t1", "Song", List.of(), "album", 1000, null);
        when(catalog.fetchSavedTracks(null)).thenReturn(Page.last(List.of(track)));

        assertThat(new UserLibraryService(catalog).savedTracks()).containsExactly(track);
    }

    @Test
    void listingFailureIsWrapped() {
        when(catalog.fetchSavedTracks(null)).thenThrow(new CatalogException("fetchSavedTracks", "HTTP 401"));

        assertThatThrownBy(() -> new UserLibraryService(catalog).savedTracks())
                .isInstanceOf(RemoteFetchException.class)
                .hasMessageContaining("saved tracks");
    }
}
