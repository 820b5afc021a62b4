package com.radarsync.application.service;

import com.radarsync.application.port.MusicCatalogPort;
import com.radarsync.core.fingerprint.FingerprintDiffer;
import com.radarsync.core.fingerprint.FingerprintEngine;
import com.radarsync.core.model.ArtistRef;
import com.radarsync.core.model.CollectionDetails;
import com.radarsync.core.model.Track;
import com.radarsync.core.paging.Page;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PlaylistComparisonServiceTest {

    @Mock
    private MusicCatalogPort catalog;

    private static Track track(String id, String title, String isrc) {
        return new Track(id, title, List.of(new ArtistRef("a1", "Artist")), "album", 180_000, isrc);
    }

    private void givenCollection(String id, List<Track> tracks) {
        when(catalog.fetchCollectionDetails(id)).thenReturn(new CollectionDetails(id, id, "snap", tracks.size()));
        when(catalog.fetchCollectionItems(id, null)).thenReturn(Page.last(tracks));
    }

    @Test
    void reportsRecordingsTheOtherCollectionLacks() {
        givenCollection("a", List.of(
                track("a1", "One", "CODE1"),
                track("a2", "Two", "CODE2"),
                track("a3", "Three", null)));
        givenCollection("b", List.of(
                track("b1", "One (Remastered)", "CODE1"),
                track("b2", "Three", null)));

        PlaylistComparisonService service = new PlaylistComparisonService(
                new CollectionReader(catalog), new FingerprintEngine(), new FingerprintDiffer());
        PlaylistComparisonService.ComparisonResult result = service.missingFrom("a", "b");

        assertThat(result.referenceCollectionId()).isEqualTo("a");
        assertThat(result.otherCollectionId()).isEqualTo("b");
        assertThat(result.missingTracks()).extracting(Track::id).containsExactly("a2");
    }
}
