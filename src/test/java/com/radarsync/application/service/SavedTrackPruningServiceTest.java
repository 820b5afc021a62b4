package com.radarsync.application.service;

import com.radarsync.application.port.MusicCatalogPort;
import com.radarsync.core.exception.ConfigurationException;
import com.radarsync.core.exception.RemoteFetchException;
import com.radarsync.core.exception.RemoteWriteException;
import com.radarsync.core.exception.ResourceNotFoundException;
import com.radarsync.core.model.CollectionDetails;
import com.radarsync.core.model.Track;
import com.radarsync.core.paging.Page;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SavedTrackPruningServiceTest {

    @Mock
    private MusicCatalogPort catalog;

    private SavedTrackPruningService service() {
        return new SavedTrackPruningService(catalog, new CollectionReader(catalog), FixedConfig.withChunkSize(100));
    }

    private static Track track(String id) {
        return new Track(id, "Title " + id, List.of(), "album", 180_000, null);
    }

    @Test
    void removesSavedTracksAcrossContainsBatches() {
        List<Track> tracks = IntStream.range(0, 60).mapToObj(i -> track("t" + i)).toList();
        List<String> ids = tracks.stream().map(Track::id).toList();
        when(catalog.fetchCollectionDetails("radar")).thenReturn(new CollectionDetails("radar", "Radar", "snap", 60));
        when(catalog.fetchCollectionItems("radar", null)).thenReturn(Page.last(tracks));
        when(catalog.containsSavedTracks(ids.subList(0, 50))).thenReturn(
                IntStream.range(0, 50).mapToObj(i -> i == 3).toList());
        when(catalog.containsSavedTracks(ids.subList(50, 60))).thenReturn(
                IntStream.range(50, 60).mapToObj(i -> i == 55).toList());

        List<String> removed = service().prune("radar");

        assertThat(removed).containsExactly("t3", "t55");
        verify(catalog).removeItems("radar", List.of("t3", "t55"));
    }

    @Test
    void nothingSavedMeansNoRemoval() {
        when(catalog.fetchCollectionDetails("radar")).thenReturn(new CollectionDetails("radar", "Radar", "snap", 1));
        when(catalog.fetchCollectionItems("radar", null)).thenReturn(Page.last(List.of(track("t1"))));
        when(catalog.containsSavedTracks(List.of("t1"))).thenReturn(List.of(false));

        assertThat(service().prune("radar")).isEmpty();
        verify(catalog, never()).removeItems(anyString(), anyList());
    }

    @Test
    void shortSavedStatusAnswerFailsInsteadOfGuessing() {
        when(catalog.fetchCollectionDetails("radar")).thenReturn(new CollectionDetails("radar", "Radar", "snap", 2));
        when(catalog.fetchCollectionItems("radar", null)).thenReturn(Page.last(List.of(track("t1"), track("t2"))));
        when(catalog.containsSavedTracks(List.of("t1", "t2"))).thenReturn(List.of(true));

        assertThatThrownBy(() -> service().prune("radar"))
                .isInstanceOf(RemoteFetchException.class)
                .hasMessageContaining("expected 2 flags but got 1");
        verify(catalog, never()).removeItems(anyString(), anyList());
    }

    @Test
    void collectionRemovedBeforeDeleteIsAWriteFailure() {
        when(catalog.fetchCollectionDetails("radar")).thenReturn(new CollectionDetails("radar", "Radar", "snap", 1));
        when(catalog.fetchCollectionItems("radar", null)).thenReturn(Page.last(List.of(track("t1"))));
        when(catalog.containsSavedTracks(List.of("t1"))).thenReturn(List.of(true));
        doThrow(new ResourceNotFoundException("radar")).when(catalog).removeItems("radar", List.of("t1"));

        assertThatThrownBy(() -> service().prune("radar"))
                .isInstanceOf(RemoteWriteException.class)
                .satisfies(e -> assertThat(((RemoteWriteException) e).getCollectionId()).isEqualTo("radar"));
    }

    @Test
    void stockCollectionIsRefused() {
        assertThatThrownBy(() -> service().prune(FixedConfig.STOCK))
                .isInstanceOf(ConfigurationException.class);
        verifyNoInteractions(catalog);
    }
}
