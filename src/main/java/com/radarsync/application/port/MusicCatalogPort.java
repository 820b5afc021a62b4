package com.radarsync.application.port;

import com.radarsync.core.model.Album;
import com.radarsync.core.model.ArtistRef;
import com.radarsync.core.model.CollectionDetails;
import com.radarsync.core.model.Track;
import com.radarsync.core.paging.Page;

import java.util.List;

/**
 * Remote music catalog and playlist service. The catalog API plugs in here.
 * Port interface for every remote read and write the application performs.
 * Batch methods accept at most the number of ids allowed by
 * {@link com.radarsync.core.batch.BatchLimits} for their operation kind.
 * Implementations report failures with {@link com.radarsync.core.exception.CatalogException}.
 */
public interface MusicCatalogPort {

    /**
     * Reads collection metadata without its items.
     *
     * @param collectionId the collection identifier
     * @return the collection details
     */
    CollectionDetails fetchCollectionDetails(String collectionId);

    /**
     * Reads one page of a collection's items. Non-track items are skipped.
     *
     * @param collectionId the collection identifier
     * @param cursor       null for the first page, otherwise the cursor of the previous page
     * @return the page of tracks
     */
    Page<Track> fetchCollectionItems(String collectionId, String cursor);

    /**
     * Reads full albums with the first page of each track listing.
     *
     * @param albumIds at most {@code ALBUM_BATCH_READ} album ids
     * @return albums in request order
     */
    List<Album> fetchAlbums(List<String> albumIds);

    /**
     * Reads a further page of an album's track listing.
     *
     * @param albumId the album identifier
     * @param cursor  the cursor reported by the previous page
     * @return the page of album tracks
     */
    Page<Track> fetchAlbumTracks(String albumId, String cursor);

    /**
     * Reads full track metadata, including catalog codes.
     *
     * @param trackIds at most {@code TRACK_BATCH_READ} track ids
     * @return tracks in request order; unknown ids are omitted
     */
    List<Track> fetchTracks(List<String> trackIds);

    /**
     * Reads one page of the current user's followed artists.
     */
    Page<ArtistRef> fetchFollowedArtists(String cursor);

    /**
     * Reads one page of the current user's saved tracks.
     */
    Page<Track> fetchSavedTracks(String cursor);

    /**
     * Checks which tracks the current user has saved.
     *
     * @param trackIds at most {@code SAVED_TRACKS_CONTAINS} track ids
     * @return one flag per requested id, in request order
     */
    List<Boolean> containsSavedTracks(List<String> trackIds);

    /**
     * Replaces the description of a collection.
     */
    void changeDescription(String collectionId, String description);

    /**
     * Replaces every item of a collection with the given tracks.
     *
     * @param trackIds at most {@code PLAYLIST_ITEM_WRITE} track ids
     */
    void replaceItems(String collectionId, List<String> trackIds);

    /**
     * Appends tracks to the end of a collection.
     *
     * @param trackIds at most {@code PLAYLIST_ITEM_WRITE} track ids
     */
    void addItems(String collectionId, List<String> trackIds);

    /**
     * Removes every occurrence of the given tracks from a collection.
     *
     * @param trackIds at most {@code PLAYLIST_ITEM_REMOVE} track ids
     */
    void removeItems(String collectionId, List<String> trackIds);
}
