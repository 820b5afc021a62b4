package com.radarsync.integration;

import com.radarsync.application.port.MusicCatalogPort;
import com.radarsync.core.batch.BatchLimits;
import com.radarsync.core.batch.OperationKind;
import com.radarsync.core.exception.ResourceNotFoundException;
import com.radarsync.core.model.Album;
import com.radarsync.core.model.ArtistRef;
import com.radarsync.core.model.CollectionDetails;
import com.radarsync.core.model.Track;
import com.radarsync.core.paging.Page;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Catalog fake holding playlists, albums and the saved-track library in memory.
 * Listings are served two items per page so every walk crosses a page boundary.
 */
class InMemoryCatalog implements MusicCatalogPort {

    static final int PAGE_SIZE = 2;

    private final Map<String, List<Track>> playlists = new LinkedHashMap<>();
    private final Map<String, String> descriptions = new HashMap<>();
    private final Map<String, List<String>> albums = new HashMap<>();
    private final Map<String, Track> tracks = new HashMap<>();
    private final Set<String> saved = new HashSet<>();
    private final List<ArtistRef> followed = new ArrayList<>();
    private final List<String> writeLog = new ArrayList<>();

    synchronized void reset() {
        playlists.clear();
        descriptions.clear();
        albums.clear();
        tracks.clear();
        saved.clear();
        followed.clear();
        writeLog.clear();
    }

    synchronized void addTrack(Track track) {
        tracks.put(track.id(), track);
        albums.computeIfAbsent(track.albumId(), id -> new ArrayList<>()).add(track.id());
    }

    synchronized void addPlaylist(String id, List<String> trackIds) {
        playlists.put(id, new ArrayList<>(trackIds.stream().map(tracks::get).toList()));
    }

    synchronized void save(String trackId) {
        saved.add(trackId);
    }

    synchronized void follow(ArtistRef artist) {
        followed.add(artist);
    }

    synchronized List<String> playlistTrackIds(String id) {
        return playlist(id).stream().map(Track::id).toList();
    }

    synchronized String description(String id) {
        return descriptions.get(id);
    }

    synchronized List<String> writeLog() {
        return List.copyOf(writeLog);
    }

    private List<Track> playlist(String id) {
        List<Track> playlist = playlists.get(id);
        if (playlist == null) {
            throw new ResourceNotFoundException(id);
        }
        return playlist;
    }

    private static <T> Page<T> page(List<T> items, String cursor) {
        int offset = cursor == null ? 0 : Integer.parseInt(cursor);
        int end = Math.min(offset + PAGE_SIZE, items.size());
        List<T> slice = offset >= items.size() ? List.of() : items.subList(offset, end);
        return Page.of(slice, end < items.size() ? String.valueOf(end) : null);
    }

    /** Album listings carry ids only, like the catalog's simplified tracks. */
    private List<Track> listing(String albumId) {
        return albums.getOrDefault(albumId, List.of()).stream()
                .map(id -> new Track(id, tracks.get(id).title(), tracks.get(id).artists(), albumId, 0, null))
                .toList();
    }

    @Override
    public synchronized CollectionDetails fetchCollectionDetails(String collectionId) {
        return new CollectionDetails(collectionId, "Playlist " + collectionId, "snap-" + writeLog.size(),
                playlist(collectionId).size());
    }

    @Override
    public synchronized Page<Track> fetchCollectionItems(String collectionId, String cursor) {
        return page(List.copyOf(playlist(collectionId)), cursor);
    }

    @Override
    public synchronized List<Album> fetchAlbums(List<String> albumIds) {
        BatchLimits.requireValid(OperationKind.ALBUM_BATCH_READ, albumIds.size());
        return albumIds.stream()
                .filter(albums::containsKey)
                .map(id -> {
                    Page<Track> first = page(listing(id), null);
                    return new Album(id, "Album " + id, first.items(), first.nextCursor());
                })
                .toList();
    }

    @Override
    public synchronized Page<Track> fetchAlbumTracks(String albumId, String cursor) {
        return page(listing(albumId), cursor);
    }

    @Override
    public synchronized List<Track> fetchTracks(List<String> trackIds) {
        BatchLimits.requireValid(OperationKind.TRACK_BATCH_READ, trackIds.size());
        return trackIds.stream().map(tracks::get).toList();
    }

    @Override
    public synchronized Page<ArtistRef> fetchFollowedArtists(String cursor) {
        return page(List.copyOf(followed), cursor);
    }

    @Override
    public synchronized Page<Track> fetchSavedTracks(String cursor) {
        return page(saved.stream().sorted().map(tracks::get).toList(), cursor);
    }

    @Override
    public synchronized List<Boolean> containsSavedTracks(List<String> trackIds) {
        BatchLimits.requireValid(OperationKind.SAVED_TRACKS_CONTAINS, trackIds.size());
        return trackIds.stream().map(saved::contains).toList();
    }

    @Override
    public synchronized void changeDescription(String collectionId, String description) {
        playlist(collectionId);
        descriptions.put(collectionId, description);
        writeLog.add("describe " + collectionId);
    }

    @Override
    public synchronized void replaceItems(String collectionId, List<String> trackIds) {
        BatchLimits.requireValid(OperationKind.PLAYLIST_ITEM_WRITE, trackIds.size());
        List<Track> playlist = playlist(collectionId);
        playlist.clear();
        trackIds.forEach(id -> playlist.add(tracks.get(id)));
        writeLog.add("replace " + collectionId + " " + trackIds);
    }

    @Override
    public synchronized void addItems(String collectionId, List<String> trackIds) {
        BatchLimits.requireValid(OperationKind.PLAYLIST_ITEM_WRITE, trackIds.size());
        List<Track> playlist = playlist(collectionId);
        trackIds.forEach(id -> playlist.add(tracks.get(id)));
        writeLog.add("add " + collectionId + " " + trackIds);
    }

    @Override
    public synchronized void removeItems(String collectionId, List<String> trackIds) {
        BatchLimits.requireValid(OperationKind.PLAYLIST_ITEM_REMOVE, trackIds.size());
        playlist(collectionId).removeIf(track -> trackIds.contains(track.id()));
        writeLog.add("remove " + collectionId + " " + trackIds);
    }
}
