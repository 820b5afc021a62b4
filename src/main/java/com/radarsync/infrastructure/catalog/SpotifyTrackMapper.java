package com.radarsync.infrastructure.catalog;

import com.radarsync.core.model.Album;
import com.radarsync.core.model.ArtistRef;
import com.radarsync.core.model.Track;
import com.radarsync.infrastructure.catalog.dto.SpotifyAlbum;
import com.radarsync.infrastructure.catalog.dto.SpotifyArtist;
import com.radarsync.infrastructure.catalog.dto.SpotifyTrack;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Maps catalog track shapes onto the single {@link Track} value the core works with.
 */
@Component
public class SpotifyTrackMapper {

    static final String TRACK_URI_PREFIX = "spotify:track:";

    /**
     * @param track          a full or simplified catalog track
     * @param fallbackAlbumId album id to use when the track object has no album (album listings)
     * @return the mapped track, or empty for episodes, local files and unlinked items
     */
    public Optional<Track> toTrack(SpotifyTrack track, String fallbackAlbumId) {
        if (track == null || track.id() == null || track.local()) {
            return Optional.empty();
        }
        if (track.type() != null && !"track".equals(track.type())) {
            return Optional.empty();
        }
        String albumId = track.album() != null && track.album().id() != null ? track.album().id() : fallbackAlbumId;
        String isrc = track.externalIds() == null ? null : track.externalIds().get("isrc");

        return Optional.of(new Track(
                track.id(),
                track.name() == null ? "" : track.name(),
                toArtists(track.artists()),
                albumId,
                track.durationMs(),
                isrc
        ));
    }

    public List<Track> toTracks(List<SpotifyTrack> tracks, String fallbackAlbumId) {
        if (tracks == null) {
            return List.of();
        }
        return tracks.stream()
                .map(track -> toTrack(track, fallbackAlbumId))
                .flatMap(Optional::stream)
                .toList();
    }

    public Album toAlbum(SpotifyAlbum album) {
        List<Track> tracks = album.tracks() == null ? List.of() : toTracks(album.tracks().items(), album.id());
        String next = album.tracks() == null ? null : album.tracks().next();
        return new Album(album.id(), album.name(), tracks, next);
    }

    public List<ArtistRef> toArtists(List<SpotifyArtist> artists) {
        if (artists == null) {
            return List.of();
        }
        return artists.stream()
                .filter(Objects::nonNull)
                .map(artist -> new ArtistRef(artist.id(), artist.name() == null ? "" : artist.name()))
                .toList();
    }

    public String toUri(String trackId) {
        return trackId.startsWith(TRACK_URI_PREFIX) ? trackId : TRACK_URI_PREFIX + trackId;
    }

    public List<String> toUris(List<String> trackIds) {
        return trackIds.stream().map(this::toUri).toList();
    }
}
