package com.radarsync.infrastructure.catalog;

import com.radarsync.application.port.MusicCatalogPort;
import com.radarsync.core.batch.BatchLimits;
import com.radarsync.core.batch.OperationKind;
import com.radarsync.core.exception.CatalogException;
import com.radarsync.core.exception.ResourceNotFoundException;
import com.radarsync.core.model.Album;
import com.radarsync.core.model.ArtistRef;
import com.radarsync.core.model.CollectionDetails;
import com.radarsync.core.model.Track;
import com.radarsync.core.paging.Page;
import com.radarsync.infrastructure.catalog.dto.SpotifyAlbumsResponse;
import com.radarsync.infrastructure.catalog.dto.SpotifyDetailsRequest;
import com.radarsync.infrastructure.catalog.dto.SpotifyFollowedArtistsResponse;
import com.radarsync.infrastructure.catalog.dto.SpotifyPaging;
import com.radarsync.infrastructure.catalog.dto.SpotifyPlaylist;
import com.radarsync.infrastructure.catalog.dto.SpotifyPlaylistItem;
import com.radarsync.infrastructure.catalog.dto.SpotifyRemoveItemsRequest;
import com.radarsync.infrastructure.catalog.dto.SpotifySavedTrack;
import com.radarsync.infrastructure.catalog.dto.SpotifyTrack;
import com.radarsync.infrastructure.catalog.dto.SpotifyTracksResponse;
import com.radarsync.infrastructure.catalog.dto.SpotifyUrisRequest;
import com.radarsync.infrastructure.config.RadarProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.util.UriBuilder;

import java.net.URI;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Catalog port implementation over the Spotify Web API.
 * Cursors are the absolute {@code next} URLs returned by the API.
 */
@Component
public class SpotifyCatalogAdapter implements MusicCatalogPort {

    private static final Logger log = LoggerFactory.getLogger(SpotifyCatalogAdapter.class);

    private static final int PLAYLIST_PAGE_SIZE = 100;
    private static final String PLAYLIST_DETAIL_FIELDS = "id,name,snapshot_id,tracks.total";

    private final RestClient restClient;
    private final SpotifyTrackMapper mapper;
    private final String market;

    public SpotifyCatalogAdapter(RestClient.Builder restClientBuilder, RadarProperties properties,
                                 SpotifyTrackMapper mapper) {
        RadarProperties.Catalog catalog = properties.getCatalog();
        RestClient.Builder builder = restClientBuilder
                .baseUrl(catalog.getBaseUrl())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        if (catalog.getAccessToken() != null && !catalog.getAccessToken().isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + catalog.getAccessToken());
        }
        this.restClient = builder.build();
        this.mapper = mapper;
        this.market = catalog.getMarket();
    }

    @Override
    public CollectionDetails fetchCollectionDetails(String collectionId) {
        SpotifyPlaylist playlist = call("fetchCollectionDetails", collectionId, () -> restClient.get()
                .uri(uri -> uri.path("/playlists/{id}")
                        .queryParam("fields", PLAYLIST_DETAIL_FIELDS)
                        .queryParam("market", market)
                        .build(collectionId))
                .retrieve()
                .body(SpotifyPlaylist.class));
        requireBody("fetchCollectionDetails", collectionId, playlist);

        int total = playlist.tracks() == null || playlist.tracks().total() == null ? 0 : playlist.tracks().total();
        return new CollectionDetails(collectionId, playlist.name(), playlist.snapshotId(), total);
    }

    @Override
    public Page<Track> fetchCollectionItems(String collectionId, String cursor) {
        SpotifyPaging<SpotifyPlaylistItem> page = call("fetchCollectionItems", collectionId, () -> listing(cursor,
                uri -> uri.path("/playlists/{id}/tracks")
                        .queryParam("limit", PLAYLIST_PAGE_SIZE)
                        .queryParam("market", market)
                        .build(collectionId))
                .retrieve()
                .body(new ParameterizedTypeReference<SpotifyPaging<SpotifyPlaylistItem>>() {}));
        requireBody("fetchCollectionItems", collectionId, page);

        List<Track> tracks = page.items() == null ? List.of() : page.items().stream()
                .filter(Objects::nonNull)
                .map(item -> mapper.toTrack(item.track(), null))
                .flatMap(Optional::stream)
                .toList();
        log.debug("Fetched {} tracks from collection {} (next: {})", tracks.size(), collectionId, page.next());
        return Page.of(tracks, page.next());
    }

    @Override
    public List<Album> fetchAlbums(List<String> albumIds) {
        BatchLimits.requireValid(OperationKind.ALBUM_BATCH_READ, albumIds.size());
        SpotifyAlbumsResponse response = call("fetchAlbums", albumIds.toString(), () -> restClient.get()
                .uri(uri -> uri.path("/albums")
                        .queryParam("ids", String.join(",", albumIds))
                        .queryParam("market", market)
                        .build())
                .retrieve()
                .body(SpotifyAlbumsResponse.class));
        requireBody("fetchAlbums", albumIds.toString(), response);

        return response.albums() == null ? List.of() : response.albums().stream()
                .filter(Objects::nonNull)
                .map(mapper::toAlbum)
                .toList();
    }

    @Override
    public Page<Track> fetchAlbumTracks(String albumId, String cursor) {
        SpotifyPaging<SpotifyTrack> page = call("fetchAlbumTracks", albumId, () -> listing(cursor,
                uri -> uri.path("/albums/{id}/tracks")
                        .queryParam("limit", BatchLimits.limitFor(OperationKind.TRACK_BATCH_READ))
                        .queryParam("market", market)
                        .build(albumId))
                .retrieve()
                .body(new ParameterizedTypeReference<SpotifyPaging<SpotifyTrack>>() {}));
        requireBody("fetchAlbumTracks", albumId, page);
        return Page.of(mapper.toTracks(page.items(), albumId), page.next());
    }

    @Override
    public List<Track> fetchTracks(List<String> trackIds) {
        BatchLimits.requireValid(OperationKind.TRACK_BATCH_READ, trackIds.size());
        SpotifyTracksResponse response = call("fetchTracks", trackIds.toString(), () -> restClient.get()
                .uri(uri -> uri.path("/tracks")
                        .queryParam("ids", String.join(",", trackIds))
                        .queryParam("market", market)
                        .build())
                .retrieve()
                .body(SpotifyTracksResponse.class));
        requireBody("fetchTracks", trackIds.toString(), response);
        return mapper.toTracks(response.tracks() == null ? List.of() :
                response.tracks().stream().filter(Objects::nonNull).toList(), null);
    }

    @Override
    public Page<ArtistRef> fetchFollowedArtists(String cursor) {
        SpotifyFollowedArtistsResponse response = call("fetchFollowedArtists", "me", () -> listing(cursor,
                uri -> uri.path("/me/following")
                        .queryParam("type", "artist")
                        .queryParam("limit", BatchLimits.limitFor(OperationKind.CURRENT_USER_PAGED_LISTING))
                        .build())
                .retrieve()
                .body(SpotifyFollowedArtistsResponse.class));
        requireBody("fetchFollowedArtists", "me", response);
        if (response.artists() == null) {
            return Page.last(List.of());
        }
        return Page.of(mapper.toArtists(response.artists().items()), response.artists().next());
    }

    @Override
    public Page<Track> fetchSavedTracks(String cursor) {
        SpotifyPaging<SpotifySavedTrack> page = call("fetchSavedTracks", "me", () -> listing(cursor,
                uri -> uri.path("/me/tracks")
                        .queryParam("limit", BatchLimits.limitFor(OperationKind.CURRENT_USER_PAGED_LISTING))
                        .queryParam("market", market)
                        .build())
                .retrieve()
                .body(new ParameterizedTypeReference<SpotifyPaging<SpotifySavedTrack>>() {}));
        requireBody("fetchSavedTracks", "me", page);

        List<Track> tracks = page.items() == null ? List.of() : page.items().stream()
                .filter(Objects::nonNull)
                .map(saved -> mapper.toTrack(saved.track(), null))
                .flatMap(Optional::stream)
                .toList();
        return Page.of(tracks, page.next());
    }

    @Override
    public List<Boolean> containsSavedTracks(List<String> trackIds) {
        BatchLimits.requireValid(OperationKind.SAVED_TRACKS_CONTAINS, trackIds.size());
        List<Boolean> flags = call("containsSavedTracks", trackIds.toString(), () -> restClient.get()
                .uri(uri -> uri.path("/me/tracks/contains")
                        .queryParam("ids", String.join(",", trackIds))
                        .build())
                .retrieve()
                .body(new ParameterizedTypeReference<List<Boolean>>() {}));
        requireBody("containsSavedTracks", trackIds.toString(), flags);
        return flags;
    }

    @Override
    public void changeDescription(String collectionId, String description) {
        call("changeDescription", collectionId, () -> restClient.put()
                .uri("/playlists/{id}", collectionId)
                .body(new SpotifyDetailsRequest(description))
                .retrieve()
                .toBodilessEntity());
        log.debug("Updated description of collection {}", collectionId);
    }

    @Override
    public void replaceItems(String collectionId, List<String> trackIds) {
        BatchLimits.requireValid(OperationKind.PLAYLIST_ITEM_WRITE, trackIds.size());
        call("replaceItems", collectionId, () -> restClient.put()
                .uri("/playlists/{id}/tracks", collectionId)
                .body(new SpotifyUrisRequest(mapper.toUris(trackIds)))
                .retrieve()
                .toBodilessEntity());
    }

    @Override
    public void addItems(String collectionId, List<String> trackIds) {
        BatchLimits.requireValid(OperationKind.PLAYLIST_ITEM_WRITE, trackIds.size());
        call("addItems", collectionId, () -> restClient.post()
                .uri("/playlists/{id}/tracks", collectionId)
                .body(new SpotifyUrisRequest(mapper.toUris(trackIds)))
                .retrieve()
                .toBodilessEntity());
    }

    @Override
    public void removeItems(String collectionId, List<String> trackIds) {
        BatchLimits.requireValid(OperationKind.PLAYLIST_ITEM_REMOVE, trackIds.size());
        List<SpotifyRemoveItemsRequest.Item> items = mapper.toUris(trackIds).stream()
                .map(SpotifyRemoveItemsRequest.Item::new)
                .toList();
        call("removeItems", collectionId, () -> restClient.method(HttpMethod.DELETE)
                .uri("/playlists/{id}/tracks", collectionId)
                .body(new SpotifyRemoveItemsRequest(items))
                .retrieve()
                .toBodilessEntity());
    }

    private RestClient.RequestHeadersSpec<?> listing(String cursor, Function<UriBuilder, URI> firstPage) {
        if (cursor == null) {
            return restClient.get().uri(firstPage);
        }
        return restClient.get().uri(URI.create(cursor));
    }

    private <T> T call(String operation, String identifier, Supplier<T> request) {
        try {
            return request.get();
        } catch (RestClientResponseException e) {
            if (e.getStatusCode().isSameCodeAs(HttpStatus.NOT_FOUND)) {
                throw new ResourceNotFoundException(identifier);
            }
            log.warn("{} for {} failed with HTTP {}: {}", operation, identifier,
                    e.getStatusCode().value(), e.getResponseBodyAsString());
            throw new CatalogException(operation, "HTTP " + e.getStatusCode().value() + " for " + identifier, e);
        } catch (RestClientException e) {
            log.warn("{} for {} failed: {}", operation, identifier, e.getMessage());
            throw new CatalogException(operation, "request for " + identifier + " failed", e);
        }
    }

    private void requireBody(String operation, String identifier, Object body) {
        if (body == null) {
            throw new CatalogException(operation, "empty response for " + identifier);
        }
    }
}
