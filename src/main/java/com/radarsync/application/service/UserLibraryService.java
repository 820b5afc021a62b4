package com.radarsync.application.service;

import com.radarsync.application.port.MusicCatalogPort;
import com.radarsync.core.exception.CatalogException;
import com.radarsync.core.exception.RemoteFetchException;
import com.radarsync.core.model.ArtistRef;
import com.radarsync.core.model.ReconciliationPhase;
import com.radarsync.core.model.Track;
import com.radarsync.core.paging.PageFetcher;
import com.radarsync.core.paging.Paginator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Reads the current user's library listings: followed artists and saved tracks.
 */
@Service
public class UserLibraryService {

    private static final Logger log = LoggerFactory.getLogger(UserLibraryService.class);

    private final MusicCatalogPort catalog;

    public UserLibraryService(MusicCatalogPort catalog) {
        this.catalog = catalog;
    }

    public List<ArtistRef> followedArtists() {
        List<ArtistRef> artists = walk("followed artists", catalog::fetchFollowedArtists);
        log.info("Retrieved {} followed artists", artists.size());
        return artists;
    }

    public List<Track> savedTracks() {
        List<Track> tracks = walk("saved tracks", catalog::fetchSavedTracks);
        log.info("Retrieved {} saved tracks", tracks.size());
        return tracks;
    }

    private <T> List<T> walk(String listing, PageFetcher<T> fetcher) {
        try {
            return Paginator.over(fetcher).toList();
        } catch (CatalogException e) {
            throw new RemoteFetchException(ReconciliationPhase.RESOLVING_COLLECTIONS, listing, e);
        }
    }
}
