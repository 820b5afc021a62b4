package com.radarsync.application.service;

import com.radarsync.application.port.BlacklistStore;
import com.radarsync.core.model.ArtistRef;
import com.radarsync.core.model.Track;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Drops tracks whose lead artist is blacklisted.
 * Only the first credited artist is checked; featured artists never exclude a track.
 */
@Service
public class BlacklistFilter {

    private static final Logger log = LoggerFactory.getLogger(BlacklistFilter.class);

    private final BlacklistStore blacklistStore;

    public BlacklistFilter(BlacklistStore blacklistStore) {
        this.blacklistStore = blacklistStore;
    }

    /**
     * @param tracks candidate tracks
     * @return the tracks whose lead artist is not blacklisted, in input order
     */
    public List<Track> apply(List<Track> tracks) {
        List<Track> kept = new ArrayList<>(tracks.size());
        for (Track track : tracks) {
            if (isExcluded(track)) {
                log.info("Artist '{}' is blacklisted. Skipping track '{}' ({})",
                        track.leadArtist().map(ArtistRef::name).orElse("?"), track.title(), track.id());
            } else {
                kept.add(track);
            }
        }
        return kept;
    }

    public boolean isExcluded(Track track) {
        Optional<ArtistRef> lead = track.leadArtist();
        return lead.isPresent() && blacklistStore.contains(lead.get());
    }
}
