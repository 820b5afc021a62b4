package com.radarsync.core.fingerprint;

import com.radarsync.core.model.ArtistRef;
import com.radarsync.core.model.FingerprintCollection;
import com.radarsync.core.model.Track;
import com.radarsync.core.model.TrackFingerprint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;

/**
 * Derives content-identity fingerprints from track metadata and classifies track lists
 * into distinct and duplicate identities.
 */
public class FingerprintEngine {

    private static final Logger log = LoggerFactory.getLogger(FingerprintEngine.class);

    /**
     * Result of an incremental insert.
     */
    public record Insertion(
            FingerprintCollection collection,
            boolean wasNew
    ) {}

    /**
     * Computes the fingerprint of a track. Never fails on a missing catalog code;
     * the title-keyed fallback is used instead.
     */
    public TrackFingerprint fingerprintOf(Track track) {
        String catalogCode = track.catalogCode().orElse(null);
        if (catalogCode == null) {
            log.debug("Track {} ('{}') has no catalog code, falling back to title identity",
                    track.id(), track.title());
        }
        List<String> artistNames = track.artists().stream()
                .map(ArtistRef::name)
                .map(name -> name.toLowerCase(Locale.ROOT))
                .toList();
        int durationBucket = (int) (Math.max(0L, track.durationMs()) / 1000L);

        return new TrackFingerprint(
                catalogCode == null ? null : catalogCode.toUpperCase(Locale.ROOT),
                TitleNormalizer.normalize(track.title()),
                artistNames,
                durationBucket,
                track.id()
        );
    }

    /**
     * Classifies tracks in input order: first occurrence of each identity is distinct,
     * later occurrences are duplicates.
     */
    public FingerprintCollection classify(List<Track> tracks) {
        FingerprintCollection collection = FingerprintCollection.of(
                tracks.stream().map(this::fingerprintOf).toList());
        log.debug("Classified {} tracks into {} distinct and {} duplicate fingerprints",
                collection.size(), collection.distinct().size(), collection.duplicates().size());
        return collection;
    }

    /**
     * Adds one track to an existing classification.
     */
    public Insertion insert(FingerprintCollection existing, Track track) {
        TrackFingerprint fingerprint = fingerprintOf(track);
        boolean wasNew = !existing.contains(fingerprint);
        return new Insertion(existing.with(fingerprint), wasNew);
    }
}
