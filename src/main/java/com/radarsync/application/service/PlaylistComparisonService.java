package com.radarsync.application.service;

import com.radarsync.core.fingerprint.FingerprintDiffer;
import com.radarsync.core.fingerprint.FingerprintEngine;
import com.radarsync.core.model.CollectionSnapshot;
import com.radarsync.core.model.FingerprintCollection;
import com.radarsync.core.model.ReconciliationPhase;
import com.radarsync.core.model.Track;
import com.radarsync.core.model.TrackFingerprint;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Compares two collections by content identity rather than by track id.
 */
@Service
public class PlaylistComparisonService {

    private final CollectionReader collectionReader;
    private final FingerprintEngine fingerprintEngine;
    private final FingerprintDiffer fingerprintDiffer;

    public PlaylistComparisonService(CollectionReader collectionReader,
                                     FingerprintEngine fingerprintEngine,
                                     FingerprintDiffer fingerprintDiffer) {
        this.collectionReader = collectionReader;
        this.fingerprintEngine = fingerprintEngine;
        this.fingerprintDiffer = fingerprintDiffer;
    }

    /**
     * Result record for a comparison.
     */
    public record ComparisonResult(
            String referenceCollectionId,
            String otherCollectionId,
            List<Track> missingTracks
    ) {}

    /**
     * Finds the recordings of {@code referenceId} that {@code otherId} does not have.
     *
     * @param referenceId the collection whose content is expected
     * @param otherId     the collection checked for that content
     * @return tracks of the reference collection missing from the other, in reference order
     */
    public ComparisonResult missingFrom(String referenceId, String otherId) {
        CollectionSnapshot reference = collectionReader.read(referenceId, ReconciliationPhase.RESOLVING_COLLECTIONS);
        CollectionSnapshot other = collectionReader.read(otherId, ReconciliationPhase.RESOLVING_COLLECTIONS);

        FingerprintCollection referencePrints = fingerprintEngine.classify(reference.tracks());
        FingerprintCollection otherPrints = fingerprintEngine.classify(other.tracks());

        Map<String, Track> byId = reference.tracks().stream()
                .collect(Collectors.toMap(Track::id, Function.identity(), (first, second) -> first));
        List<Track> missing = fingerprintDiffer.missingFrom(referencePrints, otherPrints).stream()
                .map(TrackFingerprint::getSourceTrackId)
                .map(byId::get)
                .toList();

        return new ComparisonResult(referenceId, otherId, missing);
    }
}
