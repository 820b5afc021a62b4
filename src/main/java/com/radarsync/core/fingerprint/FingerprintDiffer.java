package com.radarsync.core.fingerprint;

import com.radarsync.core.model.FingerprintCollection;
import com.radarsync.core.model.TrackFingerprint;

import java.util.List;

/**
 * Set difference between two fingerprint collections by content identity.
 */
public class FingerprintDiffer {

    /**
     * @return fingerprints of {@code reference.distinct()} whose identity {@code other} lacks,
     *         in reference order
     */
    public List<TrackFingerprint> missingFrom(FingerprintCollection reference, FingerprintCollection other) {
        return reference.distinct().stream()
                .filter(fingerprint -> !other.contains(fingerprint))
                .toList();
    }
}
