package com.radarsync.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Classification of one track list into content identities.
 * <ul>
 *   <li>{@code full}: every fingerprint in input order, duplicates included</li>
 *   <li>{@code distinct}: the first occurrence of each identity, in first-seen order</li>
 *   <li>{@code duplicates}: later occurrences that collided with an earlier entry</li>
 * </ul>
 * Immutable; {@link #with(TrackFingerprint)} returns a new collection.
 */
public final class FingerprintCollection {

    private static final FingerprintCollection EMPTY =
            new FingerprintCollection(List.of(), new LinkedHashSet<>(), List.of());

    private final List<TrackFingerprint> full;
    private final Set<TrackFingerprint> distinct;
    private final List<TrackFingerprint> duplicates;

    private FingerprintCollection(List<TrackFingerprint> full, LinkedHashSet<TrackFingerprint> distinct,
                                  List<TrackFingerprint> duplicates) {
        this.full = Collections.unmodifiableList(full);
        this.distinct = Collections.unmodifiableSet(distinct);
        this.duplicates = Collections.unmodifiableList(duplicates);
    }

    public static FingerprintCollection empty() {
        return EMPTY;
    }

    /**
     * Builds a collection from fingerprints in input order.
     */
    public static FingerprintCollection of(List<TrackFingerprint> fingerprints) {
        List<TrackFingerprint> full = new ArrayList<>(fingerprints.size());
        LinkedHashSet<TrackFingerprint> distinct = new LinkedHashSet<>();
        List<TrackFingerprint> duplicates = new ArrayList<>();
        for (TrackFingerprint fingerprint : fingerprints) {
            full.add(fingerprint);
            if (!distinct.add(fingerprint)) {
                duplicates.add(fingerprint);
            }
        }
        return new FingerprintCollection(full, distinct, duplicates);
    }

    /**
     * Returns a copy with one more fingerprint appended.
     */
    public FingerprintCollection with(TrackFingerprint fingerprint) {
        List<TrackFingerprint> newFull = new ArrayList<>(full);
        LinkedHashSet<TrackFingerprint> newDistinct = new LinkedHashSet<>(distinct);
        List<TrackFingerprint> newDuplicates = new ArrayList<>(duplicates);
        newFull.add(fingerprint);
        if (!newDistinct.add(fingerprint)) {
            newDuplicates.add(fingerprint);
        }
        return new FingerprintCollection(newFull, newDistinct, newDuplicates);
    }

    public List<TrackFingerprint> full() {
        return full;
    }

    public List<TrackFingerprint> distinct() {
        return List.copyOf(distinct);
    }

    public List<TrackFingerprint> duplicates() {
        return duplicates;
    }

    /**
     * Identity lookup against the distinct set.
     */
    public boolean contains(TrackFingerprint fingerprint) {
        return distinct.contains(fingerprint);
    }

    public List<String> distinctTrackIds() {
        return distinct.stream().map(TrackFingerprint::getSourceTrackId).toList();
    }

    public int size() {
        return full.size();
    }

    public boolean isEmpty() {
        return full.isEmpty();
    }
}
