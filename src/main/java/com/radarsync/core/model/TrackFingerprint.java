package com.radarsync.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Content identity of a recording, independent of catalog-assigned track ids.
 * <p>
 * Two fingerprints are equal when catalog code, artist names and duration bucket match.
 * Title and source track id are carried for display and lookup only. When the catalog
 * code is missing the normalized title joins the key, so a code-less fingerprint is never
 * equal to one that has a code.
 */
public final class TrackFingerprint {

    private final String catalogCode;
    private final String normalizedTitle;
    private final List<String> baseArtistNames;
    private final int durationBucketSeconds;
    private final String sourceTrackId;

    public TrackFingerprint(String catalogCode, String normalizedTitle, List<String> baseArtistNames,
                            int durationBucketSeconds, String sourceTrackId) {
        this.catalogCode = catalogCode;
        this.normalizedTitle = Objects.requireNonNull(normalizedTitle, "normalizedTitle must not be null");
        this.baseArtistNames = List.copyOf(baseArtistNames);
        this.durationBucketSeconds = durationBucketSeconds;
        this.sourceTrackId = Objects.requireNonNull(sourceTrackId, "sourceTrackId must not be null");
    }

    public Optional<String> getCatalogCode() {
        return Optional.ofNullable(catalogCode);
    }

    public String getNormalizedTitle() {
        return normalizedTitle;
    }

    public List<String> getBaseArtistNames() {
        return baseArtistNames;
    }

    public int getDurationBucketSeconds() {
        return durationBucketSeconds;
    }

    public String getSourceTrackId() {
        return sourceTrackId;
    }

    public boolean isTitleKeyed() {
        return catalogCode == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TrackFingerprint that = (TrackFingerprint) o;
        return durationBucketSeconds == that.durationBucketSeconds
                && Objects.equals(catalogCode, that.catalogCode)
                && baseArtistNames.equals(that.baseArtistNames)
                && (catalogCode != null || normalizedTitle.equals(that.normalizedTitle));
    }

    @Override
    public int hashCode() {
        return Objects.hash(catalogCode, baseArtistNames, durationBucketSeconds,
                catalogCode == null ? normalizedTitle : null);
    }

    @Override
    public String toString() {
        return "TrackFingerprint{" +
                "catalogCode=" + catalogCode +
                ", title='" + normalizedTitle + '\'' +
                ", artists=" + baseArtistNames +
                ", duration=" + durationBucketSeconds + "s" +
                ", track=" + sourceTrackId +
                '}';
    }
}
