package com.radarsync.infrastructure.api.controller;

import com.radarsync.core.model.ArtistRef;
import com.radarsync.core.model.ReconciliationResult;
import com.radarsync.core.model.Track;
import com.radarsync.infrastructure.api.dto.ArtistResponse;
import com.radarsync.infrastructure.api.dto.ReconciliationResponse;
import com.radarsync.infrastructure.api.dto.TrackResponse;

/**
 * Maps core values onto response DTOs.
 */
final class ResponseMapper {

    private ResponseMapper() {
    }

    static TrackResponse toResponse(Track track) {
        return new TrackResponse(
                track.id(),
                track.title(),
                track.artists().stream().map(ArtistRef::name).toList(),
                track.albumId(),
                track.durationMs(),
                track.isrc()
        );
    }

    static ArtistResponse toResponse(ArtistRef artist) {
        return new ArtistResponse(artist.id(), artist.name());
    }

    static ReconciliationResponse toResponse(ReconciliationResult result) {
        return new ReconciliationResponse(
                result.referenceCollectionId(),
                result.targetCollectionId(),
                result.referenceTrackCount(),
                result.albumCount(),
                result.candidateCount(),
                result.filteredCount(),
                result.duplicatesDropped(),
                result.writtenTrackIds(),
                result.chunksWritten(),
                result.wipedCount(),
                result.finalPhase().name()
        );
    }
}
