package com.radarsync.infrastructure.api.controller;

import com.radarsync.application.service.PlaylistComparisonService;
import com.radarsync.application.service.SavedTrackPruningService;
import com.radarsync.infrastructure.api.dto.MissingTracksResponse;
import com.radarsync.infrastructure.api.dto.PruneResponse;
import com.radarsync.infrastructure.api.dto.TrackResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for single-playlist operations.
 */
@RestController
@RequestMapping("/api/playlists/{playlistId}")
public class PlaylistController {

    private final PlaylistComparisonService comparisonService;
    private final SavedTrackPruningService pruningService;

    public PlaylistController(PlaylistComparisonService comparisonService, SavedTrackPruningService pruningService) {
        this.comparisonService = comparisonService;
        this.pruningService = pruningService;
    }

    @GetMapping("/missing")
    public ResponseEntity<MissingTracksResponse> missing(
            @PathVariable String playlistId,
            @RequestParam("from") String otherPlaylistId
    ) {
        PlaylistComparisonService.ComparisonResult result = comparisonService.missingFrom(playlistId, otherPlaylistId);

        List<TrackResponse> missing = result.missingTracks().stream()
                .map(ResponseMapper::toResponse)
                .toList();
        return ResponseEntity.ok(new MissingTracksResponse(playlistId, otherPlaylistId, missing, missing.size()));
    }

    @PostMapping("/saved-tracks/prune")
    public ResponseEntity<PruneResponse> pruneSavedTracks(@PathVariable String playlistId) {
        List<String> removed = pruningService.prune(playlistId);
        return ResponseEntity.ok(new PruneResponse(playlistId, removed, removed.size()));
    }
}
