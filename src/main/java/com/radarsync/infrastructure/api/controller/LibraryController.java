package com.radarsync.infrastructure.api.controller;

import com.radarsync.application.service.UserLibraryService;
import com.radarsync.infrastructure.api.dto.ArtistResponse;
import com.radarsync.infrastructure.api.dto.TrackResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for the current user's library listings.
 */
@RestController
@RequestMapping("/api")
public class LibraryController {

    private final UserLibraryService libraryService;

    public LibraryController(UserLibraryService libraryService) {
        this.libraryService = libraryService;
    }

    @GetMapping("/artists/followed")
    public ResponseEntity<List<ArtistResponse>> followedArtists() {
        return ResponseEntity.ok(libraryService.followedArtists().stream()
                .map(ResponseMapper::toResponse)
                .toList());
    }

    @GetMapping("/me/tracks")
    public ResponseEntity<List<TrackResponse>> savedTracks() {
        return ResponseEntity.ok(libraryService.savedTracks().stream()
                .map(ResponseMapper::toResponse)
                .toList());
    }
}
