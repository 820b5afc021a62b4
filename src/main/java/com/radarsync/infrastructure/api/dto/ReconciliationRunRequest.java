package com.radarsync.infrastructure.api.dto;

import jakarta.validation.constraints.Pattern;

/**
 * Request DTO for starting a reconciliation run.
 * Omitted playlist ids and flags fall back to configuration.
 */
public record ReconciliationRunRequest(
        @Pattern(regexp = "^[A-Za-z0-9]+$", message = "referencePlaylistId must be a base-62 id")
        String referencePlaylistId,
        @Pattern(regexp = "^[A-Za-z0-9]+$", message = "targetPlaylistId must be a base-62 id")
        String targetPlaylistId,
        Boolean allowDuplicates,
        Boolean wipeReference
) {}
