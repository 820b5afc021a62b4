package com.radarsync.infrastructure.api.controller;

import com.radarsync.application.port.ConfigProvider;
import com.radarsync.application.service.ReconciliationService;
import com.radarsync.core.exception.ConfigurationException;
import com.radarsync.core.model.ReconciliationRequest;
import com.radarsync.core.model.ReconciliationResult;
import com.radarsync.infrastructure.api.dto.ReconciliationResponse;
import com.radarsync.infrastructure.api.dto.ReconciliationRunRequest;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for reconciliation runs.
 */
@RestController
@RequestMapping("/api/reconciliations")
public class ReconciliationController {

    private final ReconciliationService reconciliationService;
    private final ConfigProvider config;

    public ReconciliationController(ReconciliationService reconciliationService, ConfigProvider config) {
        this.reconciliationService = reconciliationService;
        this.config = config;
    }

    @PostMapping
    public ResponseEntity<ReconciliationResponse> reconcile(
            @Valid @RequestBody(required = false) ReconciliationRunRequest body
    ) {
        ReconciliationRunRequest request = body != null ? body : new ReconciliationRunRequest(null, null, null, null);

        String referenceId = orDefault(request.referencePlaylistId(), config.defaultReferenceCollectionId(), "reference");
        String targetId = orDefault(request.targetPlaylistId(), config.defaultTargetCollectionId(), "target");
        boolean allowDuplicates = Boolean.TRUE.equals(request.allowDuplicates());
        boolean wipeReference = request.wipeReference() != null
                ? request.wipeReference()
                : config.wipeReferenceByDefault();

        ReconciliationResult result = reconciliationService.reconcile(
                new ReconciliationRequest(referenceId, targetId, allowDuplicates, wipeReference));
        return ResponseEntity.ok(ResponseMapper.toResponse(result));
    }

    private static String orDefault(String requested, String configured, String role) {
        if (requested != null) {
            return requested;
        }
        if (configured == null || configured.isBlank()) {
            throw new ConfigurationException("No " + role + " playlist given and none configured");
        }
        return configured;
    }
}
