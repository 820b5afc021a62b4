package com.radarsync.core.model;

/**
 * Input of one reconciliation run. Constructed per invocation, never persisted.
 *
 * @param referenceCollectionId transient intake collection whose albums drive the target
 * @param targetCollectionId    durable collection that is regenerated
 * @param allowDuplicates       keep tracks that share a content identity
 * @param wipeReference         drain the reference collection after a successful write
 */
public record ReconciliationRequest(
        String referenceCollectionId,
        String targetCollectionId,
        boolean allowDuplicates,
        boolean wipeReference
) {
    public ReconciliationRequest {
        if (referenceCollectionId == null || referenceCollectionId.isBlank()) {
            throw new IllegalArgumentException("referenceCollectionId must not be blank");
        }
        if (targetCollectionId == null || targetCollectionId.isBlank()) {
            throw new IllegalArgumentException("targetCollectionId must not be blank");
        }
    }

    public static ReconciliationRequest of(String referenceCollectionId, String targetCollectionId) {
        return new ReconciliationRequest(referenceCollectionId, targetCollectionId, false, true);
    }
}
