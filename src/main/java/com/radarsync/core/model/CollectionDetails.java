package com.radarsync.core.model;

/**
 * Collection metadata without items.
 */
public record CollectionDetails(
        String id,
        String name,
        String snapshotId,
        int totalItems
) {}
