package com.radarsync.application.port;

/**
 * Configuration values consumed by the reconciliation services.
 */
public interface ConfigProvider {

    /**
     * @return the id of the externally curated collection that must never be written to
     */
    String stockCollectionId();

    String defaultReferenceCollectionId();

    String defaultTargetCollectionId();

    /**
     * @return number of track ids per write call, never above the write ceiling
     */
    int writeChunkSize();

    /**
     * @return description template with a single {@code %s} for the update date
     */
    String descriptionTemplate();

    boolean wipeReferenceByDefault();
}
