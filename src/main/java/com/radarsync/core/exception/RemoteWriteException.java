package com.radarsync.core.exception;

import com.radarsync.core.model.ReconciliationPhase;

/**
 * Domain exception thrown when a write chunk is rejected.
 * The collection keeps whatever the previous successful chunks produced.
 */
public class RemoteWriteException extends ReconciliationException {

    private final String collectionId;
    private final int chunkIndex;

    public RemoteWriteException(ReconciliationPhase phase, String collectionId, int chunkIndex, Throwable cause) {
        super(phase, "Write of chunk " + chunkIndex + " to collection " + collectionId + " failed during " + phase, cause);
        this.collectionId = collectionId;
        this.chunkIndex = chunkIndex;
    }

    public String getCollectionId() {
        return collectionId;
    }

    public int getChunkIndex() {
        return chunkIndex;
    }
}
