package com.radarsync.core.batch;

/**
 * Remote catalog operations that accept a bounded number of identifiers per call.
 */
public enum OperationKind {
    ALBUM_BATCH_READ(20),
    TRACK_BATCH_READ(50),
    ARTIST_BATCH_READ(50),
    PLAYLIST_ITEM_WRITE(100),
    PLAYLIST_ITEM_REMOVE(100),
    CURRENT_USER_PAGED_LISTING(50),
    SAVED_TRACKS_CONTAINS(50);

    private final int limit;

    OperationKind(int limit) {
        this.limit = limit;
    }

    int limit() {
        return limit;
    }
}
