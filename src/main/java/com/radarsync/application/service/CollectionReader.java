package com.radarsync.application.service;

import com.radarsync.application.port.MusicCatalogPort;
import com.radarsync.core.exception.CatalogException;
import com.radarsync.core.exception.RemoteFetchException;
import com.radarsync.core.exception.ResourceNotFoundException;
import com.radarsync.core.model.CollectionDetails;
import com.radarsync.core.model.CollectionSnapshot;
import com.radarsync.core.model.ReconciliationPhase;
import com.radarsync.core.model.Track;
import com.radarsync.core.paging.Paginator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Loads full snapshots of remote collections by walking their item pages.
 */
@Service
public class CollectionReader {

    private static final Logger log = LoggerFactory.getLogger(CollectionReader.class);

    private final MusicCatalogPort catalog;

    public CollectionReader(MusicCatalogPort catalog) {
        this.catalog = catalog;
    }

    public CollectionSnapshot read(String collectionId, ReconciliationPhase phase) {
        return read(collectionId, phase, CancellationSignal.none());
    }

    /**
     * Reads collection metadata and every item. Fails fast on the first remote error.
     *
     * @param collectionId the collection identifier
     * @param phase        the phase reported if the read fails
     * @param signal       checked before every page
     * @return the snapshot
     * @throws RemoteFetchException if the details or any page cannot be read
     */
    public CollectionSnapshot read(String collectionId, ReconciliationPhase phase, CancellationSignal signal) {
        try {
            CollectionDetails details = catalog.fetchCollectionDetails(collectionId);
            List<Track> tracks = Paginator.<Track>over(cursor -> {
                signal.throwIfCancelled(phase);
                return catalog.fetchCollectionItems(collectionId, cursor);
            }).toList();

            log.info("Loaded collection '{}' ({}) with {} tracks | Snapshot ID: {}",
                    details.name(), collectionId, tracks.size(), details.snapshotId());
            return new CollectionSnapshot(collectionId, details.name(), details.snapshotId(), tracks);
        } catch (CatalogException | ResourceNotFoundException e) {
            throw new RemoteFetchException(phase, "collection " + collectionId, e);
        }
    }
}
