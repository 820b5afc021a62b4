package com.radarsync.application.service;

import com.radarsync.application.port.ConfigProvider;
import com.radarsync.application.port.MusicCatalogPort;
import com.radarsync.core.batch.ChunkPlan;
import com.radarsync.core.batch.OperationKind;
import com.radarsync.core.exception.CatalogException;
import com.radarsync.core.exception.ConfigurationException;
import com.radarsync.core.exception.RemoteFetchException;
import com.radarsync.core.exception.RemoteWriteException;
import com.radarsync.core.exception.ResourceNotFoundException;
import com.radarsync.core.model.CollectionSnapshot;
import com.radarsync.core.model.ReconciliationPhase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes tracks the user has already saved from a collection.
 */
@Service
public class SavedTrackPruningService {

    private static final Logger log = LoggerFactory.getLogger(SavedTrackPruningService.class);

    private final MusicCatalogPort catalog;
    private final CollectionReader collectionReader;
    private final ConfigProvider config;

    public SavedTrackPruningService(MusicCatalogPort catalog, CollectionReader collectionReader,
                                    ConfigProvider config) {
        this.catalog = catalog;
        this.collectionReader = collectionReader;
        this.config = config;
    }

    /**
     * @param collectionId the collection to prune, never the stock collection
     * @return ids of the removed tracks
     */
    public List<String> prune(String collectionId) {
        if (collectionId.equals(config.stockCollectionId())) {
            throw new ConfigurationException(ReconciliationPhase.RESOLVING_COLLECTIONS,
                    "Collection " + collectionId + " is the read-only stock collection");
        }
        CollectionSnapshot snapshot = collectionReader.read(collectionId, ReconciliationPhase.RESOLVING_COLLECTIONS);
        List<String> ids = snapshot.trackIds().stream().distinct().toList();

        List<String> saved = new ArrayList<>();
        for (ChunkPlan.Chunk chunk : ChunkPlan.forOperation(ids, OperationKind.SAVED_TRACKS_CONTAINS).chunks()) {
            List<Boolean> flags;
            try {
                flags = catalog.containsSavedTracks(chunk.ids());
            } catch (CatalogException | ResourceNotFoundException e) {
                throw new RemoteFetchException(ReconciliationPhase.DIFFING, "saved status of " + chunk.ids(), e);
            }
            if (flags.size() != chunk.size()) {
                throw new RemoteFetchException(ReconciliationPhase.DIFFING, "saved status of " + chunk.ids(),
                        "expected " + chunk.size() + " flags but got " + flags.size());
            }
            for (int i = 0; i < chunk.size(); i++) {
                if (Boolean.TRUE.equals(flags.get(i))) {
                    saved.add(chunk.ids().get(i));
                }
            }
        }
        log.debug("Saved tracks in {}: {} of {}", collectionId, saved.size(), ids.size());

        for (ChunkPlan.Chunk chunk : ChunkPlan.forOperation(saved, OperationKind.PLAYLIST_ITEM_REMOVE).chunks()) {
            try {
                catalog.removeItems(collectionId, chunk.ids());
            } catch (CatalogException | ResourceNotFoundException e) {
                throw new RemoteWriteException(ReconciliationPhase.WRITING_CHUNKS, collectionId, chunk.index(), e);
            }
        }
        log.info("Removed {} saved tracks from '{}' ({})", saved.size(), snapshot.name(), collectionId);
        return saved;
    }
}
