package com.radarsync.application.service;

import com.radarsync.application.port.ConfigProvider;
import com.radarsync.application.port.MusicCatalogPort;
import com.radarsync.core.batch.ChunkPlan;
import com.radarsync.core.batch.OperationKind;
import com.radarsync.core.exception.CatalogException;
import com.radarsync.core.exception.ConfigurationException;
import com.radarsync.core.exception.ReconciliationException;
import com.radarsync.core.exception.RemoteFetchException;
import com.radarsync.core.exception.RemoteWriteException;
import com.radarsync.core.exception.ResourceNotFoundException;
import com.radarsync.core.fingerprint.FingerprintEngine;
import com.radarsync.core.model.Album;
import com.radarsync.core.model.CollectionSnapshot;
import com.radarsync.core.model.FingerprintCollection;
import com.radarsync.core.model.ReconciliationPhase;
import com.radarsync.core.model.ReconciliationRequest;
import com.radarsync.core.model.ReconciliationResult;
import com.radarsync.core.model.Track;
import com.radarsync.core.model.TrackFingerprint;
import com.radarsync.core.paging.Page;
import com.radarsync.core.paging.Paginator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Rebuilds a target collection from the full albums of a reference collection.
 * <p>
 * One run resolves both collections, expands the reference tracks to every track of their
 * albums, drops blacklisted artists and duplicate recordings, then rewrites the target in
 * ordered chunks: the first chunk replaces the target's items, later chunks append. A
 * successful run finally drains the reference collection.
 * <p>
 * Every remote call is sequential. Failures are fatal and carry the phase they happened in;
 * a partially written target is left as the last successful chunk produced it.
 */
@Service
public class ReconciliationService {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationService.class);

    private static final DateTimeFormatter DESCRIPTION_DATE = DateTimeFormatter.ofPattern("MM/dd/yyyy");

    private final MusicCatalogPort catalog;
    private final CollectionReader collectionReader;
    private final BlacklistFilter blacklistFilter;
    private final FingerprintEngine fingerprintEngine;
    private final ConfigProvider config;
    private final Clock clock;

    public ReconciliationService(MusicCatalogPort catalog,
                                 CollectionReader collectionReader,
                                 BlacklistFilter blacklistFilter,
                                 FingerprintEngine fingerprintEngine,
                                 ConfigProvider config,
                                 Clock clock) {
        this.catalog = catalog;
        this.collectionReader = collectionReader;
        this.blacklistFilter = blacklistFilter;
        this.fingerprintEngine = fingerprintEngine;
        this.config = config;
        this.clock = clock;
    }

    private record Expansion(int albumCount, List<Track> candidates) {}

    private record Retained(List<String> trackIds, int duplicatesDropped) {}

    private record WriteOutcome(List<String> writtenTrackIds, int chunksWritten) {}

    public ReconciliationResult reconcile(ReconciliationRequest request) {
        return reconcile(request, CancellationSignal.none());
    }

    /**
     * Runs one reconciliation.
     *
     * @param request the collections to reconcile
     * @param signal  checked before every phase and between remote calls
     * @return the run summary
     * @throws ConfigurationException  if the target is the stock collection
     * @throws RemoteFetchException    if a read fails
     * @throws RemoteWriteException    if a write chunk or the wipe fails
     * @throws com.radarsync.core.exception.ReconciliationCancelledException if the signal is set
     */
    public ReconciliationResult reconcile(ReconciliationRequest request, CancellationSignal signal) {
        String referenceId = request.referenceCollectionId();
        String targetId = request.targetCollectionId();
        log.info("Starting reconciliation of '{}' into '{}' (allowDuplicates={}, wipeReference={})",
                referenceId, targetId, request.allowDuplicates(), request.wipeReference());

        try {
            enter(ReconciliationPhase.RESOLVING_COLLECTIONS, signal);
            collectionReader.read(targetId, ReconciliationPhase.RESOLVING_COLLECTIONS, signal);
            CollectionSnapshot reference =
                    collectionReader.read(referenceId, ReconciliationPhase.RESOLVING_COLLECTIONS, signal);
            requireWritableTarget(targetId);

            enter(ReconciliationPhase.EXPANDING_ALBUMS, signal);
            Expansion expansion = expandAlbums(reference, signal);

            enter(ReconciliationPhase.FILTERING, signal);
            List<Track> filtered = blacklistFilter.apply(expansion.candidates());
            log.info("{} of {} candidate tracks left after blacklist filtering",
                    filtered.size(), expansion.candidates().size());

            enter(ReconciliationPhase.DIFFING, signal);
            Retained retained = retain(filtered, request.allowDuplicates());

            enter(ReconciliationPhase.WRITING_CHUNKS, signal);
            WriteOutcome written = writeChunks(targetId, retained.trackIds(), signal);

            int wiped = 0;
            if (request.wipeReference()) {
                enter(ReconciliationPhase.WIPING_SOURCE, signal);
                wiped = wipe(reference, signal);
            }

            log.info("Reconciliation of '{}' into '{}' done: {} tracks written in {} chunks, {} removed from reference",
                    referenceId, targetId, written.writtenTrackIds().size(), written.chunksWritten(), wiped);
            return new ReconciliationResult(
                    referenceId,
                    targetId,
                    reference.size(),
                    expansion.albumCount(),
                    expansion.candidates().size(),
                    filtered.size(),
                    retained.duplicatesDropped(),
                    written.writtenTrackIds(),
                    written.chunksWritten(),
                    wiped,
                    ReconciliationPhase.DONE
            );
        } catch (ReconciliationException e) {
            log.error("Reconciliation of '{}' into '{}' moved to {} from {}: {}",
                    referenceId, targetId, ReconciliationPhase.FAILED, e.getPhase(), e.getMessage());
            throw e;
        }
    }

    private void enter(ReconciliationPhase phase, CancellationSignal signal) {
        signal.throwIfCancelled(phase);
        log.debug("Entering {}", phase);
    }

    private void requireWritableTarget(String targetId) {
        if (targetId.equals(config.stockCollectionId())) {
            log.error("The stock collection ID was used as the target: {}", targetId);
            throw new ConfigurationException(ReconciliationPhase.RESOLVING_COLLECTIONS,
                    "Target collection " + targetId + " is the read-only stock collection");
        }
    }

    private Expansion expandAlbums(CollectionSnapshot reference, CancellationSignal signal) {
        Set<String> albumIds = new LinkedHashSet<>();
        for (Track track : reference.tracks()) {
            if (track.albumId() == null) {
                log.warn("Reference track '{}' ({}) has no album, skipping it", track.title(), track.id());
            } else {
                albumIds.add(track.albumId());
            }
        }

        List<String> albumTrackIds = new ArrayList<>();
        ChunkPlan albumPlan = ChunkPlan.forOperation(List.copyOf(albumIds), OperationKind.ALBUM_BATCH_READ);
        for (ChunkPlan.Chunk chunk : albumPlan.chunks()) {
            signal.throwIfCancelled(ReconciliationPhase.EXPANDING_ALBUMS);
            log.debug("Current album chunk: {}", chunk.ids());
            List<Album> albums = read("albums " + chunk.ids(), () -> catalog.fetchAlbums(chunk.ids()));
            for (Album album : albums) {
                albumListing(album, signal).forEach(track -> albumTrackIds.add(track.id()));
            }
        }

        List<Track> candidates = new ArrayList<>(albumTrackIds.size());
        ChunkPlan trackPlan = ChunkPlan.forOperation(albumTrackIds, OperationKind.TRACK_BATCH_READ);
        for (ChunkPlan.Chunk chunk : trackPlan.chunks()) {
            signal.throwIfCancelled(ReconciliationPhase.EXPANDING_ALBUMS);
            candidates.addAll(read("tracks " + chunk.ids(), () -> catalog.fetchTracks(chunk.ids())));
        }

        log.info("Expanded {} reference tracks to {} tracks from {} albums",
                reference.size(), candidates.size(), albumIds.size());
        return new Expansion(albumIds.size(), candidates);
    }

    private List<Track> albumListing(Album album, CancellationSignal signal) {
        if (!album.hasMoreTracks()) {
            return album.tracks();
        }
        log.debug("Album '{}' has more than one page of tracks", album.name());
        return read("album " + album.id() + " tracks", () -> Paginator.continuing(
                Page.of(album.tracks(), album.tracksNextCursor()),
                cursor -> {
                    signal.throwIfCancelled(ReconciliationPhase.EXPANDING_ALBUMS);
                    return catalog.fetchAlbumTracks(album.id(), cursor);
                }).toList());
    }

    private <T> T read(String identifier, Supplier<T> call) {
        try {
            return call.get();
        } catch (CatalogException | ResourceNotFoundException e) {
            throw new RemoteFetchException(ReconciliationPhase.EXPANDING_ALBUMS, identifier, e);
        }
    }

    private Retained retain(List<Track> filtered, boolean allowDuplicates) {
        if (allowDuplicates) {
            return new Retained(filtered.stream().map(Track::id).toList(), 0);
        }
        FingerprintCollection fingerprints = fingerprintEngine.classify(filtered);
        for (TrackFingerprint duplicate : fingerprints.duplicates()) {
            log.debug("Skipping duplicate: {}", duplicate);
        }
        log.info("Dropped {} duplicate recordings, {} distinct tracks remain",
                fingerprints.duplicates().size(), fingerprints.distinct().size());
        return new Retained(fingerprints.distinctTrackIds(), fingerprints.duplicates().size());
    }

    private WriteOutcome writeChunks(String targetId, List<String> trackIds, CancellationSignal signal) {
        ChunkPlan plan = ChunkPlan.of(trackIds, config.writeChunkSize());
        if (plan.isEmpty()) {
            log.warn("No tracks to write, collection {} is left unchanged", targetId);
            return new WriteOutcome(List.of(), 0);
        }
        log.info("Collection {} will be updated with {} tracks in {} chunks", targetId, trackIds.size(), plan.size());

        List<String> written = new ArrayList<>(trackIds.size());
        for (ChunkPlan.Chunk chunk : plan.chunks()) {
            signal.throwIfCancelled(ReconciliationPhase.WRITING_CHUNKS);
            try {
                if (chunk.first()) {
                    catalog.changeDescription(targetId, description());
                    log.debug("Replacing collection items with {} tracks", chunk.size());
                    catalog.replaceItems(targetId, chunk.ids());
                } else {
                    log.debug("Adding {} tracks to collection", chunk.size());
                    catalog.addItems(targetId, chunk.ids());
                }
            } catch (CatalogException | ResourceNotFoundException e) {
                throw new RemoteWriteException(ReconciliationPhase.WRITING_CHUNKS, targetId, chunk.index(), e);
            }
            written.addAll(chunk.ids());
        }
        return new WriteOutcome(written, plan.size());
    }

    private int wipe(CollectionSnapshot reference, CancellationSignal signal) {
        if (reference.id().equals(config.stockCollectionId())) {
            log.warn("Reference {} is the read-only stock collection, it will not be wiped", reference.id());
            return 0;
        }
        List<String> ids = reference.trackIds().stream().distinct().toList();
        ChunkPlan plan = ChunkPlan.forOperation(ids, OperationKind.PLAYLIST_ITEM_REMOVE);
        for (ChunkPlan.Chunk chunk : plan.chunks()) {
            signal.throwIfCancelled(ReconciliationPhase.WIPING_SOURCE);
            try {
                catalog.removeItems(reference.id(), chunk.ids());
            } catch (CatalogException | ResourceNotFoundException e) {
                throw new RemoteWriteException(ReconciliationPhase.WIPING_SOURCE, reference.id(), chunk.index(), e);
            }
            log.info("Removed {} tracks from reference collection {}", chunk.size(), reference.id());
        }
        return ids.size();
    }

    private String description() {
        return String.format(config.descriptionTemplate(), LocalDate.now(clock).format(DESCRIPTION_DATE));
    }
}
