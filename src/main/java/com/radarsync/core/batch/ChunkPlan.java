package com.radarsync.core.batch;

import com.radarsync.core.exception.InvalidBatchSizeException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered split of an identifier list into batches no larger than a chunk size.
 * The first chunk is tagged so writers can pick replace semantics for it.
 */
public final class ChunkPlan {

    /**
     * One batch of the plan.
     */
    public record Chunk(
            int index,
            List<String> ids,
            boolean first
    ) {
        public Chunk {
            ids = List.copyOf(ids);
        }

        public int size() {
            return ids.size();
        }
    }

    private final int chunkSize;
    private final List<Chunk> chunks;

    private ChunkPlan(int chunkSize, List<Chunk> chunks) {
        this.chunkSize = chunkSize;
        this.chunks = Collections.unmodifiableList(chunks);
    }

    public static ChunkPlan of(List<String> ids, int chunkSize) {
        if (chunkSize < 1) {
            throw new InvalidBatchSizeException(chunkSize, "Chunk size must be positive, was " + chunkSize);
        }
        List<Chunk> chunks = new ArrayList<>();
        for (int from = 0; from < ids.size(); from += chunkSize) {
            int to = Math.min(from + chunkSize, ids.size());
            chunks.add(new Chunk(chunks.size(), ids.subList(from, to), from == 0));
        }
        return new ChunkPlan(chunkSize, chunks);
    }

    public static ChunkPlan forOperation(List<String> ids, OperationKind kind) {
        return of(ids, BatchLimits.limitFor(kind));
    }

    public List<Chunk> chunks() {
        return chunks;
    }

    public int chunkSize() {
        return chunkSize;
    }

    public int size() {
        return chunks.size();
    }

    public boolean isEmpty() {
        return chunks.isEmpty();
    }

    /**
     * Concatenation of every chunk, in order.
     */
    public List<String> flatten() {
        List<String> all = new ArrayList<>();
        chunks.forEach(chunk -> all.addAll(chunk.ids()));
        return all;
    }
}
