package com.docqa.rag.store;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Chunk arena keyed by chunk id.
 */
public class ChunkStore {

    private final Map<String, Chunk> chunks = new ConcurrentHashMap<>();

    public void putAll(Collection<Chunk> toAdd) {
        toAdd.forEach(c -> chunks.put(c.id(), c));
    }

    public Optional<Chunk> get(String chunkId) {
        return Optional.ofNullable(chunks.get(chunkId));
    }

    /**
     * Resolves ids in order, skipping ids that no longer exist.
     */
    public List<Chunk> getAll(List<String> chunkIds) {
        return chunkIds.stream().map(chunks::get).filter(Objects::nonNull).toList();
    }

    public void removeAll(Collection<String> chunkIds) {
        chunkIds.forEach(chunks::remove);
    }

    public int size() {
        return chunks.size();
    }
}
