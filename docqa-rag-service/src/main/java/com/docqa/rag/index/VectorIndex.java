package com.docqa.rag.index;

import com.docqa.rag.embedding.EmbeddingVectors;
import com.docqa.rag.error.DimensionMismatchException;
import com.docqa.rag.error.InvalidRequestException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * In-memory nearest-neighbour index ranked by cosine similarity.
 *
 * <p>Entries are immutable and published with a single map put, so a search
 * running next to an upsert sees either the old entry or the new one. Bulk
 * removals take the write lock so that a search never observes a document
 * half removed. Searches and upserts share the read lock.
 */
@Slf4j
public class VectorIndex {

    private static final Comparator<Scored> RANKING = Comparator
            .comparingDouble(Scored::score).reversed()
            .thenComparingLong(s -> s.entry().sequence());

    private final Map<String, IndexEntry> entries = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> chunkIdsByDocument = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private record Scored(IndexEntry entry, double score) {}

    /**
     * Inserts or replaces the entry for {@code chunkId}. A replaced entry keeps
     * its original insertion position.
     */
    public void upsert(String chunkId, String documentId, float[] vector, String embeddingConfigId) {
        if (vector == null || vector.length == 0) {
            throw new InvalidRequestException("Vector for chunk " + chunkId + " is empty");
        }
        float[] copy = vector.clone();
        lock.readLock().lock();
        try {
            entries.compute(chunkId, (id, existing) -> {
                long seq = existing != null ? existing.sequence() : sequence.getAndIncrement();
                if (existing != null && !existing.documentId().equals(documentId)) {
                    Set<String> old = chunkIdsByDocument.get(existing.documentId());
                    if (old != null) old.remove(id);
                }
                return new IndexEntry(id, documentId, copy, embeddingConfigId, seq);
            });
            chunkIdsByDocument.computeIfAbsent(documentId, d -> ConcurrentHashMap.newKeySet()).add(chunkId);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns up to {@code k} hits ordered by descending cosine similarity,
     * earlier insertion first on equal scores. A null or empty filter searches
     * every document.
     */
    public List<SearchHit> search(float[] queryVector, int k, Collection<String> documentIds) {
        if (k < 1) {
            throw new InvalidRequestException("k must be >= 1, got " + k);
        }
        if (queryVector == null || queryVector.length == 0) {
            throw new InvalidRequestException("Query vector is empty");
        }
        Set<String> filter = documentIds == null || documentIds.isEmpty() ? null : Set.copyOf(documentIds);

        lock.readLock().lock();
        try {
            List<Scored> scored = new ArrayList<>();
            for (IndexEntry e : entries.values()) {
                if (filter != null && !filter.contains(e.documentId())) continue;
                if (e.dimension() != queryVector.length) {
                    throw new DimensionMismatchException("Query has dimension " + queryVector.length
                            + " but chunk " + e.chunkId() + " was embedded with " + e.embeddingConfigId()
                            + " (dimension " + e.dimension() + ")");
                }
                scored.add(new Scored(e, EmbeddingVectors.cosine(queryVector, e.vector())));
            }
            scored.sort(RANKING);
            return scored.stream()
                    .limit(k)
                    .map(s -> new SearchHit(s.entry().chunkId(), s.entry().documentId(), s.score()))
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<SearchHit> search(float[] queryVector, int k) {
        return search(queryVector, k, null);
    }

    /**
     * Removes every entry of the document. No-op when it has none.
     *
     * @return number of entries removed
     */
    public int deleteByDocument(String documentId) {
        lock.writeLock().lock();
        try {
            Set<String> ids = chunkIdsByDocument.remove(documentId);
            if (ids == null) return 0;
            ids.forEach(entries::remove);
            log.debug("Removed {} index entries for document {}", ids.size(), documentId);
            return ids.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Runs {@code action} while no search or upsert is in progress. Used to
     * make a document publish or delete one step for readers. The action may
     * call {@link #upsert} and {@link #deleteByDocument}.
     */
    public <T> T exclusively(Supplier<T> action) {
        lock.writeLock().lock();
        try {
            return action.get();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public IndexEntry get(String chunkId) {
        return entries.get(chunkId);
    }

    /**
     * Embedding configurations of the entries belonging to the given documents.
     */
    public Set<String> embeddingConfigsOf(Collection<String> documentIds) {
        Set<String> configs = new TreeSet<>();
        lock.readLock().lock();
        try {
            for (String documentId : documentIds) {
                Set<String> ids = chunkIdsByDocument.getOrDefault(documentId, Set.of());
                for (String chunkId : ids) {
                    IndexEntry e = entries.get(chunkId);
                    if (e != null) configs.add(e.embeddingConfigId());
                }
            }
        } finally {
            lock.readLock().unlock();
        }
        return configs;
    }

    public int size() {
        return entries.size();
    }
}
