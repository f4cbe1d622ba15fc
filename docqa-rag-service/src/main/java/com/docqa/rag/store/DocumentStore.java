package com.docqa.rag.store;

import com.docqa.rag.error.InvalidStateTransitionException;
import com.docqa.rag.error.NotFoundException;
import com.docqa.rag.index.VectorIndex;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Owns document metadata and the cascade into the chunk store and vector index.
 * Operations on one document are serialised by a per-document lock; different
 * documents never contend.
 */
@Slf4j
public class DocumentStore {

    private final Map<String, Document> documents = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final ChunkStore chunkStore;
    private final VectorIndex vectorIndex;

    public DocumentStore(ChunkStore chunkStore, VectorIndex vectorIndex) {
        this.chunkStore = chunkStore;
        this.vectorIndex = vectorIndex;
    }

    public Document create(String filename, String mimeType, long byteSize) {
        Instant now = Instant.now();
        Document doc = Document.builder()
                .id(UUID.randomUUID().toString())
                .filename(filename)
                .mimeType(mimeType)
                .byteSize(byteSize)
                .status(DocumentStatus.UPLOADING)
                .createdAt(now)
                .updatedAt(now)
                .build();
        documents.put(doc.getId(), doc);
        log.info("Document {} accepted: filename={}, size={} bytes", doc.getId(), filename, byteSize);
        return doc.copy();
    }

    public Document get(String documentId) {
        return find(documentId).orElseThrow(() -> NotFoundException.document(documentId));
    }

    public Optional<Document> find(String documentId) {
        Document doc = documentId == null ? null : documents.get(documentId);
        return Optional.ofNullable(doc).map(Document::copy);
    }

    public boolean exists(String documentId) {
        return documentId != null && documents.containsKey(documentId);
    }

    /**
     * All documents, oldest first.
     */
    public List<Document> list() {
        return documents.values().stream()
                .map(Document::copy)
                .sorted(Comparator.comparing(Document::getCreatedAt).thenComparing(Document::getId))
                .toList();
    }

    public Document updateStatus(String documentId, DocumentStatus next) {
        return updateStatus(documentId, next, null);
    }

    public Document updateStatus(String documentId, DocumentStatus next, String errorMessage) {
        return withLock(documentId, () -> {
            Document doc = require(documentId);
            if (!doc.getStatus().canTransitionTo(next)) {
                throw new InvalidStateTransitionException(documentId, doc.getStatus(), next);
            }
            log.info("Document {} status {} -> {}", documentId, doc.getStatus(), next);
            doc.setStatus(next);
            doc.setUpdatedAt(Instant.now());
            if (next == DocumentStatus.FAILED) {
                doc.setErrorMessage(errorMessage);
            }
            return doc.copy();
        });
    }

    /**
     * Moves the document to FAILED unless it already reached a terminal status
     * or was deleted.
     *
     * @return true when the status changed
     */
    public boolean failIfInProgress(String documentId, String reason) {
        return withLock(documentId, () -> {
            Document doc = documents.get(documentId);
            if (doc == null || doc.getStatus().isTerminal()) return false;
            log.info("Document {} status {} -> FAILED: {}", documentId, doc.getStatus(), reason);
            doc.setStatus(DocumentStatus.FAILED);
            doc.setErrorMessage(reason);
            doc.setUpdatedAt(Instant.now());
            return true;
        });
    }

    /**
     * Stores the embedded chunks, indexes them in sequence order and marks the
     * document READY. The document must be in EMBEDDING. All chunks of the
     * document become searchable together and get consecutive index sequences.
     */
    public Document publishChunks(String documentId, List<Chunk> chunks, String embeddingConfigId) {
        return withLock(documentId, () -> {
            Document doc = require(documentId);
            if (doc.getStatus() != DocumentStatus.EMBEDDING) {
                throw new InvalidStateTransitionException(documentId, doc.getStatus(), DocumentStatus.READY);
            }
            List<Chunk> ordered = new ArrayList<>(chunks);
            ordered.sort(Comparator.comparingInt(Chunk::sequenceIndex));

            chunkStore.putAll(ordered);
            vectorIndex.exclusively(() -> {
                ordered.forEach(c -> vectorIndex.upsert(c.id(), documentId, c.vector(), embeddingConfigId));
                return ordered.size();
            });

            doc.setChunkIds(new ArrayList<>(ordered.stream().map(Chunk::id).toList()));
            doc.setEmbeddingConfigId(embeddingConfigId);
            doc.setStatus(DocumentStatus.READY);
            doc.setUpdatedAt(Instant.now());
            log.info("Document {} status EMBEDDING -> READY with {} chunks", documentId, ordered.size());
            return doc.copy();
        });
    }

    /**
     * Re-creates a document and its chunks as exported. Chunks are indexed in
     * sequence order so tie-breaking matches the original index.
     */
    public Document restore(Document document, List<Chunk> chunks) {
        return withLock(document.getId(), () -> {
            if (documents.containsKey(document.getId())) {
                vectorIndex.exclusively(() -> removeCascade(document.getId()));
            }
            Document doc = document.copy();
            List<Chunk> ordered = new ArrayList<>(chunks);
            ordered.sort(Comparator.comparingInt(Chunk::sequenceIndex));
            chunkStore.putAll(ordered);
            vectorIndex.exclusively(() -> {
                ordered.forEach(c -> vectorIndex.upsert(c.id(), doc.getId(), c.vector(), doc.getEmbeddingConfigId()));
                return ordered.size();
            });
            doc.setChunkIds(new ArrayList<>(ordered.stream().map(Chunk::id).toList()));
            documents.put(doc.getId(), doc);
            return doc.copy();
        });
    }

    /**
     * Removes the document, its chunks and its index entries as one step:
     * concurrent searches see either all of them or none.
     */
    public void delete(String documentId) {
        withLock(documentId, () -> {
            require(documentId);
            int removed = vectorIndex.exclusively(() -> removeCascade(documentId));
            log.info("Document {} deleted ({} index entries removed)", documentId, removed);
            return null;
        });
    }

    public List<Chunk> chunksOf(String documentId) {
        Document doc = require(documentId);
        return chunkStore.getAll(new ArrayList<>(doc.getChunkIds()));
    }

    public ChunkStore getChunkStore() {
        return chunkStore;
    }

    public VectorIndex getVectorIndex() {
        return vectorIndex;
    }

    /**
     * Runs the action under the document's lock. The lock entry is dropped once
     * the document is gone, so lookups of unknown or deleted ids leave nothing
     * behind. A thread that wakes up holding a dropped lock retries with the
     * current one.
     */
    public <T> T withLock(String documentId, Supplier<T> action) {
        while (true) {
            ReentrantLock lock = locks.computeIfAbsent(documentId, id -> new ReentrantLock());
            lock.lock();
            try {
                if (locks.get(documentId) != lock) continue;
                try {
                    return action.get();
                } finally {
                    if (!documents.containsKey(documentId)) {
                        locks.remove(documentId, lock);
                    }
                }
            } finally {
                lock.unlock();
            }
        }
    }

    int lockCount() {
        return locks.size();
    }

    private int removeCascade(String documentId) {
        Document doc = documents.remove(documentId);
        int removed = vectorIndex.deleteByDocument(documentId);
        if (doc != null) {
            chunkStore.removeAll(doc.getChunkIds());
        }
        return removed;
    }

    private Document require(String documentId) {
        Document doc = documents.get(documentId);
        if (doc == null) {
            throw NotFoundException.document(documentId);
        }
        return doc;
    }
}
