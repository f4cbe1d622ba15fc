package com.docqa.rag.service;

import com.docqa.rag.chunk.TextChunker;
import com.docqa.rag.chunk.TextSegment;
import com.docqa.rag.embedding.EmbeddingService;
import com.docqa.rag.error.DocQaException;
import com.docqa.rag.error.EmptyDocumentException;
import com.docqa.rag.error.InvalidRequestException;
import com.docqa.rag.error.InvalidStateTransitionException;
import com.docqa.rag.error.NotFoundException;
import com.docqa.rag.error.OperationCancelledException;
import com.docqa.rag.extract.DocumentTextExtractor;
import com.docqa.rag.extract.DocumentType;
import com.docqa.rag.metrics.RagMetrics;
import com.docqa.rag.store.Chunk;
import com.docqa.rag.store.Document;
import com.docqa.rag.store.DocumentStatus;
import com.docqa.rag.store.DocumentStore;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;

/**
 * Runs the ingestion pipeline of a document in the background:
 * UPLOADING, EXTRACTING, CHUNKING, EMBEDDING, then READY.
 *
 * <p>Any failure moves the document to FAILED with the error message. Cancelling
 * interrupts the pipeline and moves the document to FAILED with reason
 * {@value #CANCELLED_REASON}.
 */
@Slf4j
public class IngestionService {

    public static final String CANCELLED_REASON = "Cancelled";

    private final DocumentStore documentStore;
    private final DocumentTextExtractor extractor;
    private final TextChunker chunker;
    private final EmbeddingService embeddingService;
    private final Executor executor;
    private final RagMetrics metrics;
    private final Map<String, FutureTask<Void>> inFlight = new ConcurrentHashMap<>();

    public IngestionService(DocumentStore documentStore,
                            DocumentTextExtractor extractor,
                            TextChunker chunker,
                            EmbeddingService embeddingService,
                            Executor executor,
                            RagMetrics metrics) {
        this.documentStore = documentStore;
        this.extractor = extractor;
        this.chunker = chunker;
        this.embeddingService = embeddingService;
        this.executor = executor;
        this.metrics = metrics;
    }

    /**
     * Accepts the upload and schedules the pipeline. An unsupported type is
     * rejected before a document is created.
     *
     * @return the new document, in UPLOADING
     */
    public Document ingest(byte[] bytes, String filename, String mimeType) {
        if (bytes == null) {
            throw new InvalidRequestException("document content is required");
        }
        DocumentType type = DocumentType.resolve(mimeType, filename);
        Document doc = documentStore.create(filename, type.getMimeType(), bytes.length);

        FutureTask<Void> task = new FutureTask<>(() -> run(doc.getId(), bytes, type, filename), null);
        inFlight.put(doc.getId(), task);
        executor.execute(task);
        return doc;
    }

    /**
     * Cancels an in-flight ingestion.
     *
     * @throws InvalidStateTransitionException when the document is already READY or FAILED
     */
    public Document cancel(String documentId) {
        Document doc = documentStore.get(documentId);
        boolean changed = documentStore.failIfInProgress(documentId, CANCELLED_REASON);
        if (!changed) {
            throw new InvalidStateTransitionException(documentId, doc.getStatus(), DocumentStatus.FAILED);
        }
        abandon(documentId);
        log.info("Ingestion of document {} cancelled", documentId);
        return documentStore.get(documentId);
    }

    /**
     * Stops the pipeline of the document, if one is running, without touching
     * its status.
     */
    public void abandon(String documentId) {
        FutureTask<Void> task = inFlight.remove(documentId);
        if (task != null) {
            task.cancel(true);
        }
    }

    public boolean isInFlight(String documentId) {
        return inFlight.containsKey(documentId);
    }

    void run(String documentId, byte[] bytes, DocumentType type, String filename) {
        long start = System.currentTimeMillis();
        try {
            documentStore.updateStatus(documentId, DocumentStatus.EXTRACTING);
            String text = extractor.extract(bytes, type, filename);
            checkCancelled(documentId);

            documentStore.updateStatus(documentId, DocumentStatus.CHUNKING);
            List<TextSegment> segments = chunker.split(text);
            if (segments.isEmpty()) {
                throw new EmptyDocumentException(filename);
            }
            checkCancelled(documentId);

            documentStore.updateStatus(documentId, DocumentStatus.EMBEDDING);
            long embedStart = System.currentTimeMillis();
            List<float[]> vectors = embeddingService.embedAll(segments.stream().map(TextSegment::text).toList());
            log.debug("[TIMING] Embedding {} chunks of {}: {}ms", segments.size(), documentId,
                    System.currentTimeMillis() - embedStart);
            checkCancelled(documentId);

            List<Chunk> chunks = new ArrayList<>(segments.size());
            for (int i = 0; i < segments.size(); i++) {
                TextSegment s = segments.get(i);
                chunks.add(new Chunk(documentId + "#" + s.index(), documentId, s.index(), s.text(),
                        s.startOffset(), vectors.get(i), s.tokenEstimate()));
            }
            documentStore.publishChunks(documentId, chunks, embeddingService.getConfigurationId());

            long elapsed = System.currentTimeMillis() - start;
            metrics.recordIngest(elapsed, chunks.size());
            log.info("[TIMING] Ingested {} ({} chars, {} chunks): {}ms", documentId, text.length(), chunks.size(), elapsed);
        } catch (OperationCancelledException e) {
            documentStore.failIfInProgress(documentId, CANCELLED_REASON);
            log.info("Ingestion of document {} stopped: {}", documentId, e.getMessage());
        } catch (NotFoundException e) {
            log.info("Document {} was deleted during ingestion", documentId);
        } catch (DocQaException e) {
            fail(documentId, e.getMessage(), e);
        } catch (RuntimeException e) {
            fail(documentId, e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        } finally {
            inFlight.remove(documentId);
        }
    }

    private void fail(String documentId, String reason, Exception e) {
        if (documentStore.failIfInProgress(documentId, reason)) {
            metrics.recordIngestFailure();
            log.error("Ingestion of document {} failed: {}", documentId, reason, e);
        } else {
            log.debug("Ingestion of document {} ended after it was finalised elsewhere: {}", documentId, reason);
        }
    }

    private void checkCancelled(String documentId) {
        if (Thread.currentThread().isInterrupted()) {
            throw new OperationCancelledException("Ingestion of " + documentId + " was interrupted");
        }
    }
}
