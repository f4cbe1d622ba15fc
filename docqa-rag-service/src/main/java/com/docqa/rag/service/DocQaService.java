package com.docqa.rag.service;

import com.docqa.rag.error.DocQaException;
import com.docqa.rag.error.InvalidRequestException;
import com.docqa.rag.error.OperationCancelledException;
import com.docqa.rag.llm.ProviderDescriptor;
import com.docqa.rag.llm.ProviderRegistry;
import com.docqa.rag.persist.DocumentSetExporter;
import com.docqa.rag.qa.Answer;
import com.docqa.rag.qa.QaOrchestrator;
import com.docqa.rag.store.Document;
import com.docqa.rag.store.DocumentStatus;
import com.docqa.rag.store.DocumentStore;
import com.docqa.rag.summarize.SummarizationOrchestrator;
import com.docqa.rag.summarize.Summary;
import com.docqa.rag.summarize.SummaryRequest;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.Function;

/**
 * The operations the REST layer calls: document lifecycle, questions,
 * summaries and provider listing.
 *
 * <p>Batch calls fan items out on the batch executor and return one
 * {@link BatchItemResult} per input, in input order. With fail-fast enabled
 * the first failed item aborts the batch instead.
 */
@Slf4j
public class DocQaService {

    private final DocumentStore documentStore;
    private final IngestionService ingestionService;
    private final QaOrchestrator qaOrchestrator;
    private final SummarizationOrchestrator summarizer;
    private final ProviderRegistry providerRegistry;
    private final DocumentSetExporter exporter;
    private final ExecutorService batchExecutor;
    private final int defaultTopK;
    private final boolean failFast;

    public DocQaService(DocumentStore documentStore,
                        IngestionService ingestionService,
                        QaOrchestrator qaOrchestrator,
                        SummarizationOrchestrator summarizer,
                        ProviderRegistry providerRegistry,
                        DocumentSetExporter exporter,
                        ExecutorService batchExecutor,
                        int defaultTopK,
                        boolean failFast) {
        this.documentStore = documentStore;
        this.ingestionService = ingestionService;
        this.qaOrchestrator = qaOrchestrator;
        this.summarizer = summarizer;
        this.providerRegistry = providerRegistry;
        this.exporter = exporter;
        this.batchExecutor = batchExecutor;
        this.defaultTopK = defaultTopK;
        this.failFast = failFast;
    }

    // ---- documents ----

    public Document ingestDocument(byte[] bytes, String filename, String mimeType) {
        return ingestionService.ingest(bytes, filename, mimeType);
    }

    public Document getDocument(String documentId) {
        return documentStore.get(documentId);
    }

    public DocumentStatus getDocumentStatus(String documentId) {
        return documentStore.get(documentId).getStatus();
    }

    public List<Document> listDocuments() {
        return documentStore.list();
    }

    public void deleteDocument(String documentId) {
        ingestionService.abandon(documentId);
        documentStore.delete(documentId);
    }

    public Document cancelIngestion(String documentId) {
        return ingestionService.cancel(documentId);
    }

    // ---- questions ----

    /**
     * Answers over the given documents, or over every READY document when none
     * are given.
     */
    public Answer ask(String question, List<String> documentIds, String provider, Integer k) {
        List<String> ids = documentIds == null || documentIds.isEmpty() ? readyDocumentIds() : documentIds;
        return qaOrchestrator.answer(question, ids, k == null ? defaultTopK : k, preference(provider));
    }

    public List<BatchItemResult<Answer>> askBatch(List<String> questions, List<String> documentIds,
                                                  String provider, Integer k) {
        if (questions == null || questions.isEmpty()) {
            throw new InvalidRequestException("at least one question is required");
        }
        if (documentIds == null || documentIds.isEmpty()) {
            throw new InvalidRequestException("at least one document id is required");
        }
        List<String> ids = List.copyOf(documentIds);
        return runBatch("ask", questions, q -> ask(q, ids, provider, k));
    }

    // ---- summaries ----

    public Summary summarize(String text, int maxLength, String provider) {
        return summarizer.summarize(text, maxLength, preference(provider));
    }

    public List<BatchItemResult<Summary>> summarizeBatch(List<String> texts, int maxLength, String provider) {
        if (texts == null) {
            throw new InvalidRequestException("texts are required");
        }
        return summarizeRequests(texts.stream().map(SummaryRequest::of).toList(), maxLength, provider);
    }

    /**
     * Like {@link #summarizeBatch(List, int, String)}, with an optional provider
     * per item that takes precedence over {@code provider}.
     */
    public List<BatchItemResult<Summary>> summarizeRequests(List<SummaryRequest> requests, int maxLength, String provider) {
        if (requests == null || requests.isEmpty()) {
            throw new InvalidRequestException("at least one text is required");
        }
        if (maxLength < 1) {
            throw new InvalidRequestException("max_length must be >= 1, got " + maxLength);
        }
        return runBatch("summarize", requests, r ->
                summarize(r.text(), maxLength, r.provider() != null ? r.provider() : provider));
    }

    // ---- providers / persistence ----

    public List<ProviderDescriptor> listAvailableProviders() {
        return providerRegistry.describe(true);
    }

    public int exportDocuments(Path path) {
        return exporter.export(path);
    }

    public int importDocuments(Path path) {
        return exporter.importFrom(path);
    }

    private <I, T> List<BatchItemResult<T>> runBatch(String operation, List<I> items, Function<I, T> work) {
        long start = System.currentTimeMillis();
        List<Future<T>> futures = new ArrayList<>(items.size());
        for (I item : items) {
            futures.add(batchExecutor.submit(() -> work.apply(item)));
        }

        List<BatchItemResult<T>> results = new ArrayList<>(items.size());
        try {
            for (int i = 0; i < futures.size(); i++) {
                try {
                    results.add(BatchItemResult.success(i, futures.get(i).get()));
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    if (failFast) {
                        futures.forEach(f -> f.cancel(true));
                        throw asRuntime(cause);
                    }
                    log.warn("{} batch item {} failed: {}", operation, i, cause.getMessage());
                    results.add(BatchItemResult.failure(i, cause));
                }
            }
        } catch (InterruptedException e) {
            futures.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new OperationCancelledException(operation + " batch was cancelled", e);
        }

        long failed = results.stream().filter(r -> !r.isSuccess()).count();
        log.info("[TIMING] {} batch of {} item(s), {} failed: {}ms",
                operation, items.size(), failed, System.currentTimeMillis() - start);
        return results;
    }

    private List<String> readyDocumentIds() {
        return documentStore.list().stream()
                .filter(d -> d.getStatus() == DocumentStatus.READY)
                .map(Document::getId)
                .toList();
    }

    private static RuntimeException asRuntime(Throwable cause) {
        if (cause instanceof DocQaException) {
            return (DocQaException) cause;
        }
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        return new IllegalStateException(cause);
    }

    private static List<String> preference(String provider) {
        return provider == null || provider.isBlank() ? List.of() : List.of(provider);
    }
}
