package com.docqa.rag.qa;

import com.docqa.rag.embedding.EmbeddingService;
import com.docqa.rag.error.DimensionMismatchException;
import com.docqa.rag.error.InvalidRequestException;
import com.docqa.rag.index.SearchHit;
import com.docqa.rag.index.VectorIndex;
import com.docqa.rag.llm.GenerationResult;
import com.docqa.rag.llm.LlmGateway;
import com.docqa.rag.metrics.RagMetrics;
import com.docqa.rag.store.Chunk;
import com.docqa.rag.store.ChunkStore;
import com.docqa.rag.store.Document;
import com.docqa.rag.store.DocumentStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Answers a question from the chunks of selected documents: embed the question,
 * retrieve the top-k chunks, pack them into a bounded context and ask the gateway.
 * With no documents selected, or nothing relevant retrieved, the gateway is still
 * called with {@link #NO_CONTEXT_MARKER} as the context.
 */
@Slf4j
public class QaOrchestrator {

    public static final String NO_CONTEXT_MARKER = "[NO RELEVANT CONTEXT FOUND]";

    private static final String CONTEXT_SEPARATOR = "\n\n---\n\n";

    private final DocumentStore documentStore;
    private final EmbeddingService embeddingService;
    private final LlmGateway gateway;
    private final int maxContextChars;
    private final double minRelevanceScore;
    private final RagMetrics metrics;

    public QaOrchestrator(DocumentStore documentStore,
                          EmbeddingService embeddingService,
                          LlmGateway gateway,
                          int maxContextChars,
                          double minRelevanceScore,
                          RagMetrics metrics) {
        this.documentStore = documentStore;
        this.embeddingService = embeddingService;
        this.gateway = gateway;
        this.maxContextChars = maxContextChars;
        this.minRelevanceScore = minRelevanceScore;
        this.metrics = metrics;
    }

    public Answer answer(String question, List<String> documentIds, int k, List<String> providerOrder) {
        long totalStart = System.currentTimeMillis();
        if (question == null || question.isBlank()) {
            throw new InvalidRequestException("question is required");
        }
        if (documentIds == null) {
            throw new InvalidRequestException("document ids are required");
        }
        if (k < 1) {
            throw new InvalidRequestException("k must be >= 1, got " + k);
        }

        List<String> ids = List.copyOf(new LinkedHashSet<>(documentIds));
        Map<String, Document> documents = ids.stream()
                .map(documentStore::get)
                .collect(Collectors.toMap(Document::getId, Function.identity()));
        requireCompatibleEmbeddings(ids);

        List<SearchHit> hits = List.of();
        if (!ids.isEmpty()) {
            float[] queryVector = embeddingService.embed(question);
            long searchStart = System.currentTimeMillis();
            VectorIndex index = documentStore.getVectorIndex();
            hits = index.search(queryVector, k, ids);
            long searchMs = System.currentTimeMillis() - searchStart;
            metrics.recordSearch(searchMs);
            log.debug("[TIMING] Vector search (k={}): {}ms", k, searchMs);
        }

        List<SearchHit> relevant = hits.stream()
                .filter(h -> h.score() >= minRelevanceScore)
                .toList();
        ContextWindow context = assembleContext(relevant, documents);

        String prompt = buildPrompt(context.text(), question);
        GenerationResult result = gateway.generate(prompt, providerOrder);

        double confidence = context.citations().isEmpty() ? 0.0 : context.citations().get(0).score();
        long totalMs = System.currentTimeMillis() - totalStart;
        metrics.recordQa(totalMs);
        log.info("[TIMING] QA over {} document(s): {} hit(s), {} cited, provider={}, {}ms",
                ids.size(), hits.size(), context.citations().size(), result.provider(), totalMs);

        return new Answer(question, ids, context.citations(), result.text(), result.provider(),
                confidence, !context.citations().isEmpty(), Instant.now());
    }

    /**
     * Packs chunk texts in descending score order until the character budget is
     * used up; the lowest-scoring chunks are the ones left out. The best chunk is
     * cut to the budget when it alone does not fit.
     */
    ContextWindow assembleContext(List<SearchHit> hits, Map<String, Document> documents) {
        ChunkStore chunks = documentStore.getChunkStore();
        StringBuilder sb = new StringBuilder();
        List<Citation> citations = new ArrayList<>();

        for (SearchHit hit : hits) {
            Optional<Chunk> chunk = chunks.get(hit.chunkId());
            if (chunk.isEmpty()) continue; // deleted after the search

            Chunk c = chunk.get();
            Document doc = documents.get(c.documentId());
            String header = "[" + (citations.size() + 1) + "] "
                    + (doc != null ? doc.getFilename() : c.documentId())
                    + " (chunk " + c.sequenceIndex() + ")\n";
            String separator = sb.length() == 0 ? "" : CONTEXT_SEPARATOR;
            int remaining = maxContextChars - sb.length() - separator.length() - header.length();

            if (c.text().length() <= remaining) {
                sb.append(separator).append(header).append(c.text());
            } else if (citations.isEmpty() && remaining > 0) {
                sb.append(header).append(cutAtWhitespace(c.text(), remaining));
            } else {
                break;
            }
            citations.add(new Citation(c.id(), c.documentId(), c.sequenceIndex(), hit.score()));
        }

        String text = citations.isEmpty() ? NO_CONTEXT_MARKER : sb.toString();
        return new ContextWindow(text, List.copyOf(citations));
    }

    String buildPrompt(String context, String question) {
        return """
You are a helpful assistant. Answer the question using ONLY the context below.
If no relevant context was found or the context does not contain the answer, say that you don't know.

Context:
%s

Question: %s
Answer:""".formatted(context, question);
    }

    private void requireCompatibleEmbeddings(List<String> documentIds) {
        Set<String> configs = documentStore.getVectorIndex().embeddingConfigsOf(documentIds);
        if (configs.size() > 1) {
            throw new DimensionMismatchException("Selected documents were embedded with different configurations: " + configs);
        }
        String active = embeddingService.getConfigurationId();
        if (configs.size() == 1 && !configs.contains(active)) {
            throw new DimensionMismatchException("Documents were embedded with " + configs.iterator().next()
                    + " but questions are embedded with " + active);
        }
    }

    private static String cutAtWhitespace(String text, int limit) {
        if (text.length() <= limit) return text;
        int cut = limit;
        while (cut > 0 && !Character.isWhitespace(text.charAt(cut))) cut--;
        return text.substring(0, cut == 0 ? limit : cut);
    }

    record ContextWindow(String text, List<Citation> citations) {}
}
