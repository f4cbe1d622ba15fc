package com.docqa.rag.summarize;

import com.docqa.rag.chunk.TextChunker;
import com.docqa.rag.error.DocQaException;
import com.docqa.rag.error.InvalidRequestException;
import com.docqa.rag.error.OperationCancelledException;
import com.docqa.rag.llm.GenerationResult;
import com.docqa.rag.llm.LlmGateway;
import com.docqa.rag.metrics.RagMetrics;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Summarizes text in one pass when it fits, otherwise in two phases: a map
 * phase that summarizes each chunk in parallel, and a reduce phase that
 * summarizes the joined partial summaries. The reduce input is re-chunked and
 * mapped again while it is still too long, up to {@code maxReduceRounds}.
 */
@Slf4j
public class SummarizationOrchestrator {

    private static final int MIN_PARTIAL_WORDS = 60;

    private final LlmGateway gateway;
    private final ExecutorService mapExecutor;
    private final int singlePassChars;
    private final TextChunker chunker;
    private final int maxReduceRounds;
    private final RagMetrics metrics;

    public SummarizationOrchestrator(LlmGateway gateway,
                                     ExecutorService mapExecutor,
                                     int singlePassChars,
                                     int chunkChars,
                                     int chunkOverlapChars,
                                     int maxReduceRounds,
                                     RagMetrics metrics) {
        this.gateway = gateway;
        this.mapExecutor = mapExecutor;
        this.singlePassChars = singlePassChars;
        this.chunker = new TextChunker(chunkChars, chunkOverlapChars);
        this.maxReduceRounds = Math.max(1, maxReduceRounds);
        this.metrics = metrics;
    }

    public Summary summarize(String text, int maxLength, List<String> providerOrder) {
        if (text == null || text.isBlank()) {
            throw new InvalidRequestException("text to summarize is required");
        }
        if (maxLength < 1) {
            throw new InvalidRequestException("max_length must be >= 1, got " + maxLength);
        }
        long start = System.currentTimeMillis();
        int originalWords = countWords(text);

        if (text.length() <= singlePassChars) {
            GenerationResult result = gateway.generate(summaryPrompt(text, maxLength), providerOrder, tokenBudget(maxLength));
            return finish(result, maxLength, originalWords, 1, false, start);
        }

        String current = text;
        int chunkCount = 0;
        int rounds = 0;
        while (current.length() > singlePassChars && rounds < maxReduceRounds) {
            List<String> chunks = chunker.chunk(current);
            if (rounds == 0) chunkCount = chunks.size();
            List<String> partials = mapPhase(chunks, Math.max(MIN_PARTIAL_WORDS, maxLength), providerOrder);
            current = String.join("\n\n", partials);
            rounds++;
            log.debug("Map round {}: {} chunk(s) -> {} chars of partial summaries", rounds, chunks.size(), current.length());
        }

        GenerationResult reduced = gateway.generate(reducePrompt(current, maxLength), providerOrder, tokenBudget(maxLength));
        return finish(reduced, maxLength, originalWords, chunkCount, true, start);
    }

    /**
     * Summarizes every chunk independently. Results keep chunk order; the first
     * failure (in chunk order) fails the phase and cancels the rest.
     */
    List<String> mapPhase(List<String> chunks, int partialWords, List<String> providerOrder) {
        List<Future<String>> futures = new ArrayList<>(chunks.size());
        for (String chunk : chunks) {
            futures.add(mapExecutor.submit(() ->
                    gateway.generate(summaryPrompt(chunk, partialWords), providerOrder, tokenBudget(partialWords)).text()));
        }
        List<String> partials = new ArrayList<>(chunks.size());
        try {
            for (Future<String> f : futures) {
                partials.add(f.get());
            }
        } catch (InterruptedException e) {
            futures.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new OperationCancelledException("Summarization cancelled during the map phase", e);
        } catch (ExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            Throwable cause = e.getCause();
            if (cause instanceof DocQaException) {
                throw (DocQaException) cause;
            }
            throw new IllegalStateException("Map phase failed", cause);
        }
        return partials;
    }

    private Summary finish(GenerationResult result, int maxLength, int originalWords,
                           int chunkCount, boolean mapReduced, long start) {
        String summary = fitToLength(result.text(), maxLength);
        long elapsed = System.currentTimeMillis() - start;
        metrics.recordSummarize(elapsed);
        log.info("[TIMING] Summarized {} words into {} ({} chunk(s), map-reduce={}, provider={}): {}ms",
                originalWords, countWords(summary), chunkCount, mapReduced, result.provider(), elapsed);
        return new Summary(summary, result.provider(), originalWords, countWords(summary), chunkCount, mapReduced);
    }

    /**
     * Cuts text that overshoots the word budget at the last sentence end inside
     * the budget, or at the last whole word when no sentence ends there.
     */
    static String fitToLength(String text, int maxWords) {
        String trimmed = text.trim();
        int words = 0;
        int end = -1;
        int i = 0;
        while (i < trimmed.length()) {
            while (i < trimmed.length() && Character.isWhitespace(trimmed.charAt(i))) i++;
            if (i >= trimmed.length()) break;
            while (i < trimmed.length() && !Character.isWhitespace(trimmed.charAt(i))) i++;
            words++;
            if (words == maxWords) {
                end = i;
                break;
            }
        }
        if (end < 0 || end >= trimmed.length()) {
            return trimmed;
        }
        String prefix = trimmed.substring(0, end);
        for (int j = prefix.length() - 1; j > 0; j--) {
            char c = prefix.charAt(j);
            if (c == '.' || c == '!' || c == '?') {
                return prefix.substring(0, j + 1);
            }
        }
        return prefix;
    }

    static int countWords(String text) {
        String trimmed = text == null ? "" : text.trim();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }

    private static int tokenBudget(int words) {
        return Math.max(64, words * 2);
    }

    private static String summaryPrompt(String text, int maxWords) {
        return """
Summarize the following text in at most %d words.
Keep the key facts, names and numbers. Do not add information that is not in the text.

Text:
%s

Summary:""".formatted(maxWords, text);
    }

    private static String reducePrompt(String partials, int maxWords) {
        return """
The following are summaries of consecutive sections of one document.
Combine them into a single coherent summary of at most %d words.

Section summaries:
%s

Summary:""".formatted(maxWords, partials);
    }
}
