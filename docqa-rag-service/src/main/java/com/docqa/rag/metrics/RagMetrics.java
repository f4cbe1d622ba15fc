package com.docqa.rag.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for ingestion, retrieval and generation.
 * Exposed through the actuator metrics endpoint.
 */
@Component
public class RagMetrics {

    private final MeterRegistry registry;

    // Timers
    private final Timer ingestTimer;
    private final Timer qaTimer;
    private final Timer summarizeTimer;
    private final Timer searchTimer;
    private final Timer learningPathTimer;

    // Counters
    private final Counter documentsIngested;
    private final Counter documentsFailed;
    private final Counter chunksCreated;
    private final Counter fallbacksTaken;
    private final Counter providersExhausted;

    public RagMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.ingestTimer = Timer.builder("docqa.ingest.duration")
                .description("Time to extract, chunk and embed a document")
                .tags("operation", "ingest")
                .register(registry);

        this.qaTimer = Timer.builder("docqa.qa.duration")
                .description("Total question answering duration")
                .tags("operation", "qa")
                .register(registry);

        this.summarizeTimer = Timer.builder("docqa.summarize.duration")
                .description("Total summarization duration")
                .tags("operation", "summarize")
                .register(registry);

        this.searchTimer = Timer.builder("docqa.vector.search.duration")
                .description("Time for in-memory vector similarity search")
                .tags("component", "index")
                .register(registry);

        this.learningPathTimer = Timer.builder("docqa.learning_path.duration")
                .description("Total learning path generation duration")
                .tags("operation", "learning_path")
                .register(registry);

        this.documentsIngested = Counter.builder("docqa.documents.ingested")
                .description("Documents that reached READY")
                .register(registry);

        this.documentsFailed = Counter.builder("docqa.documents.failed")
                .description("Documents that ended in FAILED")
                .register(registry);

        this.chunksCreated = Counter.builder("docqa.chunks.created")
                .description("Chunks created during ingestion")
                .register(registry);

        this.fallbacksTaken = Counter.builder("docqa.llm.fallbacks")
                .description("Generations answered by a provider other than the first in order")
                .register(registry);

        this.providersExhausted = Counter.builder("docqa.llm.exhausted")
                .description("Generations where every provider failed")
                .register(registry);
    }

    public void recordIngest(long durationMs, int chunks) {
        ingestTimer.record(durationMs, TimeUnit.MILLISECONDS);
        documentsIngested.increment();
        chunksCreated.increment(chunks);
    }

    public void recordIngestFailure() {
        documentsFailed.increment();
    }

    public void recordQa(long durationMs) {
        qaTimer.record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordSummarize(long durationMs) {
        summarizeTimer.record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordLearningPath(long durationMs) {
        learningPathTimer.record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordSearch(long durationMs) {
        searchTimer.record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordGeneration(String provider, long durationMs, boolean fallback) {
        Timer.builder("docqa.llm.generate.duration")
                .description("Time for a provider to generate a response")
                .tags("provider", provider)
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
        if (fallback) {
            fallbacksTaken.increment();
        }
    }

    public void recordProviderFailure(String provider, String kind) {
        registry.counter("docqa.llm.provider.failures", "provider", provider, "kind", kind).increment();
    }

    public void recordExhausted() {
        providersExhausted.increment();
    }
}
