package com.docqa.rag.embedding;

import com.docqa.rag.error.EmbeddingFailureException;
import com.docqa.rag.error.OperationCancelledException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;

/**
 * Embeds texts with the active {@link EmbeddingProvider}. Large inputs are cut
 * into sub-batches that run in parallel; results keep input order and the
 * first failing input position is reported.
 */
@Slf4j
public class EmbeddingService {

    private final EmbeddingProvider provider;
    private final ExecutorService executor;
    private final int batchSize;
    private final Semaphore permits;

    public EmbeddingService(EmbeddingProvider provider, ExecutorService executor, int batchSize, int maxConcurrent) {
        this.provider = provider;
        this.executor = executor;
        this.batchSize = Math.max(1, batchSize);
        this.permits = new Semaphore(Math.max(1, maxConcurrent));
    }

    public EmbeddingProvider getProvider() {
        return provider;
    }

    public String getConfigurationId() {
        return provider.getConfigurationId();
    }

    public float[] embed(String text) {
        try {
            return provider.embed(text);
        } catch (EmbeddingFailureException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EmbeddingFailureException(provider.getName() + " failed to embed text: " + e.getMessage(), e);
        }
    }

    public List<float[]> embedAll(List<String> texts) {
        if (texts.isEmpty()) return List.of();

        List<Future<List<float[]>>> futures = new ArrayList<>();
        for (int offset = 0; offset < texts.size(); offset += batchSize) {
            int from = offset;
            List<String> slice = texts.subList(from, Math.min(from + batchSize, texts.size()));
            futures.add(executor.submit(() -> embedSlice(slice, from)));
        }

        List<float[]> out = new ArrayList<>(texts.size());
        try {
            for (Future<List<float[]>> f : futures) {
                out.addAll(f.get());
            }
        } catch (InterruptedException e) {
            futures.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new OperationCancelledException("Embedding was cancelled", e);
        } catch (ExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            Throwable cause = e.getCause();
            if (cause instanceof EmbeddingFailureException) {
                throw (EmbeddingFailureException) cause;
            }
            throw new EmbeddingFailureException("Embedding batch failed: " + cause.getMessage(), cause);
        }

        checkDimensions(out);
        log.debug("Embedded {} texts in {} sub-batches with {}", texts.size(), futures.size(), provider.getName());
        return out;
    }

    private List<float[]> embedSlice(List<String> slice, int offset) throws InterruptedException {
        permits.acquire();
        try {
            return provider.embedBatch(slice);
        } catch (EmbeddingFailureException e) {
            int index = offset + Math.max(0, e.getFailedIndex());
            throw new EmbeddingFailureException(index,
                    "Embedding failed at index " + index + ": " + e.getMessage(), e.getCause());
        } catch (RuntimeException e) {
            throw new EmbeddingFailureException(offset,
                    "Embedding failed at index " + offset + ": " + e.getMessage(), e);
        } finally {
            permits.release();
        }
    }

    private void checkDimensions(List<float[]> vectors) {
        int dim = vectors.get(0).length;
        for (int i = 1; i < vectors.size(); i++) {
            if (vectors.get(i).length != dim) {
                throw new EmbeddingFailureException(i,
                        "Embedding at index " + i + " has dimension " + vectors.get(i).length + ", expected " + dim, null);
            }
        }
    }
}
