package com.docqa.rag.embedding;

import com.docqa.rag.error.EmbeddingFailureException;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps text to a fixed-dimension vector. Vectors produced under different
 * {@link #getConfigurationId() configurations} are not comparable.
 */
public interface EmbeddingProvider {

    String getName();

    /**
     * Identifies the model and settings that produced a vector, e.g. "ollama:nomic-embed-text".
     */
    String getConfigurationId();

    float[] embed(String text);

    /**
     * Embeds every text in order. A single failure fails the call with the
     * failing position in {@link EmbeddingFailureException#getFailedIndex()}.
     */
    default List<float[]> embedBatch(List<String> texts) {
        List<float[]> out = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i++) {
            try {
                out.add(embed(texts.get(i)));
            } catch (RuntimeException e) {
                throw new EmbeddingFailureException(i,
                        getName() + " failed to embed item " + i + ": " + e.getMessage(), e);
            }
        }
        return out;
    }

    default boolean isAvailable() {
        return true;
    }
}
