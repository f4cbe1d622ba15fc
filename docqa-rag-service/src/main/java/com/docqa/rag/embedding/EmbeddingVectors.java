package com.docqa.rag.embedding;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Vector helpers shared by the embedding clients and the vector index.
 */
public final class EmbeddingVectors {

    static float[] toFloatArray(JsonNode arr) {
        float[] out = new float[arr.size()];
        for (int i = 0; i < arr.size(); i++) {
            out[i] = (float) arr.get(i).asDouble();
        }
        return out;
    }

    /**
     * Cosine similarity in [-1, 1]; 0 when either vector has zero norm.
     */
    public static double cosine(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Vector lengths differ: " + a.length + " vs " + b.length);
        }
        double dot = 0;
        double na = 0;
        double nb = 0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            na += (double) a[i] * a[i];
            nb += (double) b[i] * b[i];
        }
        if (na == 0 || nb == 0) return 0.0;
        double score = dot / (Math.sqrt(na) * Math.sqrt(nb));
        // Rounding can push identical vectors slightly past 1
        return Math.max(-1.0, Math.min(1.0, score));
    }

    private EmbeddingVectors() {}
}
