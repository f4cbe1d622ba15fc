package com.docqa.rag.embedding;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * In-process embedder based on signed feature hashing of word unigrams and
 * bigrams. Deterministic and dependency-free, so the service can run without
 * a model server. Vectors are L2-normalised; text with no indexable terms
 * maps to the zero vector.
 */
public final class HashingEmbeddingProvider implements EmbeddingProvider {

    private static final Set<String> STOPWORDS = Set.of(
            "the", "and", "for", "are", "but", "not", "you", "all",
            "can", "had", "her", "was", "one", "our", "out", "has",
            "have", "been", "were", "they", "this", "that", "with",
            "from", "will", "would", "there", "their", "what", "about",
            "which", "when", "into", "your", "some", "could", "them",
            "than", "then", "its", "also", "how", "who", "does", "any",
            "these", "being", "is", "it", "of", "to", "in", "on", "a"
    );

    private final String name;
    private final int dimension;

    public HashingEmbeddingProvider(String name, int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be > 0, got " + dimension);
        }
        this.name = name;
        this.dimension = dimension;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getConfigurationId() {
        return "local-hash:" + dimension;
    }

    public int getDimension() {
        return dimension;
    }

    @Override
    public float[] embed(String text) {
        float[] vec = new float[dimension];
        List<String> tokens = tokenize(text);
        for (int i = 0; i < tokens.size(); i++) {
            accumulate(vec, tokens.get(i), 1.0f);
            if (i > 0) {
                accumulate(vec, tokens.get(i - 1) + "_" + tokens.get(i), 0.5f);
            }
        }
        normalize(vec);
        return vec;
    }

    static List<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return Arrays.stream(text.toLowerCase(Locale.ROOT)
                        .replaceAll("[^\\p{L}\\p{N}\\s]", " ")
                        .split("\\s+"))
                .filter(t -> t.length() > 2)
                .filter(t -> !STOPWORDS.contains(t))
                .collect(Collectors.toList());
    }

    private void accumulate(float[] vec, String feature, float weight) {
        int h = fnv1a(feature);
        int bucket = Math.floorMod(h, dimension);
        // High bit decides the sign so collisions tend to cancel rather than add up
        float sign = (h >>> 31) == 0 ? 1.0f : -1.0f;
        vec[bucket] += sign * weight;
    }

    private static void normalize(float[] vec) {
        double sum = 0;
        for (float v : vec) sum += (double) v * v;
        if (sum == 0) return;
        float norm = (float) Math.sqrt(sum);
        for (int i = 0; i < vec.length; i++) vec[i] /= norm;
    }

    private static int fnv1a(String s) {
        int hash = 0x811c9dc5;
        for (byte b : s.getBytes(StandardCharsets.UTF_8)) {
            hash ^= (b & 0xff);
            hash *= 0x01000193;
        }
        return hash;
    }
}
