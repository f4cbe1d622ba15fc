package com.docqa.rag.index;

/**
 * One vector in the index. Holds no chunk text; {@code chunkId} points back
 * into the chunk store. {@code sequence} is the insertion position used to
 * break score ties.
 */
public record IndexEntry(
        String chunkId,
        String documentId,
        float[] vector,
        String embeddingConfigId,
        long sequence
) {
    public int dimension() {
        return vector.length;
    }
}
