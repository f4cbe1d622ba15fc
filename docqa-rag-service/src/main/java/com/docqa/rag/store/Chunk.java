package com.docqa.rag.store;

/**
 * A contiguous span of a document's text plus its embedding. Immutable once
 * created; removed only with its document. {@code documentId} is a plain id,
 * not a reference to the owning {@link Document}.
 */
public record Chunk(
        String id,
        String documentId,
        int sequenceIndex,
        String text,
        int startOffset,
        float[] vector,
        int tokenEstimate
) {}
