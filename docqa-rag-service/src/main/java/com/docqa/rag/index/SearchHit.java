package com.docqa.rag.index;

public record SearchHit(
        String chunkId,
        String documentId,
        double score
) {}
