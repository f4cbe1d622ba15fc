package com.docqa.rag.qa;

public record Citation(
        String chunkId,
        String documentId,
        int sequenceIndex,
        double score
) {}
