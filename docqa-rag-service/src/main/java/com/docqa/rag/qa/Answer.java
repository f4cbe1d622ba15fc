package com.docqa.rag.qa;

import java.time.Instant;
import java.util.List;

/**
 * Result of one question. {@code citations} are the chunks placed in the
 * prompt context, most relevant first.
 */
public record Answer(
        String question,
        List<String> documentIds,
        List<Citation> citations,
        String answer,
        String providerUsed,
        double confidence,
        boolean contextFound,
        Instant timestamp
) {
    public List<String> retrievedChunkIds() {
        return citations.stream().map(Citation::chunkId).toList();
    }
}
