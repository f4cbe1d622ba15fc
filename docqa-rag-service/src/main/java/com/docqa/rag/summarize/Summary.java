package com.docqa.rag.summarize;

/**
 * A summary with its word counts. {@code chunkCount} is 1 for a single pass.
 */
public record Summary(
        String summary,
        String providerUsed,
        int originalLength,
        int summaryLength,
        int chunkCount,
        boolean mapReduced
) {}
