package com.docqa.rag.dto;

import com.docqa.rag.summarize.Summary;

public record SummaryResponse(
        String summary,
        int originalLength,
        int summaryLength,
        String providerUsed,
        int chunkCount,
        boolean mapReduced
) {
    public static SummaryResponse from(Summary s) {
        return new SummaryResponse(s.summary(), s.originalLength(), s.summaryLength(), s.providerUsed(),
                s.chunkCount(), s.mapReduced());
    }
}
