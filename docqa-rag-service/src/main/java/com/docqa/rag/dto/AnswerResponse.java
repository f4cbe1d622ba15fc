package com.docqa.rag.dto;

import com.docqa.rag.qa.Answer;
import com.docqa.rag.qa.Citation;

import java.time.Instant;
import java.util.List;

public record AnswerResponse(
        String question,
        String answer,
        List<String> documentIds,
        List<String> retrievedChunkIds,
        List<Citation> sources,
        String providerUsed,
        double confidence,
        boolean contextFound,
        Instant timestamp
) {
    public static AnswerResponse from(Answer a) {
        return new AnswerResponse(a.question(), a.answer(), a.documentIds(), a.retrievedChunkIds(),
                a.citations(), a.providerUsed(), a.confidence(), a.contextFound(), a.timestamp());
    }
}
