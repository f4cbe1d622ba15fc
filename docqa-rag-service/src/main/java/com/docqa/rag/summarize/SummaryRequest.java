package com.docqa.rag.summarize;

/**
 * One item of a summarize batch. {@code provider} is optional and overrides the
 * batch-level provider for this item only.
 */
public record SummaryRequest(String text, String provider) {

    public static SummaryRequest of(String text) {
        return new SummaryRequest(text, null);
    }
}
