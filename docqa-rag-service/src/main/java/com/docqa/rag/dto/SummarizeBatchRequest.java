package com.docqa.rag.dto;

import com.docqa.rag.summarize.SummaryRequest;

import java.util.List;

/**
 * Either plain {@code texts} or {@code items} with a provider per text.
 * {@code items} wins when both are given.
 */
public record SummarizeBatchRequest(
        List<String> texts,
        List<SummaryRequest> items,
        Integer maxLength,
        String provider
) {
    public List<SummaryRequest> requests() {
        if (items != null && !items.isEmpty()) return items;
        return texts == null ? List.of() : texts.stream().map(SummaryRequest::of).toList();
    }

    public int maxLengthOrDefault() {
        return maxLength != null ? maxLength : SummarizeRequest.DEFAULT_MAX_LENGTH;
    }
}
