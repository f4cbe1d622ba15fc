package com.docqa.rag.llm;

import java.util.List;

/**
 * Text produced by {@code provider}, plus the failures of the providers tried before it.
 */
public record GenerationResult(
        String text,
        String provider,
        List<ProviderError> failures
) {}
