package com.docqa.rag.llm;

public record ProviderError(
        String provider,
        ProviderFailureKind kind,
        String message,
        long elapsedMs
) {}
