package com.docqa.rag.llm;

public enum ProviderFailureKind {
    TIMEOUT,
    AUTHENTICATION,
    RATE_LIMITED,
    MALFORMED_RESPONSE,
    UNAVAILABLE,
    UNKNOWN_PROVIDER,
    DEADLINE_EXCEEDED
}
