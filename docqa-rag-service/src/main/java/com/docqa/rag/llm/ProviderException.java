package com.docqa.rag.llm;

/**
 * A single provider call failed. Thrown by provider clients and turned into a
 * {@link ProviderError} by the gateway; never reaches gateway callers.
 */
public class ProviderException extends RuntimeException {

    private final ProviderFailureKind kind;

    public ProviderException(ProviderFailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ProviderException(ProviderFailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ProviderFailureKind getKind() {
        return kind;
    }
}
