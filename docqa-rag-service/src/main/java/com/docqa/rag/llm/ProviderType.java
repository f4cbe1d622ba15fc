package com.docqa.rag.llm;

import java.util.Locale;

/**
 * The closed set of back ends a provider entry can point at.
 */
public enum ProviderType {
    OLLAMA,
    OPENAI,
    LOCAL_HASH;

    public static ProviderType fromConfig(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Provider type is required");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown provider type: " + value, e);
        }
    }
}
