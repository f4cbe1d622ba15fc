package com.docqa.rag.llm;

import java.time.Instant;

public record ProviderDescriptor(
        String name,
        ProviderKind kind,
        ProviderType type,
        String model,
        int priority,
        boolean available,
        Instant checkedAt
) {}
