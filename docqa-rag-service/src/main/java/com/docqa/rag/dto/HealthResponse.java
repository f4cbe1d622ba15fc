package com.docqa.rag.dto;

import java.util.List;

public record HealthResponse(
        String status,
        List<String> availableProviders,
        int documents
) {
    /** Degraded while no generation provider answers its health check. */
    public static HealthResponse of(boolean generationAvailable, List<String> availableProviders, int documents) {
        return new HealthResponse(generationAvailable ? "healthy" : "degraded", availableProviders, documents);
    }
}
