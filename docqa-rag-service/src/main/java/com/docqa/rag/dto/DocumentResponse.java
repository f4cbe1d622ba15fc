package com.docqa.rag.dto;

import com.docqa.rag.store.Document;

import java.time.Instant;
import java.util.List;

public record DocumentResponse(
        String id,
        String filename,
        String mimeType,
        long byteSize,
        String status,
        String error,
        int chunkCount,
        List<String> chunkIds,
        Instant createdAt,
        Instant updatedAt
) {
    public static DocumentResponse from(Document d) {
        return new DocumentResponse(d.getId(), d.getFilename(), d.getMimeType(), d.getByteSize(),
                d.getStatus().name().toLowerCase(), d.getErrorMessage(), d.getChunkCount(),
                List.copyOf(d.getChunkIds()), d.getCreatedAt(), d.getUpdatedAt());
    }
}
