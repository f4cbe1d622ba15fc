package com.docqa.rag.persist;

import com.docqa.rag.store.DocumentStatus;

import java.time.Instant;
import java.util.List;

/**
 * On-disk form of the document set. Documents are listed in index insertion
 * order and chunks in sequence order, so an import rebuilds the same index.
 */
public record DocumentSetSnapshot(
        int formatVersion,
        Instant exportedAt,
        List<DocumentEntry> documents
) {
    public static final int FORMAT_VERSION = 1;

    public record DocumentEntry(
            String id,
            String filename,
            String mimeType,
            long byteSize,
            DocumentStatus status,
            String errorMessage,
            String embeddingConfigId,
            Instant createdAt,
            Instant updatedAt,
            List<ChunkEntry> chunks
    ) {}

    public record ChunkEntry(
            String id,
            int sequenceIndex,
            String text,
            int startOffset,
            int tokenEstimate,
            float[] vector
    ) {}
}
