package com.docqa.rag.store;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Document metadata. Instances handed out by {@link DocumentStore} are copies;
 * changes go through the store.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Document {

    private String id;

    private String filename;

    private String mimeType;

    private long byteSize;

    private DocumentStatus status;

    private String errorMessage;

    /** Ordered by sequence index. */
    @Builder.Default
    private List<String> chunkIds = new ArrayList<>();

    /** Embedding configuration the chunks were embedded with; null until embedded. */
    private String embeddingConfigId;

    private Instant createdAt;

    private Instant updatedAt;

    public int getChunkCount() {
        return chunkIds == null ? 0 : chunkIds.size();
    }

    Document copy() {
        return toBuilder()
                .chunkIds(chunkIds == null ? new ArrayList<>() : new ArrayList<>(chunkIds))
                .build();
    }
}
