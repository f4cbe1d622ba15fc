package com.docqa.rag.persist;

import com.docqa.rag.error.InvalidRequestException;
import com.docqa.rag.index.IndexEntry;
import com.docqa.rag.index.VectorIndex;
import com.docqa.rag.json.Json;
import com.docqa.rag.persist.DocumentSetSnapshot.ChunkEntry;
import com.docqa.rag.persist.DocumentSetSnapshot.DocumentEntry;
import com.docqa.rag.store.Chunk;
import com.docqa.rag.store.Document;
import com.docqa.rag.store.DocumentStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Writes the READY and FAILED documents with their chunks to a JSON file and
 * reads them back. Documents still being ingested are not exported.
 */
@Slf4j
public class DocumentSetExporter {

    private final DocumentStore documentStore;
    private final ObjectMapper mapper;

    public DocumentSetExporter(DocumentStore documentStore) {
        this(documentStore, Json.MAPPER);
    }

    public DocumentSetExporter(DocumentStore documentStore, ObjectMapper mapper) {
        this.documentStore = documentStore;
        this.mapper = mapper;
    }

    public DocumentSetSnapshot snapshot() {
        VectorIndex index = documentStore.getVectorIndex();
        List<DocumentEntry> entries = new ArrayList<>();
        for (Document doc : documentStore.list()) {
            if (!doc.getStatus().isTerminal()) continue;
            List<ChunkEntry> chunks = documentStore.chunksOf(doc.getId()).stream()
                    .sorted(Comparator.comparingInt(Chunk::sequenceIndex))
                    .map(c -> new ChunkEntry(c.id(), c.sequenceIndex(), c.text(), c.startOffset(),
                            c.tokenEstimate(), c.vector()))
                    .toList();
            entries.add(new DocumentEntry(doc.getId(), doc.getFilename(), doc.getMimeType(), doc.getByteSize(),
                    doc.getStatus(), doc.getErrorMessage(), doc.getEmbeddingConfigId(),
                    doc.getCreatedAt(), doc.getUpdatedAt(), chunks));
        }
        // documents without indexed chunks keep their creation order, after the indexed ones
        entries.sort(Comparator.comparingLong(e -> firstSequence(index, e)));
        return new DocumentSetSnapshot(DocumentSetSnapshot.FORMAT_VERSION, Instant.now(), List.copyOf(entries));
    }

    public int export(Path path) {
        DocumentSetSnapshot snapshot = snapshot();
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), snapshot);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to export documents to " + path, e);
        }
        log.info("Exported {} document(s) to {}", snapshot.documents().size(), path);
        return snapshot.documents().size();
    }

    /**
     * Restores every document of the file, replacing documents with the same id.
     *
     * @return number of documents imported
     */
    public int importFrom(Path path) {
        DocumentSetSnapshot snapshot;
        try {
            snapshot = mapper.readValue(path.toFile(), DocumentSetSnapshot.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read document export " + path, e);
        }
        if (snapshot.formatVersion() != DocumentSetSnapshot.FORMAT_VERSION) {
            throw new InvalidRequestException("Unsupported export format version " + snapshot.formatVersion());
        }
        List<DocumentEntry> documents = snapshot.documents() == null ? List.of() : snapshot.documents();
        for (DocumentEntry entry : documents) {
            documentStore.restore(toDocument(entry), toChunks(entry));
        }
        log.info("Imported {} document(s) from {}", documents.size(), path);
        return documents.size();
    }

    private static Document toDocument(DocumentEntry e) {
        return Document.builder()
                .id(e.id())
                .filename(e.filename())
                .mimeType(e.mimeType())
                .byteSize(e.byteSize())
                .status(e.status())
                .errorMessage(e.errorMessage())
                .embeddingConfigId(e.embeddingConfigId())
                .createdAt(e.createdAt())
                .updatedAt(e.updatedAt())
                .build();
    }

    private static List<Chunk> toChunks(DocumentEntry e) {
        if (e.chunks() == null) return List.of();
        return e.chunks().stream()
                .map(c -> new Chunk(c.id(), e.id(), c.sequenceIndex(), c.text(), c.startOffset(),
                        c.vector(), c.tokenEstimate()))
                .toList();
    }

    private static long firstSequence(VectorIndex index, DocumentEntry entry) {
        if (entry.chunks() == null || entry.chunks().isEmpty()) return Long.MAX_VALUE;
        IndexEntry first = index.get(entry.chunks().get(0).id());
        return first == null ? Long.MAX_VALUE : first.sequence();
    }
}
