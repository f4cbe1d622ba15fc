package com.docqa.rag.controller;

import com.docqa.rag.config.DocQaProperties;
import com.docqa.rag.error.AllProvidersExhaustedException;
import com.docqa.rag.error.ErrorCode;
import com.docqa.rag.error.InvalidStateTransitionException;
import com.docqa.rag.error.NotFoundException;
import com.docqa.rag.error.UnsupportedFormatException;
import com.docqa.rag.llm.ProviderDescriptor;
import com.docqa.rag.llm.ProviderError;
import com.docqa.rag.llm.ProviderFailureKind;
import com.docqa.rag.llm.ProviderKind;
import com.docqa.rag.llm.ProviderType;
import com.docqa.rag.qa.Answer;
import com.docqa.rag.qa.Citation;
import com.docqa.rag.service.BatchItemResult;
import com.docqa.rag.service.DocQaService;
import com.docqa.rag.store.Document;
import com.docqa.rag.store.DocumentStatus;
import com.docqa.rag.summarize.Summary;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Web layer tests for DocQaController: request binding, snake_case JSON and
 * the mapping of service errors to HTTP statuses.
 */
@WebMvcTest(DocQaController.class)
class DocQaControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private DocQaService service;

    @MockBean
    private DocQaProperties properties;

    private static Document document(String id, DocumentStatus status) {
        Instant now = Instant.parse("2026-01-01T00:00:00Z");
        return Document.builder()
                .id(id)
                .filename("report.pdf")
                .mimeType("application/pdf")
                .byteSize(1024)
                .status(status)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    @Nested
    @DisplayName("POST /api/v1/documents")
    class UploadTests {

        @Test
        @DisplayName("Should accept an upload with 202 and the new document")
        void shouldAcceptUpload() throws Exception {
            // Given
            MockMultipartFile file = new MockMultipartFile("file", "report.pdf", "application/pdf", new byte[]{1, 2, 3});
            when(service.ingestDocument(any(), eq("report.pdf"), eq("application/pdf")))
                    .thenReturn(document("doc-1", DocumentStatus.UPLOADING));

            // When/Then
            mockMvc.perform(multipart("/api/v1/documents").file(file))
                    .andExpect(status().isAccepted())
                    .andExpect(jsonPath("$.id").value("doc-1"))
                    .andExpect(jsonPath("$.status").value("uploading"))
                    .andExpect(jsonPath("$.mime_type").value("application/pdf"))
                    .andExpect(jsonPath("$.chunk_count").value(0));
        }

        @Test
        @DisplayName("Should return 415 for an unsupported file type")
        void shouldRejectUnsupportedType() throws Exception {
            // Given
            MockMultipartFile file = new MockMultipartFile("file", "photo.png", "image/png", new byte[]{1});
            when(service.ingestDocument(any(), any(), any()))
                    .thenThrow(new UnsupportedFormatException("Unsupported document type: image/png"));

            // When/Then
            mockMvc.perform(multipart("/api/v1/documents").file(file))
                    .andExpect(status().isUnsupportedMediaType())
                    .andExpect(jsonPath("$.error").value("UNSUPPORTED_FORMAT"));
        }

        @Test
        @DisplayName("Should return 400 when the file part is missing")
        void shouldRejectMissingFile() throws Exception {
            mockMvc.perform(multipart("/api/v1/documents"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error").value("INVALID_REQUEST"));
        }
    }

    @Nested
    @DisplayName("Document lifecycle")
    class DocumentTests {

        @Test
        @DisplayName("Should return the status in lower case")
        void shouldReturnStatus() throws Exception {
            when(service.getDocumentStatus("doc-1")).thenReturn(DocumentStatus.EMBEDDING);

            mockMvc.perform(get("/api/v1/documents/doc-1/status"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.id").value("doc-1"))
                    .andExpect(jsonPath("$.status").value("embedding"));
        }

        @Test
        @DisplayName("Should return 404 for an unknown document")
        void shouldReturnNotFound() throws Exception {
            when(service.getDocument("missing")).thenThrow(NotFoundException.document("missing"));

            mockMvc.perform(get("/api/v1/documents/missing"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.error").value("NOT_FOUND"));
        }

        @Test
        @DisplayName("Should list documents")
        void shouldListDocuments() throws Exception {
            when(service.listDocuments()).thenReturn(List.of(
                    document("doc-1", DocumentStatus.READY), document("doc-2", DocumentStatus.FAILED)));

            mockMvc.perform(get("/api/v1/documents"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.length()").value(2))
                    .andExpect(jsonPath("$[1].status").value("failed"));
        }

        @Test
        @DisplayName("Should delete with 204")
        void shouldDelete() throws Exception {
            mockMvc.perform(delete("/api/v1/documents/doc-1"))
                    .andExpect(status().isNoContent());

            verify(service).deleteDocument("doc-1");
        }

        @Test
        @DisplayName("Should return 409 when cancelling a finished ingestion")
        void shouldRejectCancelOfFinishedDocument() throws Exception {
            when(service.cancelIngestion("doc-1")).thenThrow(
                    new InvalidStateTransitionException("doc-1", DocumentStatus.READY, DocumentStatus.FAILED));

            mockMvc.perform(post("/api/v1/documents/doc-1/cancel"))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.error").value("INVALID_STATE_TRANSITION"));
        }

        @Test
        @DisplayName("Should export to the configured path")
        void shouldExport() throws Exception {
            DocQaProperties.PersistenceConfig persistence = new DocQaProperties.PersistenceConfig();
            persistence.setExportPath("build/export.json");
            when(properties.getPersistence()).thenReturn(persistence);
            when(service.exportDocuments(Path.of("build/export.json"))).thenReturn(3);

            mockMvc.perform(post("/api/v1/documents/export"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.exported").value(3))
                    .andExpect(jsonPath("$.path").value("build/export.json"));
        }
    }

    @Nested
    @DisplayName("POST /api/v1/qa")
    class AskTests {

        @Test
        @DisplayName("Should answer with sources and snake_case fields")
        void shouldAnswer() throws Exception {
            // Given
            Answer answer = new Answer("What is RAG?", List.of("doc-1"),
                    List.of(new Citation("doc-1#0", "doc-1", 0, 0.82)),
                    "Retrieval-augmented generation.", "ollama", 0.82, true, Instant.now());
            when(service.ask(eq("What is RAG?"), eq(List.of("doc-1")), isNull(), eq(3))).thenReturn(answer);

            // When/Then
            mockMvc.perform(post("/api/v1/qa")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                                {
                                    "question": "What is RAG?",
                                    "document_ids": ["doc-1"],
                                    "k": 3
                                }
                                """))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.answer").value("Retrieval-augmented generation."))
                    .andExpect(jsonPath("$.provider_used").value("ollama"))
                    .andExpect(jsonPath("$.context_found").value(true))
                    .andExpect(jsonPath("$.retrieved_chunk_ids[0]").value("doc-1#0"))
                    .andExpect(jsonPath("$.sources[0].sequence_index").value(0))
                    .andExpect(jsonPath("$.confidence").value(0.82));
        }

        @Test
        @DisplayName("Should return 400 for a blank question")
        void shouldRejectBlankQuestion() throws Exception {
            mockMvc.perform(post("/api/v1/qa")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"question\": \"  \"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error").value("INVALID_REQUEST"));

            verifyNoInteractions(service);
        }

        @Test
        @DisplayName("Should return 502 with every provider error when generation is exhausted")
        void shouldReturnBadGatewayWhenExhausted() throws Exception {
            when(service.ask(any(), any(), any(), any())).thenThrow(new AllProvidersExhaustedException(List.of(
                    new ProviderError("ollama", ProviderFailureKind.UNAVAILABLE, "connection refused", 3),
                    new ProviderError("openai", ProviderFailureKind.AUTHENTICATION, "HTTP 401", 120))));

            mockMvc.perform(post("/api/v1/qa")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"question\": \"Anything?\"}"))
                    .andExpect(status().isBadGateway())
                    .andExpect(jsonPath("$.error").value("ALL_PROVIDERS_EXHAUSTED"))
                    .andExpect(jsonPath("$.details.length()").value(2))
                    .andExpect(jsonPath("$.details[0].provider").value("ollama"))
                    .andExpect(jsonPath("$.details[1].kind").value("AUTHENTICATION"));
        }

        @Test
        @DisplayName("Should return 400 for malformed JSON")
        void shouldRejectMalformedJson() throws Exception {
            mockMvc.perform(post("/api/v1/qa")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{not json"))
                    .andExpect(status().isBadRequest());
        }
    }

    @Nested
    @DisplayName("POST /api/v1/summarize")
    class SummarizeTests {

        @Test
        @DisplayName("Should use the default max length when none is given")
        void shouldSummarizeWithDefaultLength() throws Exception {
            when(service.summarize("Long text.", 150, null))
                    .thenReturn(new Summary("Short.", "ollama", 2, 1, 1, false));

            mockMvc.perform(post("/api/v1/summarize")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"text\": \"Long text.\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.summary").value("Short."))
                    .andExpect(jsonPath("$.original_length").value(2))
                    .andExpect(jsonPath("$.summary_length").value(1))
                    .andExpect(jsonPath("$.provider_used").value("ollama"));
        }

        @Test
        @DisplayName("Should report batch failures per item")
        void shouldReportBatchItems() throws Exception {
            when(service.summarizeRequests(anyList(), eq(40), isNull())).thenReturn(List.of(
                    BatchItemResult.success(0, new Summary("One.", "ollama", 5, 1, 1, false)),
                    new BatchItemResult<Summary>(1, null, ErrorCode.ALL_PROVIDERS_EXHAUSTED, "All providers failed")));

            mockMvc.perform(post("/api/v1/summarize/batch")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                                {
                                    "items": [
                                        {"text": "first text"},
                                        {"text": "second text", "provider": "nonexistent"}
                                    ],
                                    "max_length": 40
                                }
                                """))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$[0].success").value(true))
                    .andExpect(jsonPath("$[0].result.summary").value("One."))
                    .andExpect(jsonPath("$[1].success").value(false))
                    .andExpect(jsonPath("$[1].error").value("ALL_PROVIDERS_EXHAUSTED"));
        }

        @Test
        @DisplayName("Should reject an empty batch")
        void shouldRejectEmptyBatch() throws Exception {
            mockMvc.perform(post("/api/v1/summarize/batch")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"texts\": []}"))
                    .andExpect(status().isBadRequest());
        }
    }

    @Test
    @DisplayName("GET /api/v1/providers should list providers")
    void shouldListProviders() throws Exception {
        when(service.listAvailableProviders()).thenReturn(List.of(new ProviderDescriptor(
                "ollama", ProviderKind.GENERATION, ProviderType.OLLAMA, "llama3", 1, true, null)));

        mockMvc.perform(get("/api/v1/providers"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("ollama"))
                .andExpect(jsonPath("$[0].available").value(true));
    }
}
