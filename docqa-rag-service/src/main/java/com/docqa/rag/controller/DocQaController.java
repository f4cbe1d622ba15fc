package com.docqa.rag.controller;

import com.docqa.rag.config.DocQaProperties;
import com.docqa.rag.dto.AnswerResponse;
import com.docqa.rag.dto.AskBatchRequest;
import com.docqa.rag.dto.AskRequest;
import com.docqa.rag.dto.BatchItemResponse;
import com.docqa.rag.dto.DocumentResponse;
import com.docqa.rag.dto.SummarizeBatchRequest;
import com.docqa.rag.dto.SummarizeRequest;
import com.docqa.rag.dto.SummaryResponse;
import com.docqa.rag.error.InvalidRequestException;
import com.docqa.rag.llm.ProviderDescriptor;
import com.docqa.rag.service.DocQaService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Document Q&A", description = "Upload documents, ask questions about them and summarize text")
@CrossOrigin(origins = "*")
public class DocQaController {

    private final DocQaService service;
    private final DocQaProperties properties;

    @PostMapping(value = "/documents", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Upload a PDF, DOCX or TXT file; ingestion continues in the background")
    public ResponseEntity<DocumentResponse> upload(@RequestParam("file") MultipartFile file) {
        log.info("Received upload: filename={}, size={} bytes, type={}",
                file.getOriginalFilename(), file.getSize(), file.getContentType());
        byte[] bytes;
        try {
            bytes = file.getBytes();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read uploaded file", e);
        }
        DocumentResponse body = DocumentResponse.from(
                service.ingestDocument(bytes, file.getOriginalFilename(), file.getContentType()));
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
    }

    @GetMapping("/documents")
    @Operation(summary = "List documents, oldest first")
    public List<DocumentResponse> listDocuments() {
        return service.listDocuments().stream().map(DocumentResponse::from).toList();
    }

    @GetMapping("/documents/{id}")
    @Operation(summary = "Get document metadata and ingestion status")
    public DocumentResponse getDocument(@PathVariable String id) {
        return DocumentResponse.from(service.getDocument(id));
    }

    @GetMapping("/documents/{id}/status")
    @Operation(summary = "Get the ingestion status of a document")
    public Map<String, String> getStatus(@PathVariable String id) {
        return Map.of("id", id, "status", service.getDocumentStatus(id).name().toLowerCase());
    }

    @DeleteMapping("/documents/{id}")
    @Operation(summary = "Delete a document with its chunks")
    public ResponseEntity<Void> deleteDocument(@PathVariable String id) {
        service.deleteDocument(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/documents/{id}/cancel")
    @Operation(summary = "Cancel an in-flight ingestion")
    public DocumentResponse cancelIngestion(@PathVariable String id) {
        return DocumentResponse.from(service.cancelIngestion(id));
    }

    @PostMapping("/documents/export")
    @Operation(summary = "Export all finished documents to the configured export file")
    public Map<String, Object> exportDocuments() {
        String path = properties.getPersistence().getExportPath();
        int count = service.exportDocuments(Path.of(path));
        return Map.of("exported", count, "path", path);
    }

    @PostMapping("/documents/import")
    @Operation(summary = "Import documents from the configured export file")
    public Map<String, Object> importDocuments() {
        String path = properties.getPersistence().getExportPath();
        int count = service.importDocuments(Path.of(path));
        return Map.of("imported", count, "path", path);
    }

    @PostMapping("/qa")
    @Operation(summary = "Answer a question from the selected documents (all ready documents when none are given)")
    public AnswerResponse ask(@Valid @RequestBody AskRequest request) {
        return AnswerResponse.from(service.ask(request.question(), request.documentIds(), request.provider(), request.k()));
    }

    @PostMapping("/qa/batch")
    @Operation(summary = "Answer several questions over the same documents")
    public List<BatchItemResponse<AnswerResponse>> askBatch(@Valid @RequestBody AskBatchRequest request) {
        return service.askBatch(request.questions(), request.documentIds(), request.provider(), request.k()).stream()
                .map(item -> BatchItemResponse.from(item, AnswerResponse::from))
                .toList();
    }

    @PostMapping("/summarize")
    @Operation(summary = "Summarize text within a word budget")
    public SummaryResponse summarize(@Valid @RequestBody SummarizeRequest request) {
        return SummaryResponse.from(service.summarize(request.text(), request.maxLengthOrDefault(), request.provider()));
    }

    @PostMapping("/summarize/batch")
    @Operation(summary = "Summarize several texts; failures are reported per item")
    public List<BatchItemResponse<SummaryResponse>> summarizeBatch(@RequestBody SummarizeBatchRequest request) {
        if (request.requests().isEmpty()) {
            throw new InvalidRequestException("texts or items are required");
        }
        return service.summarizeRequests(request.requests(), request.maxLengthOrDefault(), request.provider()).stream()
                .map(item -> BatchItemResponse.from(item, SummaryResponse::from))
                .toList();
    }

    @GetMapping("/providers")
    @Operation(summary = "List configured providers with live availability")
    public List<ProviderDescriptor> providers() {
        return service.listAvailableProviders();
    }
}
