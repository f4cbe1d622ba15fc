package com.docqa.rag.controller;

import com.docqa.rag.dto.HealthResponse;
import com.docqa.rag.llm.ProviderDescriptor;
import com.docqa.rag.llm.ProviderKind;
import com.docqa.rag.llm.ProviderRegistry;
import com.docqa.rag.store.DocumentStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequiredArgsConstructor
@Tag(name = "Health")
@CrossOrigin(origins = "*")
public class HealthController {

    private final ProviderRegistry providerRegistry;
    private final DocumentStore documentStore;

    /**
     * Reads the last availability snapshot; health checks run on their own schedule.
     */
    @GetMapping("/health")
    @Operation(summary = "Service status and the providers currently available")
    public HealthResponse health() {
        List<ProviderDescriptor> providers = providerRegistry.describe(false);
        List<String> available = providers.stream()
                .filter(ProviderDescriptor::available)
                .map(ProviderDescriptor::name)
                .toList();
        boolean generationUp = providers.stream()
                .anyMatch(p -> p.available() && p.kind() == ProviderKind.GENERATION);
        return HealthResponse.of(generationUp, available, documentStore.list().size());
    }
}
