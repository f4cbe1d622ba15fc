package com.docqa.rag.controller;

import com.docqa.rag.llm.ProviderDescriptor;
import com.docqa.rag.llm.ProviderKind;
import com.docqa.rag.llm.ProviderRegistry;
import com.docqa.rag.llm.ProviderType;
import com.docqa.rag.store.DocumentStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(HealthController.class)
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ProviderRegistry providerRegistry;

    @MockBean
    private DocumentStore documentStore;

    private static ProviderDescriptor provider(String name, ProviderKind kind, boolean available) {
        return new ProviderDescriptor(name, kind, ProviderType.OLLAMA, "m", 1, available, null);
    }

    @Test
    @DisplayName("Should be healthy while a generation provider is available")
    void shouldReportHealthy() throws Exception {
        when(providerRegistry.describe(false)).thenReturn(List.of(
                provider("ollama", ProviderKind.GENERATION, true),
                provider("openai", ProviderKind.GENERATION, false),
                provider("local-hash", ProviderKind.EMBEDDING, true)));
        when(documentStore.list()).thenReturn(List.of());

        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.available_providers.length()").value(2))
                .andExpect(jsonPath("$.available_providers[0]").value("ollama"))
                .andExpect(jsonPath("$.documents").value(0));
    }

    @Test
    @DisplayName("Should be degraded when only embedding providers answer")
    void shouldReportDegraded() throws Exception {
        when(providerRegistry.describe(false)).thenReturn(List.of(
                provider("ollama", ProviderKind.GENERATION, false),
                provider("local-hash", ProviderKind.EMBEDDING, true)));
        when(documentStore.list()).thenReturn(List.of());

        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("degraded"))
                .andExpect(jsonPath("$.available_providers[0]").value("local-hash"));
    }
}
