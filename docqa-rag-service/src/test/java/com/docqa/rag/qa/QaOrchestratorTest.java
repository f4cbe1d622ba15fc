package com.docqa.rag.qa;

import com.docqa.rag.embedding.EmbeddingService;
import com.docqa.rag.embedding.HashingEmbeddingProvider;
import com.docqa.rag.error.DimensionMismatchException;
import com.docqa.rag.error.InvalidRequestException;
import com.docqa.rag.error.NotFoundException;
import com.docqa.rag.index.SearchHit;
import com.docqa.rag.index.VectorIndex;
import com.docqa.rag.llm.GenerationResult;
import com.docqa.rag.llm.LlmGateway;
import com.docqa.rag.metrics.RagMetrics;
import com.docqa.rag.store.Chunk;
import com.docqa.rag.store.ChunkStore;
import com.docqa.rag.store.Document;
import com.docqa.rag.store.DocumentStatus;
import com.docqa.rag.store.DocumentStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class QaOrchestratorTest {

    private final HashingEmbeddingProvider embedder = new HashingEmbeddingProvider("local-hash", 384);
    private ExecutorService executor;
    private DocumentStore store;
    private LlmGateway gateway;
    private QaOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        store = new DocumentStore(new ChunkStore(), new VectorIndex());
        gateway = mock(LlmGateway.class);
        when(gateway.generate(anyString(), any())).thenReturn(new GenerationResult("The answer.", "stub", List.of()));
        orchestrator = orchestrator(6000);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private QaOrchestrator orchestrator(int maxContextChars) {
        return new QaOrchestrator(store, new EmbeddingService(embedder, executor, 8, 2), gateway,
                maxContextChars, 0.1, new RagMetrics(new SimpleMeterRegistry()));
    }

    private Document readyDocument(String filename, String configId, String... texts) {
        Document doc = store.create(filename, "text/plain", 100);
        store.updateStatus(doc.getId(), DocumentStatus.EXTRACTING);
        store.updateStatus(doc.getId(), DocumentStatus.CHUNKING);
        store.updateStatus(doc.getId(), DocumentStatus.EMBEDDING);
        List<Chunk> chunks = new ArrayList<>();
        int offset = 0;
        for (int i = 0; i < texts.length; i++) {
            chunks.add(new Chunk(doc.getId() + "#" + i, doc.getId(), i, texts[i], offset,
                    embedder.embed(texts[i]), texts[i].length() / 4));
            offset += texts[i].length();
        }
        return store.publishChunks(doc.getId(), chunks, configId);
    }

    private String sentPrompt() {
        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(gateway).generate(prompt.capture(), any());
        return prompt.getValue();
    }

    @Nested
    @DisplayName("answer")
    class AnswerFlow {

        @Test
        @DisplayName("Should cite the most relevant chunk first and put its text in the prompt")
        void shouldCiteRelevantChunk() {
            Document doc = readyDocument("energy.txt", embedder.getConfigurationId(),
                    "Solar panels convert sunlight into electricity using photovoltaic cells.",
                    "Wind turbines generate power from moving air masses.");

            Answer answer = orchestrator.answer("How do solar panels convert sunlight?",
                    List.of(doc.getId()), 4, List.of());

            assertThat(answer.contextFound()).isTrue();
            assertThat(answer.citations().get(0).chunkId()).isEqualTo(doc.getId() + "#0");
            assertThat(answer.confidence()).isEqualTo(answer.citations().get(0).score());
            assertThat(answer.answer()).isEqualTo("The answer.");
            assertThat(answer.providerUsed()).isEqualTo("stub");
            assertThat(sentPrompt())
                    .contains("[1] energy.txt (chunk 0)")
                    .contains("photovoltaic cells")
                    .contains("Question: How do solar panels convert sunlight?")
                    .doesNotContain(QaOrchestrator.NO_CONTEXT_MARKER);
        }

        @Test
        @DisplayName("Should still call the gateway with the no-context marker when no documents are selected")
        void shouldAnswerWithoutDocuments() {
            Answer answer = orchestrator.answer("What is X?", List.of(), 4, List.of());

            assertThat(answer.contextFound()).isFalse();
            assertThat(answer.citations()).isEmpty();
            assertThat(answer.confidence()).isZero();
            assertThat(sentPrompt()).contains("Context:\n" + QaOrchestrator.NO_CONTEXT_MARKER);
        }

        @Test
        @DisplayName("Should report no context when nothing passes the relevance threshold")
        void shouldDropIrrelevantHits() {
            Document doc = readyDocument("fruit.txt", embedder.getConfigurationId(),
                    "Bananas are yellow and rich in potassium.");

            Answer answer = orchestrator.answer("What is X?", List.of(doc.getId()), 4, List.of());

            assertThat(answer.contextFound()).isFalse();
            assertThat(answer.documentIds()).containsExactly(doc.getId());
            assertThat(sentPrompt()).contains("Context:\n" + QaOrchestrator.NO_CONTEXT_MARKER);
        }

        @Test
        @DisplayName("Should pass the provider preference through to the gateway")
        void shouldPassProviderPreference() {
            orchestrator.answer("Anything?", List.of(), 4, List.of("openai"));

            verify(gateway).generate(anyString(), eq(List.of("openai")));
        }
    }

    @Nested
    @DisplayName("validation")
    class Validation {

        @Test
        void shouldRejectBlankQuestion() {
            assertThatThrownBy(() -> orchestrator.answer("  ", List.of(), 4, List.of()))
                    .isInstanceOf(InvalidRequestException.class);
        }

        @Test
        void shouldRejectNonPositiveK() {
            assertThatThrownBy(() -> orchestrator.answer("q?", List.of(), 0, List.of()))
                    .isInstanceOf(InvalidRequestException.class);
        }

        @Test
        void shouldRejectUnknownDocument() {
            assertThatThrownBy(() -> orchestrator.answer("q?", List.of("missing"), 4, List.of()))
                    .isInstanceOf(NotFoundException.class);
        }

        @Test
        @DisplayName("Should refuse documents embedded with another configuration")
        void shouldRejectForeignEmbeddingConfig() {
            Document doc = readyDocument("old.txt", "openai:text-embedding-3-small", "Some indexed text here.");

            assertThatThrownBy(() -> orchestrator.answer("indexed text?", List.of(doc.getId()), 4, List.of()))
                    .isInstanceOf(DimensionMismatchException.class);
        }

        @Test
        @DisplayName("Should refuse a selection that mixes embedding configurations")
        void shouldRejectMixedConfigs() {
            Document a = readyDocument("a.txt", embedder.getConfigurationId(), "Alpha text content.");
            Document b = readyDocument("b.txt", "other:384", "Beta text content.");

            assertThatThrownBy(() -> orchestrator.answer("text?", List.of(a.getId(), b.getId()), 4, List.of()))
                    .isInstanceOf(DimensionMismatchException.class);
        }
    }

    @Nested
    @DisplayName("assembleContext")
    class ContextAssembly {

        @Test
        @DisplayName("Should stop adding chunks once the budget is used up, keeping score order")
        void shouldRespectBudget() {
            String first = "a".repeat(60);
            String second = "b".repeat(60);
            Document doc = readyDocument("doc.txt", embedder.getConfigurationId(), first, second);
            Map<String, Document> docs = Map.of(doc.getId(), doc);
            List<SearchHit> hits = List.of(
                    new SearchHit(doc.getId() + "#1", doc.getId(), 0.9),
                    new SearchHit(doc.getId() + "#0", doc.getId(), 0.5));

            QaOrchestrator.ContextWindow window = orchestrator(100).assembleContext(hits, docs);

            assertThat(window.citations()).extracting(Citation::chunkId).containsExactly(doc.getId() + "#1");
            assertThat(window.text()).hasSizeLessThanOrEqualTo(100).contains(second).doesNotContain(first);
        }

        @Test
        @DisplayName("Should include both chunks with a separator when they fit")
        void shouldJoinBlocks() {
            Document doc = readyDocument("doc.txt", embedder.getConfigurationId(), "first chunk", "second chunk");
            List<SearchHit> hits = List.of(
                    new SearchHit(doc.getId() + "#0", doc.getId(), 0.8),
                    new SearchHit(doc.getId() + "#1", doc.getId(), 0.7));

            QaOrchestrator.ContextWindow window = orchestrator.assembleContext(hits, Map.of(doc.getId(), doc));

            assertThat(window.text()).isEqualTo(
                    "[1] doc.txt (chunk 0)\nfirst chunk\n\n---\n\n[2] doc.txt (chunk 1)\nsecond chunk");
        }

        @Test
        @DisplayName("Should cut an oversized top chunk at whitespace")
        void shouldTruncateTopChunk() {
            String longText = "word ".repeat(100).trim();
            Document doc = readyDocument("big.txt", embedder.getConfigurationId(), longText);
            List<SearchHit> hits = List.of(new SearchHit(doc.getId() + "#0", doc.getId(), 0.9));

            QaOrchestrator.ContextWindow window = orchestrator(80).assembleContext(hits, Map.of(doc.getId(), doc));

            assertThat(window.citations()).hasSize(1);
            assertThat(window.text()).hasSizeLessThanOrEqualTo(80).endsWith("word");
        }

        @Test
        @DisplayName("Should skip hits whose chunk has been removed")
        void shouldSkipMissingChunks() {
            List<SearchHit> hits = List.of(new SearchHit("gone#0", "gone", 0.9));

            QaOrchestrator.ContextWindow window = orchestrator.assembleContext(hits, Map.of());

            assertThat(window.citations()).isEmpty();
            assertThat(window.text()).isEqualTo(QaOrchestrator.NO_CONTEXT_MARKER);
        }
    }
}
