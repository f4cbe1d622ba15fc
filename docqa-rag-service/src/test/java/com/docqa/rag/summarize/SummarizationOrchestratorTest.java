package com.docqa.rag.summarize;

import com.docqa.rag.error.AllProvidersExhaustedException;
import com.docqa.rag.error.InvalidRequestException;
import com.docqa.rag.llm.GenerationResult;
import com.docqa.rag.llm.LlmGateway;
import com.docqa.rag.llm.ProviderError;
import com.docqa.rag.llm.ProviderFailureKind;
import com.docqa.rag.metrics.RagMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SummarizationOrchestratorTest {

    @Mock
    private LlmGateway gateway;

    private ExecutorService mapExecutor;
    private SummarizationOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        mapExecutor = Executors.newFixedThreadPool(3);
        orchestrator = new SummarizationOrchestrator(gateway, mapExecutor, 500, 200, 20, 3,
                new RagMetrics(new SimpleMeterRegistry()));
    }

    @AfterEach
    void tearDown() {
        mapExecutor.shutdownNow();
    }

    private static String sentences(int count) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < count; i++) {
            sb.append("Sentence number ").append(i).append(" talks about the quarterly report. ");
        }
        return sb.toString().trim();
    }

    @Nested
    @DisplayName("summarize")
    class Summarize {

        @Test
        @DisplayName("Short text should be summarized in a single call")
        void shouldUseSinglePassForShortText() {
            when(gateway.generate(anyString(), any(), anyInt()))
                    .thenReturn(new GenerationResult("Revenue grew in the quarter.", "ollama", List.of()));
            String text = sentences(3);

            Summary summary = orchestrator.summarize(text, 50, List.of());

            assertThat(summary.summary()).isEqualTo("Revenue grew in the quarter.");
            assertThat(summary.providerUsed()).isEqualTo("ollama");
            assertThat(summary.mapReduced()).isFalse();
            assertThat(summary.chunkCount()).isEqualTo(1);
            assertThat(summary.originalLength()).isEqualTo(SummarizationOrchestrator.countWords(text));
            assertThat(summary.summaryLength()).isEqualTo(5);

            ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
            verify(gateway, times(1)).generate(prompt.capture(), any(), anyInt());
            assertThat(prompt.getValue()).contains("at most 50 words").contains(text);
        }

        @Test
        @DisplayName("Long text should be mapped per chunk and then reduced")
        void shouldMapReduceLongText() {
            when(gateway.generate(anyString(), any(), anyInt())).thenAnswer(inv -> {
                String prompt = inv.getArgument(0);
                String text = prompt.startsWith("The following are summaries")
                        ? "The report covers every quarter."
                        : "Partial point.";
                return new GenerationResult(text, "ollama", List.of());
            });
            String text = sentences(30);

            Summary summary = orchestrator.summarize(text, 40, List.of());

            assertThat(text.length()).isGreaterThan(500);
            assertThat(summary.mapReduced()).isTrue();
            assertThat(summary.chunkCount()).isGreaterThan(1);
            assertThat(summary.summary()).isEqualTo("The report covers every quarter.");
            verify(gateway, times(summary.chunkCount() + 1)).generate(anyString(), any(), anyInt());
        }

        @Test
        @DisplayName("A failing map call should fail the whole summary")
        void shouldPropagateMapFailure() {
            when(gateway.generate(anyString(), any(), anyInt())).thenThrow(new AllProvidersExhaustedException(
                    List.of(new ProviderError("ollama", ProviderFailureKind.UNAVAILABLE, "down", 1))));

            assertThatThrownBy(() -> orchestrator.summarize(sentences(30), 40, List.of()))
                    .isInstanceOf(AllProvidersExhaustedException.class);
            verify(gateway, atLeast(1)).generate(anyString(), any(), anyInt());
        }

        @Test
        @DisplayName("Overlong model output should be cut to the word budget")
        void shouldEnforceMaxLength() {
            when(gateway.generate(anyString(), any(), anyInt())).thenReturn(new GenerationResult(
                    "First point here. Second point follows now. Third point trails off", "ollama", List.of()));

            Summary summary = orchestrator.summarize(sentences(2), 8, List.of());

            assertThat(summary.summary()).isEqualTo("First point here. Second point follows now.");
            assertThat(summary.summaryLength()).isEqualTo(7);
        }

        @Test
        void shouldRejectBlankText() {
            assertThatThrownBy(() -> orchestrator.summarize(" ", 50, List.of()))
                    .isInstanceOf(InvalidRequestException.class);
        }

        @Test
        void shouldRejectNonPositiveMaxLength() {
            assertThatThrownBy(() -> orchestrator.summarize("text", 0, List.of()))
                    .isInstanceOf(InvalidRequestException.class);
        }
    }

    @Nested
    @DisplayName("fitToLength")
    class FitToLength {

        @Test
        void shouldKeepTextWithinBudget() {
            assertThat(SummarizationOrchestrator.fitToLength("  Short summary.  ", 10)).isEqualTo("Short summary.");
        }

        @Test
        void shouldKeepTextOfExactlyBudgetWords() {
            assertThat(SummarizationOrchestrator.fitToLength("one two three", 3)).isEqualTo("one two three");
        }

        @Test
        void shouldCutAtLastSentenceEnd() {
            assertThat(SummarizationOrchestrator.fitToLength("One two. Three four five.", 3)).isEqualTo("One two.");
        }

        @Test
        void shouldCutAtWordBoundaryWithoutSentenceEnd() {
            assertThat(SummarizationOrchestrator.fitToLength("alpha beta gamma delta", 2)).isEqualTo("alpha beta");
        }

        @Test
        void shouldCountWords() {
            assertThat(SummarizationOrchestrator.countWords("  a  b\tc\nd ")).isEqualTo(4);
            assertThat(SummarizationOrchestrator.countWords("")).isZero();
            assertThat(SummarizationOrchestrator.countWords(null)).isZero();
        }
    }
}
