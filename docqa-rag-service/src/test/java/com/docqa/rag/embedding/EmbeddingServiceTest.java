package com.docqa.rag.embedding;

import com.docqa.rag.error.EmbeddingFailureException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EmbeddingServiceTest {

    private final ExecutorService executor = Executors.newFixedThreadPool(4);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    /** Encodes the text length so results can be matched to inputs. */
    private static class LengthProvider implements EmbeddingProvider {
        private final int dimension;

        LengthProvider(int dimension) {
            this.dimension = dimension;
        }

        @Override
        public String getName() {
            return "length";
        }

        @Override
        public String getConfigurationId() {
            return "length:" + dimension;
        }

        @Override
        public float[] embed(String text) {
            if (text.equals("boom")) {
                throw new IllegalStateException("model crashed");
            }
            float[] v = new float[dimension];
            v[0] = text.length();
            return v;
        }
    }

    @Test
    @DisplayName("Should keep input order across parallel sub-batches")
    void shouldPreserveOrder() {
        EmbeddingService service = new EmbeddingService(new LengthProvider(3), executor, 2, 2);
        List<String> texts = IntStream.rangeClosed(1, 9).mapToObj("x"::repeat).toList();

        List<float[]> vectors = service.embedAll(texts);

        assertThat(vectors).hasSize(9);
        for (int i = 0; i < 9; i++) {
            assertThat(vectors.get(i)[0]).isEqualTo(i + 1f);
        }
    }

    @Test
    @DisplayName("Should fail the whole batch and report the absolute failing index")
    void shouldReportFailingIndex() {
        EmbeddingService service = new EmbeddingService(new LengthProvider(3), executor, 2, 2);

        assertThatThrownBy(() -> service.embedAll(List.of("a", "b", "c", "boom", "e")))
                .isInstanceOf(EmbeddingFailureException.class)
                .satisfies(e -> assertThat(((EmbeddingFailureException) e).getFailedIndex()).isEqualTo(3));
    }

    @Test
    @DisplayName("Should wrap single-text failures")
    void shouldWrapSingleFailure() {
        EmbeddingService service = new EmbeddingService(new LengthProvider(3), executor, 2, 2);

        assertThatThrownBy(() -> service.embed("boom"))
                .isInstanceOf(EmbeddingFailureException.class)
                .hasMessageContaining("model crashed");
    }

    @Test
    @DisplayName("Should return nothing for an empty batch")
    void shouldHandleEmptyBatch() {
        EmbeddingService service = new EmbeddingService(new LengthProvider(3), executor, 2, 2);

        assertThat(service.embedAll(List.of())).isEmpty();
        assertThat(service.getConfigurationId()).isEqualTo("length:3");
    }
}
