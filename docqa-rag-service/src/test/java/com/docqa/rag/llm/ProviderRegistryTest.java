package com.docqa.rag.llm;

import com.docqa.rag.embedding.HashingEmbeddingProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ProviderRegistryTest {

    private ProviderRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ProviderRegistry();
        registry.registerGeneration(new ScriptedProvider("remote", () -> "x") {
            @Override
            public boolean isAvailable() {
                return false;
            }
        }, ProviderType.OPENAI, 2);
        registry.registerGeneration(ScriptedProvider.answering("local", "x"), ProviderType.OLLAMA, 1);
        registry.registerEmbedding(new HashingEmbeddingProvider("local-hash", 64),
                ProviderType.LOCAL_HASH, "hash-64", 1);
    }

    @Test
    void explicitPreferenceIsUsedAsGivenWithoutDuplicates() {
        List<String> order = registry.orderFor(Arrays.asList("remote", " local ", "remote", null, ""),
                registry.snapshot());

        assertThat(order).containsExactly("remote", "local");
    }

    @Test
    void defaultOrderIsByPriorityAndExcludesEmbeddingProviders() {
        assertThat(registry.orderFor(List.of(), registry.snapshot())).containsExactly("local", "remote");
        assertThat(registry.orderFor(null, registry.snapshot())).containsExactly("local", "remote");
    }

    @Test
    void refreshPublishesHealthCheckResults() {
        Map<String, ProviderDescriptor> view = registry.refreshAvailability();

        assertThat(view.get("remote").available()).isFalse();
        assertThat(view.get("local").available()).isTrue();
        assertThat(view.get("remote").checkedAt()).isNotNull();
        assertThat(registry.orderFor(List.of(), registry.snapshot())).containsExactly("local", "remote");
    }

    @Test
    void unavailableProvidersMoveToTheBackOfTheDefaultOrder() {
        registry.markAvailability("local", false);

        assertThat(registry.orderFor(List.of(), registry.snapshot())).containsExactly("remote", "local");
    }

    @Test
    void snapshotTakenBeforeAnUpdateDoesNotChange() {
        Map<String, ProviderDescriptor> before = registry.snapshot();

        registry.markAvailability("local", false);

        assertThat(before.get("local").available()).isTrue();
        assertThat(registry.snapshot().get("local").available()).isFalse();
    }

    @Test
    void describeListsGenerationProvidersBeforeEmbeddingProviders() {
        List<ProviderDescriptor> all = registry.describe(false);

        assertThat(all).extracting(ProviderDescriptor::name).containsExactly("local", "remote", "local-hash");
        assertThat(all.get(2).kind()).isEqualTo(ProviderKind.EMBEDDING);
        assertThat(all.get(2).model()).isEqualTo("hash-64");
    }

    @Test
    void lookupsReturnEmptyForUnknownNames() {
        assertThat(registry.generation("nonexistent")).isEmpty();
        assertThat(registry.generation(null)).isEmpty();
        assertThat(registry.embedding("local-hash")).isPresent();
        assertThat(registry.generation("local-hash")).isEmpty();
    }
}
