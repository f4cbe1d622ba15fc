package com.docqa.rag.llm;

import com.docqa.rag.embedding.EmbeddingProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Instant;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

/**
 * Configured providers and their availability.
 *
 * <p>Providers are registered once at startup. Availability is held in an
 * immutable snapshot that is swapped atomically by health checks and by the
 * gateway after a call, so a caller that reads {@link #snapshot()} once sees a
 * consistent view for the whole call.
 */
@Slf4j
public class ProviderRegistry {

    private static final Comparator<ProviderDescriptor> FALLBACK_ORDER = Comparator
            .comparing((ProviderDescriptor d) -> !d.available())
            .thenComparingInt(ProviderDescriptor::priority)
            .thenComparing(ProviderDescriptor::name);

    private final Map<String, GenerationProvider> generationProviders = new ConcurrentHashMap<>();
    private final Map<String, EmbeddingProvider> embeddingProviders = new ConcurrentHashMap<>();
    private final Map<String, BooleanSupplier> healthChecks = new ConcurrentHashMap<>();
    private final AtomicReference<Map<String, ProviderDescriptor>> snapshot =
            new AtomicReference<>(Collections.emptyMap());

    public void registerGeneration(GenerationProvider provider, ProviderType type, int priority) {
        generationProviders.put(provider.getName(), provider);
        healthChecks.put(provider.getName(), provider::isAvailable);
        publish(new ProviderDescriptor(provider.getName(), ProviderKind.GENERATION, type,
                provider.getModel(), priority, true, null));
    }

    public void registerEmbedding(EmbeddingProvider provider, ProviderType type, String model, int priority) {
        embeddingProviders.put(provider.getName(), provider);
        healthChecks.put(provider.getName(), provider::isAvailable);
        publish(new ProviderDescriptor(provider.getName(), ProviderKind.EMBEDDING, type,
                model, priority, true, null));
    }

    public Optional<GenerationProvider> generation(String name) {
        return Optional.ofNullable(name == null ? null : generationProviders.get(name));
    }

    public Optional<EmbeddingProvider> embedding(String name) {
        return Optional.ofNullable(name == null ? null : embeddingProviders.get(name));
    }

    /**
     * Current availability view. The returned map never changes.
     */
    public Map<String, ProviderDescriptor> snapshot() {
        return snapshot.get();
    }

    /**
     * Provider names to try, in order. An explicit preference is used as given;
     * otherwise generation providers are ordered available-first, then by priority.
     */
    public List<String> orderFor(List<String> preference, Map<String, ProviderDescriptor> view) {
        if (preference != null && !preference.isEmpty()) {
            LinkedHashSet<String> names = new LinkedHashSet<>();
            for (String p : preference) {
                if (p != null && !p.isBlank()) names.add(p.trim());
            }
            if (!names.isEmpty()) return List.copyOf(names);
        }
        return view.values().stream()
                .filter(d -> d.kind() == ProviderKind.GENERATION)
                .sorted(FALLBACK_ORDER)
                .map(ProviderDescriptor::name)
                .toList();
    }

    public void markAvailability(String name, boolean available) {
        Map<String, ProviderDescriptor> before = snapshot.getAndUpdate(current -> {
            ProviderDescriptor d = current.get(name);
            if (d == null || d.available() == available) return current;
            Map<String, ProviderDescriptor> next = new LinkedHashMap<>(current);
            next.put(name, withAvailability(d, available));
            return Collections.unmodifiableMap(next);
        });
        ProviderDescriptor previous = before.get(name);
        if (previous != null && previous.available() != available) {
            log.info("Provider {} is now {}", name, available ? "available" : "unavailable");
        }
    }

    /**
     * Runs every provider's health check and publishes the result as one snapshot.
     */
    @Scheduled(fixedDelayString = "${docqa.gateway.health-check-interval-ms:60000}",
            initialDelayString = "${docqa.gateway.health-check-interval-ms:60000}")
    public Map<String, ProviderDescriptor> refreshAvailability() {
        Map<String, Boolean> results = new LinkedHashMap<>();
        for (Map.Entry<String, BooleanSupplier> e : healthChecks.entrySet()) {
            boolean up;
            try {
                up = e.getValue().getAsBoolean();
            } catch (RuntimeException ex) {
                log.warn("Health check for provider {} failed: {}", e.getKey(), ex.getMessage());
                up = false;
            }
            results.put(e.getKey(), up);
        }
        Map<String, ProviderDescriptor> updated = snapshot.updateAndGet(current -> {
            Map<String, ProviderDescriptor> next = new LinkedHashMap<>(current);
            results.forEach((name, up) -> {
                ProviderDescriptor d = next.get(name);
                if (d != null) next.put(name, withAvailability(d, up));
            });
            return Collections.unmodifiableMap(next);
        });
        log.debug("Provider availability refreshed: {}", results);
        return updated;
    }

    /**
     * All providers, generation first, each kind by priority.
     */
    public List<ProviderDescriptor> describe(boolean refresh) {
        Map<String, ProviderDescriptor> view = refresh ? refreshAvailability() : snapshot();
        return view.values().stream()
                .sorted(Comparator.comparing(ProviderDescriptor::kind, Comparator.reverseOrder())
                        .thenComparingInt(ProviderDescriptor::priority)
                        .thenComparing(ProviderDescriptor::name))
                .toList();
    }

    private void publish(ProviderDescriptor descriptor) {
        snapshot.updateAndGet(current -> {
            Map<String, ProviderDescriptor> next = new LinkedHashMap<>(current);
            next.put(descriptor.name(), descriptor);
            return Collections.unmodifiableMap(next);
        });
    }

    private static ProviderDescriptor withAvailability(ProviderDescriptor d, boolean available) {
        return new ProviderDescriptor(d.name(), d.kind(), d.type(), d.model(), d.priority(), available, Instant.now());
    }
}
