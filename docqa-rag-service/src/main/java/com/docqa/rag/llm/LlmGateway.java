package com.docqa.rag.llm;

import com.docqa.rag.error.AllProvidersExhaustedException;
import com.docqa.rag.error.OperationCancelledException;
import com.docqa.rag.metrics.RagMetrics;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Calls generation providers in fallback order until one returns usable text.
 *
 * <p>Each attempt runs on the gateway executor with its own timeout, capped by
 * what is left of the hard ceiling for the whole chain. A failed or timed-out
 * attempt is cancelled and its output discarded. Interrupting the calling
 * thread cancels the in-flight attempt and raises {@link OperationCancelledException}.
 */
@Slf4j
public class LlmGateway {

    private final ProviderRegistry registry;
    private final ExecutorService executor;
    private final Duration perCallTimeout;
    private final Duration hardCeiling;
    private final double temperature;
    private final int defaultMaxTokens;
    private final RagMetrics metrics;

    public LlmGateway(ProviderRegistry registry,
                      ExecutorService executor,
                      Duration perCallTimeout,
                      Duration hardCeiling,
                      double temperature,
                      int defaultMaxTokens,
                      RagMetrics metrics) {
        this.registry = registry;
        this.executor = executor;
        this.perCallTimeout = perCallTimeout;
        this.hardCeiling = hardCeiling;
        this.temperature = temperature;
        this.defaultMaxTokens = defaultMaxTokens;
        this.metrics = metrics;
    }

    public GenerationResult generate(String prompt, List<String> providerOrder) {
        return generate(prompt, providerOrder, defaultMaxTokens);
    }

    public GenerationResult generate(String prompt, List<String> providerOrder, int maxTokens) {
        Map<String, ProviderDescriptor> view = registry.snapshot();
        List<String> order = registry.orderFor(providerOrder, view);
        long deadline = System.nanoTime() + hardCeiling.toNanos();
        List<ProviderError> errors = new ArrayList<>();

        for (String name : order) {
            Optional<GenerationProvider> provider = registry.generation(name);
            if (provider.isEmpty()) {
                errors.add(new ProviderError(name, ProviderFailureKind.UNKNOWN_PROVIDER,
                        "No generation provider named '" + name + "' is configured", 0));
                continue;
            }

            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                errors.add(new ProviderError(name, ProviderFailureKind.DEADLINE_EXCEEDED,
                        "Skipped: the " + hardCeiling.toSeconds() + "s generation ceiling was reached", 0));
                continue;
            }

            long startNanos = System.nanoTime();
            Future<String> attempt = executor.submit(() -> provider.get().generate(prompt, temperature, maxTokens));
            try {
                String text = attempt.get(Math.min(perCallTimeout.toNanos(), remaining), TimeUnit.NANOSECONDS);
                if (text == null || text.isBlank()) {
                    throw new ProviderException(ProviderFailureKind.MALFORMED_RESPONSE, name + " returned no text");
                }
                long elapsedMs = elapsedMs(startNanos);
                registry.markAvailability(name, true);
                metrics.recordGeneration(name, elapsedMs, !errors.isEmpty());
                if (!errors.isEmpty()) {
                    log.info("Generation served by fallback provider {} after {} failure(s)", name, errors.size());
                }
                log.debug("[TIMING] LLM generation by {}: {}ms", name, elapsedMs);
                return new GenerationResult(text.trim(), name, List.copyOf(errors));
            } catch (TimeoutException e) {
                attempt.cancel(true);
                record(errors, new ProviderError(name, ProviderFailureKind.TIMEOUT,
                        name + " did not answer within the per-call timeout", elapsedMs(startNanos)));
            } catch (InterruptedException e) {
                attempt.cancel(true);
                Thread.currentThread().interrupt();
                throw new OperationCancelledException("Generation cancelled while waiting for " + name, e);
            } catch (ExecutionException e) {
                record(errors, toError(name, e.getCause(), elapsedMs(startNanos)));
            } catch (ProviderException e) {
                record(errors, new ProviderError(name, e.getKind(), e.getMessage(), elapsedMs(startNanos)));
            }
        }

        metrics.recordExhausted();
        throw new AllProvidersExhaustedException(errors);
    }

    private void record(List<ProviderError> errors, ProviderError error) {
        errors.add(error);
        metrics.recordProviderFailure(error.provider(), error.kind().name());
        if (error.kind() == ProviderFailureKind.UNAVAILABLE || error.kind() == ProviderFailureKind.AUTHENTICATION) {
            registry.markAvailability(error.provider(), false);
        }
        log.warn("Provider {} failed ({}): {}", error.provider(), error.kind(), error.message());
    }

    private static ProviderError toError(String name, Throwable cause, long elapsedMs) {
        if (cause instanceof ProviderException) {
            ProviderException pe = (ProviderException) cause;
            return new ProviderError(name, pe.getKind(), pe.getMessage(), elapsedMs);
        }
        String message = cause == null ? "unknown error" : cause.getClass().getSimpleName() + ": " + cause.getMessage();
        return new ProviderError(name, ProviderFailureKind.UNAVAILABLE, message, elapsedMs);
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
