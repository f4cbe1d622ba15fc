package com.docqa.rag.embedding;

import com.docqa.rag.error.EmbeddingFailureException;
import com.docqa.rag.http.Http;
import com.docqa.rag.json.Json;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Ollama embeddings via REST.
 * Endpoint: POST /api/embed
 * Body: { "model": "...", "input": ["text", ...] }
 * Response: { "embeddings": [[...], ...] }
 */
@Slf4j
public final class OllamaEmbeddingsClient implements EmbeddingProvider {
    private final String name;
    private final String baseUrl;
    private final String model;

    public OllamaEmbeddingsClient(String name, String baseUrl, String model) {
        this.name = name;
        this.baseUrl = baseUrl;
        this.model = model;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getConfigurationId() {
        return "ollama:" + model;
    }

    @Override
    public float[] embed(String text) {
        try {
            return request(List.of(text)).get(0);
        } catch (EmbeddingFailureException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingFailureException("Ollama embedding interrupted", e);
        } catch (Exception e) {
            throw new EmbeddingFailureException("Ollama embedding failed", e);
        }
    }

    @Override
    public List<float[]> embedBatch(List<String> texts) {
        if (texts.isEmpty()) return List.of();
        try {
            return request(texts);
        } catch (EmbeddingFailureException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingFailureException(0, "Ollama batch embedding interrupted", e);
        } catch (Exception e) {
            // The server rejects the whole request, so the first item is reported.
            throw new EmbeddingFailureException(0, "Ollama batch embedding failed", e);
        }
    }

    private List<float[]> request(List<String> texts) throws Exception {
        long start = System.currentTimeMillis();
        ObjectNode body = Json.MAPPER.createObjectNode().put("model", model);
        ArrayNode input = body.putArray("input");
        texts.forEach(input::add);

        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/api/embed"))
                .timeout(Duration.ofSeconds(30))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(Json.MAPPER.writeValueAsString(body)))
                .build();

        HttpResponse<String> resp = Http.CLIENT.send(req, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() / 100 != 2) {
            throw new IllegalStateException("Ollama embed HTTP " + resp.statusCode() + ": " + resp.body());
        }

        JsonNode arr = Json.MAPPER.readTree(resp.body()).get("embeddings");
        if (arr == null || !arr.isArray() || arr.size() != texts.size()) {
            throw new IllegalStateException("Bad Ollama embed JSON: expected " + texts.size() + " embeddings");
        }

        List<float[]> out = new ArrayList<>(arr.size());
        for (int i = 0; i < arr.size(); i++) {
            JsonNode vec = arr.get(i);
            if (!vec.isArray() || vec.size() == 0) {
                throw new EmbeddingFailureException(i, "Ollama returned an empty embedding for item " + i, null);
            }
            out.add(EmbeddingVectors.toFloatArray(vec));
        }
        log.debug("[EMBED TIMING] ollama total={}ms items={}", System.currentTimeMillis() - start, texts.size());
        return out;
    }
}
