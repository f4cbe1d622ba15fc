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
import java.util.Arrays;
import java.util.List;

/**
 * OpenAI-compatible embeddings client (OpenAI, llama.cpp, Ollama /v1).
 * Endpoint: POST /v1/embeddings
 */
@Slf4j
public final class OpenAIEmbeddingsClient implements EmbeddingProvider {
    private final String name;
    private final String baseUrl;
    private final String model;
    private final String apiKey;

    public OpenAIEmbeddingsClient(String name, String baseUrl, String model, String apiKey) {
        this.name = name;
        this.baseUrl = baseUrl;
        this.model = model;
        this.apiKey = apiKey;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getConfigurationId() {
        return "openai:" + model;
    }

    @Override
    public float[] embed(String text) {
        try {
            return request(List.of(text))[0];
        } catch (EmbeddingFailureException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingFailureException("OpenAI-compatible embedding interrupted", e);
        } catch (Exception e) {
            throw new EmbeddingFailureException("OpenAI-compatible embedding failed", e);
        }
    }

    @Override
    public List<float[]> embedBatch(List<String> texts) {
        if (texts.isEmpty()) return List.of();
        try {
            return Arrays.asList(request(texts));
        } catch (EmbeddingFailureException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingFailureException(0, "OpenAI-compatible batch embedding interrupted", e);
        } catch (Exception e) {
            throw new EmbeddingFailureException(0, "OpenAI-compatible batch embedding failed", e);
        }
    }

    @Override
    public boolean isAvailable() {
        return (apiKey != null && !apiKey.isBlank()) || !baseUrl.contains("api.openai.com");
    }

    private float[][] request(List<String> texts) throws Exception {
        long startTime = System.currentTimeMillis();
        ObjectNode body = Json.MAPPER.createObjectNode().put("model", model);
        ArrayNode input = body.putArray("input");
        texts.forEach(input::add);

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/v1/embeddings"))
                .timeout(Duration.ofSeconds(30))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(Json.MAPPER.writeValueAsString(body)));
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }

        HttpResponse<String> resp = Http.CLIENT.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() / 100 != 2) {
            throw new IllegalStateException("OpenAI-compatible embed HTTP " + resp.statusCode() + ": " + resp.body());
        }

        JsonNode data = Json.MAPPER.readTree(resp.body()).get("data");
        if (data == null || !data.isArray() || data.size() != texts.size()) {
            throw new IllegalStateException("Bad OpenAI embed response: expected " + texts.size() + " items");
        }

        // Items carry an "index"; the API does not promise response order.
        float[][] out = new float[texts.size()][];
        for (int i = 0; i < data.size(); i++) {
            JsonNode item = data.get(i);
            int index = item.path("index").asInt(i);
            JsonNode vec = item.get("embedding");
            if (index < 0 || index >= out.length || vec == null || !vec.isArray() || vec.size() == 0) {
                throw new EmbeddingFailureException(Math.max(0, Math.min(index, out.length - 1)),
                        "Bad OpenAI embed response: missing embedding array", null);
            }
            out[index] = EmbeddingVectors.toFloatArray(vec);
        }
        for (int i = 0; i < out.length; i++) {
            if (out[i] == null) {
                throw new EmbeddingFailureException(i, "OpenAI embed response has no embedding for item " + i, null);
            }
        }
        log.debug("[EMBED TIMING] openai total={}ms items={}", System.currentTimeMillis() - startTime, texts.size());
        return out;
    }
}
