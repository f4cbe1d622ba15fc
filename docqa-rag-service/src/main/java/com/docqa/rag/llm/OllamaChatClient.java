package com.docqa.rag.llm;

import com.docqa.rag.http.Http;
import com.docqa.rag.json.Json;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Ollama chat via REST (non-stream).
 * Endpoint: POST /api/chat, health: GET /api/tags
 */
@Slf4j
public final class OllamaChatClient implements GenerationProvider {
    private final String name;
    private final String baseUrl;
    private final String model;
    private final Duration requestTimeout;

    public OllamaChatClient(String name, String baseUrl, String model, Duration requestTimeout) {
        this.name = name;
        this.baseUrl = baseUrl;
        this.model = model;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getModel() {
        return model;
    }

    @Override
    public String generate(String prompt, double temperature, int maxTokens) {
        long startTime = System.currentTimeMillis();
        try {
            ObjectNode body = Json.MAPPER.createObjectNode();
            body.put("model", model);
            body.put("stream", false);

            body.putArray("messages")
                    .addObject()
                    .put("role", "user")
                    .put("content", prompt);

            ObjectNode opts = body.putObject("options");
            opts.put("temperature", temperature);
            opts.put("num_predict", maxTokens);

            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/api/chat"))
                    .timeout(requestTimeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(Json.MAPPER.writeValueAsString(body)))
                    .build();

            HttpResponse<String> resp = Http.CLIENT.send(req, HttpResponse.BodyHandlers.ofString());
            ProviderResponses.requireSuccess(name, resp);

            JsonNode content = Json.MAPPER.readTree(resp.body()).at("/message/content");
            if (!content.isTextual() || content.asText().isBlank()) {
                throw new ProviderException(ProviderFailureKind.MALFORMED_RESPONSE,
                        name + " response has no message content");
            }
            log.debug("[CHAT TIMING] {} total={}ms promptLen={}", name, System.currentTimeMillis() - startTime, prompt.length());
            return content.asText();
        } catch (Exception e) {
            throw ProviderResponses.fromTransport(name, e);
        }
    }

    @Override
    public boolean isAvailable() {
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/api/tags"))
                    .timeout(Duration.ofSeconds(5))
                    .GET()
                    .build();
            HttpResponse<String> resp = Http.CLIENT.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() / 100 != 2) return false;
            JsonNode models = Json.MAPPER.readTree(resp.body()).get("models");
            return models != null && models.isArray() && !models.isEmpty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (Exception e) {
            log.warn("Ollama provider {} unavailable: {}", name, e.getMessage());
            return false;
        }
    }
}
