package com.docqa.rag.llm;

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

/**
 * OpenAI-compatible chat client (OpenAI, llama.cpp server, Ollama /v1).
 * Endpoint: POST /v1/chat/completions, health: GET /v1/models
 */
@Slf4j
public final class OpenAIChatClient implements GenerationProvider {
    private static final String SYSTEM_PROMPT =
            "You are a helpful assistant. Always respond in clear, natural language. "
                    + "Do not use function calls, tool calls, or JSON format in your responses.";

    private final String name;
    private final String baseUrl;
    private final String model;
    private final String apiKey;
    private final Duration requestTimeout;

    public OpenAIChatClient(String name, String baseUrl, String model, String apiKey, Duration requestTimeout) {
        this.name = name;
        this.baseUrl = baseUrl;
        this.model = model;
        this.apiKey = apiKey;
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
            body.put("temperature", temperature);
            body.put("max_tokens", maxTokens);
            body.put("stream", false);

            ArrayNode messages = body.putArray("messages");
            messages.addObject()
                    .put("role", "system")
                    .put("content", SYSTEM_PROMPT);
            messages.addObject()
                    .put("role", "user")
                    .put("content", prompt);

            HttpRequest req = authorized(HttpRequest.newBuilder())
                    .uri(URI.create(baseUrl + "/v1/chat/completions"))
                    .timeout(requestTimeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(Json.MAPPER.writeValueAsString(body)))
                    .build();

            HttpResponse<String> resp = Http.CLIENT.send(req, HttpResponse.BodyHandlers.ofString());
            ProviderResponses.requireSuccess(name, resp);

            JsonNode content = Json.MAPPER.readTree(resp.body()).at("/choices/0/message/content");
            if (!content.isTextual() || content.asText().isBlank()) {
                throw new ProviderException(ProviderFailureKind.MALFORMED_RESPONSE,
                        name + " response has no choices[0].message.content");
            }
            log.debug("[CHAT TIMING] {} total={}ms promptLen={} maxTokens={}",
                    name, System.currentTimeMillis() - startTime, prompt.length(), maxTokens);
            return content.asText();
        } catch (Exception e) {
            throw ProviderResponses.fromTransport(name, e);
        }
    }

    @Override
    public boolean isAvailable() {
        if (requiresKey() && (apiKey == null || apiKey.isBlank())) {
            return false;
        }
        try {
            HttpRequest req = authorized(HttpRequest.newBuilder())
                    .uri(URI.create(baseUrl + "/v1/models"))
                    .timeout(Duration.ofSeconds(5))
                    .GET()
                    .build();
            return Http.CLIENT.send(req, HttpResponse.BodyHandlers.discarding()).statusCode() / 100 == 2;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (Exception e) {
            log.warn("OpenAI-compatible provider {} unavailable: {}", name, e.getMessage());
            return false;
        }
    }

    private boolean requiresKey() {
        return baseUrl.contains("api.openai.com");
    }

    private HttpRequest.Builder authorized(HttpRequest.Builder builder) {
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
        return builder;
    }
}
