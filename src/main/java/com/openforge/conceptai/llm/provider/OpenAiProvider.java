package com.openforge.conceptai.llm.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.conceptai.llm.ChatMessage;
import com.openforge.conceptai.llm.CompletionRequest;
import com.openforge.conceptai.llm.ExternalCacheHandle;
import com.openforge.conceptai.llm.ProviderType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.Map;

/**
 * OpenAI-compatible provider: POST /chat/completions and /embeddings.
 * No context-caching capability; a cache handle passed in is ignored.
 */
@Slf4j
public class OpenAiProvider extends HttpLlmProvider {

    /** Embedding input is cut here to stay under model token limits. */
    private static final int MAX_EMBED_CHARS = 8000;

    public OpenAiProvider(HttpClient httpClient,
                          ObjectMapper objectMapper,
                          String apiKey,
                          String baseUrl,
                          String model,
                          String embeddingModel,
                          double temperature,
                          Duration timeout) {
        super(httpClient, objectMapper, ProviderType.OPENAI, apiKey, baseUrl,
                model, embeddingModel, temperature, timeout);
    }

    @Override
    public ProviderType type() {
        return ProviderType.OPENAI;
    }

    @Override
    public String complete(CompletionRequest request, @Nullable ExternalCacheHandle cachedContext) {
        JsonNode response = post("/chat/completions", chatBody(request, false));
        return response.path("choices").path(0).path("message").path("content").asText("");
    }

    @Override
    public Map<String, Object> completeJson(CompletionRequest request, @Nullable ExternalCacheHandle cachedContext) {
        JsonNode response = post("/chat/completions", chatBody(request, true));
        String content = response.path("choices").path(0).path("message").path("content").asText("{}");
        return parseJsonObject(content);
    }

    @Override
    public float[] embed(String text) {
        String input = text.length() > MAX_EMBED_CHARS ? text.substring(0, MAX_EMBED_CHARS) : text;
        ObjectNode body = objectMapper.createObjectNode()
                .put("model", embeddingModel)
                .put("input", input);
        log.debug("[OpenAI] → POST /embeddings model={} input-length={}", embeddingModel, input.length());
        JsonNode response = post("/embeddings", body);
        return toFloatArray(response.path("data").path(0).path("embedding"));
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private ObjectNode chatBody(CompletionRequest request, boolean jsonMode) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", model);

        ArrayNode messages = body.putArray("messages");
        if (request.systemPrompt() != null && !request.systemPrompt().isBlank()) {
            messages.addObject().put("role", "system").put("content", request.systemPrompt());
        }
        for (ChatMessage m : request.historyOrEmpty()) {
            messages.addObject().put("role", m.role()).put("content", m.content());
        }
        messages.addObject().put("role", "user").put("content", request.prompt());

        body.put("temperature", request.temperature() != null ? request.temperature() : temperature);
        if (request.maxTokens() != null) {
            body.put("max_tokens", request.maxTokens());
        }
        if (jsonMode) {
            body.putObject("response_format").put("type", "json_object");
        }
        return body;
    }

    private JsonNode post(String path, ObjectNode body) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + apiKey)
                .timeout(timeout)
                .POST(jsonBody(body))
                .build();
        return send(request);
    }
}
