package com.openforge.conceptai.llm.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.conceptai.common.ProviderException;
import com.openforge.conceptai.llm.ChatMessage;
import com.openforge.conceptai.llm.CompletionRequest;
import com.openforge.conceptai.llm.ContextCaching;
import com.openforge.conceptai.llm.ExternalCacheHandle;
import com.openforge.conceptai.llm.ProviderType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Optional;

/**
 * Gemini provider over the Generative Language REST API.
 *
 * The only provider with the {@link ContextCaching} capability: large static
 * context can be uploaded once as a {@code cachedContents/...} resource and
 * referenced by later generateContent calls.
 *
 * A request that references cached content may not also set a system
 * instruction, so in that case the system prompt is sent as the first user
 * turn instead.
 */
@Slf4j
public class GeminiProvider extends HttpLlmProvider implements ContextCaching {

    public GeminiProvider(HttpClient httpClient,
                          ObjectMapper objectMapper,
                          String apiKey,
                          String baseUrl,
                          String model,
                          String embeddingModel,
                          double temperature,
                          Duration timeout) {
        super(httpClient, objectMapper, ProviderType.GEMINI, apiKey, baseUrl,
                model, embeddingModel, temperature, timeout);
    }

    @Override
    public ProviderType type() {
        return ProviderType.GEMINI;
    }

    @Override
    public Optional<ContextCaching> contextCaching() {
        return Optional.of(this);
    }

    // ── Completion ───────────────────────────────────────────────────────────

    @Override
    public String complete(CompletionRequest request, @Nullable ExternalCacheHandle cachedContext) {
        JsonNode response = post("/models/%s:generateContent".formatted(model),
                generateBody(request, cachedContext, false));
        return candidateText(response);
    }

    @Override
    public Map<String, Object> completeJson(CompletionRequest request, @Nullable ExternalCacheHandle cachedContext) {
        JsonNode response = post("/models/%s:generateContent".formatted(model),
                generateBody(request, cachedContext, true));
        return parseJsonObject(candidateText(response));
    }

    @Override
    public float[] embed(String text) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", "models/" + embeddingModel);
        body.putObject("content").putArray("parts").addObject().put("text", text);
        log.debug("[Gemini] → POST embedContent model={} input-length={}", embeddingModel, text.length());
        JsonNode response = post("/models/%s:embedContent".formatted(embeddingModel), body);
        return toFloatArray(response.path("embedding").path("values"));
    }

    // ── Context caching ──────────────────────────────────────────────────────

    @Override
    public ExternalCacheHandle createContextCache(String content, Duration ttl) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", "models/" + model);
        body.putArray("contents").addObject()
                .put("role", "user")
                .putArray("parts").addObject().put("text", content);
        body.put("ttl", ttl.toSeconds() + "s");

        JsonNode response = post("/cachedContents", body);
        String name = response.path("name").asText(null);
        if (name == null || name.isBlank()) {
            throw new ProviderException("Gemini cachedContents response carried no name");
        }
        Instant expiresAt = parseInstant(response.path("expireTime").asText(null))
                .orElse(Instant.now().plus(ttl));
        log.debug("[Gemini] Created context cache {} ({} chars, expires {})", name, content.length(), expiresAt);
        return new ExternalCacheHandle(name, expiresAt);
    }

    @Override
    public void deleteCache(String handleId) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/" + handleId))
                .header("x-goog-api-key", apiKey)
                .timeout(timeout)
                .DELETE()
                .build();
        send(request);
        log.debug("[Gemini] Deleted context cache {}", handleId);
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private ObjectNode generateBody(CompletionRequest request,
                                    @Nullable ExternalCacheHandle cachedContext,
                                    boolean jsonMode) {
        ObjectNode body     = objectMapper.createObjectNode();
        ArrayNode  contents = body.putArray("contents");
        String     system   = request.systemPrompt();
        boolean    hasSystem = system != null && !system.isBlank();

        if (cachedContext != null) {
            body.put("cachedContent", cachedContext.id());
            if (hasSystem) addTurn(contents, "user", system);
        } else if (hasSystem) {
            body.putObject("systemInstruction").putArray("parts").addObject().put("text", system);
        }

        for (ChatMessage m : request.historyOrEmpty()) {
            addTurn(contents, "assistant".equals(m.role()) ? "model" : "user", m.content());
        }
        addTurn(contents, "user", request.prompt());

        ObjectNode generation = body.putObject("generationConfig");
        generation.put("temperature", request.temperature() != null ? request.temperature() : temperature);
        if (request.maxTokens() != null) {
            generation.put("maxOutputTokens", request.maxTokens());
        }
        if (jsonMode) {
            generation.put("responseMimeType", "application/json");
        }
        return body;
    }

    private static void addTurn(ArrayNode contents, String role, String text) {
        contents.addObject()
                .put("role", role)
                .putArray("parts").addObject().put("text", text);
    }

    private static String candidateText(JsonNode response) {
        JsonNode parts = response.path("candidates").path(0).path("content").path("parts");
        if (!parts.isArray() || parts.isEmpty()) {
            String reason = response.path("candidates").path(0).path("finishReason").asText("none");
            throw new ProviderException("Gemini returned no content (finishReason=%s)".formatted(reason));
        }
        StringBuilder text = new StringBuilder();
        for (JsonNode part : parts) {
            text.append(part.path("text").asText(""));
        }
        return text.toString();
    }

    private JsonNode post(String path, ObjectNode body) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .header("Content-Type", "application/json")
                .header("x-goog-api-key", apiKey)
                .timeout(timeout)
                .POST(jsonBody(body))
                .build();
        return send(request);
    }

    private static Optional<Instant> parseInstant(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        try {
            return Optional.of(Instant.parse(value));
        } catch (DateTimeParseException e) {
            log.debug("[Gemini] Unparseable expireTime '{}', using requested ttl", value);
            return Optional.empty();
        }
    }
}
