package com.openforge.conceptai.llm.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.conceptai.common.ConceptAiException;
import com.openforge.conceptai.common.ConfigurationException;
import com.openforge.conceptai.common.ProviderException;
import com.openforge.conceptai.common.RateLimitException;
import com.openforge.conceptai.common.ValidationException;
import com.openforge.conceptai.llm.LlmProvider;
import com.openforge.conceptai.llm.ProviderType;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * Shared HTTP plumbing for providers: raw {@link HttpClient} + Jackson tree
 * model, no vendor SDK.
 *
 * Status classification:
 *   401 / 403        → ConfigurationException (bad credential, never retried)
 *   429              → RateLimitException
 *   404, 5xx, I/O    → ProviderException (model unavailable / transient)
 *   other non-2xx    → ConceptAiException (request rejected, not retried)
 */
@Slf4j
abstract class HttpLlmProvider implements LlmProvider {

    private static final TypeReference<Map<String, Object>> JSON_OBJECT_TYPE = new TypeReference<>() {};

    protected final HttpClient   httpClient;
    protected final ObjectMapper objectMapper;
    protected final String       apiKey;
    protected final String       baseUrl;
    protected final String       model;
    protected final String       embeddingModel;
    protected final double       temperature;
    protected final Duration     timeout;

    protected HttpLlmProvider(HttpClient httpClient,
                              ObjectMapper objectMapper,
                              ProviderType type,
                              String apiKey,
                              String baseUrl,
                              String model,
                              String embeddingModel,
                              double temperature,
                              Duration timeout) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new ConfigurationException("No API key configured for provider [%s]".formatted(type.id()));
        }
        this.httpClient     = httpClient;
        this.objectMapper   = objectMapper;
        this.apiKey         = apiKey;
        this.baseUrl        = stripTrailingSlash(baseUrl);
        this.model          = model;
        this.embeddingModel = embeddingModel;
        this.temperature    = temperature;
        this.timeout        = timeout;
    }

    @Override
    public String model() {
        return model;
    }

    @Override
    public double temperature() {
        return temperature;
    }

    @Override
    public String embeddingModel() {
        return embeddingModel;
    }

    // ── Transport ────────────────────────────────────────────────────────────

    protected JsonNode send(HttpRequest request) {
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ProviderException("Network error calling provider [%s]".formatted(type().id()), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException("Interrupted calling provider [%s]".formatted(type().id()), e);
        }

        int    status = response.statusCode();
        String body   = response.body();
        log.debug("[{}] ← HTTP {} body-length={}", type().id(), status, body == null ? 0 : body.length());

        if (status == 401 || status == 403) throw new ConfigurationException(
                "Provider [%s] rejected the credential (HTTP %d)".formatted(type().id(), status));
        if (status == 429) throw new RateLimitException(
                "Rate-limited by provider [%s].".formatted(type().id()));
        if (status == 404 || status >= 500) throw new ProviderException(
                "Provider [%s] unavailable (HTTP %d): %s".formatted(type().id(), status, snippet(body)));
        if (status < 200 || status >= 300) throw new ConceptAiException(
                "Provider [%s] returned HTTP %d: %s".formatted(type().id(), status, snippet(body)));

        if (body == null || body.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ProviderException("Unparseable response envelope from provider [%s]".formatted(type().id()), e);
        }
    }

    protected HttpRequest.BodyPublisher jsonBody(JsonNode node) {
        try {
            return HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(node));
        } catch (JsonProcessingException e) {
            throw new ConceptAiException("Failed to serialize request for provider [%s]".formatted(type().id()), e);
        }
    }

    /**
     * Parses the text of a JSON-mode completion.  Anything but a JSON object
     * (including code-fenced output some models emit) is a ValidationException.
     */
    protected Map<String, Object> parseJsonObject(String text) {
        String candidate = stripCodeFence(text);
        try {
            JsonNode node = objectMapper.readTree(candidate);
            if (node == null || !node.isObject()) {
                throw new ValidationException("Provider [%s] returned JSON that is not an object: %s"
                        .formatted(type().id(), snippet(candidate)));
            }
            return objectMapper.convertValue(node, JSON_OBJECT_TYPE);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Provider [%s] returned malformed JSON: %s"
                    .formatted(type().id(), snippet(candidate)), e);
        }
    }

    protected static float[] toFloatArray(JsonNode values) {
        if (values == null || !values.isArray() || values.isEmpty()) {
            throw new ProviderException("Embedding response contained no vector");
        }
        float[] vector = new float[values.size()];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = values.get(i).floatValue();
        }
        return vector;
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private static String stripCodeFence(String text) {
        if (text == null) return "";
        String trimmed = text.strip();
        if (trimmed.startsWith("```")) {
            int firstNewline = trimmed.indexOf('\n');
            int lastFence    = trimmed.lastIndexOf("```");
            if (firstNewline > 0 && lastFence > firstNewline) {
                return trimmed.substring(firstNewline + 1, lastFence).strip();
            }
        }
        return trimmed;
    }

    private static String snippet(String body) {
        if (body == null) return "";
        return body.length() > 500 ? body.substring(0, 500) + "…" : body;
    }

    private static String stripTrailingSlash(String url) {
        return url != null && url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
