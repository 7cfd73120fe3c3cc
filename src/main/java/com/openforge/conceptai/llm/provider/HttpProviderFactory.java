package com.openforge.conceptai.llm.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.conceptai.common.ConfigurationException;
import com.openforge.conceptai.llm.CredentialSource;
import com.openforge.conceptai.llm.LlmProperties;
import com.openforge.conceptai.llm.LlmProvider;
import com.openforge.conceptai.llm.ProviderFactory;
import com.openforge.conceptai.llm.ProviderSettings;
import com.openforge.conceptai.llm.ProviderType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Builds the HTTP-backed providers from {@link LlmProperties}, taking the
 * credential from the {@link CredentialSource}.
 */
@Slf4j
@RequiredArgsConstructor
public class HttpProviderFactory implements ProviderFactory {

    private static final String GEMINI_BASE_URL = "https://generativelanguage.googleapis.com/v1beta";
    private static final String OPENAI_BASE_URL = "https://api.openai.com/v1";

    private final HttpClient       httpClient;
    private final ObjectMapper     objectMapper;
    private final LlmProperties    properties;
    private final CredentialSource credentials;

    @Override
    public boolean isConfigured(ProviderType type) {
        return credentials.apiKey(type).isPresent();
    }

    @Override
    public LlmProvider create(ProviderType type, ProviderSettings settings) {
        String apiKey = credentials.apiKey(type).orElseThrow(() -> new ConfigurationException(
                "No API key configured for provider [%s]. Set concept.llm.%s.api-key."
                        .formatted(type.id(), type.id())));

        LlmProperties.ProviderConfig config = properties.config(type);
        String   model          = settings != null && settings.model() != null
                ? settings.model()
                : valueOr(config == null ? null : config.model(), type.defaultModel());
        double   temperature    = settings != null ? settings.temperature() : properties.temperature();
        String   embeddingModel = valueOr(config == null ? null : config.embeddingModel(), type.defaultEmbeddingModel());
        Duration timeout        = Duration.ofSeconds(config == null || config.timeoutSeconds() <= 0
                ? 120 : config.timeoutSeconds());

        log.debug("[ProviderFactory] Building {} provider model={} embedding-model={}", type.id(), model, embeddingModel);

        return switch (type) {
            case GEMINI -> new GeminiProvider(httpClient, objectMapper, apiKey,
                    valueOr(config == null ? null : config.baseUrl(), GEMINI_BASE_URL),
                    model, embeddingModel, temperature, timeout);
            case OPENAI -> new OpenAiProvider(httpClient, objectMapper, apiKey,
                    valueOr(config == null ? null : config.baseUrl(), OPENAI_BASE_URL),
                    model, embeddingModel, temperature, timeout);
        };
    }

    private static String valueOr(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
