package com.openforge.conceptai.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Externalised LLM provider configuration.
 *
 * Reads from application.yml under the "concept.llm" prefix:
 *
 * concept:
 *   llm:
 *     provider:            # optional; otherwise first configured of gemini, openai
 *     temperature: 0.7
 *     json-max-attempts: 3
 *     fallback-enabled: false
 *     retry:
 *       max-attempts: 3
 *       initial-backoff: 1s
 *       multiplier: 2.0
 *       max-backoff: 10s
 *     gemini:
 *       api-key: ${GOOGLE_API_KEY:}
 *       base-url: https://generativelanguage.googleapis.com/v1beta
 *       model: gemini-2.0-flash
 *       embedding-model: text-embedding-004
 *     openai:
 *       api-key: ${OPENAI_API_KEY:}
 *       base-url: https://api.openai.com/v1
 *       model: gpt-4o-mini
 *       embedding-model: text-embedding-3-small
 */
@ConfigurationProperties(prefix = "concept.llm")
public record LlmProperties(
        String provider,
        @DefaultValue("0.7") double temperature,
        @DefaultValue("3") int jsonMaxAttempts,
        @DefaultValue("false") boolean fallbackEnabled,
        @DefaultValue RetrySettings retry,
        ProviderConfig gemini,
        ProviderConfig openai
) {

    /** Config block for {@code type}; null when the block is absent. */
    public ProviderConfig config(ProviderType type) {
        return switch (type) {
            case GEMINI -> gemini;
            case OPENAI -> openai;
        };
    }

    public record ProviderConfig(
            String apiKey,
            String baseUrl,
            String model,
            String embeddingModel,
            @DefaultValue("120") int timeoutSeconds
    ) {}

    /** Capped exponential backoff for transient provider failures. */
    public record RetrySettings(
            @DefaultValue("3") int maxAttempts,
            @DefaultValue("1s") Duration initialBackoff,
            @DefaultValue("2.0") double multiplier,
            @DefaultValue("10s") Duration maxBackoff
    ) {}
}
