package com.openforge.conceptai.llm;

import lombok.RequiredArgsConstructor;

import java.util.Optional;

/**
 * Reads credentials from {@link LlmProperties}.  Blank values and the
 * {@code *-placeholder} convention count as "not configured".
 */
@RequiredArgsConstructor
public class PropertiesCredentialSource implements CredentialSource {

    private final LlmProperties properties;

    @Override
    public Optional<String> apiKey(ProviderType type) {
        LlmProperties.ProviderConfig config = properties.config(type);
        if (config == null) return Optional.empty();
        String key = config.apiKey();
        if (key == null || key.isBlank() || key.endsWith("-placeholder")) {
            return Optional.empty();
        }
        return Optional.of(key.trim());
    }
}
