package com.openforge.conceptai.llm;

/**
 * Builds provider instances.  The seam where credentials are checked: a
 * provider can only be constructed when its credential is configured.
 */
public interface ProviderFactory {

    boolean isConfigured(ProviderType type);

    /**
     * @param settings null means the provider's configured default model and temperature
     * @throws com.openforge.conceptai.common.ConfigurationException when the credential is missing
     */
    LlmProvider create(ProviderType type, ProviderSettings settings);
}
