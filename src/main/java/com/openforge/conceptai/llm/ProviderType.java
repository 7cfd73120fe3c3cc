package com.openforge.conceptai.llm;

import com.openforge.conceptai.common.ConfigurationException;

/**
 * The supported LLM providers.
 *
 * Declaration order is the preference order used when no provider is
 * requested explicitly: the first one with a configured credential wins.
 * Adding a provider means adding a constant here and a branch in the
 * {@link ProviderFactory}.
 */
public enum ProviderType {

    GEMINI("gemini", "gemini-2.0-flash", "text-embedding-004"),
    OPENAI("openai", "gpt-4o-mini",      "text-embedding-3-small");

    private final String id;
    private final String defaultModel;
    private final String defaultEmbeddingModel;

    ProviderType(String id, String defaultModel, String defaultEmbeddingModel) {
        this.id                    = id;
        this.defaultModel          = defaultModel;
        this.defaultEmbeddingModel = defaultEmbeddingModel;
    }

    /** Stable lowercase id used in durable rows, config keys and resilience instance names. */
    public String id() {
        return id;
    }

    public String defaultModel() {
        return defaultModel;
    }

    public String defaultEmbeddingModel() {
        return defaultEmbeddingModel;
    }

    public static ProviderType fromId(String id) {
        for (ProviderType type : values()) {
            if (type.id.equalsIgnoreCase(id)) return type;
        }
        throw new ConfigurationException("Unknown LLM provider: " + id);
    }
}
