package com.openforge.conceptai.llm;

import org.springframework.lang.Nullable;

import java.util.Map;
import java.util.Optional;

/**
 * One LLM backend, treated as a black box.
 *
 * Implementations classify their failures: credential problems as
 * {@code ConfigurationException}, transient transport/rate-limit/availability
 * problems as {@code ProviderException}, and a JSON-mode answer that is not a
 * JSON object as {@code ValidationException}.  Retrying is the caller's job.
 */
public interface LlmProvider {

    ProviderType type();

    String model();

    double temperature();

    String embeddingModel();

    /**
     * @param cachedContext live provider-side context to reference, or null
     */
    String complete(CompletionRequest request, @Nullable ExternalCacheHandle cachedContext);

    Map<String, Object> completeJson(CompletionRequest request, @Nullable ExternalCacheHandle cachedContext);

    float[] embed(String text);

    /** Present only for providers that can host context server-side. */
    default Optional<ContextCaching> contextCaching() {
        return Optional.empty();
    }
}
