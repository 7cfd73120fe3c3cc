package com.openforge.conceptai.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.conceptai.cache.SemanticResponseCache;
import com.openforge.conceptai.common.ConfigurationException;
import com.openforge.conceptai.common.ProviderException;
import com.openforge.conceptai.common.ValidationException;
import com.openforge.conceptai.domain.SemanticCacheEntry.ResponseFormat;
import com.openforge.conceptai.session.ContextSessionService;
import com.openforge.conceptai.session.SessionSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.time.Clock;
import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiFunction;

/**
 * Façade in front of the LLM providers.
 *
 * Request pipeline for complete / completeJson:
 *
 *   1. semantic cache lookup   (useCache)            ── hit → return, provider skipped
 *   2. context session lookup  (sessionKey + caching provider) → live handle, if any
 *   3. provider call           breaker + retry (+ JSON re-issue, + optional fallback)
 *   4. semantic cache store    (useCache)
 *
 * Steps 1, 2 and 4 each run inside their own catch-log-continue boundary; only
 * a failure in step 3 reaches the caller.
 *
 * Provider state: exactly one active provider.  A swap builds the new
 * instance first and commits only if construction succeeded, so a missing
 * credential leaves the previous provider in charge.  Swapping while a call
 * is in flight against the old provider is not coordinated; the in-flight
 * call finishes on the instance it started with.
 */
@Slf4j
public class LlmClient implements TextEmbedder {

    private static final TypeReference<Map<String, Object>> JSON_OBJECT_TYPE = new TypeReference<>() {};

    private final ProviderFactory       providerFactory;
    private final LlmResilience         resilience;
    private final ObjectMapper          objectMapper;
    private final SemanticResponseCache semanticCache;
    private final ContextSessionService sessions;
    private final boolean               fallbackEnabled;
    private final Clock                 clock;

    /** Lazily built providers used only as fallbacks; never the active one. */
    private final Map<ProviderType, LlmProvider> fallbackProviders = new ConcurrentHashMap<>();

    private volatile LlmProvider provider;
    private volatile double      temperature;

    public LlmClient(ProviderFactory providerFactory,
                     LlmResilience resilience,
                     ObjectMapper objectMapper,
                     @Nullable SemanticResponseCache semanticCache,
                     @Nullable ContextSessionService sessions,
                     Options options) {
        this.providerFactory = providerFactory;
        this.resilience      = resilience;
        this.objectMapper    = objectMapper;
        this.semanticCache   = semanticCache;
        this.sessions        = sessions;
        this.fallbackEnabled = options.fallbackEnabled();
        this.clock           = options.clock() != null ? options.clock() : Clock.systemUTC();
        this.temperature     = options.temperature();

        ProviderType type = options.provider() != null ? options.provider() : firstConfigured();
        this.provider = providerFactory.create(type, new ProviderSettings(null, temperature));
        log.info("[LlmClient] Active provider {} model={}", type.id(), provider.model());
    }

    /**
     * @param provider        explicit provider, or null for the first configured in preference order
     * @param temperature     default sampling temperature
     * @param fallbackEnabled retry an ultimately failed call once on the next configured provider
     * @param clock           time source for handle liveness; null means system UTC
     */
    public record Options(ProviderType provider, double temperature, boolean fallbackEnabled, Clock clock) {

        public static Options defaults() {
            return new Options(null, 0.7, false, null);
        }
    }

    // ── Provider state ───────────────────────────────────────────────────────

    public ProviderType getProviderType() {
        return provider.type();
    }

    public String getModel() {
        return provider.model();
    }

    public double getTemperature() {
        return temperature;
    }

    /** Embedding model of the active provider; recorded on every stored embedding. */
    public String embeddingModel() {
        return provider.embeddingModel();
    }

    /** Context-caching capability of the active provider, if it has one. */
    public Optional<ContextCaching> contextCaching() {
        return provider.contextCaching();
    }

    /**
     * Switches the active provider.  The new instance starts on its configured
     * model (model names do not carry across vendors) and keeps the client's
     * temperature.
     *
     * @throws ConfigurationException when {@code type} has no credential; nothing changes
     */
    public synchronized void setProvider(ProviderType type) {
        if (provider.type() == type) return;
        LlmProvider next = providerFactory.create(type, new ProviderSettings(null, temperature));
        LlmProvider previous = provider;
        provider = next;
        fallbackProviders.remove(type);
        log.info("[LlmClient] Provider switched {} → {} model={}", previous.type().id(), type.id(), next.model());
    }

    public synchronized void setModel(String model) {
        provider = providerFactory.create(provider.type(), new ProviderSettings(model, temperature));
    }

    public synchronized void setTemperature(double temperature) {
        LlmProvider next = providerFactory.create(provider.type(), new ProviderSettings(provider.model(), temperature));
        this.temperature = temperature;
        provider = next;
    }

    // ── Completions ──────────────────────────────────────────────────────────

    public String complete(CompletionRequest request) {
        LlmProvider active = provider;

        if (request.useCache()) {
            Optional<String> cached = cacheLookup(request, active, ResponseFormat.TEXT);
            if (cached.isPresent()) return cached.get();
        }

        ExternalCacheHandle handle = resolveCachedContext(request, active);
        Answer<String> answer = invoke(active, handle, (p, h) -> p.complete(request, h));

        if (request.useCache()) {
            cacheStore(request, answer.value(), answer.provider(), ResponseFormat.TEXT);
        }
        return answer.value();
    }

    public String complete(String prompt, String systemPrompt) {
        return complete(CompletionRequest.of(prompt, systemPrompt));
    }

    /**
     * Same pipeline as {@link #complete}, re-issuing the provider call until the
     * answer parses as a JSON object.
     *
     * @throws ValidationException when every attempt returned malformed JSON
     */
    public Map<String, Object> completeJson(CompletionRequest request) {
        LlmProvider active = provider;

        if (request.useCache()) {
            Optional<Map<String, Object>> cached = cacheLookup(request, active, ResponseFormat.JSON)
                    .flatMap(this::parseCachedJson);
            if (cached.isPresent()) return cached.get();
        }

        ExternalCacheHandle handle = resolveCachedContext(request, active);
        Answer<Map<String, Object>> answer;
        try {
            answer = resilience.reissueUntilValid(
                    () -> invoke(active, handle, (p, h) -> p.completeJson(request, h)));
        } catch (ValidationException e) {
            throw new ValidationException("Provider [%s] did not return a well-formed JSON object: %s"
                    .formatted(active.type().id(), e.getMessage()), e);
        }

        if (request.useCache()) {
            toJson(answer.value()).ifPresent(json ->
                    cacheStore(request, json, answer.provider(), ResponseFormat.JSON));
        }
        return answer.value();
    }

    /** Passthrough to the active provider.  Transient failures are retried; results are never cached. */
    @Override
    public float[] embed(String text) {
        LlmProvider active = provider;
        return resilience.call(active.type(), () -> active.embed(text));
    }

    // ── Step 3: provider call with optional fallback ─────────────────────────

    private <T> Answer<T> invoke(LlmProvider active,
                                 @Nullable ExternalCacheHandle handle,
                                 BiFunction<LlmProvider, ExternalCacheHandle, T> call) {
        try {
            return new Answer<>(resilience.call(active.type(), () -> call.apply(active, handle)), active);
        } catch (ProviderException primaryFailure) {
            Optional<LlmProvider> fallback = fallbackEnabled ? fallbackFor(active.type()) : Optional.empty();
            if (fallback.isEmpty()) throw primaryFailure;

            LlmProvider next = fallback.get();
            log.warn("[LlmClient] Provider {} failed ({}), engaging fallback {}. Cause: {}",
                    active.type().id(), primaryFailure.getClass().getSimpleName(),
                    next.type().id(), primaryFailure.getMessage());
            // a cached-context handle belongs to the failed provider
            return new Answer<>(resilience.call(next.type(), () -> call.apply(next, null)), next);
        }
    }

    private Optional<LlmProvider> fallbackFor(ProviderType failed) {
        return Arrays.stream(ProviderType.values())
                .filter(t -> t != failed && providerFactory.isConfigured(t))
                .findFirst()
                .map(t -> fallbackProviders.computeIfAbsent(t,
                        type -> providerFactory.create(type, new ProviderSettings(null, temperature))));
    }

    private ProviderType firstConfigured() {
        return Arrays.stream(ProviderType.values())
                .filter(providerFactory::isConfigured)
                .findFirst()
                .orElseThrow(() -> new ConfigurationException(
                        "No LLM provider API keys found. Configure concept.llm.gemini.api-key or concept.llm.openai.api-key."));
    }

    // ── Steps 1, 2, 4: isolated secondary boundaries ─────────────────────────

    private Optional<String> cacheLookup(CompletionRequest request, LlmProvider active, ResponseFormat format) {
        if (semanticCache == null) return Optional.empty();
        try {
            return semanticCache.lookup(request.cacheKeyText(), active.type(), active.model(), format);
        } catch (RuntimeException e) {
            log.warn("[LlmClient] Semantic cache lookup failed, calling provider uncached: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private void cacheStore(CompletionRequest request, String response, LlmProvider answeredBy, ResponseFormat format) {
        if (semanticCache == null) return;
        try {
            semanticCache.store(request.cacheKeyText(), response, answeredBy.type(), answeredBy.model(), format);
        } catch (RuntimeException e) {
            log.warn("[LlmClient] Semantic cache store failed: {}", e.getMessage());
        }
    }

    @Nullable
    private ExternalCacheHandle resolveCachedContext(CompletionRequest request, LlmProvider active) {
        if (sessions == null || request.sessionKey() == null || active.contextCaching().isEmpty()) {
            return null;
        }
        try {
            return sessions.getContextSession(request.sessionKey())
                    .flatMap(SessionSnapshot::externalCache)
                    .filter(h -> h.isLive(clock.instant()))
                    .orElse(null);
        } catch (RuntimeException e) {
            log.warn("[LlmClient] Context session lookup failed for {}, sending full context: {}",
                    request.sessionKey(), e.getMessage());
            return null;
        }
    }

    private Optional<Map<String, Object>> parseCachedJson(String json) {
        try {
            return Optional.of(objectMapper.readValue(json, JSON_OBJECT_TYPE));
        } catch (JsonProcessingException e) {
            log.warn("[LlmClient] Ignoring unreadable cached JSON response: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private Optional<String> toJson(Map<String, Object> value) {
        try {
            return Optional.of(objectMapper.writeValueAsString(value));
        } catch (JsonProcessingException e) {
            log.warn("[LlmClient] Response not cached, serialization failed: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    /** A provider result together with the provider that produced it. */
    private record Answer<T>(T value, LlmProvider provider) {
    }
}
