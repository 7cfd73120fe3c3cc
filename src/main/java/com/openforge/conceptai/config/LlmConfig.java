package com.openforge.conceptai.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.conceptai.cache.CacheRetentionPolicy;
import com.openforge.conceptai.cache.LeastRecentlyUsedRetentionPolicy;
import com.openforge.conceptai.cache.NoEvictionPolicy;
import com.openforge.conceptai.cache.SemanticCacheProperties;
import com.openforge.conceptai.cache.SemanticResponseCache;
import com.openforge.conceptai.embedding.EmbeddingProperties;
import com.openforge.conceptai.index.VectorIndex;
import com.openforge.conceptai.llm.CredentialSource;
import com.openforge.conceptai.llm.LlmClient;
import com.openforge.conceptai.llm.LlmProperties;
import com.openforge.conceptai.llm.LlmResilience;
import com.openforge.conceptai.llm.PropertiesCredentialSource;
import com.openforge.conceptai.llm.ProviderFactory;
import com.openforge.conceptai.llm.ProviderType;
import com.openforge.conceptai.llm.TextEmbedder;
import com.openforge.conceptai.llm.provider.HttpProviderFactory;
import com.openforge.conceptai.repository.SemanticCacheEntryRepository;
import com.openforge.conceptai.session.ContextSessionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;

import java.net.http.HttpClient;
import java.time.Clock;

/**
 * Wires the process-wide LLM client, the semantic response cache and the
 * vector index.
 *
 * The cache embeds prompts through the client while the client consults the
 * cache, so the cache receives a lazy {@link TextEmbedder} reference that is
 * resolved on first use.
 */
@Slf4j
@Configuration
public class LlmConfig {

    @Bean
    public CredentialSource credentialSource(LlmProperties properties) {
        return new PropertiesCredentialSource(properties);
    }

    @Bean
    public ProviderFactory providerFactory(HttpClient httpClient,
                                           ObjectMapper objectMapper,
                                           LlmProperties properties,
                                           CredentialSource credentialSource) {
        return new HttpProviderFactory(httpClient, objectMapper, properties, credentialSource);
    }

    @Bean
    public CacheRetentionPolicy cacheRetentionPolicy(SemanticCacheProperties properties,
                                                     SemanticCacheEntryRepository repository) {
        if (properties.maxEntries() > 0) {
            log.info("[SemanticCache] LRU retention enabled, max {} entries per provider/model",
                    properties.maxEntries());
            return new LeastRecentlyUsedRetentionPolicy(repository, properties.maxEntries());
        }
        return new NoEvictionPolicy();
    }

    @Bean
    public SemanticResponseCache semanticResponseCache(SemanticCacheEntryRepository repository,
                                                       @Lazy TextEmbedder embedder,
                                                       SemanticCacheProperties properties,
                                                       CacheRetentionPolicy retentionPolicy,
                                                       Clock clock) {
        return new SemanticResponseCache(repository, embedder, properties, retentionPolicy, clock);
    }

    @Bean
    public LlmClient llmClient(ProviderFactory providerFactory,
                               LlmResilience resilience,
                               ObjectMapper objectMapper,
                               SemanticResponseCache semanticResponseCache,
                               ContextSessionService contextSessionService,
                               LlmProperties properties,
                               Clock clock) {
        ProviderType explicit = properties.provider() == null || properties.provider().isBlank()
                ? null
                : ProviderType.fromId(properties.provider().trim());
        return new LlmClient(providerFactory, resilience, objectMapper,
                semanticResponseCache, contextSessionService,
                new LlmClient.Options(explicit, properties.temperature(), properties.fallbackEnabled(), clock));
    }

    /** Empty until {@code EmbeddingBootstrap} loads it from the store. */
    @Bean
    public VectorIndex vectorIndex(EmbeddingProperties properties) {
        return new VectorIndex(properties.minDimensions());
    }
}
