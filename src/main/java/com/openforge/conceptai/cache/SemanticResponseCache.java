package com.openforge.conceptai.cache;

import com.openforge.conceptai.domain.SemanticCacheEntry;
import com.openforge.conceptai.domain.SemanticCacheEntry.ResponseFormat;
import com.openforge.conceptai.embedding.EmbeddingCodec;
import com.openforge.conceptai.index.VectorMath;
import com.openforge.conceptai.llm.ProviderType;
import com.openforge.conceptai.llm.TextEmbedder;
import com.openforge.conceptai.repository.SemanticCacheEntryRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Cache of LLM completions keyed by prompt meaning rather than prompt text.
 *
 * A lookup embeds the prompt and compares it with the most recently used
 * entries of the same (provider, model, format) scope; the closest entry at
 * or above the similarity threshold is a hit.
 *
 * Failures propagate.  The LLM client wraps every call in its own boundary
 * so a broken cache degrades to an uncached completion.  Lookup and store run
 * in their own transaction: a failure rolls back only the cache work and
 * never marks the caller's transaction rollback-only.
 */
@Slf4j
public class SemanticResponseCache {

    private final SemanticCacheEntryRepository repository;
    private final TextEmbedder                 embedder;
    private final SemanticCacheProperties      properties;
    private final CacheRetentionPolicy         retentionPolicy;
    private final Clock                        clock;

    public SemanticResponseCache(SemanticCacheEntryRepository repository,
                                 TextEmbedder embedder,
                                 SemanticCacheProperties properties,
                                 CacheRetentionPolicy retentionPolicy,
                                 Clock clock) {
        this.repository      = repository;
        this.embedder        = embedder;
        this.properties      = properties;
        this.retentionPolicy = retentionPolicy;
        this.clock           = clock;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Optional<String> lookup(String promptText, ProviderType provider, String model, ResponseFormat format) {
        if (!properties.enabled()) return Optional.empty();

        float[] query     = embedder.embed(promptText);
        double  queryNorm = VectorMath.norm(query);
        if (queryNorm == 0.0) return Optional.empty();

        List<SemanticCacheEntry> candidates = repository
                .findByProviderAndModelAndResponseFormatOrderByLastUsedAtDesc(
                        provider.id(), model, format, PageRequest.of(0, Math.max(1, properties.candidateWindow())));

        SemanticCacheEntry best           = null;
        double             bestSimilarity = Double.NEGATIVE_INFINITY;

        for (SemanticCacheEntry entry : candidates) {
            float[] vector;
            try {
                vector = EmbeddingCodec.decode(entry.getQueryEmbedding()).values();
            } catch (EmbeddingCodec.DecodeException e) {
                log.debug("[SemanticCache] Skipping unreadable entry {}: {}", entry.getId(), e.getMessage());
                continue;
            }
            double similarity = VectorMath.cosine(query, queryNorm, vector, VectorMath.norm(vector));
            if (!Double.isNaN(similarity)
                    && similarity >= properties.similarityThreshold()
                    && similarity > bestSimilarity) {
                best           = entry;
                bestSimilarity = similarity;
            }
        }

        if (best == null) {
            log.debug("[SemanticCache] Miss for {}/{} among {} candidates", provider.id(), model, candidates.size());
            return Optional.empty();
        }

        Instant now = clock.instant();
        repository.touch(best.getId(), now);
        log.debug("[SemanticCache] Hit entry {} similarity={} query='{}'",
                best.getId(), bestSimilarity, abbreviate(promptText));
        return Optional.of(best.getResponse());
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void store(String promptText, String response, ProviderType provider, String model, ResponseFormat format) {
        if (!properties.enabled()) return;

        float[] embedding = embedder.embed(promptText);
        repository.save(SemanticCacheEntry.builder()
                .queryEmbedding(EmbeddingCodec.encode(embedding))
                .queryText(promptText)
                .response(response)
                .responseFormat(format)
                .provider(provider.id())
                .model(model)
                .lastUsedAt(clock.instant())
                .build());
        log.debug("[SemanticCache] Stored response for {}/{} query='{}'", provider.id(), model, abbreviate(promptText));

        retentionPolicy.afterStore(provider, model);
    }

    /**
     * Removes cached entries.  A null provider or model widens the scope.
     *
     * @return number of entries removed
     */
    @Transactional
    public int clear(ProviderType provider, String model) {
        int removed = repository.deleteScope(provider == null ? null : provider.id(), model);
        log.info("[SemanticCache] Cleared {} entries (provider={}, model={})", removed,
                provider == null ? "*" : provider.id(), model == null ? "*" : model);
        return removed;
    }

    private static String abbreviate(String text) {
        return text.length() > 100 ? text.substring(0, 100) + "…" : text;
    }
}
