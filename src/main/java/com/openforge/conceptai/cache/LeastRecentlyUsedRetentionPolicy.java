package com.openforge.conceptai.cache;

import com.openforge.conceptai.domain.SemanticCacheEntry;
import com.openforge.conceptai.llm.ProviderType;
import com.openforge.conceptai.repository.SemanticCacheEntryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;

import java.util.List;

/**
 * Keeps at most {@code maxEntries} rows per (provider, model), dropping the
 * least recently used.
 */
@Slf4j
@RequiredArgsConstructor
public class LeastRecentlyUsedRetentionPolicy implements CacheRetentionPolicy {

    private final SemanticCacheEntryRepository repository;
    private final int                          maxEntries;

    @Override
    public void afterStore(ProviderType provider, String model) {
        long count = repository.countByProviderAndModel(provider.id(), model);
        if (count <= maxEntries) return;

        int excess = (int) Math.min(Integer.MAX_VALUE, count - maxEntries);
        List<SemanticCacheEntry> oldest = repository.findByProviderAndModelOrderByLastUsedAtAsc(
                provider.id(), model, PageRequest.of(0, excess));
        repository.deleteAll(oldest);
        log.debug("[SemanticCache] Evicted {} least recently used entries for {}/{}",
                oldest.size(), provider.id(), model);
    }
}
