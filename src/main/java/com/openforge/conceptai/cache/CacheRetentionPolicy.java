package com.openforge.conceptai.cache;

import com.openforge.conceptai.llm.ProviderType;

/**
 * Capacity management hook for the semantic cache, invoked after every store.
 * The cache itself only stores and looks up.
 */
@FunctionalInterface
public interface CacheRetentionPolicy {

    void afterStore(ProviderType provider, String model);
}
