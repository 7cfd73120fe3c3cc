package com.openforge.conceptai.cache;

import com.openforge.conceptai.llm.ProviderType;

/** Default retention: the cache grows without bound. */
public class NoEvictionPolicy implements CacheRetentionPolicy {

    @Override
    public void afterStore(ProviderType provider, String model) {
        // unbounded
    }
}
