package com.openforge.conceptai.llm;

import java.time.Duration;

/**
 * Optional provider capability: host large static context server-side so
 * later calls can reference it by handle instead of resending it.
 */
public interface ContextCaching {

    ExternalCacheHandle createContextCache(String content, Duration ttl);

    void deleteCache(String handleId);
}
