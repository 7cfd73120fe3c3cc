package com.openforge.conceptai.llm;

import java.time.Instant;

/**
 * Opaque reference to provider-hosted context (e.g. {@code cachedContents/abc123}).
 * The provider owns the content; this module only passes the id along and
 * eventually asks for its release.
 */
public record ExternalCacheHandle(String id, Instant expiresAt) {

    public boolean isLive(Instant now) {
        return expiresAt == null || expiresAt.isAfter(now);
    }
}
