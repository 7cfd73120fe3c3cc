package com.openforge.conceptai.session;

import com.openforge.conceptai.llm.ChatMessage;
import com.openforge.conceptai.llm.ExternalCacheHandle;
import com.openforge.conceptai.llm.ProviderType;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable view of a context session row.
 *
 * The external cache handle is attached asynchronously after the row is
 * first written, so it may be absent on a perfectly healthy session.
 */
public record SessionSnapshot(
        String sessionKey,
        ProviderType provider,
        String model,
        List<ChatMessage> messages,
        Set<String> conceptIds,
        Instant expiresAt,
        ExternalCacheHandle cacheHandle
) {

    public SessionSnapshot {
        messages   = List.copyOf(messages);
        conceptIds = Set.copyOf(conceptIds);
    }

    public Optional<ExternalCacheHandle> externalCache() {
        return Optional.ofNullable(cacheHandle);
    }

    public boolean isExpired(Instant now) {
        return !expiresAt.isAfter(now);
    }
}
