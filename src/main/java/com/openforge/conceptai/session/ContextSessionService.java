package com.openforge.conceptai.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.conceptai.common.ConceptAiException;
import com.openforge.conceptai.domain.ContextSession;
import com.openforge.conceptai.llm.ChatMessage;
import com.openforge.conceptai.llm.ContextCaching;
import com.openforge.conceptai.llm.ExternalCacheHandle;
import com.openforge.conceptai.llm.LlmClient;
import com.openforge.conceptai.llm.ProviderType;
import com.openforge.conceptai.repository.ContextSessionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Server-side conversational state keyed by a deterministic session key.
 *
 * Rows are merged rather than replaced: a repeated getOrCreate appends to the
 * transcript and unions the tracked concept ids.  Expiry is lazy; an expired
 * row stays in the table until {@link #cleanupExpiredSessions} removes it,
 * but every read treats it as absent.
 *
 * Large transcripts may additionally be uploaded to the active provider as
 * hosted context.  That upload runs on a background executor once the row has
 * been committed, and writes its handle back through
 * {@link #attachExternalCache}; callers never wait for it and never see its
 * failure.
 */
@Slf4j
@Service
public class ContextSessionService {

    private static final TypeReference<List<ChatMessage>> MESSAGE_LIST_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<String>>      ID_LIST_TYPE      = new TypeReference<>() {};

    private final ContextSessionRepository repository;
    private final ObjectMapper             objectMapper;
    private final ContextSessionProperties properties;
    private final Executor                 executor;
    private final Clock                    clock;

    public ContextSessionService(ContextSessionRepository repository,
                                 ObjectMapper objectMapper,
                                 ContextSessionProperties properties,
                                 @Qualifier("backgroundExecutor") Executor executor,
                                 Clock clock) {
        this.repository   = repository;
        this.objectMapper = objectMapper;
        this.properties   = properties;
        this.executor     = executor;
        this.clock        = clock;
    }

    // ── Create / merge ───────────────────────────────────────────────────────

    /**
     * Merges into the unexpired row for {@code key}, or starts a fresh one.
     * An expired or unreadable row is reset in place; its hosted context, if
     * any, is released first when {@code llmClient} can do so.
     *
     * @param ttl       lifetime from now; null means the configured default
     * @param llmClient enables hosted-context creation; null skips it
     */
    @Transactional
    public SessionSnapshot getOrCreate(String key,
                                       ProviderType provider,
                                       String model,
                                       List<ChatMessage> messages,
                                       Collection<String> conceptIds,
                                       @Nullable Duration ttl,
                                       @Nullable LlmClient llmClient) {
        Instant now       = clock.instant();
        Instant expiresAt = now.plus(ttl != null ? ttl : properties.defaultTtl());

        Optional<ContextSession> existing = repository.findBySessionKey(key);
        ContextSession row;
        List<ChatMessage> mergedMessages;
        Set<String> mergedIds;

        Optional<SessionSnapshot> live = existing.flatMap(this::decode).filter(s -> !s.isExpired(now));
        if (live.isPresent()) {
            row            = existing.get();
            mergedMessages = new ArrayList<>(live.get().messages());
            mergedMessages.addAll(messages);
            mergedIds      = new LinkedHashSet<>(live.get().conceptIds());
            mergedIds.addAll(conceptIds);
            log.debug("[ContextSession] Merging {} messages into session {}", messages.size(), key);
        } else {
            row = existing.map(stale -> {
                releaseQuietly(stale, llmClient);
                resetExternalCache(stale);
                return stale;
            }).orElseGet(ContextSession::new);
            row.setSessionKey(key);
            row.setProvider(provider.id());
            row.setModel(model);
            mergedMessages = new ArrayList<>(messages);
            mergedIds      = new LinkedHashSet<>(conceptIds);
            log.debug("[ContextSession] {} session {}", existing.isPresent() ? "Restarting" : "Creating", key);
        }

        row.setMessages(writeJson(mergedMessages));
        row.setConceptIds(mergedIds.isEmpty() ? null : writeJson(new ArrayList<>(mergedIds)));
        row.setExpiresAt(expiresAt);
        ContextSession saved = repository.save(row);

        SessionSnapshot snapshot = toSnapshot(saved, mergedMessages, mergedIds);

        if (llmClient != null && snapshot.externalCache().isEmpty()) {
            ProviderType sessionProvider = snapshot.provider();
            String content = transcriptText(mergedMessages);
            if (qualifiesForExternalCache(sessionProvider, content, llmClient)) {
                afterCommit(() -> scheduleExternalCache(key, sessionProvider, content, llmClient));
            }
        }
        return snapshot;
    }

    // ── Read / update / delete ───────────────────────────────────────────────

    /**
     * The session, unless absent, expired or unreadable. An expired row is left in place.
     * Runs in its own transaction so a store failure cannot poison the caller's.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW, readOnly = true)
    public Optional<SessionSnapshot> getContextSession(String key) {
        Instant now = clock.instant();
        return repository.findBySessionKey(key)
                .flatMap(this::decode)
                .filter(s -> !s.isExpired(now));
    }

    @Transactional
    public Optional<SessionSnapshot> updateContextSession(String key, List<ChatMessage> newMessages) {
        return updateContextSession(key, newMessages, null);
    }

    /**
     * Appends {@code newMessages} and, when given, unions {@code conceptIds}.
     * Expiry is left unchanged.
     *
     * @return the merged session, or empty when no live session exists
     */
    @Transactional
    public Optional<SessionSnapshot> updateContextSession(String key,
                                                          List<ChatMessage> newMessages,
                                                          @Nullable Collection<String> conceptIds) {
        Instant now = clock.instant();
        Optional<ContextSession> existing = repository.findBySessionKey(key);
        Optional<SessionSnapshot> live = existing.flatMap(this::decode).filter(s -> !s.isExpired(now));
        if (live.isEmpty()) return Optional.empty();

        List<ChatMessage> mergedMessages = new ArrayList<>(live.get().messages());
        mergedMessages.addAll(newMessages);
        Set<String> mergedIds = new LinkedHashSet<>(live.get().conceptIds());
        if (conceptIds != null) mergedIds.addAll(conceptIds);

        ContextSession row = existing.get();
        row.setMessages(writeJson(mergedMessages));
        row.setConceptIds(mergedIds.isEmpty() ? null : writeJson(new ArrayList<>(mergedIds)));
        return Optional.of(toSnapshot(repository.save(row), mergedMessages, mergedIds));
    }

    @Transactional
    public void deleteContextSession(String key) {
        repository.deleteBySessionKey(key);
    }

    // ── Sweeps ───────────────────────────────────────────────────────────────

    /**
     * Deletes every expired row.  Hosted context owned by a deleted row is
     * released first through {@code llmClient}, when its active provider is
     * the one that created it; release failures are logged and the row is
     * deleted anyway.
     *
     * @return number of rows removed
     */
    @Transactional
    public int cleanupExpiredSessions(@Nullable LlmClient llmClient) {
        List<ContextSession> expired = repository.findByExpiresAtBefore(clock.instant());
        if (expired.isEmpty()) return 0;

        for (ContextSession row : expired) {
            releaseQuietly(row, llmClient);
        }
        repository.deleteAll(expired);
        log.debug("[ContextSession] Cleaned up {} expired sessions", expired.size());
        return expired.size();
    }

    /**
     * Deletes every session whose tracked concept set intersects
     * {@code conceptIds}.
     *
     * Hosted context on the deleted rows is not released here; it lapses
     * with its own provider-side TTL.  Runs in its own transaction, separate
     * from whatever concept change triggered it.
     *
     * @return number of rows removed
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int invalidateSessionsForConcepts(Collection<String> conceptIds) {
        if (conceptIds == null || conceptIds.isEmpty()) return 0;
        Set<String> changed = Set.copyOf(conceptIds);

        List<ContextSession> affected = repository.findByConceptIdsIsNotNull().stream()
                .filter(row -> readConceptIds(row).stream().anyMatch(changed::contains))
                .collect(Collectors.toList());
        if (affected.isEmpty()) return 0;

        for (ContextSession row : affected) {
            if (row.getExternalCacheId() != null) {
                log.warn("[ContextSession] Invalidated session {} still owns hosted context {}; not released",
                        row.getSessionKey(), row.getExternalCacheId());
            }
        }
        repository.deleteAll(affected);
        log.debug("[ContextSession] Invalidated {} sessions for concepts {}", affected.size(), changed);
        return affected.size();
    }

    // ── Hosted context ───────────────────────────────────────────────────────

    /**
     * Uploads {@code content} as hosted context for the session and attaches
     * the handle to its row.  A no-op unless {@code provider} is the client's
     * active provider, that provider supports context caching, and the content
     * reaches the size threshold.  Remote failures are logged, never thrown.
     *
     * @return the handle now attached to the row, if any
     */
    public Optional<ExternalCacheHandle> createCacheFor(String key,
                                                        ProviderType provider,
                                                        String content,
                                                        LlmClient llmClient) {
        if (!qualifiesForExternalCache(provider, content, llmClient)) return Optional.empty();
        ContextCaching caching = llmClient.contextCaching().orElseThrow();

        ExternalCacheHandle handle;
        try {
            handle = caching.createContextCache(content, properties.externalCacheTtl());
        } catch (RuntimeException e) {
            log.warn("[ContextSession] Hosted context creation failed for {}, continuing without: {}",
                    key, e.getMessage());
            return Optional.empty();
        }
        log.debug("[ContextSession] Created hosted context {} for session {}", handle.id(), key);

        try {
            return attachExternalCache(key, handle, caching);
        } catch (RuntimeException e) {
            log.warn("[ContextSession] Could not attach hosted context {} to {}: {}", handle.id(), key, e.getMessage());
            deleteQuietly(caching, handle.id());
            return Optional.empty();
        }
    }

    /**
     * Writes {@code handle} onto the session row.  The first handle to land
     * wins; a later one, or one whose row has disappeared, is released.
     *
     * The write touches only the handle columns and leaves the row version
     * alone, so a foreground merge of the same row commits unaffected.
     */
    @Transactional
    public Optional<ExternalCacheHandle> attachExternalCache(String key,
                                                             ExternalCacheHandle handle,
                                                             ContextCaching owner) {
        if (repository.attachExternalCacheIfAbsent(key, handle.id(), handle.expiresAt()) == 1) {
            return Optional.of(handle);
        }

        deleteQuietly(owner, handle.id());
        Optional<ContextSession> row = repository.findBySessionKey(key);
        if (row.isEmpty()) {
            log.debug("[ContextSession] Session {} gone before hosted context {} landed", key, handle.id());
            return Optional.empty();
        }
        ContextSession session = row.get();
        return Optional.ofNullable(session.getExternalCacheId())
                .map(id -> new ExternalCacheHandle(id, session.getCacheExpiresAt()));
    }

    private boolean qualifiesForExternalCache(ProviderType provider, String content, LlmClient llmClient) {
        return content != null
                && content.length() >= properties.externalCacheThresholdChars()
                && llmClient.getProviderType() == provider
                && llmClient.contextCaching().isPresent();
    }

    private void scheduleExternalCache(String key, ProviderType provider, String content, LlmClient llmClient) {
        CompletableFuture
                .runAsync(() -> createCacheFor(key, provider, content, llmClient), executor)
                .exceptionally(e -> {
                    log.warn("[ContextSession] Hosted context task for {} failed: {}", key, e.getMessage());
                    return null;
                });
    }

    /** Runs {@code task} once the surrounding transaction commits, or right away outside one. */
    private static void afterCommit(Runnable task) {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    task.run();
                }
            });
        } else {
            task.run();
        }
    }

    private void releaseQuietly(ContextSession row, @Nullable LlmClient llmClient) {
        if (row.getExternalCacheId() == null || llmClient == null) return;
        if (!row.getProvider().equals(llmClient.getProviderType().id())) {
            log.debug("[ContextSession] Hosted context {} belongs to {}, active provider is {}; left to expire",
                    row.getExternalCacheId(), row.getProvider(), llmClient.getProviderType().id());
            return;
        }
        llmClient.contextCaching().ifPresent(caching -> deleteQuietly(caching, row.getExternalCacheId()));
    }

    private static void deleteQuietly(ContextCaching caching, String handleId) {
        try {
            caching.deleteCache(handleId);
        } catch (RuntimeException e) {
            log.warn("[ContextSession] Failed to release hosted context {}: {}", handleId, e.getMessage());
        }
    }

    private static void resetExternalCache(ContextSession row) {
        row.setExternalCacheId(null);
        row.setCacheExpiresAt(null);
    }

    // ── Row ↔ snapshot ───────────────────────────────────────────────────────

    private Optional<SessionSnapshot> decode(ContextSession row) {
        try {
            List<ChatMessage> messages = objectMapper.readValue(row.getMessages(), MESSAGE_LIST_TYPE);
            List<String> ids = row.getConceptIds() == null
                    ? List.of()
                    : objectMapper.readValue(row.getConceptIds(), ID_LIST_TYPE);
            return Optional.of(toSnapshot(row, messages, new LinkedHashSet<>(ids)));
        } catch (JsonProcessingException | ConceptAiException e) {
            log.warn("[ContextSession] Unreadable session {}, treating as absent: {}", row.getSessionKey(), e.getMessage());
            return Optional.empty();
        }
    }

    private List<String> readConceptIds(ContextSession row) {
        try {
            return objectMapper.readValue(row.getConceptIds(), ID_LIST_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("[ContextSession] Unreadable concept ids on session {}: {}", row.getSessionKey(), e.getMessage());
            return List.of();
        }
    }

    private static SessionSnapshot toSnapshot(ContextSession row, List<ChatMessage> messages, Set<String> conceptIds) {
        ExternalCacheHandle handle = row.getExternalCacheId() == null
                ? null
                : new ExternalCacheHandle(row.getExternalCacheId(), row.getCacheExpiresAt());
        return new SessionSnapshot(
                row.getSessionKey(),
                ProviderType.fromId(row.getProvider()),
                row.getModel(),
                messages,
                conceptIds,
                row.getExpiresAt(),
                handle);
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ConceptAiException("Failed to serialize context session payload", e);
        }
    }

    private static String transcriptText(List<ChatMessage> messages) {
        return messages.stream()
                .map(ChatMessage::content)
                .filter(c -> c != null && !c.isEmpty())
                .collect(Collectors.joining("\n\n"));
    }
}
