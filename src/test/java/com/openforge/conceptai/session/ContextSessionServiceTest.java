package com.openforge.conceptai.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.conceptai.common.ProviderException;
import com.openforge.conceptai.config.JpaConfig;
import com.openforge.conceptai.llm.ChatMessage;
import com.openforge.conceptai.llm.ContextCaching;
import com.openforge.conceptai.llm.ExternalCacheHandle;
import com.openforge.conceptai.llm.LlmClient;
import com.openforge.conceptai.llm.ProviderType;
import com.openforge.conceptai.repository.ContextSessionRepository;
import com.openforge.conceptai.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Runs without a surrounding test transaction so that each repository call
 * commits, as it does in production, and post-commit work actually fires.
 */
@DataJpaTest
@Import(JpaConfig.class)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class ContextSessionServiceTest {

    private static final String MODEL = "gemini-2.0-flash";
    private static final String BIG   = "x".repeat(2500);

    @Autowired
    private ContextSessionRepository repository;

    @Autowired
    private PlatformTransactionManager transactionManager;

    private MutableClock    clock;
    private Deque<Runnable> pending;
    private ContextCaching  caching;
    private LlmClient       llmClient;

    @BeforeEach
    void setUp() {
        clock   = MutableClock.startingAt("2025-01-01T00:00:00Z");
        pending = new ArrayDeque<>();
        caching = mock(ContextCaching.class);
        llmClient = mock(LlmClient.class);
        when(llmClient.getProviderType()).thenReturn(ProviderType.GEMINI);
        when(llmClient.contextCaching()).thenReturn(Optional.of(caching));
    }

    @AfterEach
    void tearDown() {
        repository.deleteAll();
    }

    @Test
    void getOrCreate_sameKeyTwice_mergesMessagesAndUnionsConceptIds() {
        ContextSessionService service = service(Runnable::run);
        String key = SessionKeys.of("enrich", "c1");

        service.getOrCreate(key, ProviderType.GEMINI, MODEL,
                List.of(ChatMessage.system("sys"), ChatMessage.user("one")), List.of("a", "b"), null, null);
        SessionSnapshot merged = service.getOrCreate(key, ProviderType.GEMINI, MODEL,
                List.of(ChatMessage.user("two")), List.of("b", "c"), null, null);

        assertThat(merged.messages()).extracting(ChatMessage::content).containsExactly("sys", "one", "two");
        assertThat(merged.conceptIds()).containsExactlyInAnyOrder("a", "b", "c");
        assertThat(repository.count()).isEqualTo(1);
    }

    @Test
    void getContextSession_afterTtl_reportsAbsentButRowRemainsUntilCleanup() {
        ContextSessionService service = service(Runnable::run);
        service.getOrCreate("short", ProviderType.GEMINI, MODEL,
                List.of(ChatMessage.user("hi")), List.of(), Duration.ofMillis(1), null);

        clock.advance(Duration.ofMillis(10));

        assertThat(service.getContextSession("short")).isEmpty();
        assertThat(repository.findBySessionKey("short")).isPresent();

        assertThat(service.cleanupExpiredSessions(null)).isEqualTo(1);
        assertThat(repository.findBySessionKey("short")).isEmpty();
    }

    @Test
    void getOrCreate_expiredRow_startsFreshTranscript() {
        ContextSessionService service = service(Runnable::run);
        service.getOrCreate("k", ProviderType.GEMINI, MODEL,
                List.of(ChatMessage.user("old")), List.of("a"), Duration.ofSeconds(1), null);
        clock.advance(Duration.ofSeconds(5));

        SessionSnapshot fresh = service.getOrCreate("k", ProviderType.GEMINI, MODEL,
                List.of(ChatMessage.user("new")), List.of("b"), null, null);

        assertThat(fresh.messages()).extracting(ChatMessage::content).containsExactly("new");
        assertThat(fresh.conceptIds()).containsExactly("b");
        assertThat(repository.count()).isEqualTo(1);
    }

    @Test
    void updateContextSession_absentKey_returnsEmpty() {
        assertThat(service(Runnable::run).updateContextSession("nope", List.of(ChatMessage.user("x")))).isEmpty();
    }

    @Test
    void updateContextSession_existing_appendsMessages() {
        ContextSessionService service = service(Runnable::run);
        service.getOrCreate("k", ProviderType.GEMINI, MODEL, List.of(ChatMessage.user("q")), List.of(), null, null);

        Optional<SessionSnapshot> updated = service.updateContextSession("k",
                List.of(ChatMessage.assistant("a")), List.of("c9"));

        assertThat(updated).isPresent();
        assertThat(updated.get().messages()).hasSize(2);
        assertThat(service.getContextSession("k").orElseThrow().conceptIds()).containsExactly("c9");
    }

    @Test
    void invalidateSessionsForConcepts_deletesExactlyIntersectingSessions() {
        ContextSessionService service = service(Runnable::run);
        service.getOrCreate("s1", ProviderType.GEMINI, MODEL, List.of(ChatMessage.user("1")), List.of("x", "y"), null, null);
        service.getOrCreate("s2", ProviderType.GEMINI, MODEL, List.of(ChatMessage.user("2")), List.of("y"), null, null);
        service.getOrCreate("s3", ProviderType.GEMINI, MODEL, List.of(ChatMessage.user("3")), List.of("z"), null, null);
        service.getOrCreate("s4", ProviderType.GEMINI, MODEL, List.of(ChatMessage.user("4")), List.of(), null, null);

        int removed = service.invalidateSessionsForConcepts(List.of("x"));

        assertThat(removed).isEqualTo(1);
        assertThat(repository.findBySessionKey("s1")).isEmpty();
        assertThat(repository.findBySessionKey("s2")).isPresent();
        assertThat(repository.findBySessionKey("s3")).isPresent();
        assertThat(repository.findBySessionKey("s4")).isPresent();
    }

    @Test
    void deleteContextSession_removesRow() {
        ContextSessionService service = service(Runnable::run);
        service.getOrCreate("k", ProviderType.GEMINI, MODEL, List.of(ChatMessage.user("q")), List.of(), null, null);

        service.deleteContextSession("k");

        assertThat(service.getContextSession("k")).isEmpty();
    }

    @Test
    void getOrCreate_largeTranscript_createsHostedContextWithoutBlocking() {
        when(caching.createContextCache(anyString(), any()))
                .thenReturn(new ExternalCacheHandle("cachedContents/abc", Instant.parse("2025-01-01T01:00:00Z")));
        ContextSessionService service = service(pending::add);

        SessionSnapshot created = service.getOrCreate("big", ProviderType.GEMINI, MODEL,
                List.of(ChatMessage.system(BIG)), List.of(), null, llmClient);

        assertThat(created.externalCache()).isEmpty();
        verifyNoInteractions(caching);
        assertThat(pending).hasSize(1);

        pending.poll().run();

        assertThat(service.getContextSession("big").orElseThrow().externalCache())
                .map(ExternalCacheHandle::id)
                .contains("cachedContents/abc");
    }

    @Test
    void getOrCreate_remoteCreationFails_sessionStaysUsable() {
        when(caching.createContextCache(anyString(), any())).thenThrow(new ProviderException("quota"));
        ContextSessionService service = service(Runnable::run);

        SessionSnapshot created = service.getOrCreate("big", ProviderType.GEMINI, MODEL,
                List.of(ChatMessage.system(BIG)), List.of(), null, llmClient);

        assertThat(created.messages()).hasSize(1);
        assertThat(service.getContextSession("big").orElseThrow().externalCache()).isEmpty();
    }

    @Test
    void getOrCreate_smallTranscript_doesNotCreateHostedContext() {
        ContextSessionService service = service(Runnable::run);

        service.getOrCreate("small", ProviderType.GEMINI, MODEL,
                List.of(ChatMessage.user("short")), List.of(), null, llmClient);

        verifyNoInteractions(caching);
    }

    @Test
    void createCacheFor_providerWithoutCaching_isNoOp() {
        when(llmClient.getProviderType()).thenReturn(ProviderType.OPENAI);
        when(llmClient.contextCaching()).thenReturn(Optional.empty());
        ContextSessionService service = service(Runnable::run);
        service.getOrCreate("k", ProviderType.OPENAI, "gpt-4o-mini", List.of(ChatMessage.user("q")), List.of(), null, null);

        assertThat(service.createCacheFor("k", ProviderType.OPENAI, BIG, llmClient)).isEmpty();
    }

    @Test
    void attachExternalCache_secondHandle_losesAndIsReleased() {
        ContextSessionService service = service(Runnable::run);
        service.getOrCreate("k", ProviderType.GEMINI, MODEL, List.of(ChatMessage.user("q")), List.of(), null, null);
        ExternalCacheHandle first  = new ExternalCacheHandle("cachedContents/1", null);
        ExternalCacheHandle second = new ExternalCacheHandle("cachedContents/2", null);

        service.attachExternalCache("k", first, caching);
        Optional<ExternalCacheHandle> kept = service.attachExternalCache("k", second, caching);

        assertThat(kept).map(ExternalCacheHandle::id).contains("cachedContents/1");
        verify(caching).deleteCache("cachedContents/2");
        verify(caching, never()).deleteCache("cachedContents/1");
    }

    @Test
    void attachExternalCache_landingWhileMergeIsUncommitted_bothSurvive() {
        ContextSessionService service = service(Runnable::run);
        String key = SessionKeys.of("enrich", "c1");
        service.getOrCreate(key, ProviderType.GEMINI, MODEL, List.of(ChatMessage.user("first")), List.of("a"), null, null);
        ExternalCacheHandle handle = new ExternalCacheHandle("cachedContents/late", Instant.parse("2025-01-01T01:00:00Z"));
        ExecutorService background = Executors.newSingleThreadExecutor();

        try {
            new TransactionTemplate(transactionManager).executeWithoutResult(status -> {
                service.getOrCreate(key, ProviderType.GEMINI, MODEL,
                        List.of(ChatMessage.user("second")), List.of("b"), null, null);
                // the upload commits its handle between the merge's read and its commit
                awaitOn(background, () -> service.attachExternalCache(key, handle, caching));
            });
        } finally {
            background.shutdownNow();
        }

        SessionSnapshot session = service.getContextSession(key).orElseThrow();
        assertThat(session.messages()).extracting(ChatMessage::content).containsExactly("first", "second");
        assertThat(session.conceptIds()).containsExactlyInAnyOrder("a", "b");
        assertThat(session.externalCache()).map(ExternalCacheHandle::id).contains("cachedContents/late");
        verify(caching, never()).deleteCache(anyString());
    }

    @Test
    void attachExternalCache_rowGone_releasesHandle() {
        ContextSessionService service = service(Runnable::run);

        Optional<ExternalCacheHandle> kept = service.attachExternalCache("missing",
                new ExternalCacheHandle("cachedContents/orphan", null), caching);

        assertThat(kept).isEmpty();
        verify(caching).deleteCache("cachedContents/orphan");
    }

    @Test
    void cleanupExpiredSessions_releasesHostedContext() {
        ContextSessionService service = service(Runnable::run);
        service.getOrCreate("k", ProviderType.GEMINI, MODEL,
                List.of(ChatMessage.user("q")), List.of(), Duration.ofMinutes(1), null);
        service.attachExternalCache("k", new ExternalCacheHandle("cachedContents/9", null), caching);
        clock.advance(Duration.ofMinutes(2));

        int removed = service.cleanupExpiredSessions(llmClient);

        assertThat(removed).isEqualTo(1);
        verify(caching).deleteCache("cachedContents/9");
    }

    @Test
    void cleanupExpiredSessions_releaseFails_rowStillDeleted() {
        ContextSessionService service = service(Runnable::run);
        service.getOrCreate("k", ProviderType.GEMINI, MODEL,
                List.of(ChatMessage.user("q")), List.of(), Duration.ofMinutes(1), null);
        service.attachExternalCache("k", new ExternalCacheHandle("cachedContents/9", null), caching);
        doThrow(new ProviderException("boom")).when(caching).deleteCache("cachedContents/9");
        clock.advance(Duration.ofMinutes(2));

        assertThat(service.cleanupExpiredSessions(llmClient)).isEqualTo(1);
        assertThat(repository.count()).isZero();
    }

    private static void awaitOn(ExecutorService executor, Runnable task) {
        try {
            executor.submit(task).get(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        } catch (ExecutionException | TimeoutException e) {
            throw new IllegalStateException(e);
        }
    }

    private ContextSessionService service(Executor executor) {
        return new ContextSessionService(repository, new ObjectMapper(),
                new ContextSessionProperties(Duration.ofHours(1), 2000, Duration.ofHours(1), Duration.ofMinutes(10)),
                executor, clock);
    }
}
