package com.openforge.conceptai.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.conceptai.cache.NoEvictionPolicy;
import com.openforge.conceptai.cache.SemanticCacheProperties;
import com.openforge.conceptai.cache.SemanticResponseCache;
import com.openforge.conceptai.common.ProviderException;
import com.openforge.conceptai.config.JpaConfig;
import com.openforge.conceptai.repository.SemanticCacheEntryRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * The cache runs as a real transactional bean here, and the completion is
 * issued from inside the caller's own transaction.
 */
@DataJpaTest
@Import(JpaConfig.class)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class LlmClientCacheIsolationTest {

    @TestConfiguration
    static class FailingEmbedderCache {

        @Bean
        SemanticResponseCache semanticResponseCache(SemanticCacheEntryRepository repository) {
            TextEmbedder embedder = text -> {
                throw new ProviderException("embedding endpoint down");
            };
            return new SemanticResponseCache(repository, embedder,
                    new SemanticCacheProperties(true, 0.95, 100, 0), new NoEvictionPolicy(), Clock.systemUTC());
        }
    }

    @Autowired
    private SemanticResponseCache semanticCache;

    @Autowired
    private SemanticCacheEntryRepository repository;

    @Autowired
    private PlatformTransactionManager transactionManager;

    @AfterEach
    void tearDown() {
        repository.deleteAll();
    }

    @Test
    void complete_cacheEmbeddingFails_callerTransactionStillCommits() {
        LlmClient client = client("answer");
        AtomicBoolean rollbackOnly = new AtomicBoolean();

        String answer = new TransactionTemplate(transactionManager).execute(status -> {
            String result = client.complete(CompletionRequest.builder().prompt("what is a monad?").useCache(true).build());
            rollbackOnly.set(status.isRollbackOnly());
            return result;
        });

        assertThat(answer).isEqualTo("answer");
        assertThat(rollbackOnly).isFalse();
        assertThat(repository.count()).isZero();
    }

    private LlmClient client(String answer) {
        LlmProvider gemini = mock(LlmProvider.class);
        when(gemini.type()).thenReturn(ProviderType.GEMINI);
        when(gemini.model()).thenReturn("gemini-2.0-flash");
        when(gemini.embeddingModel()).thenReturn(ProviderType.GEMINI.defaultEmbeddingModel());
        when(gemini.contextCaching()).thenReturn(Optional.empty());
        when(gemini.complete(any(), isNull())).thenReturn(answer);

        ProviderFactory factory = mock(ProviderFactory.class);
        when(factory.create(eq(ProviderType.GEMINI), any())).thenReturn(gemini);

        LlmResilience resilience = LlmResilience.from(
                new LlmProperties.RetrySettings(1, Duration.ofMillis(1), 2.0, Duration.ofMillis(2)), 1);
        return new LlmClient(factory, resilience, new ObjectMapper(), semanticCache, null,
                new LlmClient.Options(ProviderType.GEMINI, 0.7, false, Clock.systemUTC()));
    }
}
