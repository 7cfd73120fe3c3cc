package com.openforge.conceptai.embedding;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Loads the vector index from the durable store once the context is up, then
 * optionally starts a background backfill of missing embeddings.
 */
@Slf4j
@Component
@Order(10)
@RequiredArgsConstructor
public class EmbeddingBootstrap implements ApplicationRunner {

    private final EmbeddingOrchestrator orchestrator;
    private final EmbeddingProperties   properties;

    @Override
    public void run(ApplicationArguments args) {
        int loaded = orchestrator.rebuildIndex();
        log.info("[Embedding] Vector index ready with {} entries", loaded);

        if (!properties.backfillOnStartup()) return;

        orchestrator.backfillMissingAsync(properties.batchSize())
                .whenComplete((result, error) -> {
                    if (error != null) {
                        log.error("[Backfill] Startup backfill aborted: {}", error.getMessage(), error);
                    } else if (!result.skipped()) {
                        log.info("[Backfill] Startup backfill done: {} embedded, {} failed, {} remaining",
                                result.succeeded(), result.failed(), result.remaining());
                    }
                });
    }
}
