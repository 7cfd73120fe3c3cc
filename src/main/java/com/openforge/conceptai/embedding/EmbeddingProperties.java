package com.openforge.conceptai.embedding;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Embedding generation and backfill settings.
 *
 * application.yml:
 *
 * concept:
 *   embedding:
 *     batch-size: 10
 *     max-iterations: 50          # safety valve for one backfill run
 *     batch-retry-attempts: 3     # extra attempts for a batch in which every concept failed
 *     batch-initial-backoff: 500ms
 *     batch-max-backoff: 8s
 *     min-dimensions: 4           # stored vectors shorter than this are not indexed
 *     backfill-on-startup: true
 */
@ConfigurationProperties(prefix = "concept.embedding")
public record EmbeddingProperties(
        @DefaultValue("10") int batchSize,
        @DefaultValue("50") int maxIterations,
        @DefaultValue("3") int batchRetryAttempts,
        @DefaultValue("500ms") Duration batchInitialBackoff,
        @DefaultValue("8s") Duration batchMaxBackoff,
        @DefaultValue("4") int minDimensions,
        @DefaultValue("true") boolean backfillOnStartup
) {}
