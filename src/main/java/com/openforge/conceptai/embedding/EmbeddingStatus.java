package com.openforge.conceptai.embedding;

import java.time.Instant;

/**
 * Live embedding coverage.
 *
 * @param lastIndexedAt end of the last backfill that left nothing missing; null before the first
 */
public record EmbeddingStatus(
        long totalConcepts,
        long conceptsWithEmbeddings,
        long conceptsWithoutEmbeddings,
        boolean indexing,
        Instant lastIndexedAt
) {}
