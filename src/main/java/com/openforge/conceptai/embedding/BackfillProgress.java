package com.openforge.conceptai.embedding;

/**
 * Reported after every backfill batch.
 *
 * batchSuccessful / batchFailed  - outcome of the batch just finished
 * successful / failed            - running totals for the whole run
 */
public record BackfillProgress(int batch,
                               int batchSuccessful,
                               int batchFailed,
                               int successful,
                               int failed,
                               long remaining) {}
