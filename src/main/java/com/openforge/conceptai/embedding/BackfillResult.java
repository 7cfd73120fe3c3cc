package com.openforge.conceptai.embedding;

/**
 * Outcome of one backfill run.
 *
 * @param skipped           another run was already in progress; nothing was attempted
 * @param hitIterationLimit the run stopped on the iteration cap rather than an empty backlog
 */
public record BackfillResult(
        int batches,
        int succeeded,
        int failed,
        long remaining,
        boolean hitIterationLimit,
        boolean skipped
) {

    static BackfillResult alreadyRunning() {
        return new BackfillResult(0, 0, 0, -1, false, true);
    }
}
