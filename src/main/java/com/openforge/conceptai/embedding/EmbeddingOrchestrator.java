package com.openforge.conceptai.embedding;

import com.openforge.conceptai.common.NotFoundException;
import com.openforge.conceptai.concept.ConceptCatalog;
import com.openforge.conceptai.concept.ConceptText;
import com.openforge.conceptai.domain.ConceptEmbedding;
import com.openforge.conceptai.index.SimilarityMatch;
import com.openforge.conceptai.index.VectorIndex;
import com.openforge.conceptai.llm.LlmClient;
import com.openforge.conceptai.repository.ConceptEmbeddingRepository;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Keeps the durable embedding store and the in-memory {@link VectorIndex}
 * in step with the concept catalog.
 *
 * getOrCreate outcomes for a stored row:
 *   binary, same model  → returned as is
 *   legacy JSON text    → rewritten as binary (best-effort), then returned
 *   unreadable, too short, or written by another embedding model
 *                       → regenerated through the LLM client and replaced in place
 *
 * Backfill walks the concepts without an embedding in sequential batches.
 * A concept that fails is logged, skipped, and not selected again in the
 * same run.  A batch in which every concept failed is retried with capped
 * exponential backoff before its concepts are given up on.  The iteration
 * cap is the last-resort stop.
 */
@Slf4j
@Service
public class EmbeddingOrchestrator {

    private final ConceptCatalog             catalog;
    private final ConceptEmbeddingRepository embeddings;
    private final VectorIndex                index;
    private final LlmClient                  llmClient;
    private final EmbeddingProperties        properties;
    private final Executor                   executor;
    private final Clock                      clock;

    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile Instant lastIndexedAt;

    public EmbeddingOrchestrator(ConceptCatalog catalog,
                                 ConceptEmbeddingRepository embeddings,
                                 VectorIndex index,
                                 LlmClient llmClient,
                                 EmbeddingProperties properties,
                                 @Qualifier("backgroundExecutor") Executor executor,
                                 Clock clock) {
        this.catalog    = catalog;
        this.embeddings = embeddings;
        this.index      = index;
        this.llmClient  = llmClient;
        this.properties = properties;
        this.executor   = executor;
        this.clock      = clock;
    }

    // ── Status ───────────────────────────────────────────────────────────────

    public EmbeddingStatus getStatus() {
        long total = catalog.count();
        long with  = embeddings.count();
        return new EmbeddingStatus(total, with, Math.max(0, total - with), running.get(), lastIndexedAt);
    }

    // ── Single concept ───────────────────────────────────────────────────────

    /**
     * The stored embedding of {@code conceptId}, generating and persisting one
     * when none usable exists.  A freshly generated vector is also pushed into
     * the index.
     *
     * @param model embedding model the caller expects; a row written by another model is regenerated
     * @throws com.openforge.conceptai.common.ProviderException when generation fails; the stored row is untouched
     */
    public float[] getOrCreate(String conceptId, String text, String model) {
        Optional<ConceptEmbedding> existing = embeddings.findByConceptId(conceptId);

        if (existing.isPresent()) {
            ConceptEmbedding row = existing.get();
            Optional<EmbeddingCodec.DecodedVector> decoded = decodeQuietly(row).filter(v -> isUsable(row, v));

            if (decoded.isPresent() && model.equals(row.getModel())) {
                if (decoded.get().legacy()) {
                    rewriteAsBinary(row, decoded.get().values());
                }
                return decoded.get().values();
            }
            if (decoded.isPresent()) {
                log.info("[Embedding] Concept {} was embedded with {}, regenerating with {}",
                        conceptId, row.getModel(), model);
            }
        }

        return generateAndStore(conceptId, text, model, existing);
    }

    /**
     * Embeds a concept from the catalog and makes sure the index holds it.
     *
     * @throws NotFoundException when the catalog has no such concept
     */
    public float[] generateFor(String conceptId) {
        ConceptText concept = catalog.find(conceptId)
                .orElseThrow(() -> new NotFoundException("Concept", conceptId));
        float[] vector = getOrCreate(conceptId, concept.embeddingText(), llmClient.embeddingModel());
        index.addEmbedding(conceptId, vector);
        return vector;
    }

    /** Re-embeds a concept whose text changed, replacing any stored vector. */
    public float[] regenerateFor(String conceptId) {
        ConceptText concept = catalog.find(conceptId)
                .orElseThrow(() -> new NotFoundException("Concept", conceptId));
        return generateAndStore(conceptId, concept.embeddingText(), llmClient.embeddingModel(),
                embeddings.findByConceptId(conceptId));
    }

    /** Drops the durable row and the index entry of a deleted concept. */
    @Transactional
    public void removeEmbedding(String conceptId) {
        int removed = embeddings.deleteByConceptId(conceptId);
        index.removeEmbedding(conceptId);
        log.debug("[Embedding] Removed embedding of concept {} ({} rows)", conceptId, removed);
    }

    // ── Index ────────────────────────────────────────────────────────────────

    /** Reloads the whole index from the durable store. */
    @Transactional(readOnly = true)
    public int rebuildIndex() {
        return index.initialize(embeddings.findAll());
    }

    // ── Search ───────────────────────────────────────────────────────────────

    /**
     * Nearest concepts to {@code queryText}, embedded with the active provider.
     *
     * @throws com.openforge.conceptai.common.ProviderException when the query cannot be embedded
     */
    public List<SimilarityMatch> findSimilarConcepts(String queryText,
                                                     int limit,
                                                     double minSimilarity,
                                                     Collection<String> exclude) {
        return findSimilarConcepts(llmClient.embed(queryText), limit, minSimilarity, exclude);
    }

    /** Nearest concepts to an already computed query embedding; no provider call. */
    public List<SimilarityMatch> findSimilarConcepts(float[] queryEmbedding,
                                                     int limit,
                                                     double minSimilarity,
                                                     Collection<String> exclude) {
        return index.search(queryEmbedding, limit, minSimilarity, exclude);
    }

    // ── Backfill ─────────────────────────────────────────────────────────────

    public CompletableFuture<BackfillResult> backfillMissingAsync(int batchSize) {
        return CompletableFuture.supplyAsync(() -> backfillMissing(batchSize, progress ->
                log.debug("[Backfill] batch={} ok={} failed={} (run ok={} failed={}) remaining={}",
                        progress.batch(), progress.batchSuccessful(), progress.batchFailed(),
                        progress.successful(), progress.failed(), progress.remaining())),
                executor);
    }

    /**
     * Generates embeddings for every concept that lacks one.
     *
     * Only one run at a time; a concurrent call returns a skipped result
     * immediately.
     *
     * @param batchSize  concepts per batch; non-positive means the configured size
     * @param onProgress called after every batch; its failures are logged and ignored
     */
    public BackfillResult backfillMissing(int batchSize, Consumer<BackfillProgress> onProgress) {
        if (!running.compareAndSet(false, true)) {
            log.info("[Backfill] Already running, skipping");
            return BackfillResult.alreadyRunning();
        }
        try {
            return runBackfill(batchSize > 0 ? batchSize : properties.batchSize(), onProgress);
        } finally {
            running.set(false);
        }
    }

    private BackfillResult runBackfill(int batchSize, Consumer<BackfillProgress> onProgress) {
        long missing = getStatus().conceptsWithoutEmbeddings();
        if (missing == 0) {
            log.info("[Backfill] All concepts have embeddings, nothing to do");
            lastIndexedAt = clock.instant();
            return new BackfillResult(0, 0, 0, 0, false, false);
        }
        log.info("[Backfill] Starting: {} concepts without embeddings, batch size {}", missing, batchSize);

        Retry         batchRetry = batchRetry();
        String        model      = llmClient.embeddingModel();
        Set<String>   failedIds  = new HashSet<>();
        int           batches    = 0;
        int           succeeded  = 0;
        boolean       hitLimit   = false;
        long          remaining  = missing;

        while (true) {
            List<ConceptText> batch = catalog.findWithoutEmbedding(batchSize, failedIds);
            if (batch.isEmpty()) break;

            if (batches >= properties.maxIterations()) {
                hitLimit = true;
                log.warn("[Backfill] Stopping after {} batches (iteration limit), {} concepts still missing",
                        batches, remaining);
                break;
            }

            BatchOutcome outcome = batchRetry.executeSupplier(() -> runBatch(batch, model));
            batches++;
            succeeded += outcome.succeeded();
            failedIds.addAll(outcome.failedIds());
            remaining = getStatus().conceptsWithoutEmbeddings();

            if (outcome.allFailed()) {
                log.warn("[Backfill] Batch {} failed for all {} concepts after retries; skipping them this run",
                        batches, batch.size());
            }
            report(onProgress, new BackfillProgress(batches, outcome.succeeded(), outcome.failedIds().size(),
                    succeeded, failedIds.size(), remaining));
        }

        if (remaining == 0) {
            lastIndexedAt = clock.instant();
        }
        log.info("[Backfill] Finished: batches={} succeeded={} failed={} remaining={}",
                batches, succeeded, failedIds.size(), remaining);
        return new BackfillResult(batches, succeeded, failedIds.size(), remaining, hitLimit, false);
    }

    private BatchOutcome runBatch(List<ConceptText> batch, String model) {
        int          ok     = 0;
        List<String> failed = new ArrayList<>();
        for (ConceptText concept : batch) {
            try {
                getOrCreate(concept.id(), concept.embeddingText(), model);
                ok++;
            } catch (RuntimeException e) {
                log.warn("[Backfill] Concept {} failed: {}", concept.id(), e.getMessage());
                failed.add(concept.id());
            }
        }
        return new BatchOutcome(ok, failed);
    }

    private Retry batchRetry() {
        RetryConfig config = RetryConfig.<BatchOutcome>custom()
                .maxAttempts(1 + Math.max(0, properties.batchRetryAttempts()))
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        properties.batchInitialBackoff(), 2.0, properties.batchMaxBackoff()))
                .retryOnResult(BatchOutcome::allFailed)
                .build();
        Retry retry = Retry.of("embedding-backfill", config);
        retry.getEventPublisher().onRetry(event ->
                log.info("[Backfill] Whole batch failed, retry attempt #{} in {}ms",
                        event.getNumberOfRetryAttempts(), event.getWaitInterval().toMillis()));
        return retry;
    }

    private static void report(Consumer<BackfillProgress> onProgress, BackfillProgress progress) {
        if (onProgress == null) return;
        try {
            onProgress.accept(progress);
        } catch (RuntimeException e) {
            log.warn("[Backfill] Progress callback failed: {}", e.getMessage());
        }
    }

    // ── Persistence helpers ──────────────────────────────────────────────────

    private float[] generateAndStore(String conceptId,
                                     String text,
                                     String model,
                                     Optional<ConceptEmbedding> existing) {
        float[] vector = llmClient.embed(text);

        ConceptEmbedding row = existing.orElseGet(() -> ConceptEmbedding.builder().conceptId(conceptId).build());
        row.setVector(EmbeddingCodec.encode(vector));
        row.setModel(model);
        try {
            embeddings.save(row);
        } catch (DataIntegrityViolationException e) {
            // a concurrent writer inserted the row first; keep theirs
            log.debug("[Embedding] Concept {} was embedded concurrently, using stored row", conceptId);
            return embeddings.findByConceptId(conceptId)
                    .flatMap(this::decodeQuietly)
                    .map(EmbeddingCodec.DecodedVector::values)
                    .orElseThrow(() -> e);
        }

        index.addEmbedding(conceptId, vector);
        log.debug("[Embedding] Stored {}-dim embedding for concept {} model={}", vector.length, conceptId, model);
        return vector;
    }

    private void rewriteAsBinary(ConceptEmbedding row, float[] vector) {
        try {
            row.setVector(EmbeddingCodec.encode(vector));
            embeddings.save(row);
            log.info("[Embedding] Rewrote legacy JSON embedding of concept {} as binary", row.getConceptId());
        } catch (RuntimeException e) {
            log.warn("[Embedding] Could not rewrite legacy embedding of concept {}: {}",
                    row.getConceptId(), e.getMessage());
        }
    }

    private boolean isUsable(ConceptEmbedding row, EmbeddingCodec.DecodedVector decoded) {
        if (decoded.values().length >= properties.minDimensions()) return true;
        log.warn("[Embedding] Stored embedding of concept {} has {} dimensions, below minimum {}; regenerating",
                row.getConceptId(), decoded.values().length, properties.minDimensions());
        return false;
    }

    private Optional<EmbeddingCodec.DecodedVector> decodeQuietly(ConceptEmbedding row) {
        try {
            return Optional.of(EmbeddingCodec.decode(row.getVector()));
        } catch (EmbeddingCodec.DecodeException e) {
            log.warn("[Embedding] Stored embedding of concept {} is unreadable, regenerating: {}",
                    row.getConceptId(), e.getMessage());
            return Optional.empty();
        }
    }

    private record BatchOutcome(int succeeded, List<String> failedIds) {

        boolean allFailed() {
            return succeeded == 0 && !failedIds.isEmpty();
        }
    }
}
