package com.openforge.conceptai.index;

import com.openforge.conceptai.domain.ConceptEmbedding;
import com.openforge.conceptai.embedding.EmbeddingCodec;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory exact nearest-neighbour index over concept embeddings.
 *
 * A cache of the durable embedding store, not the source of truth: it is
 * rebuilt wholesale from stored rows at startup and then kept current by
 * individual add/remove calls.  The index itself never reads or writes the
 * store.
 *
 * Concurrency: entries are immutable and swapped into a ConcurrentHashMap, so
 * a concurrent search sees either the old or the new vector of a concept,
 * never a mix.  Ordering between a concurrent write and read is unspecified.
 */
@Slf4j
public class VectorIndex {

    public static final int DEFAULT_MIN_DIMENSIONS = 4;

    private final int minDimensions;

    private volatile Map<String, Entry> entries = new ConcurrentHashMap<>();

    public VectorIndex() {
        this(DEFAULT_MIN_DIMENSIONS);
    }

    public VectorIndex(int minDimensions) {
        this.minDimensions = minDimensions;
    }

    // ── Bulk load ────────────────────────────────────────────────────────────

    /**
     * Replaces the whole index with the given durable rows.
     *
     * Rows that decode neither as binary nor as legacy JSON, or that are
     * shorter than the minimum dimensionality, are skipped and logged.
     *
     * @return number of entries loaded
     */
    public int initialize(Iterable<ConceptEmbedding> rows) {
        Map<String, Entry> loaded  = new ConcurrentHashMap<>();
        int                skipped = 0;

        for (ConceptEmbedding row : rows) {
            try {
                float[] vector = EmbeddingCodec.decode(row.getVector()).values();
                if (vector.length < minDimensions) {
                    log.warn("[VectorIndex] Skipping concept {}: {} dimensions is below minimum {}",
                            row.getConceptId(), vector.length, minDimensions);
                    skipped++;
                    continue;
                }
                loaded.put(row.getConceptId(), Entry.of(row.getConceptId(), vector));
            } catch (EmbeddingCodec.DecodeException e) {
                log.warn("[VectorIndex] Skipping concept {}: {}", row.getConceptId(), e.getMessage());
                skipped++;
            }
        }

        entries = loaded;
        log.info("[VectorIndex] Initialized with {} entries ({} skipped)", loaded.size(), skipped);
        return loaded.size();
    }

    // ── Single-entry mutation ────────────────────────────────────────────────

    /** Inserts or wholesale replaces the entry for {@code conceptId}. */
    public void addEmbedding(String conceptId, float[] vector) {
        entries.put(conceptId, Entry.of(conceptId, vector.clone()));
    }

    /** No-op when the concept is not indexed. */
    public void removeEmbedding(String conceptId) {
        entries.remove(conceptId);
    }

    // ── Search ───────────────────────────────────────────────────────────────

    public List<SimilarityMatch> search(float[] query, int limit) {
        return search(query, limit, 0.0, Set.of());
    }

    public List<SimilarityMatch> search(float[] query, int limit, double minSimilarity) {
        return search(query, limit, minSimilarity, Set.of());
    }

    /**
     * Cosine similarity of {@code query} against every entry not in
     * {@code exclude}, keeping scores {@code >= minSimilarity}, highest first,
     * at most {@code limit} results.
     *
     * A zero-norm query matches nothing; zero-norm entries are skipped.
     */
    public List<SimilarityMatch> search(float[] query,
                                        int limit,
                                        double minSimilarity,
                                        Collection<String> exclude) {
        if (query == null || limit <= 0) return List.of();

        double queryNorm = VectorMath.norm(query);
        if (queryNorm == 0.0) return List.of();

        Set<String> excluded = exclude == null ? Set.of() : Set.copyOf(exclude);
        List<SimilarityMatch> matches = new ArrayList<>();

        for (Entry entry : entries.values()) {
            if (excluded.contains(entry.conceptId())) continue;

            double similarity = VectorMath.cosine(query, queryNorm, entry.vector(), entry.norm());
            if (Double.isNaN(similarity)) continue;

            if (similarity >= minSimilarity) {
                matches.add(new SimilarityMatch(entry.conceptId(), similarity));
            }
        }

        return matches.stream()
                .sorted(Comparator.comparingDouble(SimilarityMatch::similarity).reversed())
                .limit(limit)
                .toList();
    }

    // ── Accessors ────────────────────────────────────────────────────────────

    public int size() {
        return entries.size();
    }

    public boolean contains(String conceptId) {
        return entries.containsKey(conceptId);
    }

    /** Drops every entry; durable rows are untouched. */
    public void clear() {
        entries = new ConcurrentHashMap<>();
    }

    /** An indexed vector with its L2 norm computed once at insert time. */
    private record Entry(String conceptId, float[] vector, double norm) {

        static Entry of(String conceptId, float[] vector) {
            return new Entry(conceptId, vector, VectorMath.norm(vector));
        }
    }
}
