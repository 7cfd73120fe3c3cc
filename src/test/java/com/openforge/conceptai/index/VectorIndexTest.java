package com.openforge.conceptai.index;

import com.openforge.conceptai.domain.ConceptEmbedding;
import com.openforge.conceptai.embedding.EmbeddingCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class VectorIndexTest {

    private VectorIndex index;

    @BeforeEach
    void setUp() {
        index = new VectorIndex();
    }

    @Test
    void search_queryEqualToOnlyEntry_returnsSimilarityOfOne() {
        float[] a = {0.3f, -1.2f, 4.5f, 0.01f};
        index.addEmbedding("a", a);

        List<SimilarityMatch> results = index.search(a, 5);

        assertThat(results).hasSize(1);
        assertThat(results.get(0).conceptId()).isEqualTo("a");
        assertThat(results.get(0).similarity()).isCloseTo(1.0, within(1e-6));
    }

    @Test
    void search_unitAxes_returnsOnlyExactMatchWithLimitOne() {
        index.addEmbedding("concept-1", new float[]{1, 0, 0});
        index.addEmbedding("concept-2", new float[]{0, 1, 0});
        index.addEmbedding("concept-3", new float[]{0, 0, 1});

        List<SimilarityMatch> results = index.search(new float[]{1, 0, 0}, 1);

        assertThat(results).hasSize(1);
        assertThat(results.get(0).conceptId()).isEqualTo("concept-1");
        assertThat(results.get(0).similarity()).isCloseTo(1.0, within(1e-6));
    }

    @Test
    void search_diagonalQueryWithHighThreshold_returnsNothing() {
        index.addEmbedding("concept-1", new float[]{1, 0, 0});
        index.addEmbedding("concept-2", new float[]{0, 1, 0});
        index.addEmbedding("concept-3", new float[]{0, 0, 1});

        List<SimilarityMatch> results = index.search(new float[]{1, 1, 0}, 10, 0.99);

        assertThat(results).isEmpty();
    }

    @Test
    void search_multipleEntries_sortedDescendingAndFilteredByThreshold() {
        index.addEmbedding("x", new float[]{1, 0, 0});
        index.addEmbedding("xy", new float[]{0.7f, 0.7f, 0});
        index.addEmbedding("y", new float[]{0, 1, 0});

        List<SimilarityMatch> results = index.search(new float[]{1, 0, 0}, 10, 0.5);

        assertThat(results).extracting(SimilarityMatch::conceptId).containsExactly("x", "xy");
        assertThat(results.get(0).similarity()).isGreaterThan(results.get(1).similarity());
    }

    @Test
    void search_zeroNormQuery_returnsEmpty() {
        index.addEmbedding("a", new float[]{1, 2, 3});

        assertThat(index.search(new float[]{0, 0, 0}, 10)).isEmpty();
    }

    @Test
    void search_onlyZeroNormEntries_returnsEmpty() {
        index.addEmbedding("zero-1", new float[]{0, 0, 0});
        index.addEmbedding("zero-2", new float[]{0, 0, 0, 0});

        assertThat(index.search(new float[]{1, 0, 0}, 10)).isEmpty();
    }

    @Test
    void search_excludingEveryEntry_returnsEmpty() {
        index.addEmbedding("a", new float[]{1, 0, 0});
        index.addEmbedding("b", new float[]{0, 1, 0});

        assertThat(index.search(new float[]{1, 1, 0}, 10, -1.0, Set.of("a", "b"))).isEmpty();
    }

    @Test
    void search_excludedId_neverReturned() {
        index.addEmbedding("a", new float[]{1, 0, 0});
        index.addEmbedding("b", new float[]{0.9f, 0.1f, 0});

        List<SimilarityMatch> results = index.search(new float[]{1, 0, 0}, 10, -1.0, Set.of("a"));

        assertThat(results).extracting(SimilarityMatch::conceptId).containsExactly("b");
    }

    @Test
    void search_differentLengths_comparesOverlappingPrefix() {
        index.addEmbedding("long", new float[]{1, 0, 0, 0, 0});

        List<SimilarityMatch> results = index.search(new float[]{1, 0, 0}, 10);

        assertThat(results).hasSize(1);
        assertThat(results.get(0).similarity()).isCloseTo(1.0, within(1e-6));
    }

    @Test
    void addEmbedding_sameId_replacesEntry() {
        index.addEmbedding("a", new float[]{1, 0, 0});
        index.addEmbedding("a", new float[]{0, 1, 0});

        List<SimilarityMatch> results = index.search(new float[]{0, 1, 0}, 10);

        assertThat(index.size()).isEqualTo(1);
        assertThat(results.get(0).similarity()).isCloseTo(1.0, within(1e-6));
    }

    @Test
    void addEmbedding_callerMutatesArray_indexUnaffected() {
        float[] vector = {1, 0, 0};
        index.addEmbedding("a", vector);
        vector[0] = 0;
        vector[1] = 1;

        assertThat(index.search(new float[]{1, 0, 0}, 1).get(0).similarity()).isCloseTo(1.0, within(1e-6));
    }

    @Test
    void removeEmbedding_absentId_isNoOp() {
        index.addEmbedding("a", new float[]{1, 0, 0});

        index.removeEmbedding("missing");
        index.removeEmbedding("a");

        assertThat(index.size()).isZero();
        assertThat(index.contains("a")).isFalse();
    }

    @Test
    void initialize_mixedRows_loadsBinaryAndLegacyAndSkipsBadOnes() {
        List<ConceptEmbedding> rows = List.of(
                row("binary", EmbeddingCodec.encode(new float[]{1, 0, 0, 0})),
                row("legacy", EmbeddingCodec.encodeLegacyJson(new float[]{0, 1, 0, 0})),
                row("garbage", "not-a-vector!".getBytes()),
                row("too-short", EmbeddingCodec.encode(new float[]{1, 0})));

        int loaded = index.initialize(rows);

        assertThat(loaded).isEqualTo(2);
        assertThat(index.contains("binary")).isTrue();
        assertThat(index.contains("legacy")).isTrue();
        assertThat(index.contains("garbage")).isFalse();
        assertThat(index.contains("too-short")).isFalse();
    }

    @Test
    void initialize_replacesPreviousState() {
        index.addEmbedding("stale", new float[]{1, 0, 0, 0});

        index.initialize(List.of(row("fresh", EmbeddingCodec.encode(new float[]{0, 0, 1, 0}))));

        assertThat(index.contains("stale")).isFalse();
        assertThat(index.size()).isEqualTo(1);
    }

    @Test
    void clear_removesAllEntries() {
        index.addEmbedding("a", new float[]{1, 0, 0});
        index.addEmbedding("b", new float[]{0, 1, 0});

        index.clear();

        assertThat(index.size()).isZero();
    }

    private static ConceptEmbedding row(String conceptId, byte[] vector) {
        return ConceptEmbedding.builder().conceptId(conceptId).vector(vector).model("test-model").build();
    }
}
