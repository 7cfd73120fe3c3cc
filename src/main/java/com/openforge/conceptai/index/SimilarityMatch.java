package com.openforge.conceptai.index;

/** One search hit: a concept and its cosine similarity to the query. */
public record SimilarityMatch(String conceptId, double similarity) {
}
