package com.openforge.conceptai.concept;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Concept read API consumed by the embedding orchestrator.
 *
 * The content-management side owns concepts; this interface is the whole
 * surface this module depends on.
 */
public interface ConceptCatalog {

    Optional<ConceptText> find(String conceptId);

    long count();

    /**
     * Up to {@code limit} concepts that have no durable embedding, skipping
     * {@code excludeIds} (concepts that already failed in the current sweep).
     * Ordering is stable so repeated calls make progress through the backlog.
     */
    List<ConceptText> findWithoutEmbedding(int limit, Collection<String> excludeIds);
}
