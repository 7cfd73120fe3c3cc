package com.openforge.conceptai.concept;

import com.openforge.conceptai.embedding.EmbeddingOrchestrator;
import com.openforge.conceptai.session.ContextSessionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Entry point for concept lifecycle notifications from the content side.
 *
 * Secondary work (embedding generation, session invalidation) never fails
 * the notification; errors are logged and the next backfill picks up any
 * concept left without an embedding.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConceptChangeListener {

    private final EmbeddingOrchestrator embeddings;
    private final ContextSessionService sessions;

    public void onConceptCreated(String conceptId) {
        try {
            embeddings.generateFor(conceptId);
        } catch (RuntimeException e) {
            log.warn("[Concept] Embedding for new concept {} deferred to backfill: {}", conceptId, e.getMessage());
        }
    }

    /** Cached conversations that quoted the old text are dropped before the vector is refreshed. */
    public void onConceptUpdated(String conceptId) {
        invalidateSessions(conceptId);
        try {
            embeddings.regenerateFor(conceptId);
        } catch (RuntimeException e) {
            log.warn("[Concept] Re-embedding of concept {} failed: {}", conceptId, e.getMessage());
        }
    }

    public void onConceptDeleted(String conceptId) {
        try {
            embeddings.removeEmbedding(conceptId);
        } catch (RuntimeException e) {
            log.warn("[Concept] Could not remove embedding of deleted concept {}: {}", conceptId, e.getMessage());
        }
        invalidateSessions(conceptId);
    }

    private void invalidateSessions(String conceptId) {
        try {
            int removed = sessions.invalidateSessionsForConcepts(List.of(conceptId));
            if (removed > 0) {
                log.info("[Concept] Invalidated {} context sessions referencing {}", removed, conceptId);
            }
        } catch (RuntimeException e) {
            log.warn("[Concept] Session invalidation for {} failed: {}", conceptId, e.getMessage());
        }
    }
}
