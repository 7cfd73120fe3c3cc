package com.openforge.conceptai.concept;

import com.openforge.conceptai.domain.Concept;
import com.openforge.conceptai.repository.ConceptRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/** {@link ConceptCatalog} over the local relational store. */
@Component
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class JpaConceptCatalog implements ConceptCatalog {

    private final ConceptRepository conceptRepository;

    @Override
    public Optional<ConceptText> find(String conceptId) {
        return conceptRepository.findById(conceptId).map(JpaConceptCatalog::toText);
    }

    @Override
    public long count() {
        return conceptRepository.count();
    }

    @Override
    public List<ConceptText> findWithoutEmbedding(int limit, Collection<String> excludeIds) {
        PageRequest page = PageRequest.of(0, Math.max(1, limit));
        // "not in ()" is not portable JPQL, so the empty case gets its own query
        List<Concept> rows = excludeIds == null || excludeIds.isEmpty()
                ? conceptRepository.findWithoutEmbedding(page)
                : conceptRepository.findWithoutEmbeddingExcluding(excludeIds, page);
        return rows.stream().map(JpaConceptCatalog::toText).toList();
    }

    private static ConceptText toText(Concept c) {
        return new ConceptText(c.getId(), c.getTitle(), c.getDescription(), c.getContent());
    }
}
