package com.openforge.conceptai.repository;

import com.openforge.conceptai.domain.Concept;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface ConceptRepository extends JpaRepository<Concept, String> {

    @Query("""
            select c from Concept c
            where not exists (select 1 from ConceptEmbedding e where e.conceptId = c.id)
            order by c.id
            """)
    List<Concept> findWithoutEmbedding(Pageable page);

    @Query("""
            select c from Concept c
            where not exists (select 1 from ConceptEmbedding e where e.conceptId = c.id)
              and c.id not in :excluded
            order by c.id
            """)
    List<Concept> findWithoutEmbeddingExcluding(@Param("excluded") Collection<String> excluded, Pageable page);
}
