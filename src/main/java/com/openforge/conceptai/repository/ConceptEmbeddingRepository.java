package com.openforge.conceptai.repository;

import com.openforge.conceptai.domain.ConceptEmbedding;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Repository
public interface ConceptEmbeddingRepository extends JpaRepository<ConceptEmbedding, Long> {

    Optional<ConceptEmbedding> findByConceptId(String conceptId);

    @Transactional
    @Modifying
    @Query("delete from ConceptEmbedding e where e.conceptId = :conceptId")
    int deleteByConceptId(@Param("conceptId") String conceptId);
}
