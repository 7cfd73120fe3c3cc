package com.openforge.conceptai.repository;

import com.openforge.conceptai.domain.SemanticCacheEntry;
import com.openforge.conceptai.domain.SemanticCacheEntry.ResponseFormat;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

@Repository
public interface SemanticCacheEntryRepository extends JpaRepository<SemanticCacheEntry, Long> {

    /** Most recently used entries first; the caller bounds the window through {@code page}. */
    List<SemanticCacheEntry> findByProviderAndModelAndResponseFormatOrderByLastUsedAtDesc(
            String provider, String model, ResponseFormat responseFormat, Pageable page);

    long countByProviderAndModel(String provider, String model);

    /** Oldest-used first, for retention policies. */
    List<SemanticCacheEntry> findByProviderAndModelOrderByLastUsedAtAsc(
            String provider, String model, Pageable page);

    @Transactional
    @Modifying
    @Query("update SemanticCacheEntry e set e.lastUsedAt = :usedAt where e.id = :id")
    int touch(@Param("id") Long id, @Param("usedAt") Instant usedAt);

    @Transactional
    @Modifying
    @Query("""
            delete from SemanticCacheEntry e
            where (:provider is null or e.provider = :provider)
              and (:model is null or e.model = :model)
            """)
    int deleteScope(@Param("provider") String provider, @Param("model") String model);
}
