package com.openforge.conceptai.repository;

import com.openforge.conceptai.domain.ContextSession;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface ContextSessionRepository extends JpaRepository<ContextSession, Long> {

    Optional<ContextSession> findBySessionKey(String sessionKey);

    List<ContextSession> findByExpiresAtBefore(Instant now);

    /** Candidate rows for concept invalidation; the JSON set itself is matched in memory. */
    List<ContextSession> findByConceptIdsIsNotNull();

    @Transactional
    void deleteBySessionKey(String sessionKey);

    /**
     * Sets the hosted-context handle only when the row has none yet.  A bulk
     * update: the row version is not checked or bumped.
     *
     * @return 1 when the handle was written, 0 when the row is gone or already has one
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update ContextSession s
               set s.externalCacheId = :handleId, s.cacheExpiresAt = :expiresAt
             where s.sessionKey = :sessionKey and s.externalCacheId is null
            """)
    int attachExternalCacheIfAbsent(@Param("sessionKey") String sessionKey,
                                    @Param("handleId") String handleId,
                                    @Param("expiresAt") Instant expiresAt);
}
