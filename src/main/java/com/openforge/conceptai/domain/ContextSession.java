package com.openforge.conceptai.domain;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.DynamicUpdate;

import java.time.Instant;

/**
 * Server-side conversational state shared by repeated calls that resolve to
 * the same session key.
 *
 *  messages        - JSON array of {role, content}; only ever appended to.
 *  conceptIds      - JSON array used as a set; null when no concept is tracked.
 *                    Drives invalidation when a referenced concept changes.
 *  expiresAt       - checked lazily on read; rows are physically removed only
 *                    by the cleanup sweep or by invalidation.
 *  externalCacheId - provider-owned handle for large static context.  Set
 *                    asynchronously after the row exists, so readers must
 *                    treat it as optional.  Written by a targeted update;
 *                    dynamic updates keep a concurrent merge from writing
 *                    back the stale null.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@DynamicUpdate
@Table(
    name = "context_sessions",
    uniqueConstraints = @UniqueConstraint(name = "uq_session_key", columnNames = "session_key")
)
public class ContextSession extends BaseEntity {

    @Column(name = "session_key", nullable = false, length = 255)
    private String sessionKey;

    @Column(name = "provider", nullable = false, length = 32)
    private String provider;

    @Column(name = "model", nullable = false, length = 128)
    private String model;

    @Lob
    @Column(name = "messages", nullable = false)
    private String messages;

    @Column(name = "concept_ids", columnDefinition = "TEXT")
    private String conceptIds;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Column(name = "external_cache_id", length = 255)
    private String externalCacheId;

    @Column(name = "cache_expires_at")
    private Instant cacheExpiresAt;
}
