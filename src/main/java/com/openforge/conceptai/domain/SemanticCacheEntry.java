package com.openforge.conceptai.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * One cached LLM completion, looked up by prompt similarity rather than key
 * equality.  {@code createTime} from the audit base is the entry's creation
 * timestamp; {@code lastUsedAt} is bumped on every hit.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "llm_cache",
    indexes = @Index(name = "idx_llm_cache_scope", columnList = "provider, model, response_format")
)
public class SemanticCacheEntry extends BaseEntity {

    public enum ResponseFormat {
        TEXT,
        JSON
    }

    /** Float32 little-endian embedding of system prompt + user prompt. */
    @Lob
    @Column(name = "query_embedding", nullable = false)
    private byte[] queryEmbedding;

    @Column(name = "query_text", nullable = false, columnDefinition = "TEXT")
    private String queryText;

    @Column(name = "response", nullable = false, columnDefinition = "TEXT")
    private String response;

    @Enumerated(EnumType.STRING)
    @Column(name = "response_format", nullable = false, length = 16)
    private ResponseFormat responseFormat;

    @Column(name = "provider", nullable = false, length = 32)
    private String provider;

    @Column(name = "model", nullable = false, length = 128)
    private String model;

    @Column(name = "last_used_at", nullable = false)
    private Instant lastUsedAt;
}
