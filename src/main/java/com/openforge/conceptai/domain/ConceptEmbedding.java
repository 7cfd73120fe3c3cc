package com.openforge.conceptai.domain;

import jakarta.persistence.*;
import lombok.*;

/**
 * Durable embedding of one concept.
 *
 * Invariant: at most one row per concept (unique concept_id).  Regeneration
 * overwrites {@code vector} and {@code model} in place.
 *
 * vector - little-endian float32 bytes.  Rows written before the binary
 *          migration still hold the UTF-8 JSON array text in the same column;
 *          {@link com.openforge.conceptai.embedding.EmbeddingCodec} tells them
 *          apart and the orchestrator rewrites them on first read.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "concept_embeddings",
    uniqueConstraints = @UniqueConstraint(name = "uq_embedding_concept", columnNames = "concept_id")
)
public class ConceptEmbedding extends BaseEntity {

    @Column(name = "concept_id", nullable = false, length = 64)
    private String conceptId;

    @Lob
    @Column(name = "vector", nullable = false)
    private byte[] vector;

    /** e.g. text-embedding-3-small, text-embedding-004 */
    @Column(name = "model", nullable = false, length = 128)
    private String model;
}
