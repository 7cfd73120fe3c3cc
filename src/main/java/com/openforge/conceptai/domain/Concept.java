package com.openforge.conceptai.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * A unit of managed content.
 *
 * Owned by the content-management side of the application; this module only
 * reads it to build embedding text and never writes it.  Deleting a concept
 * must be followed by {@code ConceptChangeListener#onConceptDeleted} so the
 * embedding row, the index entry and any dependent sessions go with it.
 */
@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "concepts")
public class Concept {

    @Id
    @Column(length = 64)
    private String id;

    @Column(nullable = false, length = 512)
    private String title;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String content;

    @Column(name = "create_time")
    private Instant createTime;

    @Column(name = "update_time")
    private Instant updateTime;

    public Concept(String id, String title, String description, String content) {
        this.id          = id;
        this.title       = title;
        this.description = description;
        this.content     = content;
    }
}
