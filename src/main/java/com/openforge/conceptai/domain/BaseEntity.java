package com.openforge.conceptai.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.Instant;

/**
 * Canonical audit columns shared by every table this module owns.
 *
 * - create_time  : set once on INSERT, never touched again
 * - update_time  : refreshed on every UPDATE
 * - version      : JPA @Version; of two concurrent entity writes to the same
 *                  row the later flush loses instead of silently overwriting
 */
@Getter
@Setter
@MappedSuperclass
@EntityListeners(AuditingEntityListener.class)
public abstract class BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @CreatedDate
    @Column(name = "create_time", nullable = false, updatable = false)
    private Instant createTime;

    @LastModifiedDate
    @Column(name = "update_time", nullable = false)
    private Instant updateTime;

    @Version
    @Column(nullable = false)
    private Integer version = 0;
}
