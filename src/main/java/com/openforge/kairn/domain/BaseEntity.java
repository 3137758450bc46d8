package com.openforge.kairn.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.LocalDateTime;

/**
 * Canonical audit columns shared by every workspace table.
 *
 * - create_time  : set once on INSERT, never touched again; experience decay
 *                  measures age from this column
 * - update_time  : refreshed on every UPDATE
 * - version      : JPA @Version, the optimistic-lock counter that turns a
 *                  lost update (two writers on one row) into an error
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
    private LocalDateTime createTime;

    @LastModifiedDate
    @Column(name = "update_time", nullable = false)
    private LocalDateTime updateTime;

    /** Null until first persisted, so Spring Data treats the row as new. */
    @Version
    @Column(nullable = false)
    private Integer version;
}
