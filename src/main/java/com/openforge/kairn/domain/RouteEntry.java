package com.openforge.kairn.domain;

import jakarta.persistence.*;
import lombok.*;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * One row of the context router's keyword index: keyword → node ids + confidence.
 *
 * Derived data only. The whole table can be dropped and rebuilt from live
 * node content at any time (ContextRouter#rebuild) without losing anything.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "routes",
    uniqueConstraints = @UniqueConstraint(name = "uq_route_keyword", columnNames = "keyword")
)
public class RouteEntry extends BaseEntity {

    @Column(name = "keyword", nullable = false, length = 128)
    private String keyword;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "route_nodes", joinColumns = @JoinColumn(name = "route_id"))
    @Column(name = "node_id", nullable = false)
    private Set<Long> nodeIds = new LinkedHashSet<>();

    /** In [0, 1]; rarer keywords score higher. */
    @Column(name = "confidence", nullable = false)
    private double confidence;
}
