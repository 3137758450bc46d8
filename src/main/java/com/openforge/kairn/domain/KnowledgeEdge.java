package com.openforge.kairn.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A directed, typed, weighted relationship between two nodes.
 *
 * The triple (source_id, target_id, edge_type) is unique: connecting the same
 * triple again overwrites weight/properties on this row instead of adding one.
 *
 * weight — relationship strength in [0, 1]; traversal visits heavier edges first.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "edges",
    uniqueConstraints = @UniqueConstraint(
        name = "uq_edge_triple", columnNames = {"source_id", "target_id", "edge_type"}),
    indexes = {
        @Index(name = "idx_edges_source", columnList = "source_id"),
        @Index(name = "idx_edges_target", columnList = "target_id")
    }
)
public class KnowledgeEdge extends BaseEntity {

    public static final double DEFAULT_WEIGHT = 1.0;

    @Column(name = "source_id", nullable = false)
    private Long sourceId;

    @Column(name = "target_id", nullable = false)
    private Long targetId;

    @Column(name = "edge_type", nullable = false, length = 64)
    private String type;

    @Builder.Default
    @Column(name = "weight", nullable = false)
    private double weight = DEFAULT_WEIGHT;

    @Builder.Default
    @Convert(converter = JsonMapConverter.class)
    @Column(name = "properties", length = 20000)
    private Map<String, Object> properties = new LinkedHashMap<>();

    /** Null = live. */
    @Column(name = "deleted_at")
    private LocalDateTime deletedAt;

    public boolean isLive() {
        return deletedAt == null;
    }

    /** The endpoint on the other side of {@code nodeId}. */
    public Long otherEnd(Long nodeId) {
        return sourceId.equals(nodeId) ? targetId : sourceId;
    }
}
