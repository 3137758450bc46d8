package com.openforge.kairn.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * A permanent unit of knowledge in the graph.
 *
 * Soft delete: {@code deletedAt != null} hides the node from every query and
 * traversal, but the row (and its id) stays so that edges pointing at it are
 * hidden rather than broken, and the node can be restored later.
 *
 * Tags are stored lower-cased in their own table so tag filters hit an index.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "nodes",
    indexes = {
        @Index(name = "idx_nodes_ns_type", columnList = "namespace, node_type"),
        @Index(name = "idx_nodes_deleted", columnList = "deleted_at")
    }
)
public class KnowledgeNode extends BaseEntity {

    public static final String DEFAULT_NAMESPACE = "knowledge";

    /** Logical partition, e.g. "knowledge", "project-x". */
    @Builder.Default
    @Column(name = "namespace", nullable = false, length = 64)
    private String namespace = DEFAULT_NAMESPACE;

    /** Free-form classification, e.g. "pattern", "tool", "learned_solution". */
    @Column(name = "node_type", nullable = false, length = 64)
    private String type;

    @Column(name = "name", nullable = false, length = 512)
    private String name;

    @Column(name = "description", length = 10000)
    private String description;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(
        name = "node_tags",
        joinColumns = @JoinColumn(name = "node_id"),
        indexes = @Index(name = "idx_node_tags_tag", columnList = "tag")
    )
    @Column(name = "tag", nullable = false, length = 128)
    private Set<String> tags = new LinkedHashSet<>();

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
}
