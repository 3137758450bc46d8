package com.openforge.kairn.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A decaying memory.
 *
 * Relevance is never stored: it is computed on read as
 *   score × exp(−decayRate × ageInDays)
 * from create_time, so there is no background job to fall behind.
 *
 * Promotion bookkeeping:
 *   needsPromotion   — set by the access path once accessCount reaches the
 *                      threshold; cleared in the same transaction that
 *                      creates the promoted node
 *   promotedToNodeId — the node this experience is linked to; once set the
 *                      experience is never re-evaluated for promotion, but it
 *                      stays searchable and keeps decaying
 *   nodeLink         — how it got linked: "derived-from" (learned with HIGH
 *                      confidence) or "promoted-to" (auto-promotion)
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "experiences",
    indexes = {
        @Index(name = "idx_experiences_type", columnList = "experience_type"),
        @Index(name = "idx_experiences_promotion", columnList = "needs_promotion")
    }
)
public class Experience extends BaseEntity {

    public static final String LINK_DERIVED_FROM = "derived-from";
    public static final String LINK_PROMOTED_TO  = "promoted-to";

    @Enumerated(EnumType.STRING)
    @Column(name = "experience_type", nullable = false, length = 32)
    private ExperienceType type;

    @Column(name = "content", nullable = false, length = 10000)
    private String content;

    /** Situation in which this was learned. */
    @Column(name = "context", length = 4000)
    private String context;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(name = "confidence", nullable = false, length = 16)
    private Confidence confidence = Confidence.HIGH;

    /** Relevance at age zero. */
    @Builder.Default
    @Column(name = "score", nullable = false)
    private double score = 1.0;

    /** ln(2) × confidenceMultiplier / baseHalfLifeDays, per day. */
    @Column(name = "decay_rate", nullable = false)
    private double decayRate;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "experience_tags", joinColumns = @JoinColumn(name = "experience_id"))
    @Column(name = "tag", nullable = false, length = 128)
    private Set<String> tags = new LinkedHashSet<>();

    @Builder.Default
    @Column(name = "access_count", nullable = false)
    private int accessCount = 0;

    @Builder.Default
    @Column(name = "needs_promotion", nullable = false)
    private boolean needsPromotion = false;

    @Column(name = "promoted_to_node_id")
    private Long promotedToNodeId;

    @Column(name = "node_link", length = 32)
    private String nodeLink;

    @Column(name = "last_accessed_at")
    private LocalDateTime lastAccessedAt;
}
