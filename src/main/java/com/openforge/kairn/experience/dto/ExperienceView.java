package com.openforge.kairn.experience.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.openforge.kairn.domain.Confidence;
import com.openforge.kairn.domain.Experience;
import com.openforge.kairn.domain.ExperienceType;
import com.openforge.kairn.experience.ExperienceDecay;
import com.openforge.kairn.graph.Detail;

import java.time.LocalDateTime;
import java.util.Set;

/**
 * Experience as returned over the API. SUMMARY keeps id, type, content,
 * confidence and relevance; FULL adds the decay and promotion bookkeeping.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExperienceView(
        Long           id,
        ExperienceType type,
        String         content,
        Confidence     confidence,
        double         relevance,
        String         context,
        Double         score,
        Double         decayRate,
        Double         halfLifeDays,
        Set<String>    tags,
        Integer        accessCount,
        Long           promotedToNodeId,
        String         nodeLink,
        LocalDateTime  createTime,
        LocalDateTime  lastAccessedAt
) {
    public static ExperienceView of(Experience e, double relevance, Detail detail) {
        double rounded = Math.round(relevance * 10_000d) / 10_000d;
        if (detail != Detail.FULL) {
            return new ExperienceView(e.getId(), e.getType(), e.getContent(), e.getConfidence(), rounded,
                    null, null, null, null, null, null, null, null, null, null);
        }
        return new ExperienceView(
                e.getId(),
                e.getType(),
                e.getContent(),
                e.getConfidence(),
                rounded,
                e.getContext(),
                e.getScore(),
                e.getDecayRate(),
                ExperienceDecay.halfLifeDays(e.getDecayRate()),
                e.getTags(),
                e.getAccessCount(),
                e.getPromotedToNodeId(),
                e.getNodeLink(),
                e.getCreateTime(),
                e.getLastAccessedAt());
    }
}
