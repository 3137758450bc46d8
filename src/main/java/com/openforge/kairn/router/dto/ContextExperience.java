package com.openforge.kairn.router.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.openforge.kairn.domain.Confidence;
import com.openforge.kairn.domain.Experience;
import com.openforge.kairn.domain.ExperienceType;
import com.openforge.kairn.graph.Detail;

import java.util.Set;

/**
 * One experience attached to a resolved context. SUMMARY keeps id, type,
 * relevance and the first {@value #SUMMARY_CONTENT_CHARS} characters of the
 * content; FULL carries the whole content plus confidence, tags and context.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ContextExperience(
        Long           id,
        ExperienceType type,
        String         content,
        double         relevance,
        Confidence     confidence,
        Set<String>    tags,
        String         context
) {
    public static final int SUMMARY_CONTENT_CHARS = 200;

    public static ContextExperience of(Experience e, double relevance, Detail detail) {
        double rounded = Math.round(relevance * 10_000d) / 10_000d;
        if (detail != Detail.FULL) {
            String content = e.getContent().length() <= SUMMARY_CONTENT_CHARS
                    ? e.getContent()
                    : e.getContent().substring(0, SUMMARY_CONTENT_CHARS);
            return new ContextExperience(e.getId(), e.getType(), content, rounded, null, null, null);
        }
        return new ContextExperience(e.getId(), e.getType(), e.getContent(), rounded,
                e.getConfidence(), e.getTags(), e.getContext());
    }
}
