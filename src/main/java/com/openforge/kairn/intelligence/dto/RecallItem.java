package com.openforge.kairn.intelligence.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDateTime;

/**
 * One merged recall hit, either a graph node or an experience.
 *
 * Nodes carry name/description, experiences carry content/confidence.
 * {@code workspace} is set for crossref results only.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RecallItem(
        String        source,
        Long          id,
        String        name,
        String        type,
        String        description,
        String        content,
        String        confidence,
        double        relevance,
        String        workspace,
        LocalDateTime createTime
) {
    public static final String SOURCE_NODE       = "node";
    public static final String SOURCE_EXPERIENCE = "experience";
}
