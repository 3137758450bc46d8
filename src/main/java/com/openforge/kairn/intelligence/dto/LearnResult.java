package com.openforge.kairn.intelligence.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.openforge.kairn.domain.Confidence;
import com.openforge.kairn.domain.ExperienceType;

/**
 * Outcome of learn(): which routing path fired and what it created.
 *
 * @param storedAs "node" (HIGH confidence: node + linked experience) or
 *                 "experience" (MEDIUM/LOW: decaying experience only)
 * @param link     link type between node and experience, null when no node
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LearnResult(
        String         storedAs,
        Long           nodeId,
        Long           experienceId,
        ExperienceType type,
        Confidence     confidence,
        String         link
) {
    public static final String STORED_AS_NODE       = "node";
    public static final String STORED_AS_EXPERIENCE = "experience";
}
