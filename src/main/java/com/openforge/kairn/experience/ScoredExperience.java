package com.openforge.kairn.experience;

import com.openforge.kairn.domain.Experience;

/**
 * A search hit.
 *
 * @param experience       the experience, access already counted
 * @param relevance        decayed relevance at search time
 * @param promotionPending flagged for promotion and not yet linked to a node
 */
public record ScoredExperience(
        Experience experience,
        double     relevance,
        boolean    promotionPending
) {}
