package com.openforge.kairn.graph;

import com.openforge.kairn.domain.KnowledgeNode;

import java.util.List;
import java.util.Locale;

/**
 * Full-text rank of a node against query tokens, normalised into [0, 1].
 *
 * Per token: name hit 2.0, tag hit 1.5, description hit 1.0.
 */
public final class TextRelevance {

    private static final double NAME_WEIGHT        = 2.0;
    private static final double TAG_WEIGHT         = 1.5;
    private static final double DESCRIPTION_WEIGHT = 1.0;
    private static final double MAX_PER_TOKEN      = NAME_WEIGHT + TAG_WEIGHT + DESCRIPTION_WEIGHT;

    private TextRelevance() {
    }

    public static double score(KnowledgeNode node, List<String> tokens) {
        if (tokens.isEmpty()) {
            return 1.0;
        }
        String name = lower(node.getName());
        String description = lower(node.getDescription());

        double total = 0.0;
        for (String token : tokens) {
            if (name.contains(token)) total += NAME_WEIGHT;
            if (node.getTags().contains(token)) total += TAG_WEIGHT;
            if (description.contains(token)) total += DESCRIPTION_WEIGHT;
        }
        return total / (MAX_PER_TOKEN * tokens.size());
    }

    private static String lower(String s) {
        return s == null ? "" : s.toLowerCase(Locale.ROOT);
    }
}
