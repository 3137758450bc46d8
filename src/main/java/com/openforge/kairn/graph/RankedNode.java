package com.openforge.kairn.graph;

import com.openforge.kairn.domain.KnowledgeNode;

/**
 * A query hit.
 *
 * @param node      the live node
 * @param relevance text relevance in [0, 1]; 1.0 for filter-only queries
 */
public record RankedNode(
        KnowledgeNode node,
        double        relevance
) {}
