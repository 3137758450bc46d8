package com.openforge.kairn.graph;

import com.openforge.kairn.domain.KnowledgeNode;

/**
 * One node reached by a traversal.
 *
 * @param node        the reached node
 * @param depth       hops from the start node (start itself = 0)
 * @param viaEdgeType type of the edge it was reached through; null for the start node
 * @param viaNodeId   node it was reached from; null for the start node
 */
public record TraversalHit(
        KnowledgeNode node,
        int           depth,
        String        viaEdgeType,
        Long          viaNodeId
) {}
