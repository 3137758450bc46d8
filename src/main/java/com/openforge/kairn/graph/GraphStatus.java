package com.openforge.kairn.graph;

import java.util.Map;

/**
 * Workspace overview.
 *
 * @param nodeCount       live nodes
 * @param edgeCount       live edges between live nodes
 * @param experienceCount stored experiences
 * @param routeCount      keyword entries in the router index
 * @param namespaces      live node count per namespace
 */
public record GraphStatus(
        long              nodeCount,
        long              edgeCount,
        long              experienceCount,
        long              routeCount,
        Map<String, Long> namespaces
) {}
