package com.openforge.kairn.router.dto;

import com.openforge.kairn.graph.Detail;

import java.util.List;

/**
 * @param source      "router" when the keyword index answered, "fulltext" when
 *                    resolution fell back to a graph text query
 * @param count       nodes plus experiences
 * @param experiences decay-ranked experiences matching the keywords; empty
 *                    when the router is asked directly
 */
public record ContextResult(
        String                  query,
        Detail                  detail,
        String                  source,
        int                     count,
        List<ContextNode>       nodes,
        List<ContextExperience> experiences
) {
    public static final String SOURCE_ROUTER   = "router";
    public static final String SOURCE_FULLTEXT = "fulltext";

    public static ContextResult ofNodes(String query, Detail detail, String source, List<ContextNode> nodes) {
        return new ContextResult(query, detail, source, nodes.size(), nodes, List.of());
    }

    public ContextResult withExperiences(List<ContextExperience> found) {
        return new ContextResult(query, detail, source, nodes.size() + found.size(), nodes, found);
    }
}
