package com.openforge.kairn.graph;

import com.openforge.kairn.error.KairnException;

import java.util.Locale;

/**
 * BFS answers "what is directly or nearly connected" and is the default;
 * DFS follows the heaviest chain first.
 */
public enum TraversalMode {
    BFS,
    DFS;

    public static TraversalMode parseOrDefault(String value) {
        if (value == null || value.isBlank()) {
            return BFS;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw KairnException.invalidArgument("Invalid traversal mode: " + value + ". Must be bfs or dfs");
        }
    }
}
