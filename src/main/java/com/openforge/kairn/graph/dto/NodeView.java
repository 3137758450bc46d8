package com.openforge.kairn.graph.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.openforge.kairn.domain.KnowledgeEdge;
import com.openforge.kairn.domain.KnowledgeNode;
import com.openforge.kairn.graph.Detail;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Node as returned over the API.
 *
 * A SUMMARY view carries only id, name and type; everything else is null and
 * left out of the JSON.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NodeView(
        Long                id,
        String              name,
        String              type,
        String              namespace,
        String              description,
        Set<String>         tags,
        Map<String, Object> properties,
        List<EdgeView>      edges,
        LocalDateTime       createTime,
        LocalDateTime       updateTime
) {
    public static NodeView summary(KnowledgeNode node) {
        return new NodeView(node.getId(), node.getName(), node.getType(),
                null, null, null, null, null, null, null);
    }

    public static NodeView full(KnowledgeNode node, List<KnowledgeEdge> edges) {
        return new NodeView(
                node.getId(),
                node.getName(),
                node.getType(),
                node.getNamespace(),
                node.getDescription(),
                node.getTags(),
                node.getProperties(),
                edges != null ? edges.stream().map(EdgeView::of).toList() : null,
                node.getCreateTime(),
                node.getUpdateTime());
    }

    public static NodeView of(KnowledgeNode node, Detail detail) {
        return detail == Detail.FULL ? full(node, null) : summary(node);
    }
}
