package com.openforge.kairn.router.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.openforge.kairn.domain.KnowledgeEdge;
import com.openforge.kairn.domain.KnowledgeNode;
import com.openforge.kairn.graph.dto.EdgeView;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One node of a resolved context. A summary stub is exactly {id, name, type}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ContextNode(
        Long                id,
        String              name,
        String              type,
        Double              confidence,
        String              namespace,
        String              description,
        Set<String>         tags,
        Map<String, Object> properties,
        List<EdgeView>      edges,
        LocalDateTime       createTime,
        LocalDateTime       updateTime
) {
    public static ContextNode summary(KnowledgeNode node) {
        return new ContextNode(node.getId(), node.getName(), node.getType(),
                null, null, null, null, null, null, null, null);
    }

    public static ContextNode full(KnowledgeNode node, double confidence, List<KnowledgeEdge> edges) {
        return new ContextNode(
                node.getId(),
                node.getName(),
                node.getType(),
                Math.round(confidence * 10_000d) / 10_000d,
                node.getNamespace(),
                node.getDescription(),
                node.getTags(),
                node.getProperties(),
                edges.stream().map(EdgeView::of).toList(),
                node.getCreateTime(),
                node.getUpdateTime());
    }
}
