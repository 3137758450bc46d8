package com.openforge.kairn.graph.dto;

import com.openforge.kairn.domain.KnowledgeEdge;

import java.time.LocalDateTime;
import java.util.Map;

/** Edge as returned over the API. */
public record EdgeView(
        Long                sourceId,
        Long                targetId,
        String              edgeType,
        double              weight,
        Map<String, Object> properties,
        LocalDateTime       createTime,
        LocalDateTime       updateTime
) {
    public static EdgeView of(KnowledgeEdge edge) {
        return new EdgeView(
                edge.getSourceId(),
                edge.getTargetId(),
                edge.getType(),
                edge.getWeight(),
                edge.getProperties(),
                edge.getCreateTime(),
                edge.getUpdateTime());
    }
}
