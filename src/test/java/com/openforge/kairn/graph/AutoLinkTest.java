package com.openforge.kairn.graph;

import com.openforge.kairn.domain.KnowledgeEdge;
import com.openforge.kairn.domain.KnowledgeNode;
import com.openforge.kairn.support.AbstractIntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.TestPropertySource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@TestPropertySource(properties = "kairn.graph.auto-link=true")
class AutoLinkTest extends AbstractIntegrationTest {

    @Autowired
    private GraphService graphService;

    @Test
    void addNode_linksToTextMatchingNodes() {
        KnowledgeNode kafka = graphService.addNode("Kafka partitions", "topic", null, null, null);
        graphService.addNode("Unrelated gardening", "topic", null, null, null);

        KnowledgeNode consumer = graphService.addNode("Kafka consumer lag", "topic", null, null, null);

        List<KnowledgeEdge> edges = edgeRepository.findBySourceIdAndDeletedAtIsNull(consumer.getId());
        assertEquals(1, edges.size());
        assertEquals(kafka.getId(), edges.get(0).getTargetId());
        assertEquals(GraphService.AUTO_LINK_EDGE_TYPE, edges.get(0).getType());
        assertEquals(GraphService.AUTO_LINK_WEIGHT, edges.get(0).getWeight(), 0.0);
    }

    @Test
    void addNode_linksAtMostFiveNodes() {
        for (int i = 0; i < 7; i++) {
            graphService.addNode("Metrics dashboard " + i, "topic", null, null, null);
        }

        KnowledgeNode node = graphService.addNode("Metrics overview", "topic", null, null, null);

        assertEquals(GraphService.AUTO_LINK_MAX,
                edgeRepository.findBySourceIdAndDeletedAtIsNull(node.getId()).size());
    }
}
