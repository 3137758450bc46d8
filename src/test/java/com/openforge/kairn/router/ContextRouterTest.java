package com.openforge.kairn.router;

import com.openforge.kairn.domain.KnowledgeNode;
import com.openforge.kairn.domain.RouteEntry;
import com.openforge.kairn.error.ErrorKind;
import com.openforge.kairn.error.KairnException;
import com.openforge.kairn.graph.Detail;
import com.openforge.kairn.graph.GraphService;
import com.openforge.kairn.router.dto.ContextNode;
import com.openforge.kairn.router.dto.ContextResult;
import com.openforge.kairn.router.dto.RebuildResult;
import com.openforge.kairn.support.AbstractIntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ContextRouterTest extends AbstractIntegrationTest {

    @Autowired
    private ContextRouter contextRouter;

    @Autowired
    private GraphService graphService;

    private static List<Long> ids(ContextResult result) {
        return result.nodes().stream().map(ContextNode::id).toList();
    }

    @Test
    void confidenceFor_isOneForUniqueKeywordAndFallsWithFrequency() {
        assertEquals(1.0, ContextRouter.confidenceFor(1), 0.0);
        assertEquals(1.0 / (1.0 + Math.log(2)), ContextRouter.confidenceFor(2), 1e-12);
        assertTrue(ContextRouter.confidenceFor(10) < ContextRouter.confidenceFor(3));
        assertTrue(ContextRouter.confidenceFor(1_000) > 0.0);
    }

    @Test
    void addNode_indexesNameDescriptionAndTags() {
        KnowledgeNode node = graphService.addNode("Redis caching", "pattern", null,
                "cache aside strategy", List.of("performance"));

        RouteEntry redis = routeEntryRepository.findByKeyword("redis").orElseThrow();
        assertEquals(Set.of(node.getId()), redis.getNodeIds());
        assertEquals(1.0, redis.getConfidence(), 0.0);
        assertTrue(routeEntryRepository.findByKeyword("performance").isPresent());
        assertTrue(routeEntryRepository.findByKeyword("strategy").isPresent());
    }

    @Test
    void index_lowersConfidenceOfSharedKeywords() {
        graphService.addNode("Database caching", "pattern", null, null, null);
        graphService.addNode("Database sharding", "pattern", null, null, null);

        assertEquals(ContextRouter.confidenceFor(2),
                routeEntryRepository.findByKeyword("database").orElseThrow().getConfidence(), 1e-12);
        assertEquals(1.0, routeEntryRepository.findByKeyword("sharding").orElseThrow().getConfidence(), 0.0);
    }

    @Test
    void resolve_summaryReturnsOnlyIdNameType() {
        KnowledgeNode node = graphService.addNode("Database caching", "pattern", "infra",
                "read-through cache", List.of("perf"), Map.of("owner", "platform"));

        ContextResult result = contextRouter.resolve("database caching", Detail.SUMMARY, 10);

        assertEquals(ContextResult.SOURCE_ROUTER, result.source());
        assertEquals(1, result.count());
        ContextNode stub = result.nodes().get(0);
        assertEquals(node.getId(), stub.id());
        assertEquals("Database caching", stub.name());
        assertEquals("pattern", stub.type());
        assertNull(stub.tags());
        assertNull(stub.properties());
        assertNull(stub.description());
        assertNull(stub.edges());
    }

    @Test
    void resolve_fullReturnsTagsPropertiesAndEdgesForSameNodes() {
        KnowledgeNode db = graphService.addNode("Database caching", "pattern", null,
                "read-through cache", List.of("perf"), Map.of("owner", "platform"));
        KnowledgeNode redis = graphService.addNode("Redis", "tool", null, null, null);
        graphService.connect(db.getId(), redis.getId(), "uses", 0.8);

        ContextResult summary = contextRouter.resolve("database caching", Detail.SUMMARY, 10);
        ContextResult full = contextRouter.resolve("database caching", Detail.FULL, 10);

        assertEquals(ids(summary), ids(full));
        ContextNode node = full.nodes().get(0);
        assertEquals(Set.of("perf"), node.tags());
        assertEquals("platform", node.properties().get("owner"));
        assertEquals(1, node.edges().size());
        assertEquals(redis.getId(), node.edges().get(0).targetId());
        assertNotNull(node.confidence());
    }

    @Test
    void resolve_ranksNodesMatchingMoreKeywordsFirst() {
        KnowledgeNode both = graphService.addNode("Database caching", "pattern", null, null, null);
        KnowledgeNode one = graphService.addNode("Database indexes", "pattern", null, null, null);

        ContextResult result = contextRouter.resolve("database caching", Detail.SUMMARY, 10);

        assertEquals(List.of(both.getId(), one.getId()), ids(result));
    }

    @Test
    void resolve_excludesDeletedNodes() {
        KnowledgeNode keep = graphService.addNode("Queue retries", "pattern", null, null, null);
        KnowledgeNode gone = graphService.addNode("Queue batching", "pattern", null, null, null);
        graphService.removeNode(gone.getId());

        assertEquals(List.of(keep.getId()), ids(contextRouter.resolve("queue", Detail.SUMMARY, 10)));
    }

    @Test
    void removeNode_dropsNodeFromRouteEntriesAndRaisesSharedConfidence() {
        KnowledgeNode keep = graphService.addNode("Queue retries", "pattern", null, null, null);
        KnowledgeNode gone = graphService.addNode("Queue batching", "pattern", null, null, null);
        assertEquals(ContextRouter.confidenceFor(2),
                routeEntryRepository.findByKeyword("queue").orElseThrow().getConfidence(), 1e-12);

        graphService.removeNode(gone.getId());

        RouteEntry queue = routeEntryRepository.findByKeyword("queue").orElseThrow();
        assertEquals(Set.of(keep.getId()), queue.getNodeIds());
        assertEquals(1.0, queue.getConfidence(), 0.0);
        assertTrue(routeEntryRepository.findByKeyword("batching").isEmpty());
    }

    @Test
    void updateNode_reindexesUnderNewKeywordsOnly() {
        KnowledgeNode node = graphService.addNode("Legacy cron", "topic", null, null, null);
        KnowledgeNode other = graphService.addNode("Cron syntax", "topic", null, null, null);

        graphService.updateNode(node.getId(), "Workflow scheduler", null, List.of("jobs"), null);

        assertTrue(routeEntryRepository.findByKeyword("legacy").isEmpty());
        assertEquals(Set.of(other.getId()), routeEntryRepository.findByKeyword("cron").orElseThrow().getNodeIds());
        assertEquals(List.of(node.getId()), ids(contextRouter.resolve("scheduler jobs", Detail.SUMMARY, 10)));
        assertEquals(ContextResult.SOURCE_ROUTER, contextRouter.resolve("workflow", Detail.SUMMARY, 10).source());
    }

    @Test
    void resolve_fallsBackToFullTextWhenIndexHasNoEntry() {
        KnowledgeNode node = graphService.addNode("Observability", "topic", null, null, null);
        routeEntryRepository.deleteAll();

        ContextResult result = contextRouter.resolve("observability", Detail.SUMMARY, 10);

        assertEquals(ContextResult.SOURCE_FULLTEXT, result.source());
        assertEquals(List.of(node.getId()), ids(result));
    }

    @Test
    void resolve_returnsEmptyForStopWordsOnly() {
        graphService.addNode("Anything", "topic", null, null, null);

        ContextResult result = contextRouter.resolve("the and of", Detail.SUMMARY, 10);

        assertEquals(0, result.count());
    }

    @Test
    void resolve_rejectsBlankKeywords() {
        KairnException ex = assertThrows(KairnException.class,
                () -> contextRouter.resolve(" ", Detail.SUMMARY, 10));
        assertEquals(ErrorKind.INVALID_ARGUMENT, ex.getKind());
    }

    @Test
    void rebuild_dropsDeletedNodesAndRestoresMissingEntries() {
        KnowledgeNode live = graphService.addNode("Tracing spans", "topic", null, null, null);
        KnowledgeNode gone = graphService.addNode("Tracing sampling", "topic", null, null, null);
        graphService.removeNode(gone.getId());
        routeEntryRepository.delete(routeEntryRepository.findByKeyword("spans").orElseThrow());

        RebuildResult result = contextRouter.rebuild();

        assertEquals(1, result.nodesIndexed());
        assertEquals(Set.of(live.getId()), routeEntryRepository.findByKeyword("tracing").orElseThrow().getNodeIds());
        assertTrue(routeEntryRepository.findByKeyword("spans").isPresent());
        assertTrue(routeEntryRepository.findByKeyword("sampling").isEmpty());
    }

    @Test
    void restoreNode_reindexesNode() {
        KnowledgeNode node = graphService.addNode("Feature flags", "topic", null, null, null);
        graphService.removeNode(node.getId());
        contextRouter.rebuild();
        assertTrue(routeEntryRepository.findByKeyword("flags").isEmpty());

        graphService.restoreNode(node.getId());

        assertEquals(Set.of(node.getId()), routeEntryRepository.findByKeyword("flags").orElseThrow().getNodeIds());
    }
}
