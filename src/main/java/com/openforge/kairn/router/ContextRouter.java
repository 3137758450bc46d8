package com.openforge.kairn.router;

import com.openforge.kairn.domain.KnowledgeNode;
import com.openforge.kairn.domain.RouteEntry;
import com.openforge.kairn.error.Arguments;
import com.openforge.kairn.event.KnowledgeEvent;
import com.openforge.kairn.event.KnowledgeEventPublisher;
import com.openforge.kairn.event.KnowledgeEventType;
import com.openforge.kairn.graph.Detail;
import com.openforge.kairn.graph.GraphService;
import com.openforge.kairn.graph.RankedNode;
import com.openforge.kairn.repository.NodeRepository;
import com.openforge.kairn.repository.RouteEntryRepository;
import com.openforge.kairn.router.dto.ContextNode;
import com.openforge.kairn.router.dto.ContextResult;
import com.openforge.kairn.router.dto.RebuildResult;
import com.openforge.kairn.store.WorkspaceTransactions;
import com.openforge.kairn.text.Keywords;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Keyword → node routing with progressive disclosure.
 *
 * Index maintenance:
 *   NODE_CREATED / NODE_RESTORED  ──►  index(node)
 *   NODE_UPDATED                  ──►  unindex(id) + index(node)
 *   NODE_DELETED                  ──►  unindex(id)
 *     keywords(name + description + tags) → upsert one RouteEntry per keyword
 *
 * Resolution:
 *   resolve("database caching", detail, limit)
 *     1. tokenise → look up route entries
 *     2. score(node) = Σ confidence of the entries that list it
 *     3. keep live nodes, rank by score desc then most recently updated
 *     4. nothing left → fall back to GraphService.query with the raw string
 *
 * The index is a cache over node content, kept in step with node writes and
 * safe to regenerate with {@link #rebuild()}. Deleted nodes are also
 * filtered at read time.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ContextRouter {

    private final RouteEntryRepository    routeRepository;
    private final NodeRepository          nodeRepository;
    private final GraphService            graphService;
    private final WorkspaceTransactions   transactions;
    private final KnowledgeEventPublisher events;
    private final RouterProperties        properties;

    // ── Index maintenance ────────────────────────────────────────────────────

    /**
     * Runs inside the transaction that changed the node, so a failed index
     * update rolls the node write back with it.
     */
    @EventListener
    public void onKnowledgeEvent(KnowledgeEvent event) {
        if (!(event.payload() instanceof KnowledgeNode node)) return;
        switch (event.type()) {
            case NODE_CREATED, NODE_RESTORED -> index(node);
            case NODE_UPDATED -> {
                unindex(node.getId());
                index(node);
            }
            case NODE_DELETED -> unindex(node.getId());
            default -> { }
        }
    }

    public void index(KnowledgeNode node) {
        List<String> keywords = keywordsOf(node);
        if (keywords.isEmpty()) return;

        transactions.write(() -> {
            Map<String, RouteEntry> existing = routeRepository.findByKeywordIn(keywords).stream()
                    .collect(Collectors.toMap(RouteEntry::getKeyword, Function.identity()));
            List<RouteEntry> changed = new ArrayList<>(keywords.size());
            for (String keyword : keywords) {
                RouteEntry entry = existing.get(keyword);
                if (entry == null) {
                    entry = RouteEntry.builder().keyword(keyword).build();
                }
                entry.getNodeIds().add(node.getId());
                entry.setConfidence(confidenceFor(entry.getNodeIds().size()));
                changed.add(entry);
            }
            routeRepository.saveAll(changed);
            log.debug("[Router] Indexed node {} under {} keywords", node.getId(), keywords.size());
        });
    }

    /**
     * Take a node out of every route entry that lists it. Entries left with
     * no node are dropped; the rest get their confidence recomputed.
     */
    public void unindex(Long nodeId) {
        transactions.write(() -> {
            List<RouteEntry> entries = routeRepository.findByNodeIdsContaining(nodeId);
            List<RouteEntry> emptied = new ArrayList<>();
            List<RouteEntry> changed = new ArrayList<>();
            for (RouteEntry entry : entries) {
                entry.getNodeIds().remove(nodeId);
                if (entry.getNodeIds().isEmpty()) {
                    emptied.add(entry);
                } else {
                    entry.setConfidence(confidenceFor(entry.getNodeIds().size()));
                    changed.add(entry);
                }
            }
            routeRepository.deleteAll(emptied);
            routeRepository.saveAll(changed);
            // re-indexing the same keywords must not collide with pending deletes
            routeRepository.flush();
            log.debug("[Router] Unindexed node {} from {} keywords", nodeId, entries.size());
        });
    }

    /** Drop every route entry and re-index all live nodes. */
    public RebuildResult rebuild() {
        return transactions.write(() -> {
            routeRepository.deleteAll();
            // deletes must reach the database before re-inserting the same keywords
            routeRepository.flush();

            List<KnowledgeNode> nodes = nodeRepository.findByDeletedAtIsNull();
            Map<String, Set<Long>> index = new LinkedHashMap<>();
            for (KnowledgeNode node : nodes) {
                for (String keyword : keywordsOf(node)) {
                    index.computeIfAbsent(keyword, k -> new LinkedHashSet<>()).add(node.getId());
                }
            }
            List<RouteEntry> entries = index.entrySet().stream()
                    .map(e -> RouteEntry.builder()
                            .keyword(e.getKey())
                            .nodeIds(e.getValue())
                            .confidence(confidenceFor(e.getValue().size()))
                            .build())
                    .toList();
            routeRepository.saveAll(entries);

            RebuildResult result = new RebuildResult(nodes.size(), entries.size());
            events.publish(KnowledgeEventType.ROUTES_REBUILT, null, result);
            log.info("[Router] Rebuilt index: {} nodes, {} keywords", nodes.size(), entries.size());
            return result;
        });
    }

    // ── Resolution ───────────────────────────────────────────────────────────

    public ContextResult resolve(String keywords, Detail detail, int limit) {
        String query = Arguments.requireText(keywords, "keywords");
        Arguments.requireLimit(limit);
        Detail level = detail != null ? detail : Detail.SUMMARY;
        List<String> tokens = Keywords.extract(query, properties.maxKeywords());
        if (tokens.isEmpty()) {
            return ContextResult.ofNodes(query, level, ContextResult.SOURCE_ROUTER, List.of());
        }

        return transactions.read(() -> {
            List<RankedNode> ranked = fromIndex(tokens, limit);
            String source = ContextResult.SOURCE_ROUTER;
            if (ranked.isEmpty()) {
                ranked = graphService.query(query, null, null, null, limit, 0);
                source = ContextResult.SOURCE_FULLTEXT;
            }
            List<ContextNode> nodes = ranked.stream()
                    .map(r -> level == Detail.FULL
                            ? ContextNode.full(r.node(), r.relevance(),
                                    graphService.edgesOf(r.node().getId(), properties.fullEdgeLimit()))
                            : ContextNode.summary(r.node()))
                    .toList();
            log.debug("[Router] resolve '{}' tokens={} source={} → {} nodes",
                    query, tokens, source, nodes.size());
            return ContextResult.ofNodes(query, level, source, nodes);
        });
    }

    /** 1.0 for a keyword unique to one node, falling as the keyword gets more common. */
    public static double confidenceFor(int nodeCount) {
        if (nodeCount <= 1) return 1.0;
        return 1.0 / (1.0 + Math.log(nodeCount));
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private List<RankedNode> fromIndex(List<String> tokens, int limit) {
        Map<Long, Double> scores = new HashMap<>();
        for (RouteEntry entry : routeRepository.findByKeywordIn(tokens)) {
            if (entry.getConfidence() < properties.minConfidence()) continue;
            for (Long nodeId : entry.getNodeIds()) {
                scores.merge(nodeId, entry.getConfidence(), Double::sum);
            }
        }
        if (scores.isEmpty()) return List.of();

        Comparator<RankedNode> ranking = Comparator.comparingDouble(RankedNode::relevance).reversed()
                .thenComparing(r -> r.node().getUpdateTime(),
                        Comparator.nullsLast(Comparator.<LocalDateTime>reverseOrder()));
        return nodeRepository.findByIdInAndDeletedAtIsNull(scores.keySet()).stream()
                .map(n -> new RankedNode(n, scores.get(n.getId())))
                .sorted(ranking)
                .limit(limit)
                .toList();
    }

    private List<String> keywordsOf(KnowledgeNode node) {
        StringBuilder text = new StringBuilder(node.getName());
        if (node.getDescription() != null) {
            text.append(' ').append(node.getDescription());
        }
        for (String tag : node.getTags()) {
            text.append(' ').append(tag);
        }
        return Keywords.extract(text.toString(), properties.maxKeywords());
    }
}
