package com.openforge.kairn.graph;

import com.openforge.kairn.domain.KnowledgeEdge;
import com.openforge.kairn.domain.KnowledgeNode;
import com.openforge.kairn.error.Arguments;
import com.openforge.kairn.error.KairnException;
import com.openforge.kairn.event.KnowledgeEventPublisher;
import com.openforge.kairn.event.KnowledgeEventType;
import com.openforge.kairn.repository.EdgeRepository;
import com.openforge.kairn.repository.ExperienceRepository;
import com.openforge.kairn.repository.NodeRepository;
import com.openforge.kairn.repository.NodeSpecifications;
import com.openforge.kairn.repository.RouteEntryRepository;
import com.openforge.kairn.store.WorkspaceTransactions;
import com.openforge.kairn.text.Keywords;
import com.openforge.kairn.text.Tags;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Graph engine — node / edge lifecycle, filtered text query and traversal.
 *
 * Four operation groups:
 *
 *   addNode / getNode / updateNode / removeNode / restoreNode
 *                                                   — node lifecycle (soft delete)
 *   connect / removeEdge / restoreEdge / edgesOf   — edge lifecycle, one row per triple
 *   query                                           — filter-only or ranked text search
 *   traverse / status                               — BFS/DFS walk, workspace counts
 *
 * Soft-deleted nodes stay in the table: every read filters them out, and
 * edges touching them are hidden rather than removed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GraphService {

    static final String AUTO_LINK_EDGE_TYPE = "auto_related";
    static final double AUTO_LINK_WEIGHT    = 0.5;
    static final int    AUTO_LINK_MAX       = 5;

    private final NodeRepository          nodeRepository;
    private final EdgeRepository          edgeRepository;
    private final ExperienceRepository    experienceRepository;
    private final RouteEntryRepository    routeEntryRepository;
    private final WorkspaceTransactions   transactions;
    private final KnowledgeEventPublisher events;
    private final GraphProperties         properties;
    private final Clock                   clock;

    // ── Nodes ────────────────────────────────────────────────────────────────

    public KnowledgeNode addNode(String name,
                                 String type,
                                 @Nullable String namespace,
                                 @Nullable String description,
                                 @Nullable Collection<String> tags) {
        return addNode(name, type, namespace, description, tags, null);
    }

    /**
     * Create a live node. Emits NODE_CREATED inside the same transaction, so
     * the router's keyword index is updated atomically with the insert.
     */
    public KnowledgeNode addNode(String name,
                                 String type,
                                 @Nullable String namespace,
                                 @Nullable String description,
                                 @Nullable Collection<String> tags,
                                 @Nullable Map<String, Object> nodeProperties) {
        String cleanName = Arguments.requireText(name, "name");
        String cleanType = Arguments.requireText(type, "type");
        String ns = Arguments.blankToNull(namespace);

        return transactions.write(() -> {
            KnowledgeNode node = KnowledgeNode.builder()
                    .name(cleanName)
                    .type(cleanType)
                    .namespace(ns != null ? ns : KnowledgeNode.DEFAULT_NAMESPACE)
                    .description(Arguments.blankToNull(description))
                    .tags(Tags.normalize(tags))
                    .properties(nodeProperties != null ? new LinkedHashMap<>(nodeProperties) : new LinkedHashMap<>())
                    .build();
            KnowledgeNode saved = nodeRepository.save(node);

            events.publish(KnowledgeEventType.NODE_CREATED, saved.getId(), saved);
            if (properties.autoLink()) {
                autoLink(saved);
            }
            log.info("[Graph] Created node {} '{}' (type={}, namespace={})",
                    saved.getId(), saved.getName(), saved.getType(), saved.getNamespace());
            return saved;
        });
    }

    /** A live node, or NOT_FOUND. */
    public KnowledgeNode getNode(Long nodeId) {
        Arguments.requirePresent(nodeId, "node_id");
        return transactions.read(() -> requireLiveNode(nodeId, "Node"));
    }

    /**
     * Change a live node in place. Null arguments leave the field as it is;
     * a blank description clears it, and properties, when given, replace the
     * whole map. Emits NODE_UPDATED so the router re-indexes the node in the
     * same transaction.
     */
    public KnowledgeNode updateNode(Long nodeId,
                                    @Nullable String name,
                                    @Nullable String description,
                                    @Nullable Collection<String> tags,
                                    @Nullable Map<String, Object> nodeProperties) {
        Arguments.requirePresent(nodeId, "node_id");
        String cleanName = name != null ? Arguments.requireText(name, "name") : null;

        return transactions.write(() -> {
            KnowledgeNode node = requireLiveNode(nodeId, "Node");
            if (cleanName != null) {
                node.setName(cleanName);
            }
            if (description != null) {
                node.setDescription(Arguments.blankToNull(description));
            }
            if (tags != null) {
                node.setTags(Tags.normalize(tags));
            }
            if (nodeProperties != null) {
                node.setProperties(new LinkedHashMap<>(nodeProperties));
            }
            // explicit, so a tags-only change still moves update_time
            node.setUpdateTime(LocalDateTime.now(clock));
            KnowledgeNode saved = nodeRepository.save(node);
            events.publish(KnowledgeEventType.NODE_UPDATED, nodeId, saved);
            log.info("[Graph] Updated node {} '{}'", nodeId, saved.getName());
            return saved;
        });
    }

    public void removeNode(Long nodeId) {
        Arguments.requirePresent(nodeId, "node_id");
        transactions.write(() -> {
            KnowledgeNode node = requireLiveNode(nodeId, "Node");
            node.setDeletedAt(LocalDateTime.now(clock));
            nodeRepository.save(node);
            events.publish(KnowledgeEventType.NODE_DELETED, nodeId, node);
            log.info("[Graph] Soft-deleted node {}", nodeId);
        });
    }

    /**
     * Undo a soft delete. Restoring a node that is already live is a CONFLICT;
     * a node id that never existed is NOT_FOUND.
     */
    public KnowledgeNode restoreNode(Long nodeId) {
        Arguments.requirePresent(nodeId, "node_id");
        return transactions.write(() -> {
            KnowledgeNode node = nodeRepository.findById(nodeId)
                    .orElseThrow(() -> KairnException.notFound("Node not found: " + nodeId));
            if (node.isLive()) {
                throw KairnException.conflict("Node is not deleted: " + nodeId);
            }
            node.setDeletedAt(null);
            KnowledgeNode saved = nodeRepository.save(node);
            events.publish(KnowledgeEventType.NODE_RESTORED, nodeId, saved);
            log.info("[Graph] Restored node {}", nodeId);
            return saved;
        });
    }

    // ── Edges ────────────────────────────────────────────────────────────────

    public KnowledgeEdge connect(Long sourceId, Long targetId, String edgeType, @Nullable Double weight) {
        return connect(sourceId, targetId, edgeType, weight, null);
    }

    /**
     * Create or overwrite the edge for (source, target, type). A second call
     * with the same triple replaces weight (and properties, when given) and
     * revives the edge if it had been soft-deleted; it never adds a row.
     */
    public KnowledgeEdge connect(Long sourceId,
                                 Long targetId,
                                 String edgeType,
                                 @Nullable Double weight,
                                 @Nullable Map<String, Object> edgeProperties) {
        Arguments.requirePresent(sourceId, "source_id");
        Arguments.requirePresent(targetId, "target_id");
        String type = Arguments.requireText(edgeType, "edge_type");
        double w = weight != null
                ? Arguments.requireUnitInterval(weight, "weight")
                : KnowledgeEdge.DEFAULT_WEIGHT;

        return transactions.write(() -> {
            requireLiveNode(sourceId, "Source node");
            requireLiveNode(targetId, "Target node");

            Optional<KnowledgeEdge> existing =
                    edgeRepository.findBySourceIdAndTargetIdAndType(sourceId, targetId, type);
            KnowledgeEdge edge;
            KnowledgeEventType eventType;
            if (existing.isPresent()) {
                edge = existing.get();
                edge.setWeight(w);
                edge.setDeletedAt(null);
                if (edgeProperties != null) {
                    edge.setProperties(new LinkedHashMap<>(edgeProperties));
                }
                eventType = KnowledgeEventType.EDGE_UPDATED;
            } else {
                edge = KnowledgeEdge.builder()
                        .sourceId(sourceId)
                        .targetId(targetId)
                        .type(type)
                        .weight(w)
                        .properties(edgeProperties != null ? new LinkedHashMap<>(edgeProperties) : new LinkedHashMap<>())
                        .build();
                eventType = KnowledgeEventType.EDGE_CREATED;
            }
            KnowledgeEdge saved = edgeRepository.save(edge);
            events.publish(eventType, sourceId, saved);
            log.debug("[Graph] {} {} -[{} {}]-> {}", eventType, sourceId, type, w, targetId);
            return saved;
        });
    }

    public void removeEdge(Long sourceId, Long targetId, String edgeType) {
        Arguments.requirePresent(sourceId, "source_id");
        Arguments.requirePresent(targetId, "target_id");
        String type = Arguments.requireText(edgeType, "edge_type");
        transactions.write(() -> {
            KnowledgeEdge edge = edgeRepository.findBySourceIdAndTargetIdAndType(sourceId, targetId, type)
                    .filter(KnowledgeEdge::isLive)
                    .orElseThrow(() -> KairnException.notFound(
                            "Edge not found: %d -[%s]-> %d".formatted(sourceId, type, targetId)));
            edge.setDeletedAt(LocalDateTime.now(clock));
            edgeRepository.save(edge);
            events.publish(KnowledgeEventType.EDGE_DELETED, sourceId, edge);
            log.info("[Graph] Soft-deleted edge {} -[{}]-> {}", sourceId, type, targetId);
        });
    }

    public KnowledgeEdge restoreEdge(Long sourceId, Long targetId, String edgeType) {
        Arguments.requirePresent(sourceId, "source_id");
        Arguments.requirePresent(targetId, "target_id");
        String type = Arguments.requireText(edgeType, "edge_type");
        return transactions.write(() -> {
            KnowledgeEdge edge = edgeRepository.findBySourceIdAndTargetIdAndType(sourceId, targetId, type)
                    .orElseThrow(() -> KairnException.notFound(
                            "Edge not found: %d -[%s]-> %d".formatted(sourceId, type, targetId)));
            if (edge.isLive()) {
                throw KairnException.conflict(
                        "Edge is not deleted: %d -[%s]-> %d".formatted(sourceId, type, targetId));
            }
            edge.setDeletedAt(null);
            KnowledgeEdge saved = edgeRepository.save(edge);
            events.publish(KnowledgeEventType.EDGE_RESTORED, sourceId, saved);
            log.info("[Graph] Restored edge {} -[{}]-> {}", sourceId, type, targetId);
            return saved;
        });
    }

    /**
     * Visible edges touching a node (live edge, live other end), heaviest
     * first, at most {@code limit}.
     */
    public List<KnowledgeEdge> edgesOf(Long nodeId, int limit) {
        return transactions.read(() -> {
            List<KnowledgeEdge> edges = new ArrayList<>(liveEdges(nodeId, null));
            Set<Long> otherEnds = edges.stream().map(e -> e.otherEnd(nodeId)).collect(Collectors.toSet());
            Set<Long> liveEnds = nodeRepository.findByIdInAndDeletedAtIsNull(otherEnds).stream()
                    .map(KnowledgeNode::getId)
                    .collect(Collectors.toSet());
            return edges.stream()
                    .filter(e -> liveEnds.contains(e.otherEnd(nodeId)))
                    .limit(limit)
                    .toList();
        });
    }

    // ── Query ────────────────────────────────────────────────────────────────

    /**
     * Search live nodes.
     *
     * Without usable text (null, blank or only stop words) this is a filter
     * query ordered by most recent update. With text, nodes mentioning at
     * least one keyword are ranked by {@link TextRelevance}, restricted by
     * the same filters, most relevant first.
     *
     * @param tags node must carry all of them
     */
    public List<RankedNode> query(@Nullable String text,
                                  @Nullable String type,
                                  @Nullable Collection<String> tags,
                                  @Nullable String namespace,
                                  int limit,
                                  int offset) {
        Arguments.requireLimit(limit);
        Arguments.requireOffset(offset);
        List<String> tokens = Keywords.extract(text);

        Specification<KnowledgeNode> spec = Specification.where(NodeSpecifications.live());
        if (Arguments.blankToNull(type) != null) {
            spec = spec.and(NodeSpecifications.ofType(type.trim()));
        }
        if (Arguments.blankToNull(namespace) != null) {
            spec = spec.and(NodeSpecifications.inNamespace(namespace.trim()));
        }
        Set<String> tagFilter = Tags.normalize(tags);
        if (!tagFilter.isEmpty()) {
            spec = spec.and(NodeSpecifications.taggedWithAll(tagFilter));
        }
        if (!tokens.isEmpty()) {
            spec = spec.and(NodeSpecifications.mentionsAny(tokens));
        }
        Specification<KnowledgeNode> finalSpec = spec;

        return transactions.read(() -> {
            List<KnowledgeNode> candidates = nodeRepository.findAll(finalSpec,
                    Sort.by(Sort.Order.desc("updateTime"), Sort.Order.desc("id")));
            Comparator<RankedNode> byRelevance = Comparator.comparingDouble(RankedNode::relevance).reversed();
            List<RankedNode> ranked = candidates.stream()
                    .map(n -> new RankedNode(n, TextRelevance.score(n, tokens)))
                    .filter(r -> r.relevance() > 0.0)
                    // stable sort keeps the recency order among equal scores
                    .sorted(byRelevance)
                    .skip(offset)
                    .limit(limit)
                    .toList();
            log.debug("[Graph] query text='{}' tokens={} → {} of {} candidates",
                    text, tokens, ranked.size(), candidates.size());
            return ranked;
        });
    }

    // ── Traversal ────────────────────────────────────────────────────────────

    /**
     * Walk the graph from a live start node, following edges in both
     * directions, up to {@code depth} hops.
     *
     * Each node appears at most once (keyed by id), at the fewest hops it can
     * be reached in, so cycles terminate. Neighbours are expanded heaviest
     * edge first. Soft-deleted nodes and edges are skipped without error. The
     * start node is the first hit, at depth 0.
     */
    public List<TraversalHit> traverse(Long startId,
                                       int depth,
                                       @Nullable String edgeType,
                                       @Nullable TraversalMode mode) {
        Arguments.requirePresent(startId, "node_id");
        Arguments.requireDepth(depth);
        String typeFilter = Arguments.blankToNull(edgeType);
        TraversalMode effectiveMode = mode != null ? mode : TraversalMode.BFS;

        return transactions.read(() -> {
            KnowledgeNode start = requireLiveNode(startId, "Node");
            List<TraversalHit> hits = effectiveMode == TraversalMode.BFS
                    ? breadthFirst(start, depth, typeFilter)
                    : depthFirst(start, depth, typeFilter);
            log.debug("[Graph] {} from {} depth={} edgeType={} → {} nodes",
                    effectiveMode, startId, depth, typeFilter, hits.size());
            return hits;
        });
    }

    private List<TraversalHit> breadthFirst(KnowledgeNode start, int maxDepth, String edgeType) {
        List<TraversalHit> hits = new ArrayList<>();
        Set<Long> visited = new HashSet<>();
        Deque<TraversalHit> queue = new ArrayDeque<>();

        visited.add(start.getId());
        queue.add(new TraversalHit(start, 0, null, null));

        while (!queue.isEmpty()) {
            TraversalHit current = queue.poll();
            hits.add(current);
            if (current.depth() >= maxDepth) continue;

            for (Neighbour nb : neighbours(current.node().getId(), edgeType)) {
                if (visited.add(nb.node().getId())) {
                    queue.add(new TraversalHit(nb.node(), current.depth() + 1,
                            nb.edgeType(), current.node().getId()));
                }
            }
        }
        return hits;
    }

    /**
     * A node first reached through a long branch is expanded again when a
     * shorter path reaches it later, so everything within {@code maxDepth}
     * hops is found. Each node is still listed once, at its shallowest depth,
     * in the order it was first reached.
     */
    private List<TraversalHit> depthFirst(KnowledgeNode start, int maxDepth, String edgeType) {
        Map<Long, TraversalHit> reached = new LinkedHashMap<>();
        Deque<TraversalHit> stack = new ArrayDeque<>();

        stack.push(new TraversalHit(start, 0, null, null));

        while (!stack.isEmpty()) {
            TraversalHit current = stack.pop();
            TraversalHit seen = reached.get(current.node().getId());
            if (seen != null && seen.depth() <= current.depth()) continue;
            // replacing an existing key keeps its first-reached position
            reached.put(current.node().getId(), current);
            if (current.depth() >= maxDepth) continue;

            int nextDepth = current.depth() + 1;
            List<Neighbour> next = neighbours(current.node().getId(), edgeType);
            // push lightest first so the heaviest edge is explored first
            for (int i = next.size() - 1; i >= 0; i--) {
                Neighbour nb = next.get(i);
                TraversalHit known = reached.get(nb.node().getId());
                if (known == null || known.depth() > nextDepth) {
                    stack.push(new TraversalHit(nb.node(), nextDepth,
                            nb.edgeType(), current.node().getId()));
                }
            }
        }
        return new ArrayList<>(reached.values());
    }

    private record Neighbour(KnowledgeNode node, String edgeType, double weight) {}

    /** Live neighbours over live edges, heaviest edge first. */
    private List<Neighbour> neighbours(Long nodeId, String edgeType) {
        List<KnowledgeEdge> edges = liveEdges(nodeId, edgeType);
        if (edges.isEmpty()) return List.of();

        Set<Long> ids = edges.stream().map(e -> e.otherEnd(nodeId)).collect(Collectors.toSet());
        Map<Long, KnowledgeNode> live = nodeRepository.findByIdInAndDeletedAtIsNull(ids).stream()
                .collect(Collectors.toMap(KnowledgeNode::getId, Function.identity()));

        List<Neighbour> result = new ArrayList<>();
        for (KnowledgeEdge e : edges) {
            KnowledgeNode other = live.get(e.otherEnd(nodeId));
            if (other != null) {
                result.add(new Neighbour(other, e.getType(), e.getWeight()));
            }
        }
        return result;
    }

    /** Outgoing then incoming live edges, sorted by weight descending, then id. */
    private List<KnowledgeEdge> liveEdges(Long nodeId, String edgeType) {
        List<KnowledgeEdge> edges = new ArrayList<>();
        if (edgeType == null) {
            edges.addAll(edgeRepository.findBySourceIdAndDeletedAtIsNull(nodeId));
            edges.addAll(edgeRepository.findByTargetIdAndDeletedAtIsNull(nodeId));
        } else {
            edges.addAll(edgeRepository.findBySourceIdAndTypeAndDeletedAtIsNull(nodeId, edgeType));
            edges.addAll(edgeRepository.findByTargetIdAndTypeAndDeletedAtIsNull(nodeId, edgeType));
        }
        edges.sort(Comparator.comparingDouble(KnowledgeEdge::getWeight).reversed()
                .thenComparing(KnowledgeEdge::getId));
        return edges;
    }

    // ── Status ───────────────────────────────────────────────────────────────

    public GraphStatus status() {
        return transactions.read(() -> {
            Map<String, Long> namespaces = new TreeMap<>();
            for (Object[] row : nodeRepository.countLiveByNamespace()) {
                namespaces.put((String) row[0], ((Number) row[1]).longValue());
            }
            return new GraphStatus(
                    nodeRepository.countByDeletedAtIsNull(),
                    edgeRepository.countVisible(),
                    experienceRepository.count(),
                    routeEntryRepository.count(),
                    namespaces);
        });
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private KnowledgeNode requireLiveNode(Long nodeId, String label) {
        return nodeRepository.findByIdAndDeletedAtIsNull(nodeId)
                .orElseThrow(() -> KairnException.notFound(label + " not found: " + nodeId));
    }

    /**
     * Link a new node to the best text matches among existing nodes.
     * Runs inside the addNode transaction.
     */
    private void autoLink(KnowledgeNode node) {
        String text = node.getName() + " " + (node.getDescription() != null ? node.getDescription() : "");
        if (Keywords.extract(text).isEmpty()) return;

        List<RankedNode> related = query(text, null, null, null, AUTO_LINK_MAX + 1, 0);
        int linked = 0;
        for (RankedNode r : related) {
            Long otherId = r.node().getId();
            if (otherId.equals(node.getId()) || linked >= AUTO_LINK_MAX) continue;
            connect(node.getId(), otherId, AUTO_LINK_EDGE_TYPE, AUTO_LINK_WEIGHT);
            linked++;
        }
        if (linked > 0) {
            log.debug("[Graph] Auto-linked node {} to {} related nodes", node.getId(), linked);
        }
    }

}
