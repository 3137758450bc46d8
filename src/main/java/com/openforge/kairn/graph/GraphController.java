package com.openforge.kairn.graph;

import com.openforge.kairn.domain.KnowledgeNode;
import com.openforge.kairn.error.Arguments;
import com.openforge.kairn.graph.dto.EdgeView;
import com.openforge.kairn.graph.dto.NodeView;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST API over the graph engine.
 *
 * ┌──────────────────────────────────────────────────────────────────────┐
 * │  Endpoint                                   Description              │
 * ├──────────────────────────────────────────────────────────────────────┤
 * │  POST   /api/graph/nodes                    add a node               │
 * │  GET    /api/graph/nodes                    filtered / text query    │
 * │  GET    /api/graph/nodes/{id}               one live node, full      │
 * │  PATCH  /api/graph/nodes/{id}               update a live node       │
 * │  DELETE /api/graph/nodes/{id}               soft-delete a node       │
 * │  POST   /api/graph/nodes/{id}/restore       undo a node delete       │
 * │  POST   /api/graph/edges                    connect (upsert triple)  │
 * │  DELETE /api/graph/edges                    soft-delete an edge      │
 * │  POST   /api/graph/edges/restore            undo an edge delete      │
 * │  GET    /api/graph/status                   workspace counts         │
 * └──────────────────────────────────────────────────────────────────────┘
 */
@RestController
@RequestMapping("/api/graph")
@RequiredArgsConstructor
public class GraphController {

    private final GraphService graphService;

    // ── Nodes ────────────────────────────────────────────────────────────────

    @PostMapping("/nodes")
    public ResponseEntity<NodeView> addNode(@Valid @RequestBody AddNodeRequest req) {
        KnowledgeNode node = graphService.addNode(
                req.name(), req.type(), req.namespace(), req.description(), req.tags(), req.properties());
        return ResponseEntity.status(HttpStatus.CREATED).body(NodeView.full(node, null));
    }

    /**
     * Query params:
     *   text       — free text; absent = filter-only, newest first
     *   node_type  — exact type                    (optional)
     *   namespace  — exact namespace               (optional)
     *   tags       — comma-separated, all required (optional)
     *   detail     — summary | full                (default full)
     *   limit      — 1..50                         (default 10)
     *   offset     — ≥ 0                           (default 0)
     */
    @GetMapping("/nodes")
    public ResponseEntity<NodePage> queryNodes(
            @RequestParam(required = false) String text,
            @RequestParam(name = "node_type", required = false) String nodeType,
            @RequestParam(required = false) String namespace,
            @RequestParam(required = false) List<String> tags,
            @RequestParam(defaultValue = "full") String detail,
            @RequestParam(defaultValue = "10") int limit,
            @RequestParam(defaultValue = "0") int offset) {

        Detail level = Detail.parseOrDefault(detail);
        List<NodeHit> items = graphService.query(text, nodeType, tags, namespace, limit, offset).stream()
                .map(r -> new NodeHit(NodeView.of(r.node(), level), round(r.relevance())))
                .toList();
        return ResponseEntity.ok(new NodePage(items, items.size(), limit, offset));
    }

    @GetMapping("/nodes/{id}")
    public ResponseEntity<NodeView> getNode(@PathVariable long id) {
        KnowledgeNode node = graphService.getNode(id);
        return ResponseEntity.ok(NodeView.full(node, graphService.edgesOf(id, Arguments.MAX_LIMIT)));
    }

    /** Omitted fields stay as they are; {@code properties} replaces the whole map. */
    @PatchMapping("/nodes/{id}")
    public ResponseEntity<NodeView> updateNode(@PathVariable long id, @Valid @RequestBody UpdateNodeRequest req) {
        KnowledgeNode node = graphService.updateNode(
                id, req.name(), req.description(), req.tags(), req.properties());
        return ResponseEntity.ok(NodeView.full(node, null));
    }

    @DeleteMapping("/nodes/{id}")
    public ResponseEntity<Void> removeNode(@PathVariable long id) {
        graphService.removeNode(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/nodes/{id}/restore")
    public ResponseEntity<NodeView> restoreNode(@PathVariable long id) {
        return ResponseEntity.ok(NodeView.full(graphService.restoreNode(id), null));
    }

    // ── Edges ────────────────────────────────────────────────────────────────

    /** Connecting an existing triple overwrites it, so this is 200 either way. */
    @PostMapping("/edges")
    public ResponseEntity<EdgeView> connect(@Valid @RequestBody ConnectRequest req) {
        return ResponseEntity.ok(EdgeView.of(graphService.connect(
                req.sourceId(), req.targetId(), req.edgeType(), req.weight(), req.properties())));
    }

    @DeleteMapping("/edges")
    public ResponseEntity<Void> removeEdge(
            @RequestParam(name = "source_id") long sourceId,
            @RequestParam(name = "target_id") long targetId,
            @RequestParam(name = "edge_type") String edgeType) {
        graphService.removeEdge(sourceId, targetId, edgeType);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/edges/restore")
    public ResponseEntity<EdgeView> restoreEdge(@Valid @RequestBody EdgeKeyRequest req) {
        return ResponseEntity.ok(EdgeView.of(
                graphService.restoreEdge(req.sourceId(), req.targetId(), req.edgeType())));
    }

    // ── Status ───────────────────────────────────────────────────────────────

    @GetMapping("/status")
    public ResponseEntity<GraphStatus> status() {
        return ResponseEntity.ok(graphService.status());
    }

    private static double round(double value) {
        return Math.round(value * 10_000d) / 10_000d;
    }

    // ── Inner DTOs ────────────────────────────────────────────────────────────

    public record AddNodeRequest(
            @NotBlank @Size(max = 512) String name,
            @NotBlank @Size(max = 64)  String type,
            @Size(max = 64)            String namespace,
            @Size(max = 10000)         String description,
            List<String>               tags,
            Map<String, Object>        properties
    ) {}

    public record UpdateNodeRequest(
            @Size(max = 512)   String name,
            @Size(max = 10000) String description,
            List<String>       tags,
            Map<String, Object> properties
    ) {}

    public record ConnectRequest(
            @NotNull  Long                sourceId,
            @NotNull  Long                targetId,
            @NotBlank String              edgeType,
            Double                        weight,
            Map<String, Object>           properties
    ) {}

    public record EdgeKeyRequest(
            @NotNull  Long   sourceId,
            @NotNull  Long   targetId,
            @NotBlank String edgeType
    ) {}

    public record NodeHit(
            NodeView node,
            double   relevance
    ) {}

    public record NodePage(
            List<NodeHit> items,
            int           count,
            int           limit,
            int           offset
    ) {}
}
