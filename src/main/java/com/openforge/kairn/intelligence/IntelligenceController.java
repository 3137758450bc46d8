package com.openforge.kairn.intelligence;

import com.openforge.kairn.graph.TraversalHit;
import com.openforge.kairn.intelligence.dto.LearnResult;
import com.openforge.kairn.intelligence.dto.RecallPage;
import com.openforge.kairn.router.dto.ContextResult;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for the composite operations.
 *
 * ┌──────────────────────────────────────────────────────────────────────┐
 * │  Endpoint                        Description                         │
 * ├──────────────────────────────────────────────────────────────────────┤
 * │  POST /api/intel/learn           store a fact, routed by confidence  │
 * │  GET  /api/intel/recall          merged nodes + experiences          │
 * │  GET  /api/intel/crossref        recall labelled by workspace        │
 * │  GET  /api/intel/context         routed nodes + experiences          │
 * │  GET  /api/intel/related         traversal from a node               │
 * └──────────────────────────────────────────────────────────────────────┘
 */
@RestController
@RequestMapping("/api/intel")
@RequiredArgsConstructor
public class IntelligenceController {

    private final IntelligenceService intelligenceService;

    @PostMapping("/learn")
    public ResponseEntity<LearnResult> learn(@Valid @RequestBody LearnRequest req) {
        LearnResult result = intelligenceService.learn(
                req.content(), req.type(), req.context(), req.confidence(), req.tags());
        return ResponseEntity.status(HttpStatus.CREATED).body(result);
    }

    @GetMapping("/recall")
    public ResponseEntity<RecallPage> recall(
            @RequestParam(required = false) String topic,
            @RequestParam(defaultValue = "10") int limit,
            @RequestParam(name = "min_relevance", defaultValue = "0.0") double minRelevance) {
        return ResponseEntity.ok(intelligenceService.recall(topic, limit, minRelevance));
    }

    @GetMapping("/crossref")
    public ResponseEntity<RecallPage> crossref(
            @RequestParam String problem,
            @RequestParam(defaultValue = "10") int limit) {
        return ResponseEntity.ok(intelligenceService.crossref(problem, limit));
    }

    /**
     * Query params:
     *   keywords — free text, split into tokens  (required)
     *   detail   — summary | full                (default summary)
     *   limit    — 1..50                         (default 10)
     */
    @GetMapping("/context")
    public ResponseEntity<ContextResult> context(
            @RequestParam String keywords,
            @RequestParam(defaultValue = "summary") String detail,
            @RequestParam(defaultValue = "10") int limit) {
        return ResponseEntity.ok(intelligenceService.context(keywords, detail, limit));
    }

    /**
     * Query params:
     *   node_id   — start node                   (required)
     *   depth     — 1..5                         (default 1)
     *   edge_type — follow only this edge type   (optional)
     *   mode      — bfs | dfs                    (default bfs)
     */
    @GetMapping("/related")
    public ResponseEntity<RelatedPage> related(
            @RequestParam(name = "node_id") long nodeId,
            @RequestParam(defaultValue = "1") int depth,
            @RequestParam(name = "edge_type", required = false) String edgeType,
            @RequestParam(defaultValue = "bfs") String mode) {

        List<RelatedNode> nodes = intelligenceService.related(nodeId, depth, edgeType, mode).stream()
                .map(RelatedNode::of)
                .toList();
        return ResponseEntity.ok(new RelatedPage(nodeId, depth, nodes.size(), nodes));
    }

    // ── Inner DTOs ────────────────────────────────────────────────────────────

    public record LearnRequest(
            @NotBlank @Size(max = 10000) String content,
            @NotBlank                    String type,
            @Size(max = 4000)            String context,
            String                       confidence,
            List<String>                 tags
    ) {}

    public record RelatedNode(
            Long   id,
            String name,
            String type,
            int    depth,
            String viaEdgeType,
            Long   viaNodeId
    ) {
        static RelatedNode of(TraversalHit hit) {
            return new RelatedNode(hit.node().getId(), hit.node().getName(), hit.node().getType(),
                    hit.depth(), hit.viaEdgeType(), hit.viaNodeId());
        }
    }

    public record RelatedPage(
            long              startId,
            int               depth,
            int               count,
            List<RelatedNode> nodes
    ) {}
}
