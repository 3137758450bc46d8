package com.openforge.kairn.intelligence;

import com.openforge.kairn.domain.Experience;
import com.openforge.kairn.domain.KnowledgeNode;
import com.openforge.kairn.experience.ExperienceService;
import com.openforge.kairn.experience.ScoredExperience;
import com.openforge.kairn.graph.GraphService;
import com.openforge.kairn.store.WorkspaceTransactions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Turns frequently accessed experiences into permanent nodes.
 *
 * Flow per flagged experience:
 *
 *   search() commits the access and sets needs_promotion
 *        │
 *        ▼
 *   tryPromote(id) — one write transaction
 *     ├─ re-read; skip unless still flagged and unlinked
 *     ├─ addNode("promoted_experience")   (router indexes it via NODE_CREATED)
 *     └─ completePromotion: set promoted_to_node_id, clear the flag
 *
 * Any failure rolls back the whole transaction: no node, flag still set, so
 * the next qualifying access tries again. Failures are logged, never thrown;
 * the caller's read has already succeeded.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PromotionService {

    static final String PROMOTED_NODE_TYPE = "promoted_experience";
    private static final int NAME_PREFIX_CHARS = 50;

    private final ExperienceService     experienceService;
    private final GraphService          graphService;
    private final WorkspaceTransactions transactions;

    /**
     * Promote every hit flagged by a search.
     *
     * @return experience id → id of the node it was promoted into, for the
     *         promotions that succeeded
     */
    public Map<Long, Long> promoteFlagged(List<ScoredExperience> hits) {
        Map<Long, Long> promoted = new LinkedHashMap<>();
        for (ScoredExperience hit : hits) {
            if (!hit.promotionPending()) continue;
            Long experienceId = hit.experience().getId();
            tryPromote(experienceId).ifPresent(nodeId -> promoted.put(experienceId, nodeId));
        }
        return promoted;
    }

    public Optional<Long> tryPromote(Long experienceId) {
        try {
            Long nodeId = transactions.write(() -> {
                Experience e = experienceService.get(experienceId);
                if (e.getPromotedToNodeId() != null || !e.isNeedsPromotion()) {
                    return null;
                }
                KnowledgeNode node = graphService.addNode(
                        nodeName(e),
                        PROMOTED_NODE_TYPE,
                        KnowledgeNode.DEFAULT_NAMESPACE,
                        e.getContent(),
                        e.getTags(),
                        nodeProperties(e));
                experienceService.completePromotion(experienceId, node.getId());
                return node.getId();
            });
            if (nodeId != null) {
                log.info("[Promotion] Experience {} promoted to node {}", experienceId, nodeId);
            }
            return Optional.ofNullable(nodeId);
        } catch (RuntimeException ex) {
            log.warn("[Promotion] Experience {} not promoted, will retry on next access: {}",
                    experienceId, ex.getMessage());
            return Optional.empty();
        }
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private static String nodeName(Experience e) {
        return IntelligenceService.titleCase(e.getType().code()) + ": "
                + IntelligenceService.truncate(e.getContent(), NAME_PREFIX_CHARS);
    }

    private static Map<String, Object> nodeProperties(Experience e) {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put("source_experience_id", e.getId());
        props.put("experience_type", e.getType().code());
        props.put("confidence", e.getConfidence().code());
        props.put("access_count", e.getAccessCount());
        props.put("tags", new ArrayList<>(e.getTags()));
        return props;
    }
}
