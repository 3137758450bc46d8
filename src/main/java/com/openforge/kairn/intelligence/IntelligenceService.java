package com.openforge.kairn.intelligence;

import com.openforge.kairn.domain.Confidence;
import com.openforge.kairn.domain.Experience;
import com.openforge.kairn.domain.ExperienceType;
import com.openforge.kairn.domain.KnowledgeNode;
import com.openforge.kairn.error.Arguments;
import com.openforge.kairn.event.KnowledgeEventPublisher;
import com.openforge.kairn.event.KnowledgeEventType;
import com.openforge.kairn.experience.ExperienceService;
import com.openforge.kairn.experience.ScoredExperience;
import com.openforge.kairn.graph.Detail;
import com.openforge.kairn.graph.GraphService;
import com.openforge.kairn.graph.RankedNode;
import com.openforge.kairn.graph.TraversalHit;
import com.openforge.kairn.graph.TraversalMode;
import com.openforge.kairn.intelligence.dto.LearnResult;
import com.openforge.kairn.intelligence.dto.RecallItem;
import com.openforge.kairn.intelligence.dto.RecallPage;
import com.openforge.kairn.router.ContextRouter;
import com.openforge.kairn.router.dto.ContextExperience;
import com.openforge.kairn.router.dto.ContextResult;
import com.openforge.kairn.store.WorkspaceTransactions;
import com.openforge.kairn.text.Keywords;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.*;
import java.util.stream.Collectors;

/**
 * The five composite operations that sit on top of the graph, experience
 * and router engines.
 *
 * Call graph:
 *
 *   learn(content, type, confidence)
 *     ├─ HIGH        → addNode("learned_<type>") + save(experience) + link derived-from
 *     └─ MEDIUM/LOW  → save(experience)
 *
 *   recall(topic) / crossref(problem)
 *     ├─ ExperienceService.search      (counts accesses, may flag)
 *     ├─ PromotionService.promoteFlagged
 *     ├─ GraphService.query
 *     └─ merge → drop experiences promoted into a returned node → rank
 *
 *   context(keywords, detail)
 *     ├─ ContextRouter.resolve         (nodes)
 *     └─ ExperienceService.search      (experiences, min relevance 0.1)
 *          └─ PromotionService.promoteFlagged
 *
 *   related(nodeId, depth)     → GraphService.traverse
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IntelligenceService {

    static final String LEARNED_TYPE_PREFIX   = "learned_";
    static final double CROSSREF_MIN_RELEVANCE = 0.1;
    static final double CONTEXT_MIN_RELEVANCE  = 0.1;
    private static final int NAME_PREFIX_CHARS = 60;

    private final GraphService            graphService;
    private final ExperienceService       experienceService;
    private final ContextRouter           contextRouter;
    private final PromotionService        promotionService;
    private final WorkspaceTransactions   transactions;
    private final KnowledgeEventPublisher events;
    private final WorkspaceProperties     workspace;

    // ── learn ────────────────────────────────────────────────────────────────

    /**
     * Route an incoming fact by confidence. Everything it creates is written
     * in one transaction.
     */
    public LearnResult learn(String content,
                             String type,
                             @Nullable String context,
                             @Nullable String confidence,
                             @Nullable Collection<String> tags) {
        String text = Arguments.requireText(content, "content");
        ExperienceType experienceType = ExperienceType.parse(type);
        Confidence tier = Confidence.parseOrDefault(confidence);

        LearnResult result = transactions.write(() -> {
            if (tier != Confidence.HIGH) {
                Experience e = experienceService.save(text, experienceType, context, tier, tags);
                return new LearnResult(LearnResult.STORED_AS_EXPERIENCE, null, e.getId(),
                        experienceType, tier, null);
            }

            Map<String, Object> props = new LinkedHashMap<>();
            props.put("source", "learn");
            props.put("experience_type", experienceType.code());
            if (Arguments.blankToNull(context) != null) {
                props.put("context", context.trim());
            }
            KnowledgeNode node = graphService.addNode(
                    titleCase(experienceType.code()) + ": " + truncate(text, NAME_PREFIX_CHARS),
                    LEARNED_TYPE_PREFIX + experienceType.code(),
                    KnowledgeNode.DEFAULT_NAMESPACE,
                    text,
                    tags,
                    props);
            Experience e = experienceService.save(text, experienceType, context, tier, tags);
            experienceService.markLinked(e.getId(), node.getId(), Experience.LINK_DERIVED_FROM);
            return new LearnResult(LearnResult.STORED_AS_NODE, node.getId(), e.getId(),
                    experienceType, tier, Experience.LINK_DERIVED_FROM);
        });

        events.publish(KnowledgeEventType.KNOWLEDGE_LEARNED, result.experienceId(), result);
        log.info("[Intel] learn {} ({}) stored as {} (node={}, experience={})",
                experienceType.code(), tier.code(), result.storedAs(), result.nodeId(), result.experienceId());
        return result;
    }

    // ── recall / crossref ────────────────────────────────────────────────────

    public RecallPage recall(@Nullable String topic, int limit, double minRelevance) {
        Arguments.requireLimit(limit);
        Arguments.requireUnitInterval(minRelevance, "min_relevance");

        List<RecallItem> items = retrieve(topic, limit, minRelevance, null);
        events.publish(KnowledgeEventType.KNOWLEDGE_RECALLED, null, items.size());
        log.debug("[Intel] recall '{}' → {} items", topic, items.size());
        return new RecallPage(topic, items.size(), items);
    }

    /**
     * Same retrieval as recall, over the single configured workspace, with
     * every result labelled by workspace name.
     */
    public RecallPage crossref(String problem, int limit) {
        String text = Arguments.requireText(problem, "problem");
        Arguments.requireLimit(limit);

        List<RecallItem> items = retrieve(text, limit, CROSSREF_MIN_RELEVANCE, workspace.name());
        events.publish(KnowledgeEventType.CROSSREF_FOUND, null, items.size());
        log.debug("[Intel] crossref '{}' in workspace {} → {} items", text, workspace.name(), items.size());
        return new RecallPage(text, items.size(), items);
    }

    // ── context / related ────────────────────────────────────────────────────

    /**
     * Router nodes plus the experiences that mention the keywords, ranked by
     * current relevance. The experience search counts as an access, so a
     * hit can trigger promotion just as it does in recall.
     */
    public ContextResult context(String keywords, @Nullable String detail, int limit) {
        Detail level = Detail.parseOrDefault(detail);
        ContextResult routed = contextRouter.resolve(keywords, level, limit);
        if (Keywords.extract(routed.query()).isEmpty()) {
            return routed;
        }

        List<ScoredExperience> hits = experienceService.search(routed.query(), null, CONTEXT_MIN_RELEVANCE, limit, 0);
        promotionService.promoteFlagged(hits);
        List<ContextExperience> experiences = hits.stream()
                .map(s -> ContextExperience.of(s.experience(), s.relevance(), level))
                .toList();
        log.debug("[Intel] context '{}' → {} nodes, {} experiences",
                routed.query(), routed.nodes().size(), experiences.size());
        return routed.withExperiences(experiences);
    }

    public List<TraversalHit> related(Long nodeId, int depth, @Nullable String edgeType, @Nullable String mode) {
        return graphService.traverse(nodeId, depth, edgeType, TraversalMode.parseOrDefault(mode));
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private List<RecallItem> retrieve(@Nullable String text, int limit, double minRelevance,
                                      @Nullable String workspaceLabel) {
        List<ScoredExperience> hits = experienceService.search(text, null, minRelevance, limit, 0);
        Map<Long, Long> promoted = promotionService.promoteFlagged(hits);
        List<RankedNode> nodes = graphService.query(text, null, null, null, limit, 0);

        Set<Long> nodeIds = nodes.stream().map(r -> r.node().getId()).collect(Collectors.toSet());
        List<RecallItem> merged = new ArrayList<>(nodes.size() + hits.size());
        for (RankedNode r : nodes) {
            KnowledgeNode n = r.node();
            merged.add(new RecallItem(RecallItem.SOURCE_NODE, n.getId(), n.getName(), n.getType(),
                    n.getDescription(), null, null, round(r.relevance()), workspaceLabel, n.getCreateTime()));
        }
        for (ScoredExperience s : hits) {
            Experience e = s.experience();
            Long linkedNode = promoted.getOrDefault(e.getId(), e.getPromotedToNodeId());
            if (linkedNode != null && nodeIds.contains(linkedNode)) continue;
            merged.add(new RecallItem(RecallItem.SOURCE_EXPERIENCE, e.getId(), null, e.getType().code(),
                    null, e.getContent(), e.getConfidence().code(), round(s.relevance()), workspaceLabel,
                    e.getCreateTime()));
        }

        Comparator<RecallItem> ranking = Comparator.comparingDouble(RecallItem::relevance).reversed()
                .thenComparing(RecallItem::createTime, Comparator.nullsLast(Comparator.<LocalDateTime>reverseOrder()));
        return merged.stream()
                .sorted(ranking)
                .limit(limit)
                .toList();
    }

    private static double round(double value) {
        return Math.round(value * 10_000d) / 10_000d;
    }

    static String titleCase(String code) {
        return code.isEmpty() ? code : Character.toUpperCase(code.charAt(0)) + code.substring(1);
    }

    static String truncate(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max);
    }
}
