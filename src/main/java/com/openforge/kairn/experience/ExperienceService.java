package com.openforge.kairn.experience;

import com.openforge.kairn.domain.Confidence;
import com.openforge.kairn.domain.Experience;
import com.openforge.kairn.domain.ExperienceType;
import com.openforge.kairn.error.Arguments;
import com.openforge.kairn.error.KairnException;
import com.openforge.kairn.event.KnowledgeEventPublisher;
import com.openforge.kairn.event.KnowledgeEventType;
import com.openforge.kairn.experience.dto.PruneResult;
import com.openforge.kairn.repository.ExperienceRepository;
import com.openforge.kairn.repository.ExperienceSpecifications;
import com.openforge.kairn.store.WorkspaceTransactions;
import com.openforge.kairn.text.Keywords;
import com.openforge.kairn.text.Tags;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.*;

/**
 * Experience engine — owns the decay model and the access bookkeeping.
 *
 * ┌───────────────────────────────────────────────────────────────────────┐
 * │  save()     — stores an experience with its type/confidence decay rate │
 * │  search()   — relevance-ranked read; every hit counts as an access     │
 * │               and may flag the experience for promotion                │
 * │  prune()    — explicit, irreversible removal below a relevance floor   │
 * └───────────────────────────────────────────────────────────────────────┘
 *
 * Relevance is never persisted. It is computed from (now, create_time,
 * score, decay_rate) on every read, so nothing needs a background job.
 *
 * Promotion itself (node creation) is not done here: this engine only sets
 * the flag and, once told, records the node link.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExperienceService {

    private final ExperienceRepository    experienceRepository;
    private final WorkspaceTransactions   transactions;
    private final KnowledgeEventPublisher events;
    private final ExperienceProperties    properties;
    private final Clock                   clock;

    // ── Save ─────────────────────────────────────────────────────────────────

    public Experience save(String content,
                           ExperienceType type,
                           @Nullable String context,
                           @Nullable Confidence confidence,
                           @Nullable Collection<String> tags) {
        String text = Arguments.requireText(content, "content");
        Arguments.requirePresent(type, "type");
        Confidence tier = confidence != null ? confidence : Confidence.HIGH;

        return transactions.write(() -> {
            Experience experience = Experience.builder()
                    .type(type)
                    .content(text)
                    .context(Arguments.blankToNull(context))
                    .confidence(tier)
                    .decayRate(ExperienceDecay.decayRate(type, tier))
                    .tags(Tags.normalize(tags))
                    .build();
            Experience saved = experienceRepository.save(experience);
            events.publish(KnowledgeEventType.EXPERIENCE_CREATED, saved.getId(), saved);
            log.info("[Experience] Saved {} {} (confidence={}, half-life={} days)",
                    type.code(), saved.getId(), tier.code(),
                    Math.round(ExperienceDecay.halfLifeDays(saved.getDecayRate())));
            return saved;
        });
    }

    /** Plain read; does not count as an access. */
    public Experience get(Long experienceId) {
        Arguments.requirePresent(experienceId, "experience_id");
        return transactions.read(() -> experienceRepository.findById(experienceId)
                .orElseThrow(() -> KairnException.notFound("Experience not found: " + experienceId)));
    }

    // ── Search ───────────────────────────────────────────────────────────────

    /**
     * Experiences ranked by current relevance (descending, newest first on
     * ties), optionally restricted to a type and to those mentioning any
     * keyword of {@code text}.
     *
     * Runs as a write: each returned hit gets its access count incremented
     * and last-accessed refreshed. A hit whose count reaches the promotion
     * threshold while still unlinked is flagged; the caller is expected to
     * hand flagged hits to the promotion step after this returns.
     */
    public List<ScoredExperience> search(@Nullable String text,
                                         @Nullable ExperienceType type,
                                         double minRelevance,
                                         int limit,
                                         int offset) {
        Arguments.requireUnitInterval(minRelevance, "min_relevance");
        Arguments.requireLimit(limit);
        Arguments.requireOffset(offset);
        List<String> tokens = Keywords.extract(text);

        Specification<Experience> spec = Specification.where(ExperienceSpecifications.any());
        if (type != null) {
            spec = spec.and(ExperienceSpecifications.ofType(type));
        }
        if (!tokens.isEmpty()) {
            spec = spec.and(ExperienceSpecifications.mentionsAny(tokens));
        }
        Specification<Experience> finalSpec = spec;

        return transactions.write(() -> {
            LocalDateTime now = LocalDateTime.now(clock);
            Comparator<ScoredExperience> ranking = Comparator
                    .comparingDouble(ScoredExperience::relevance).reversed()
                    .thenComparing(s -> s.experience().getCreateTime(),
                            Comparator.nullsLast(Comparator.<LocalDateTime>reverseOrder()));

            List<ScoredExperience> page = experienceRepository.findAll(finalSpec).stream()
                    .map(e -> new ScoredExperience(e, relevance(e, now), false))
                    .filter(s -> s.relevance() >= minRelevance)
                    .sorted(ranking)
                    .skip(offset)
                    .limit(limit)
                    .toList();

            List<ScoredExperience> hits = new ArrayList<>(page.size());
            for (ScoredExperience s : page) {
                Experience e = recordAccess(s.experience(), now);
                hits.add(new ScoredExperience(e, s.relevance(), isPromotionPending(e)));
            }
            log.debug("[Experience] search text='{}' type={} → {} hits", text, type, hits.size());
            return hits;
        });
    }

    // ── Prune ────────────────────────────────────────────────────────────────

    /**
     * Delete every experience whose current relevance is strictly below
     * {@code threshold} (default from configuration). Irreversible.
     */
    public PruneResult prune(@Nullable Double threshold) {
        double floor = threshold != null
                ? Arguments.requireUnitInterval(threshold, "threshold")
                : properties.defaultPruneThreshold();

        return transactions.write(() -> {
            LocalDateTime now = LocalDateTime.now(clock);
            List<Experience> expired = experienceRepository.findAll().stream()
                    .filter(e -> relevance(e, now) < floor)
                    .toList();
            List<Long> ids = expired.stream().map(Experience::getId).toList();
            if (!expired.isEmpty()) {
                experienceRepository.deleteAll(expired);
                events.publish(KnowledgeEventType.EXPERIENCE_PRUNED, null, ids);
            }
            log.info("[Experience] Pruned {} experiences below relevance {}", ids.size(), floor);
            return new PruneResult(ids.size(), floor, ids);
        });
    }

    // ── Promotion bookkeeping ────────────────────────────────────────────────

    /**
     * Record that an experience is now represented by a node. Once linked it
     * is never re-evaluated for promotion.
     */
    public Experience markLinked(Long experienceId, Long nodeId, String link) {
        return transactions.write(() -> {
            Experience e = experienceRepository.findById(experienceId)
                    .orElseThrow(() -> KairnException.notFound("Experience not found: " + experienceId));
            e.setPromotedToNodeId(nodeId);
            e.setNodeLink(link);
            e.setNeedsPromotion(false);
            return experienceRepository.save(e);
        });
    }

    /** Second half of a promotion; must run in the transaction that created the node. */
    public Experience completePromotion(Long experienceId, Long nodeId) {
        return transactions.write(() -> {
            Experience e = markLinked(experienceId, nodeId, Experience.LINK_PROMOTED_TO);
            events.publish(KnowledgeEventType.EXPERIENCE_PROMOTED, experienceId, e);
            return e;
        });
    }

    // ── Decay ────────────────────────────────────────────────────────────────

    public double relevance(Experience e) {
        return relevance(e, LocalDateTime.now(clock));
    }

    private static double relevance(Experience e, LocalDateTime now) {
        return ExperienceDecay.relevance(e.getScore(), e.getDecayRate(),
                ExperienceDecay.ageInDays(e.getCreateTime(), now));
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private Experience recordAccess(Experience e, LocalDateTime now) {
        e.setAccessCount(e.getAccessCount() + 1);
        e.setLastAccessedAt(now);
        boolean flagNow = !e.isNeedsPromotion()
                && e.getPromotedToNodeId() == null
                && e.getAccessCount() >= properties.promotionThreshold();
        if (flagNow) {
            e.setNeedsPromotion(true);
        }
        Experience saved = experienceRepository.save(e);
        events.publish(KnowledgeEventType.EXPERIENCE_ACCESSED, saved.getId(), saved);
        if (flagNow) {
            events.publish(KnowledgeEventType.EXPERIENCE_FLAGGED, saved.getId(), saved);
            log.info("[Experience] {} reached {} accesses, flagged for promotion",
                    saved.getId(), saved.getAccessCount());
        }
        return saved;
    }

    private static boolean isPromotionPending(Experience e) {
        return e.isNeedsPromotion() && e.getPromotedToNodeId() == null;
    }

}
