package com.openforge.kairn.experience;

import com.openforge.kairn.domain.Confidence;
import com.openforge.kairn.domain.Experience;
import com.openforge.kairn.domain.ExperienceType;
import com.openforge.kairn.experience.dto.ExperienceView;
import com.openforge.kairn.experience.dto.PruneResult;
import com.openforge.kairn.graph.Detail;
import com.openforge.kairn.intelligence.PromotionService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API over the experience engine.
 *
 * ┌──────────────────────────────────────────────────────────────────────┐
 * │  Endpoint                           Description                      │
 * ├──────────────────────────────────────────────────────────────────────┤
 * │  POST /api/experiences              save an experience               │
 * │  GET  /api/experiences              relevance search (counts access) │
 * │  GET  /api/experiences/{id}         one experience, no access count  │
 * │  POST /api/experiences/prune        delete below a relevance floor   │
 * └──────────────────────────────────────────────────────────────────────┘
 */
@RestController
@RequestMapping("/api/experiences")
@RequiredArgsConstructor
public class ExperienceController {

    private final ExperienceService experienceService;
    private final PromotionService  promotionService;

    @PostMapping
    public ResponseEntity<ExperienceView> save(@Valid @RequestBody SaveExperienceRequest req) {
        Experience saved = experienceService.save(
                req.content(),
                ExperienceType.parse(req.type()),
                req.context(),
                Confidence.parseOrDefault(req.confidence()),
                req.tags());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ExperienceView.of(saved, experienceService.relevance(saved), Detail.FULL));
    }

    /**
     * Query params:
     *   text          — keywords matched against content, context, tags (optional)
     *   type          — solution | pattern | decision | workaround | gotcha (optional)
     *   min_relevance — 0..1                                  (default 0)
     *   detail        — summary | full                        (default summary)
     *   limit         — 1..50                                 (default 10)
     *   offset        — ≥ 0                                   (default 0)
     */
    @GetMapping
    public ResponseEntity<ExperiencePage> search(
            @RequestParam(required = false) String text,
            @RequestParam(required = false) String type,
            @RequestParam(name = "min_relevance", defaultValue = "0.0") double minRelevance,
            @RequestParam(defaultValue = "summary") String detail,
            @RequestParam(defaultValue = "10") int limit,
            @RequestParam(defaultValue = "0") int offset) {

        ExperienceType experienceType = type == null || type.isBlank() ? null : ExperienceType.parse(type);
        Detail level = Detail.parseOrDefault(detail);
        List<ScoredExperience> hits = experienceService.search(text, experienceType, minRelevance, limit, offset);
        promotionService.promoteFlagged(hits);

        List<ExperienceView> items = hits.stream()
                .map(s -> ExperienceView.of(s.experience(), s.relevance(), level))
                .toList();
        return ResponseEntity.ok(new ExperiencePage(items, items.size(), limit, offset));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ExperienceView> get(@PathVariable long id) {
        Experience e = experienceService.get(id);
        return ResponseEntity.ok(ExperienceView.of(e, experienceService.relevance(e), Detail.FULL));
    }

    @PostMapping("/prune")
    public ResponseEntity<PruneResult> prune(@RequestParam(required = false) Double threshold) {
        return ResponseEntity.ok(experienceService.prune(threshold));
    }

    // ── Inner DTOs ────────────────────────────────────────────────────────────

    public record SaveExperienceRequest(
            @NotBlank @Size(max = 10000) String content,
            @NotBlank                    String type,
            @Size(max = 4000)            String context,
            String                       confidence,
            List<String>                 tags
    ) {}

    public record ExperiencePage(
            List<ExperienceView> items,
            int                  count,
            int                  limit,
            int                  offset
    ) {}
}
