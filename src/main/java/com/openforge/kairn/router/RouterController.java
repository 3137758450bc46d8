package com.openforge.kairn.router;

import com.openforge.kairn.router.dto.RebuildResult;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * POST /api/router/rebuild — drop the keyword index and rebuild it from live nodes.
 *
 * Resolution itself is exposed as /api/intel/context.
 */
@RestController
@RequestMapping("/api/router")
@RequiredArgsConstructor
public class RouterController {

    private final ContextRouter contextRouter;

    @PostMapping("/rebuild")
    public ResponseEntity<RebuildResult> rebuild() {
        return ResponseEntity.ok(contextRouter.rebuild());
    }
}
