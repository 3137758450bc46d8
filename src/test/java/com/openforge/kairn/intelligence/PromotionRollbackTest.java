package com.openforge.kairn.intelligence;

import com.openforge.kairn.domain.Experience;
import com.openforge.kairn.intelligence.dto.LearnResult;
import com.openforge.kairn.router.ContextRouter;
import com.openforge.kairn.support.AbstractIntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.mock.mockito.SpyBean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doCallRealMethod;
import static org.mockito.Mockito.doThrow;

/**
 * The router indexes a promoted node inside the promotion transaction, so
 * making it fail simulates a crash between node creation and flag clearing.
 */
class PromotionRollbackTest extends AbstractIntegrationTest {

    @Autowired
    private IntelligenceService intelligenceService;

    @SpyBean
    private ContextRouter contextRouter;

    @Test
    void failedPromotion_leavesExperienceUntouchedAndRetriesOnNextAccess() {
        LearnResult learned = intelligenceService.learn(
                "Batch inserts with rewriteBatchedStatements", "solution", null, "medium", null);
        for (int i = 0; i < 4; i++) {
            intelligenceService.recall("batch inserts", 10, 0.0);
        }

        doThrow(new IllegalStateException("index unavailable")).when(contextRouter).index(any());
        intelligenceService.recall("batch inserts", 10, 0.0);

        assertEquals(0, nodeRepository.count());
        Experience afterFailure = experienceRepository.findById(learned.experienceId()).orElseThrow();
        assertTrue(afterFailure.isNeedsPromotion());
        assertNull(afterFailure.getPromotedToNodeId());
        assertNull(afterFailure.getNodeLink());
        assertEquals(5, afterFailure.getAccessCount());

        doCallRealMethod().when(contextRouter).index(any());
        intelligenceService.recall("batch inserts", 10, 0.0);

        assertEquals(1, nodeRepository.count());
        Experience promoted = experienceRepository.findById(learned.experienceId()).orElseThrow();
        assertFalse(promoted.isNeedsPromotion());
        assertEquals(Experience.LINK_PROMOTED_TO, promoted.getNodeLink());
        assertEquals(nodeRepository.findAll().get(0).getId(), promoted.getPromotedToNodeId());
    }
}
