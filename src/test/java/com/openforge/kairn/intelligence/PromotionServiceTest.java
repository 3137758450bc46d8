package com.openforge.kairn.intelligence;

import com.openforge.kairn.domain.Confidence;
import com.openforge.kairn.domain.Experience;
import com.openforge.kairn.domain.ExperienceType;
import com.openforge.kairn.domain.KnowledgeNode;
import com.openforge.kairn.experience.ExperienceService;
import com.openforge.kairn.experience.ScoredExperience;
import com.openforge.kairn.graph.GraphService;
import com.openforge.kairn.store.WorkspaceTransactions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class PromotionServiceTest {

    private ExperienceService experienceService;
    private GraphService graphService;
    private PromotionService promotionService;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        experienceService = mock(ExperienceService.class);
        graphService = mock(GraphService.class);
        WorkspaceTransactions transactions = mock(WorkspaceTransactions.class);
        when(transactions.write(any(Supplier.class)))
                .thenAnswer(inv -> ((Supplier<Object>) inv.getArgument(0)).get());

        promotionService = new PromotionService(experienceService, graphService, transactions);
    }

    private static Experience flagged(long id) {
        Experience e = Experience.builder()
                .type(ExperienceType.WORKAROUND)
                .content("Restart the scheduler when the lock table fills up after a failover")
                .confidence(Confidence.MEDIUM)
                .accessCount(5)
                .needsPromotion(true)
                .tags(new LinkedHashSet<>(Set.of("scheduler")))
                .build();
        e.setId(id);
        return e;
    }

    private static KnowledgeNode node(long id) {
        KnowledgeNode n = KnowledgeNode.builder().name("n").type(PromotionService.PROMOTED_NODE_TYPE).build();
        n.setId(id);
        return n;
    }

    @Test
    void promoteFlagged_ignoresHitsWithoutPendingPromotion() {
        Map<Long, Long> promoted = promotionService.promoteFlagged(
                List.of(new ScoredExperience(flagged(1L), 0.9, false)));

        assertTrue(promoted.isEmpty());
        verifyNoInteractions(graphService);
    }

    @Test
    void tryPromote_createsNodeAndCompletesPromotion() {
        when(experienceService.get(7L)).thenReturn(flagged(7L));
        when(graphService.addNode(anyString(), eq(PromotionService.PROMOTED_NODE_TYPE), anyString(),
                anyString(), anyCollection(), anyMap())).thenReturn(node(70L));

        Map<Long, Long> promoted = promotionService.promoteFlagged(
                List.of(new ScoredExperience(flagged(7L), 0.9, true)));

        assertEquals(Map.of(7L, 70L), promoted);
        verify(graphService).addNode(
                eq("Workaround: Restart the scheduler when the lock table fills up"),
                eq(PromotionService.PROMOTED_NODE_TYPE),
                eq(KnowledgeNode.DEFAULT_NAMESPACE),
                anyString(), anyCollection(),
                argThat(props -> Long.valueOf(7L).equals(props.get("source_experience_id"))
                        && "workaround".equals(props.get("experience_type"))
                        && Integer.valueOf(5).equals(props.get("access_count"))));
        verify(experienceService).completePromotion(7L, 70L);
    }

    @Test
    void tryPromote_skipsAlreadyPromotedExperience() {
        Experience done = flagged(8L);
        done.setPromotedToNodeId(80L);
        when(experienceService.get(8L)).thenReturn(done);

        assertTrue(promotionService.tryPromote(8L).isEmpty());
        verifyNoInteractions(graphService);
        verify(experienceService, never()).completePromotion(anyLong(), anyLong());
    }

    @Test
    void tryPromote_swallowsFailure() {
        when(experienceService.get(9L)).thenReturn(flagged(9L));
        when(graphService.addNode(anyString(), anyString(), anyString(), anyString(), anyCollection(), anyMap()))
                .thenThrow(new IllegalStateException("store down"));

        assertTrue(promotionService.tryPromote(9L).isEmpty());
        verify(experienceService, never()).completePromotion(anyLong(), anyLong());
    }
}
