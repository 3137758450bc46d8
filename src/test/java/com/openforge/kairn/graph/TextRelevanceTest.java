package com.openforge.kairn.graph;

import com.openforge.kairn.domain.KnowledgeNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TextRelevanceTest {

    private static KnowledgeNode node(String name, String description, String... tags) {
        KnowledgeNode node = KnowledgeNode.builder()
                .name(name)
                .type("pattern")
                .description(description)
                .build();
        node.getTags().addAll(Set.of(tags));
        return node;
    }

    @Test
    void score_isOneWithoutTokens() {
        assertEquals(1.0, TextRelevance.score(node("Anything", null), List.of()), 0.0);
    }

    @Test
    void score_isOneWhenEveryTokenHitsEveryField() {
        KnowledgeNode n = node("Redis cache", "use redis as a cache", "redis", "cache");

        assertEquals(1.0, TextRelevance.score(n, List.of("redis", "cache")), 1e-12);
    }

    @Test
    void score_weightsNameAboveTagAboveDescription() {
        double nameOnly = TextRelevance.score(node("Redis", null), List.of("redis"));
        double tagOnly = TextRelevance.score(node("Other", null, "redis"), List.of("redis"));
        double descOnly = TextRelevance.score(node("Other", "about redis"), List.of("redis"));

        assertTrue(nameOnly > tagOnly);
        assertTrue(tagOnly > descOnly);
        assertEquals(2.0 / 4.5, nameOnly, 1e-12);
    }

    @Test
    void score_isZeroWithoutAnyHit() {
        assertEquals(0.0, TextRelevance.score(node("Postgres", "sql database"), List.of("redis")), 0.0);
    }
}
