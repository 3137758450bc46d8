package com.openforge.kairn.text;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class KeywordsTest {

    @Test
    void extract_lowercasesAndDropsStopWordsAndShortTokens() {
        List<String> keywords = Keywords.extract("How do I fix the Redis connection-pool in a DB?");

        assertEquals(List.of("fix", "redis", "connection-pool"), keywords);
    }

    @Test
    void extract_deduplicatesInFirstSeenOrder() {
        assertEquals(List.of("cache", "database"), Keywords.extract("cache database CACHE Cache"));
    }

    @Test
    void extract_capsAtMax() {
        List<String> keywords = Keywords.extract("alpha bravo charlie delta echo foxtrot", 3);

        assertEquals(List.of("alpha", "bravo", "charlie"), keywords);
    }

    @Test
    void extract_emptyForBlankOrStopWordsOnly() {
        assertTrue(Keywords.extract(null).isEmpty());
        assertTrue(Keywords.extract("   ").isEmpty());
        assertTrue(Keywords.extract("the and of it").isEmpty());
    }

    @Test
    void extract_keepsUnderscoresAndDigits() {
        assertEquals(List.of("max_pool_size", "http2"), Keywords.extract("max_pool_size http2"));
    }

    @Test
    void normalize_trimsLowercasesAndDropsBlanks() {
        Set<String> tags = Tags.normalize(java.util.Arrays.asList(" Redis ", "", null, "redis", "Caching"));

        assertEquals(List.of("redis", "caching"), List.copyOf(tags));
    }
}
