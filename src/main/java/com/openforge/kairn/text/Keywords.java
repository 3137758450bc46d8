package com.openforge.kairn.text;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns free text into search keywords: lower-cased word runs, stop words
 * and tokens of two characters or fewer dropped, duplicates removed (first
 * occurrence wins), capped at {@code max}.
 */
public final class Keywords {

    public static final int DEFAULT_MAX = 20;

    private static final Pattern WORD = Pattern.compile("[a-z0-9_-]+");

    private static final Set<String> STOP_WORDS = Set.of(
            "the", "a", "an", "is", "are", "was", "were", "be", "been", "being",
            "have", "has", "had", "do", "does", "did", "will", "would", "could",
            "should", "may", "might", "can", "shall", "to", "of", "in", "for",
            "on", "with", "at", "by", "from", "as", "into", "about", "between",
            "through", "after", "before", "above", "below", "and", "or", "but",
            "not", "no", "nor", "so", "yet", "both", "either", "neither", "each",
            "every", "all", "any", "few", "more", "most", "other", "some", "such",
            "than", "too", "very", "just", "also", "how", "what", "which", "who",
            "whom", "this", "that", "these", "those", "my", "your", "his", "her",
            "its", "our", "their", "i", "me", "we", "us", "you", "he", "she",
            "it", "they", "them", "if", "then", "else", "when", "where", "why",
            "need", "want", "try");

    private Keywords() {
    }

    public static List<String> extract(String text) {
        return extract(text, DEFAULT_MAX);
    }

    public static List<String> extract(String text, int max) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        Set<String> unique = new LinkedHashSet<>();
        Matcher m = WORD.matcher(text.toLowerCase(Locale.ROOT));
        while (m.find() && unique.size() < max) {
            String word = m.group();
            if (word.length() > 2 && !STOP_WORDS.contains(word)) {
                unique.add(word);
            }
        }
        return new ArrayList<>(unique);
    }
}
