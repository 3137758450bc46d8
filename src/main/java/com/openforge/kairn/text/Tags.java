package com.openforge.kairn.text;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/** Tags are stored trimmed and lower-cased; blanks are dropped. */
public final class Tags {

    private Tags() {
    }

    public static Set<String> normalize(Collection<String> tags) {
        Set<String> normalized = new LinkedHashSet<>();
        if (tags == null) return normalized;
        for (String tag : tags) {
            if (tag != null && !tag.isBlank()) {
                normalized.add(tag.trim().toLowerCase(Locale.ROOT));
            }
        }
        return normalized;
    }
}
