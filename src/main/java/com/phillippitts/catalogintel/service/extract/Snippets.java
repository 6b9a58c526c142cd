package com.phillippitts.catalogintel.service.extract;

import java.util.List;
import java.util.Locale;

/**
 * Evidence snippets cut from the original (not lower-cased) text around a match.
 */
final class Snippets {

    static final int RADIUS = 35;

    private Snippets() {
    }

    /**
     * Text within {@link #RADIUS} characters of the first occurrence of {@code needle} in the
     * first source containing it; the needle itself when nothing usable is found.
     */
    static String around(List<String> sources, String needle) {
        for (String source : sources) {
            int idx = source.toLowerCase(Locale.ROOT).indexOf(needle);
            if (idx < 0) {
                continue;
            }
            int start = Math.max(0, idx - RADIUS);
            int end = Math.min(source.length(), idx + needle.length() + RADIUS);
            String snippet = source.substring(start, end).strip();
            if (!snippet.isEmpty()) {
                return snippet;
            }
        }
        return needle;
    }
}
