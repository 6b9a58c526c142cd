package com.phillippitts.catalogintel.util;

/** Privacy-safe previews of record text for log lines. */
public final class LogSanitizer {

    /** Preview length used for product titles. */
    public static final int TITLE_PREVIEW_CHARS = 40;

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max) + "...";
    }

    /**
     * Flattens line breaks so a preview stays on one log line.
     */
    public static String preview(String s) {
        return truncate(s, TITLE_PREVIEW_CHARS).replace('\n', ' ').replace('\r', ' ');
    }
}
