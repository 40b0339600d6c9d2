package com.phillippitts.modelrelay.util;

/** Utility for privacy-safe logging of prompt and error previews. */
public final class LogSanitizer {
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
     * Length-only description for message bodies that must never reach the log.
     */
    public static String describeLength(String s) {
        return s == null ? "<null>" : "<" + s.length() + " chars>";
    }
}
