package com.phillippitts.audiofetch.util;

/** Utility for keeping tool output and titles short in logs and error messages. */
public final class LogSanitizer {
    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Collapses line breaks so multi-line stderr fits on one log line, then truncates.
     */
    public static String singleLine(String s, int max) {
        if (s == null) {
            return "";
        }
        return truncate(s.strip().replaceAll("\\s*[\\r\\n]+\\s*", " | "), max);
    }
}
