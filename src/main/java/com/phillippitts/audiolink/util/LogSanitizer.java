package com.phillippitts.audiolink.util;

/** Privacy-safe previews of message text for logs. */
public final class LogSanitizer {

    /** Default preview length for decoded or submitted text. */
    public static final int DEFAULT_PREVIEW_CHARS = 40;

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Single-line preview: truncated to {@code max} characters, control characters escaped,
     * and an ellipsis plus the full length appended when cut.
     */
    public static String preview(String s, int max) {
        if (s == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (char c : truncate(s, max).toCharArray()) {
            switch (c) {
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (Character.isISOControl(c)) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        if (s.length() > max) {
            sb.append("...(").append(s.length()).append(" chars)");
        }
        return sb.toString();
    }

    public static String preview(String s) {
        return preview(s, DEFAULT_PREVIEW_CHARS);
    }
}
