package me.go_gradually.ceddy.domain.util;

public final class TextUtils {
    private TextUtils() {
    }

    public static boolean isBlank(String text) {
        return text == null || text.isBlank();
    }

    /**
     * Shortens text for log lines, marking truncation with an ellipsis.
     */
    public static String preview(String text, int maxChars) {
        if (text == null) {
            return "";
        }
        String flattened = text.replace('\n', ' ').replace('\r', ' ').trim();
        if (flattened.length() <= maxChars) {
            return flattened;
        }
        return flattened.substring(0, Math.max(0, maxChars - 1)).trim() + "…";
    }

    public static String defaultMessage(String message, String fallback) {
        return isBlank(message) ? fallback : message;
    }
}
