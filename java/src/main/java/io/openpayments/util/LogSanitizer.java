package io.openpayments.util;

import java.util.regex.Pattern;

/**
 * Helpers to keep secrets and server-controlled values safe for log statements.
 * Access tokens and continuation tokens must only ever be logged masked.
 */
public final class LogSanitizer {

    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\r\\n\\t]+");

    private LogSanitizer() {
        // Utility class
    }

    /**
     * Removes control characters that could be abused for log injection.
     *
     * @param value value received from a server or caller
     * @return sanitized value, empty for {@code null}
     */
    public static String sanitize(String value) {
        if (value == null) {
            return "";
        }
        return CONTROL_CHARS.matcher(value).replaceAll("_");
    }

    /**
     * Masks a token while keeping enough of it to correlate log lines.
     *
     * @param secret token value
     * @return short masked representation
     */
    public static String maskIdentifier(String secret) {
        String sanitized = sanitize(secret);
        if (sanitized.isEmpty()) {
            return "";
        }
        if (sanitized.length() <= 4) {
            return "****";
        }
        int prefixLength = Math.min(4, sanitized.length() / 4);
        return sanitized.substring(0, prefixLength) + "...(" + sanitized.length() + " chars)";
    }
}
