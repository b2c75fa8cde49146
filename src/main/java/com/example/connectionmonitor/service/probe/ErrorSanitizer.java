package com.example.connectionmonitor.service.probe;

import java.util.regex.Pattern;

/**
 * Redacts credential-shaped substrings from error text before it is logged or stored.
 * <p>
 * A value runs to the next {@code ;} or {@code &}, spaces included, unless it is
 * wrapped in braces, in which case the whole braced value is redacted.
 */
public final class ErrorSanitizer {

    private static final String VALUE = "\\s*=\\s*(?:\\{[^}]*}|[^;&]+)";

    private static final Pattern PASSWORD = Pattern.compile("(?:password|pwd|pass)" + VALUE, Pattern.CASE_INSENSITIVE);
    private static final Pattern API_KEY = Pattern.compile("(?:apikey|api_key|key)" + VALUE, Pattern.CASE_INSENSITIVE);

    private ErrorSanitizer() {
    }

    public static String sanitize(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        var result = PASSWORD.matcher(text).replaceAll("password=***");
        return API_KEY.matcher(result).replaceAll("apikey=***");
    }
}
