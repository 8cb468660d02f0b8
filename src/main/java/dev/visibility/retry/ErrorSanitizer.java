package dev.visibility.retry;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Redacts credential-shaped substrings before text reaches a log line.
 */
public final class ErrorSanitizer {

    public static final String REDACTED = "[REDACTED]";

    private static final Pattern BEARER = Pattern.compile("Bearer\\s+[A-Za-z0-9\\-._~+/]+=*",
            Pattern.CASE_INSENSITIVE);

    // key=value, key: value and "key":"value" forms
    private static final List<Pattern> KEY_VALUE = List.of(
            Pattern.compile("(api[_-]?key[\"']?\\s*[:=]\\s*[\"']?)[^\\s\"'&,;}]+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(token[\"']?\\s*[:=]\\s*[\"']?)[^\\s\"'&,;}]+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(password[\"']?\\s*[:=]\\s*[\"']?)[^\\s\"'&,;}]+", Pattern.CASE_INSENSITIVE));

    private static final Pattern PROVIDER_KEY = Pattern.compile("\\bsk-[A-Za-z0-9_-]{10,}");

    private ErrorSanitizer() {
    }

    public static String sanitize(String message) {
        if (message == null || message.isEmpty()) {
            return message;
        }
        String result = BEARER.matcher(message).replaceAll("Bearer " + REDACTED);
        for (Pattern pattern : KEY_VALUE) {
            result = pattern.matcher(result).replaceAll("$1" + Matcher.quoteReplacement(REDACTED));
        }
        return PROVIDER_KEY.matcher(result).replaceAll(REDACTED);
    }

    /**
     * Sanitized message of an error, falling back to its type name.
     */
    public static String sanitize(Throwable error) {
        if (error == null) {
            return "Unknown error";
        }
        String message = error.getMessage();
        if (message == null || message.isBlank()) {
            return error.getClass().getSimpleName();
        }
        return sanitize(message);
    }
}
