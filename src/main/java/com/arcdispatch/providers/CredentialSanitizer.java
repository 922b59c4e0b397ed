package com.arcdispatch.providers;

import java.util.regex.Pattern;

/**
 * Strips credentials from text that may end up in logs or error events.
 */
public final class CredentialSanitizer {

    private static final String REDACTED = "[redacted]";
    private static final Pattern BEARER = Pattern.compile("(?i)bearer\\s+[A-Za-z0-9._\\-]+");
    private static final Pattern KEY_PARAM = Pattern.compile("(?i)((?:api[_-]?key|key|token)=)[^&\\s\"']+");
    private static final Pattern KEY_HEADER = Pattern.compile("(?i)(x-api-key\"?\\s*[:=]\\s*\"?)[^\"\\s,}]+");
    private static final Pattern KNOWN_KEY_SHAPES = Pattern.compile("\\b(?:sk|xai|sk-ant|sk-or)-[A-Za-z0-9_\\-]{8,}");

    private CredentialSanitizer() {
    }

    public static String sanitize(String text) {
        return sanitize(text, null);
    }

    /**
     * Redact bearer tokens, key query parameters, key-shaped strings and the literal {@code apiKey}.
     */
    public static String sanitize(String text, String apiKey) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String out = text;
        if (apiKey != null && apiKey.length() >= 4) {
            out = out.replace(apiKey, REDACTED);
        }
        out = BEARER.matcher(out).replaceAll("Bearer " + REDACTED);
        out = KEY_PARAM.matcher(out).replaceAll("$1" + REDACTED);
        out = KEY_HEADER.matcher(out).replaceAll("$1" + REDACTED);
        out = KNOWN_KEY_SHAPES.matcher(out).replaceAll(REDACTED);
        return out;
    }
}
