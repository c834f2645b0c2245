package com.runnerfleet.core.util;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Masks credential-shaped substrings before a message is logged or propagated.
 * <p>
 * Covers bearer authorization values, {@code token: value} / {@code "token":"value"} pairs,
 * GitHub token formats and {@code --token <value>} command-line arguments.
 * </p>
 */
public final class SecretRedactor {
    private SecretRedactor() {
    }

    public static final String MASK = "***";

    // pattern -> replacement, applied in order
    private static final Map<Pattern, String> RULES = new LinkedHashMap<>();

    static {
        RULES.put(Pattern.compile("(--token\\s+)('[^']*'|\"[^\"]*\"|\\S+)"), "$1" + MASK);
        RULES.put(Pattern.compile("(?i)\\b(bearer\\s+)[A-Za-z0-9._~+/=-]+"), "$1" + MASK);
        RULES.put(Pattern.compile("(?i)(\"?token\"?\\s*[:=]\\s*\"?)[A-Za-z0-9._~+/=-]{8,}"), "$1" + MASK);
        RULES.put(Pattern.compile("\\bgh[pousr]_[A-Za-z0-9]{16,}"), MASK);
        RULES.put(Pattern.compile("\\bgithub_pat_[A-Za-z0-9_]{16,}"), MASK);
    }

    /**
     * @param message text that may contain credentials, may be {@code null}
     * @return the text with every credential replaced by {@value #MASK}
     */
    public static String redact(String message) {
        if (message == null || message.isEmpty()) {
            return message;
        }
        String result = message;
        for (Map.Entry<Pattern, String> rule : RULES.entrySet()) {
            result = rule.getKey().matcher(result).replaceAll(rule.getValue());
        }
        return result;
    }

    /**
     * Replaces the given secret values first, then any credential-shaped substring.
     */
    public static String redact(String message, String... secrets) {
        if (message == null) {
            return null;
        }
        String result = message;
        for (String secret : secrets) {
            if (secret != null && !secret.isEmpty()) {
                result = result.replace(secret, MASK);
            }
        }
        return redact(result);
    }

    /**
     * Sanitized message of an error, falling back to its class name.
     */
    public static String describe(Throwable error) {
        if (error == null) {
            return null;
        }
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return redact(message);
    }
}
