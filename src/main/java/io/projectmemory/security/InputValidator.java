package io.projectmemory.security;

import io.projectmemory.error.ValidationException;

import java.util.Map;
import java.util.regex.Pattern;

/**
 * The only path by which caller input reaches storage.
 *
 * <p>Free text has null bytes stripped, is trimmed, and is truncated to the configured length
 * with a {@value #TRUNCATION_MARKER} suffix. Keys are never corrected: anything outside
 * {@code [A-Za-z0-9_.-]{1,100}} is rejected.</p>
 */
public class InputValidator {

    public static final String TRUNCATION_MARKER = "... [truncated]";
    public static final int MAX_KEY_LENGTH = 100;
    public static final int MAX_KEYWORD_LENGTH = 100;

    private static final Pattern KEY_PATTERN = Pattern.compile("[A-Za-z0-9_.\\-]+");

    private final int maxTextLength;

    public InputValidator(int maxTextLength) {
        if (maxTextLength < 1) {
            throw new IllegalArgumentException("maxTextLength must be positive");
        }
        this.maxTextLength = maxTextLength;
    }

    /**
     * Strips null bytes, trims, and truncates to {@code maxLen} characters followed by the
     * truncation marker.
     *
     * @param value  raw input, may be null
     * @param maxLen maximum kept characters
     * @return sanitized text, never null
     */
    public String sanitizeText(String value, int maxLen) {
        if (value == null) return "";
        String cleaned = value.replace("\u0000", "").trim();
        if (cleaned.length() > maxLen) {
            cleaned = cleaned.substring(0, maxLen) + TRUNCATION_MARKER;
        }
        return cleaned;
    }

    /** Sanitizes with the configured text limit. */
    public String sanitizeText(String value) {
        return sanitizeText(value, maxTextLength);
    }

    /**
     * Checks the key rule: letters, digits, {@code _}, {@code -} and {@code .}, at most
     * {@value #MAX_KEY_LENGTH} characters.
     */
    public boolean validateKey(String key) {
        if (key == null || key.isEmpty() || key.length() > MAX_KEY_LENGTH) {
            return false;
        }
        return KEY_PATTERN.matcher(key).matches();
    }

    /**
     * Returns the key unchanged or rejects it.
     *
     * @throws ValidationException if the key breaks the key rule
     */
    public String requireKey(String key, String field) {
        if (!validateKey(key)) {
            throw new ValidationException(
                    "'%s' must be 1-%d characters of letters, digits, '_', '-' or '.'".formatted(field, MAX_KEY_LENGTH),
                    Map.of("field", field));
        }
        return key;
    }

    /**
     * Sanitizes a mandatory text field.
     *
     * @throws ValidationException if nothing is left after sanitizing
     */
    public String requireText(String value, String field) {
        String sanitized = sanitizeText(value);
        if (sanitized.isEmpty()) {
            throw new ValidationException("'%s' is required".formatted(field), Map.of("field", field));
        }
        return sanitized;
    }

    /** Sanitizes an optional text field; absent becomes empty. */
    public String optionalText(String value) {
        return sanitizeText(value);
    }

    /** Sanitizes a search keyword; blank becomes null, meaning no filter. */
    public String sanitizeKeyword(String keyword) {
        String sanitized = sanitizeText(keyword, MAX_KEYWORD_LENGTH);
        return sanitized.isEmpty() ? null : sanitized;
    }

    public int maxTextLength() {
        return maxTextLength;
    }
}
