package com.surveygateway.util;

import javax.annotation.Nonnull;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Null-safe string helpers shared by the request pipeline and the audit log.
 */
public final class Strings {

    private Strings() {
        // Utility class
    }

    /**
     * Returns a safe non-null string for use with @Nonnull APIs.
     * If the input is null or blank, returns "unknown".
     */
    @Nonnull
    public static String safe(String value) {
        if (value == null || value.isBlank()) {
            return "unknown";
        }
        return value;
    }

    /**
     * Returns true when the value is null or contains only whitespace.
     */
    public static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /**
     * Trims whitespace and removes any trailing slashes, so that
     * "https://a.example/ " and "https://a.example" compare equal.
     *
     * @param value raw origin (may be null)
     * @return normalized origin, empty string for null input
     */
    @Nonnull
    public static String normalizeOrigin(String value) {
        if (value == null) {
            return "";
        }
        String trimmed = value.trim();
        int end = trimmed.length();
        while (end > 0 && trimmed.charAt(end - 1) == '/') {
            end--;
        }
        return trimmed.substring(0, end);
    }

    /**
     * Parses a comma-separated list of origins into a normalized, ordered set.
     * Blank entries are dropped.
     */
    @Nonnull
    public static Set<String> parseOriginList(String commaSeparated) {
        if (commaSeparated == null || commaSeparated.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(commaSeparated.split(","))
                .map(Strings::normalizeOrigin)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * Truncates to at most {@code maxChars} characters, appending a marker with the dropped length.
     */
    @Nonnull
    public static String truncate(String value, int maxChars) {
        if (value == null) {
            return "";
        }
        if (maxChars <= 0 || value.length() <= maxChars) {
            return value;
        }
        int end = maxChars;
        // Never split a surrogate pair
        if (Character.isHighSurrogate(value.charAt(end - 1))) {
            end--;
        }
        return value.substring(0, end) + "...(+" + (value.length() - end) + " chars)";
    }
}
