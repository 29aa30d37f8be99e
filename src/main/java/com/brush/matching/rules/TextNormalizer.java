package com.brush.matching.rules;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * The single normalization applied before any lookup or pattern match:
 * lowercase, trim and collapse whitespace.
 */
public final class TextNormalizer {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextNormalizer() {
    }

    public static String normalize(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        return WHITESPACE.matcher(text.toLowerCase(Locale.ROOT).trim()).replaceAll(" ");
    }
}
