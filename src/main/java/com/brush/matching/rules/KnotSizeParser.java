package com.brush.matching.rules;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts a stated knot diameter such as {@code "26mm"} or {@code "24.5 mm"}.
 */
public final class KnotSizeParser {
    private static final Pattern SIZE = Pattern.compile("\\b(\\d{2}(?:\\.\\d)?)\\s*mm\\b",
            Pattern.CASE_INSENSITIVE);

    private KnotSizeParser() {
    }

    public static Optional<Double> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher matcher = SIZE.matcher(text);
        if (matcher.find()) {
            return Optional.of(Double.parseDouble(matcher.group(1)));
        }
        return Optional.empty();
    }

    public static boolean containsSize(String text) {
        return text != null && SIZE.matcher(text).find();
    }
}
