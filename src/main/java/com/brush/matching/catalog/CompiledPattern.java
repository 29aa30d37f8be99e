package com.brush.matching.catalog;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A catalog pattern compiled to a case-insensitive matcher.
 *
 * @param source  the pattern text as written in the catalog
 * @param pattern the compiled matcher
 */
public record CompiledPattern(String source, Pattern pattern) {

    public CompiledPattern {
        Objects.requireNonNull(source, "source is required");
        Objects.requireNonNull(pattern, "pattern is required");
    }

    /**
     * Compiles a pattern case-insensitively.
     *
     * @throws java.util.regex.PatternSyntaxException if the pattern is invalid
     */
    public static CompiledPattern compile(String source) {
        return new CompiledPattern(source,
                Pattern.compile(source, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
    }

    public boolean matches(String text) {
        return pattern.matcher(text).find();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CompiledPattern that)) return false;
        return source.equals(that.source);
    }

    @Override
    public int hashCode() {
        return source.hashCode();
    }
}
