package com.brush.matching.split;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognises slashes that are part of a specification rather than a
 * handle/knot delimiter: fiber ratios ({@code 50/50}), mixed fibers
 * ({@code badger/boar}), community handles ({@code r/wetshaving}) and catalog
 * names that contain a slash.
 */
public class SpecificationSlashDetector {

    private static final List<Pattern> SPECIFICATION_PATTERNS = List.of(
            Pattern.compile("\\b\\d{1,2}\\s*/\\s*\\d{1,2}\\b"),
            Pattern.compile("\\bmixed\\s+(badger|boar|synthetic|syn|horse)\\s*/\\s*(badger|boar|synthetic|syn|horse)\\b",
                    Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(badger|boar|synthetic|syn|horse)\\s*/\\s*(badger|boar|synthetic|syn|horse)\\b",
                    Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b[ru]/\\w+", Pattern.CASE_INSENSITIVE)
    );

    private final Set<String> slashNames;

    /**
     * @param slashNames lowercase catalog names that contain a slash
     */
    public SpecificationSlashDetector(Set<String> slashNames) {
        this.slashNames = Set.copyOf(slashNames);
    }

    /**
     * Returns true if the slash at {@code slashIndex} belongs to a specification.
     */
    public boolean isSpecification(String text, int slashIndex) {
        for (Pattern pattern : SPECIFICATION_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                if (matcher.start() <= slashIndex && slashIndex < matcher.end()) {
                    return true;
                }
            }
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (String name : slashNames) {
            int from = 0;
            int found;
            while ((found = lower.indexOf(name, from)) >= 0) {
                if (found <= slashIndex && slashIndex < found + name.length()) {
                    return true;
                }
                from = found + 1;
            }
        }
        return false;
    }
}
