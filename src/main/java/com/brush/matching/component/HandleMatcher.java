package com.brush.matching.component;

import com.brush.matching.catalog.BrushCatalog;
import com.brush.matching.catalog.CompiledPattern;
import com.brush.matching.catalog.HandlePatternEntry;

import java.util.List;
import java.util.Optional;

/**
 * Matches text against the handle maker catalog. Entries are tried in
 * descending section priority; the first match wins.
 */
public class HandleMatcher {

    private final List<HandlePatternEntry> entries;

    public HandleMatcher(BrushCatalog catalog) {
        this.entries = catalog.handles();
    }

    public Optional<HandleHit> match(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        for (HandlePatternEntry entry : entries) {
            Optional<CompiledPattern> pattern = entry.firstMatch(text);
            if (pattern.isPresent()) {
                return Optional.of(HandleHit.of(entry, pattern.get()));
            }
        }
        return Optional.empty();
    }
}
