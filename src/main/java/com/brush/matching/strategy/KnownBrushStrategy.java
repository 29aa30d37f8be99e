package com.brush.matching.strategy;

import com.brush.matching.catalog.BrushCatalog;
import com.brush.matching.catalog.CatalogEntry;
import com.brush.matching.catalog.CatalogSection;
import com.brush.matching.catalog.CompiledPattern;
import com.brush.matching.component.CatalogHit;
import com.brush.matching.component.CatalogHitSource;
import com.brush.matching.core.model.MatchType;

import java.util.List;
import java.util.Optional;

/**
 * Model-level entries of the {@code known_brushes} section.
 */
public class KnownBrushStrategy implements CatalogHitSource {

    private final List<CatalogEntry> entries;

    public KnownBrushStrategy(BrushCatalog catalog) {
        this.entries = catalog.modelEntries(CatalogSection.KNOWN_BRUSHES);
    }

    @Override
    public Optional<CatalogHit> find(String text) {
        for (CatalogEntry entry : entries) {
            Optional<CompiledPattern> pattern = entry.firstMatch(text);
            if (pattern.isPresent()) {
                return Optional.of(CatalogHit.of(entry, pattern.get(), MatchType.REGEX));
            }
        }
        return Optional.empty();
    }

    @Override
    public String getName() {
        return "known_brush";
    }
}
