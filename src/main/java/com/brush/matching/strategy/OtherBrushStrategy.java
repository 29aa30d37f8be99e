package com.brush.matching.strategy;

import com.brush.matching.catalog.BrushCatalog;
import com.brush.matching.catalog.CatalogEntry;
import com.brush.matching.catalog.CatalogSection;
import com.brush.matching.catalog.CompiledPattern;
import com.brush.matching.component.CatalogHit;
import com.brush.matching.component.CatalogHitSource;
import com.brush.matching.rules.FiberDetector;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Brand-level fallback over {@code other_brushes} and brand patterns of the
 * model-keyed sections. The model is the fiber: the one the user named when the
 * brand only declares a {@code default}, otherwise the declared fiber.
 */
public class OtherBrushStrategy implements CatalogHitSource {

    private final List<CatalogEntry> entries;

    public OtherBrushStrategy(BrushCatalog catalog) {
        List<CatalogEntry> all = new ArrayList<>(catalog.brandEntries(CatalogSection.KNOWN_BRUSHES));
        all.addAll(catalog.brandEntries(CatalogSection.DECLARATION_GROOMING));
        all.addAll(catalog.entries(CatalogSection.OTHER_BRUSHES));
        this.entries = List.copyOf(all);
    }

    @Override
    public Optional<CatalogHit> find(String text) {
        for (CatalogEntry entry : entries) {
            Optional<CompiledPattern> pattern = entry.firstMatch(text);
            if (pattern.isPresent()) {
                return Optional.of(CatalogHit.brandFallback(entry, pattern.get(), FiberDetector.detect(text)));
            }
        }
        return Optional.empty();
    }

    @Override
    public String getName() {
        return "other_brush";
    }
}
