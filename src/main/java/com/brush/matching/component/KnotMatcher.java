package com.brush.matching.component;

import com.brush.matching.catalog.BrushCatalog;
import com.brush.matching.catalog.CatalogEntry;
import com.brush.matching.catalog.CatalogSection;
import com.brush.matching.catalog.CompiledPattern;
import com.brush.matching.core.model.Fiber;
import com.brush.matching.core.model.MatchType;
import com.brush.matching.rules.FiberDetector;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Identifies the knot in a piece of text.
 *
 * <p>Lookup order: model-level knot entries, then the model-level brush
 * sources supplied by the caller, then brand-level knot entries, then the
 * brand-level brush source. Model-level hits always outrank brand fallbacks.</p>
 */
public class KnotMatcher {

    private final List<CatalogEntry> knownKnots;
    private final List<CatalogEntry> otherKnots;
    private final List<CatalogHitSource> brushModelSources;
    private final CatalogHitSource brushBrandSource;

    /**
     * @param catalog           compiled catalogs
     * @param brushModelSources brush strategies consulted after the knot catalog's model entries
     * @param brushBrandSource  brand-level brush fallback, consulted last; may be {@code null}
     */
    public KnotMatcher(BrushCatalog catalog, List<CatalogHitSource> brushModelSources,
                       CatalogHitSource brushBrandSource) {
        this.knownKnots = catalog.modelEntries(CatalogSection.KNOWN_KNOTS);
        List<CatalogEntry> brandLevel = new ArrayList<>(catalog.brandEntries(CatalogSection.KNOWN_KNOTS));
        brandLevel.addAll(catalog.entries(CatalogSection.OTHER_KNOTS));
        this.otherKnots = List.copyOf(brandLevel);
        this.brushModelSources = List.copyOf(brushModelSources);
        this.brushBrandSource = brushBrandSource;
    }

    public Optional<CatalogHit> match(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        Optional<CatalogHit> known = matchKnownKnot(text);
        if (known.isPresent()) {
            return known;
        }
        for (CatalogHitSource source : brushModelSources) {
            Optional<CatalogHit> hit = source.find(text);
            if (hit.isPresent()) {
                return hit;
            }
        }
        Optional<CatalogHit> other = matchOtherKnot(text);
        if (other.isPresent()) {
            return other;
        }
        return brushBrandSource != null ? brushBrandSource.find(text) : Optional.empty();
    }

    /**
     * Counts how many independent catalog lookups recognise the text.
     * Used as a knot-likelihood signal when splitting.
     */
    public int countMatchingSources(String text) {
        int count = 0;
        if (matchKnownKnot(text).isPresent()) {
            count++;
        }
        for (CatalogHitSource source : brushModelSources) {
            if (source.find(text).isPresent()) {
                count++;
            }
        }
        if (matchOtherKnot(text).isPresent()) {
            count++;
        }
        if (brushBrandSource != null && brushBrandSource.find(text).isPresent()) {
            count++;
        }
        return count;
    }

    Optional<CatalogHit> matchKnownKnot(String text) {
        for (CatalogEntry entry : knownKnots) {
            Optional<CompiledPattern> pattern = entry.firstMatch(text);
            if (pattern.isPresent()) {
                return Optional.of(CatalogHit.of(entry, pattern.get(), MatchType.REGEX));
            }
        }
        return Optional.empty();
    }

    Optional<CatalogHit> matchOtherKnot(String text) {
        for (CatalogEntry entry : otherKnots) {
            Optional<CompiledPattern> pattern = entry.firstMatch(text);
            if (pattern.isPresent()) {
                Optional<Fiber> userFiber = FiberDetector.detect(text);
                return Optional.of(CatalogHit.brandFallback(entry, pattern.get(), userFiber));
            }
        }
        return Optional.empty();
    }
}
