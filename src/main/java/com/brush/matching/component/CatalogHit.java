package com.brush.matching.component;

import com.brush.matching.catalog.CatalogEntry;
import com.brush.matching.catalog.CompiledPattern;
import com.brush.matching.core.model.Fiber;
import com.brush.matching.core.model.MatchType;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A brand/model identified for a complete brush or a knot, before composition.
 *
 * @param brand            matched brand
 * @param model            matched model; brand-level hits carry the fiber name
 * @param fiber            fiber the catalog or strategy declares, or {@code null}
 * @param fiberOverridable true if a fiber named by the user replaces {@code fiber}
 * @param knotSizeMm       declared knot diameter, or {@code null}
 * @param pattern          the pattern that matched
 * @param matchType        how the hit was obtained
 * @param entry            catalog entry behind the hit, or {@code null} for heuristic hits
 */
public record CatalogHit(
        String brand,
        String model,
        Fiber fiber,
        boolean fiberOverridable,
        Double knotSizeMm,
        String pattern,
        MatchType matchType,
        CatalogEntry entry
) {
    public static final String EXACT_PATTERN = "exact_match";

    public CatalogHit {
        Objects.requireNonNull(brand, "brand is required");
        Objects.requireNonNull(matchType, "matchType is required");
    }

    /**
     * A model-level hit on a catalog entry.
     */
    public static CatalogHit of(CatalogEntry entry, CompiledPattern pattern, MatchType matchType) {
        Fiber declared = entry.getFiber() != null ? entry.getFiber() : entry.getDefaultFiber();
        return new CatalogHit(entry.getBrand(), entry.getModel(), declared,
                entry.getFiber() == null && entry.getDefaultFiber() != null,
                entry.getKnotSizeMm(), pattern.source(), matchType, entry);
    }

    /**
     * A brand-level hit. The model is named after the fiber: the user's fiber when
     * the brand's fiber is only a default, otherwise the declared fiber.
     */
    public static CatalogHit brandFallback(CatalogEntry entry, CompiledPattern pattern, Optional<Fiber> userFiber) {
        boolean overridable = entry.getFiber() == null;
        Fiber declared = overridable ? entry.getDefaultFiber() : entry.getFiber();
        Fiber modelFiber = overridable && userFiber.isPresent() ? userFiber.get() : declared;
        return new CatalogHit(entry.getBrand(), modelFiber != null ? modelFiber.displayName() : null,
                declared, overridable, entry.getKnotSizeMm(), pattern.source(), MatchType.BRAND, entry);
    }

    /**
     * A hit taken from a correct-match override. Explicit fiber and size take
     * precedence over the catalog entry, which may be {@code null}.
     */
    public static CatalogHit exact(String brand, String model, CatalogEntry entry, Fiber fiber, Double knotSizeMm) {
        Fiber declared = fiber;
        boolean overridable = false;
        if (declared == null && entry != null) {
            declared = entry.getFiber() != null ? entry.getFiber() : entry.getDefaultFiber();
            overridable = entry.getFiber() == null && entry.getDefaultFiber() != null;
        }
        Double size = knotSizeMm != null ? knotSizeMm : entry != null ? entry.getKnotSizeMm() : null;
        return new CatalogHit(brand, model, declared, overridable, size, EXACT_PATTERN, MatchType.EXACT, entry);
    }

    public String section() {
        return entry != null ? entry.getSection().key() : null;
    }

    public Map<String, Object> specification() {
        return entry != null ? entry.getSpecification() : Map.of();
    }
}
