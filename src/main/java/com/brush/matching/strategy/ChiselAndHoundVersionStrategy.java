package com.brush.matching.strategy;

import com.brush.matching.component.CatalogHit;
import com.brush.matching.component.CatalogHitSource;
import com.brush.matching.core.model.Fiber;
import com.brush.matching.core.model.MatchType;
import com.brush.matching.rules.VersionTokens;

import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Pattern;

/**
 * Chisel &amp; Hound versioned knots ({@code V10} to {@code V27} by default).
 * A version token outside the configured range does not match, so the text falls
 * through to the brand-level fallback.
 */
public class ChiselAndHoundVersionStrategy implements CatalogHitSource {

    static final String BRAND = "Chisel & Hound";
    private static final double KNOT_SIZE_MM = 26.0;
    private static final Pattern BRAND_PATTERN = Pattern.compile(
            "chis.*hou|chis.*fou|\\bc(?:&|and|\\+)h\\b|\\bc\\s*&\\s*h\\b",
            Pattern.CASE_INSENSITIVE);

    private final int minVersion;
    private final int maxVersion;

    public ChiselAndHoundVersionStrategy(int minVersion, int maxVersion) {
        if (minVersion > maxVersion) {
            throw new IllegalArgumentException("minVersion must be <= maxVersion");
        }
        this.minVersion = minVersion;
        this.maxVersion = maxVersion;
    }

    @Override
    public Optional<CatalogHit> find(String text) {
        if (!BRAND_PATTERN.matcher(text).find()) {
            return Optional.empty();
        }
        OptionalInt version = VersionTokens.versionNumber(text);
        if (version.isEmpty() || version.getAsInt() < minVersion || version.getAsInt() > maxVersion) {
            return Optional.empty();
        }
        return Optional.of(new CatalogHit(BRAND, "V" + version.getAsInt(), Fiber.BADGER, false,
                KNOT_SIZE_MM, BRAND_PATTERN.pattern(), MatchType.REGEX, null));
    }

    @Override
    public String getName() {
        return "chisel_and_hound";
    }
}
