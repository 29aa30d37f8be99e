package com.brush.matching.strategy;

import com.brush.matching.component.CatalogHit;
import com.brush.matching.component.CatalogHitSource;
import com.brush.matching.core.model.Fiber;
import com.brush.matching.core.model.MatchType;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Omega and Semogue model numbers ({@code omega 10077}, {@code semogue c3}).
 * Both makers default to boar; a fiber named by the user replaces the default.
 */
public class OmegaSemogueStrategy implements CatalogHitSource {

    private static final Pattern MODEL_PATTERN = Pattern.compile(
            "\\b(omega|semogue)\\b.*?\\b(?:pro\\s*)?(\\d{2,6}|c\\d{1,2})\\b",
            Pattern.CASE_INSENSITIVE);

    @Override
    public Optional<CatalogHit> find(String text) {
        Matcher matcher = MODEL_PATTERN.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String brand = matcher.group(1).equalsIgnoreCase("omega") ? "Omega" : "Semogue";
        String model = matcher.group(2).toUpperCase(Locale.ROOT);
        return Optional.of(new CatalogHit(brand, model, Fiber.BOAR, true, null,
                MODEL_PATTERN.pattern(), MatchType.REGEX, null));
    }

    @Override
    public String getName() {
        return "omega_semogue";
    }
}
