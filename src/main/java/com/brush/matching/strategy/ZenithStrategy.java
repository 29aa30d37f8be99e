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
 * Zenith model codes such as {@code B26} or {@code 506U}. Defaults to boar.
 */
public class ZenithStrategy implements CatalogHitSource {

    private static final Pattern MODEL_PATTERN = Pattern.compile(
            "\\bzenith\\b.*?\\b([a-wyz]\\d{1,3}|\\d{3}[a-z]{0,2})\\b",
            Pattern.CASE_INSENSITIVE);

    @Override
    public Optional<CatalogHit> find(String text) {
        Matcher matcher = MODEL_PATTERN.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String model = matcher.group(1).toUpperCase(Locale.ROOT);
        return Optional.of(new CatalogHit("Zenith", model, Fiber.BOAR, true, null,
                MODEL_PATTERN.pattern(), MatchType.REGEX, null));
    }

    @Override
    public String getName() {
        return "zenith";
    }
}
