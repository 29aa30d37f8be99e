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
import java.util.regex.Pattern;

/**
 * Smart default for bare model codes such as {@code B2}.
 *
 * <p>Entries of the {@code declaration_grooming} section that belong to the home
 * brand match even when the text names no brand, in which case the hit is an
 * {@link MatchType#ALIAS}. If the text names a competing brand the home-brand
 * default is suppressed. Entries of other brands in the section match as plain
 * catalog patterns.</p>
 */
public class DeclarationGroomingStrategy implements CatalogHitSource {

    private final List<CatalogEntry> entries;
    private final String homeBrand;
    private final List<Pattern> homeBrandTokens;
    private final List<Pattern> competingBrandTokens;

    public DeclarationGroomingStrategy(BrushCatalog catalog, String homeBrand,
                                       List<Pattern> homeBrandTokens, List<Pattern> competingBrandTokens) {
        this.entries = catalog.modelEntries(CatalogSection.DECLARATION_GROOMING);
        this.homeBrand = homeBrand;
        this.homeBrandTokens = List.copyOf(homeBrandTokens);
        this.competingBrandTokens = List.copyOf(competingBrandTokens);
    }

    @Override
    public Optional<CatalogHit> find(String text) {
        boolean competing = containsAny(text, competingBrandTokens);
        for (CatalogEntry entry : entries) {
            boolean home = entry.getBrand().equalsIgnoreCase(homeBrand);
            if (home && competing) {
                continue;
            }
            Optional<CompiledPattern> pattern = entry.firstMatch(text);
            if (pattern.isEmpty()) {
                continue;
            }
            MatchType type = !home || containsAny(text, homeBrandTokens) ? MatchType.REGEX : MatchType.ALIAS;
            return Optional.of(CatalogHit.of(entry, pattern.get(), type));
        }
        return Optional.empty();
    }

    @Override
    public String getName() {
        return "declaration_grooming";
    }

    private static boolean containsAny(String text, List<Pattern> tokens) {
        for (Pattern token : tokens) {
            if (token.matcher(text).find()) {
                return true;
            }
        }
        return false;
    }
}
