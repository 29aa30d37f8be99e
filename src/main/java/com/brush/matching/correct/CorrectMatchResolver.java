package com.brush.matching.correct;

import com.brush.matching.catalog.BrushCatalog;
import com.brush.matching.catalog.CatalogException;
import com.brush.matching.catalog.CatalogEntry;
import com.brush.matching.component.CatalogHit;
import com.brush.matching.component.HandleHit;
import com.brush.matching.component.HandleMatcher;
import com.brush.matching.component.KnotMatcher;
import com.brush.matching.compose.ResultComposer;
import com.brush.matching.compose.SplitParts;
import com.brush.matching.core.model.MatchResult;
import com.brush.matching.core.model.MatchType;
import com.brush.matching.rules.TextNormalizer;

import java.util.Optional;

/**
 * Exact-string lookup against the correct-match overrides.
 *
 * <p>Tables are consulted in order: whole brush, handle only, knot only, then
 * pre-split entries. Whole-brush hits carry every field of the matching catalog
 * entry. A string listed under both handle and knot yields one result carrying
 * both components. Split texts are resolved against the handle and knot overrides first and
 * the catalogs second; a split text that resolves to nothing is rejected when the
 * resolver is built.</p>
 */
public class CorrectMatchResolver {

    public static final String STRATEGY_NAME = "correct_matches";

    private final CorrectMatchTable table;
    private final BrushCatalog catalog;
    private final HandleMatcher handleMatcher;
    private final KnotMatcher knotMatcher;
    private final ResultComposer composer;

    public CorrectMatchResolver(CorrectMatchTable table, BrushCatalog catalog, HandleMatcher handleMatcher,
                                KnotMatcher knotMatcher, ResultComposer composer) {
        this.table = table;
        this.catalog = catalog;
        this.handleMatcher = handleMatcher;
        this.knotMatcher = knotMatcher;
        this.composer = composer;
        validateSplits();
    }

    /**
     * Returns the curated result for the text, if one exists. The text is
     * normalized before lookup.
     */
    public Optional<MatchResult> resolve(String text) {
        String key = TextNormalizer.normalize(text);
        if (key.isEmpty()) {
            return Optional.empty();
        }
        Optional<CorrectMatchEntry> brush = table.findBrush(key);
        if (brush.isPresent()) {
            CorrectMatchEntry entry = brush.get();
            CatalogEntry catalogEntry = catalog.findBrush(entry.brand(), entry.model()).orElse(null);
            CatalogHit hit = CatalogHit.exact(entry.brand(), entry.model(), catalogEntry, null, null);
            return Optional.of(composer.composeComplete(key, hit, STRATEGY_NAME));
        }
        Optional<CorrectMatchEntry> handle = table.findHandle(key);
        if (handle.isPresent()) {
            HandleHit hit = HandleHit.exact(handle.get().brand(), handle.get().model());
            CatalogHit knotHit = table.findKnot(key).map(this::knotHit).orElse(null);
            return Optional.of(composer.composeComponents(key, hit, knotHit, null, MatchType.EXACT, STRATEGY_NAME));
        }
        Optional<CorrectMatchEntry> knot = table.findKnot(key);
        if (knot.isPresent()) {
            return Optional.of(composer.composeComponents(key, null, knotHit(knot.get()), null,
                    MatchType.EXACT, STRATEGY_NAME));
        }
        Optional<CorrectMatchEntry> split = table.findSplit(key);
        if (split.isPresent()) {
            CorrectMatchEntry entry = split.get();
            HandleHit handleHit = resolveHandleText(entry.handleText()).orElse(null);
            CatalogHit knotHit = resolveKnotText(entry.knotText()).orElse(null);
            return Optional.of(composer.composeComponents(key, handleHit, knotHit,
                    SplitParts.curated(entry.handleText(), entry.knotText()), MatchType.EXACT, STRATEGY_NAME));
        }
        return Optional.empty();
    }

    private Optional<HandleHit> resolveHandleText(String handleText) {
        if (handleText == null) {
            return Optional.empty();
        }
        String key = TextNormalizer.normalize(handleText);
        Optional<CorrectMatchEntry> curated = table.findHandle(key);
        if (curated.isPresent()) {
            return Optional.of(HandleHit.exact(curated.get().brand(), curated.get().model()));
        }
        return handleMatcher.match(key);
    }

    private Optional<CatalogHit> resolveKnotText(String knotText) {
        if (knotText == null) {
            return Optional.empty();
        }
        String key = TextNormalizer.normalize(knotText);
        Optional<CorrectMatchEntry> curated = table.findKnot(key);
        if (curated.isPresent()) {
            return Optional.of(knotHit(curated.get()));
        }
        return knotMatcher.match(key);
    }

    private CatalogHit knotHit(CorrectMatchEntry entry) {
        CatalogEntry catalogEntry = catalog.findKnot(entry.brand(), entry.model()).orElse(null);
        return CatalogHit.exact(entry.brand(), entry.model(), catalogEntry, entry.fiber(), entry.knotSizeMm());
    }

    private void validateSplits() {
        for (CorrectMatchEntry split : table.splits()) {
            if (split.handleText() != null && resolveHandleText(split.handleText()).isEmpty()) {
                throw new CatalogException("correct_matches.split_brush '" + split.key()
                        + "': handle text '" + split.handleText() + "' does not resolve");
            }
            if (split.knotText() != null && resolveKnotText(split.knotText()).isEmpty()) {
                throw new CatalogException("correct_matches.split_brush '" + split.key()
                        + "': knot text '" + split.knotText() + "' does not resolve");
            }
        }
    }
}
