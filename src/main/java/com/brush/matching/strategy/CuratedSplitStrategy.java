package com.brush.matching.strategy;

import com.brush.matching.component.CatalogHit;
import com.brush.matching.component.HandleHit;
import com.brush.matching.component.HandleMatcher;
import com.brush.matching.component.KnotMatcher;
import com.brush.matching.compose.ResultComposer;
import com.brush.matching.compose.SplitParts;
import com.brush.matching.core.model.MatchResult;
import com.brush.matching.correct.CuratedSplit;
import com.brush.matching.correct.CuratedSplitTable;
import com.brush.matching.rules.TextNormalizer;

import java.util.Optional;

/**
 * Applies a human-reviewed split when the input has one. Entries marked
 * {@code should_not_split} produce nothing here and block the delimiter splits
 * further down the chain.
 */
public class CuratedSplitStrategy implements BrushMatchingStrategy {

    private final CuratedSplitTable splits;
    private final HandleMatcher handleMatcher;
    private final KnotMatcher knotMatcher;
    private final ResultComposer composer;

    public CuratedSplitStrategy(CuratedSplitTable splits, HandleMatcher handleMatcher, KnotMatcher knotMatcher,
                                ResultComposer composer) {
        this.splits = splits;
        this.handleMatcher = handleMatcher;
        this.knotMatcher = knotMatcher;
        this.composer = composer;
    }

    @Override
    public Optional<MatchResult> match(String text) {
        Optional<CuratedSplit> found = splits.find(text);
        if (found.isEmpty() || found.get().shouldNotSplit()) {
            return Optional.empty();
        }
        CuratedSplit split = found.get();
        HandleHit handle = split.handle() != null
                ? handleMatcher.match(TextNormalizer.normalize(split.handle())).orElse(null)
                : null;
        CatalogHit knot = split.knot() != null
                ? knotMatcher.match(TextNormalizer.normalize(split.knot())).orElse(null)
                : null;
        if (handle == null && knot == null) {
            return Optional.empty();
        }
        return Optional.of(composer.composeComponents(text, handle, knot,
                SplitParts.curated(split.handle(), split.knot()), ResultComposer.componentMatchType(knot),
                getName()));
    }

    @Override
    public String getName() {
        return "curated_split";
    }
}
