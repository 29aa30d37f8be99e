package com.brush.matching.strategy;

import com.brush.matching.component.CatalogHit;
import com.brush.matching.component.HandleHit;
import com.brush.matching.component.HandleMatcher;
import com.brush.matching.component.KnotMatcher;
import com.brush.matching.compose.ResultComposer;
import com.brush.matching.core.model.MatchResult;

import java.util.Optional;

/**
 * Matches when both a handle and a knot pattern are found in the unsplit text.
 */
public class DualComponentStrategy implements BrushMatchingStrategy {

    private final HandleMatcher handleMatcher;
    private final KnotMatcher knotMatcher;
    private final ResultComposer composer;

    public DualComponentStrategy(HandleMatcher handleMatcher, KnotMatcher knotMatcher, ResultComposer composer) {
        this.handleMatcher = handleMatcher;
        this.knotMatcher = knotMatcher;
        this.composer = composer;
    }

    @Override
    public Optional<MatchResult> match(String text) {
        Optional<HandleHit> handle = handleMatcher.match(text);
        if (handle.isEmpty()) {
            return Optional.empty();
        }
        Optional<CatalogHit> knot = knotMatcher.match(text);
        if (knot.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(composer.composeComponents(text, handle.get(), knot.get(), null,
                ResultComposer.componentMatchType(knot.get()), getName()));
    }

    @Override
    public String getName() {
        return "dual_component";
    }
}
