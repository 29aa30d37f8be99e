package com.brush.matching.strategy;

import com.brush.matching.component.CatalogHit;
import com.brush.matching.component.HandleHit;
import com.brush.matching.component.HandleMatcher;
import com.brush.matching.component.KnotMatcher;
import com.brush.matching.compose.ResultComposer;
import com.brush.matching.core.model.MatchResult;
import com.brush.matching.core.model.MatchType;

import java.util.Optional;

/**
 * Last resort: a handle alone, otherwise a knot alone.
 */
public class SingleComponentStrategy implements BrushMatchingStrategy {

    private final HandleMatcher handleMatcher;
    private final KnotMatcher knotMatcher;
    private final ResultComposer composer;

    public SingleComponentStrategy(HandleMatcher handleMatcher, KnotMatcher knotMatcher, ResultComposer composer) {
        this.handleMatcher = handleMatcher;
        this.knotMatcher = knotMatcher;
        this.composer = composer;
    }

    @Override
    public Optional<MatchResult> match(String text) {
        Optional<HandleHit> handle = handleMatcher.match(text);
        if (handle.isPresent()) {
            return Optional.of(composer.composeComponents(text, handle.get(), null, null,
                    MatchType.BRAND, getName()));
        }
        Optional<CatalogHit> knot = knotMatcher.match(text);
        return knot.map(hit -> composer.composeComponents(text, null, hit, null, hit.matchType(), getName()));
    }

    @Override
    public String getName() {
        return "single_component";
    }
}
