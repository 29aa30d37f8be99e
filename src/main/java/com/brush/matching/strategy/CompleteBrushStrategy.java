package com.brush.matching.strategy;

import com.brush.matching.component.CatalogHitSource;
import com.brush.matching.compose.ResultComposer;
import com.brush.matching.core.model.MatchResult;

import java.util.Optional;

/**
 * Matches the whole string as a complete brush through one {@link CatalogHitSource}.
 */
public class CompleteBrushStrategy implements BrushMatchingStrategy {

    private final CatalogHitSource source;
    private final ResultComposer composer;

    public CompleteBrushStrategy(CatalogHitSource source, ResultComposer composer) {
        this.source = source;
        this.composer = composer;
    }

    @Override
    public Optional<MatchResult> match(String text) {
        return source.find(text).map(hit -> composer.composeComplete(text, hit, source.getName()));
    }

    @Override
    public String getName() {
        return source.getName();
    }
}
