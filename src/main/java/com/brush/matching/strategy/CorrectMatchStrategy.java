package com.brush.matching.strategy;

import com.brush.matching.core.model.MatchResult;
import com.brush.matching.correct.CorrectMatchResolver;

import java.util.Optional;

/**
 * First link of the chain: curated overrides win over every pattern.
 */
public class CorrectMatchStrategy implements BrushMatchingStrategy {

    private final CorrectMatchResolver resolver;

    public CorrectMatchStrategy(CorrectMatchResolver resolver) {
        this.resolver = resolver;
    }

    @Override
    public Optional<MatchResult> match(String text) {
        return resolver.resolve(text);
    }

    @Override
    public String getName() {
        return CorrectMatchResolver.STRATEGY_NAME;
    }
}
