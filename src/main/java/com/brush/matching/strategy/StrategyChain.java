package com.brush.matching.strategy;

import com.brush.matching.core.model.MatchResult;
import com.brush.matching.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Runs strategies in priority order and returns the first result.
 * A strategy that throws aborts the match; the chain does not skip it.
 */
public class StrategyChain {
    private static final Logger log = LoggerFactory.getLogger(StrategyChain.class);

    private final List<BrushMatchingStrategy> strategies;
    private final MetricsService metricsService;

    public StrategyChain(List<BrushMatchingStrategy> strategies, MetricsService metricsService) {
        if (strategies.isEmpty()) {
            throw new IllegalArgumentException("at least one strategy is required");
        }
        this.strategies = List.copyOf(strategies);
        this.metricsService = metricsService;
    }

    /**
     * Matches normalized text against each strategy in turn.
     *
     * @param text normalized input text
     * @return the first strategy's result, or a no-match result
     */
    public MatchResult match(String text) {
        if (text == null || text.isBlank()) {
            metricsService.incrementNoMatch();
            return MatchResult.noMatch(text);
        }
        for (BrushMatchingStrategy strategy : strategies) {
            Optional<MatchResult> result = strategy.match(text);
            if (result.isPresent()) {
                log.debug("chain.matched strategy={} matchType={} text='{}'",
                        strategy.getName(), result.get().matchType(), text);
                metricsService.incrementStrategyMatched(strategy.getName());
                return result.get();
            }
        }
        log.debug("chain.no_match text='{}'", text);
        metricsService.incrementNoMatch();
        return MatchResult.noMatch(text);
    }

    public List<String> strategyNames() {
        return strategies.stream().map(BrushMatchingStrategy::getName).toList();
    }
}
