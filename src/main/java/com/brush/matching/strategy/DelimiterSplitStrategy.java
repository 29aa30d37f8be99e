package com.brush.matching.strategy;

import com.brush.matching.component.CatalogHit;
import com.brush.matching.component.HandleHit;
import com.brush.matching.component.HandleMatcher;
import com.brush.matching.component.KnotMatcher;
import com.brush.matching.compose.ResultComposer;
import com.brush.matching.compose.SplitParts;
import com.brush.matching.core.model.DelimiterClass;
import com.brush.matching.core.model.MatchResult;
import com.brush.matching.core.model.SplitCandidate;
import com.brush.matching.correct.CuratedSplitTable;
import com.brush.matching.metrics.MetricsService;
import com.brush.matching.split.BrushSplitter;

import java.util.List;
import java.util.Optional;

/**
 * Splits the text at a delimiter of one of the given classes and matches each
 * side as a component. Classes are tried in order; the first class whose split
 * yields at least one matched component wins.
 */
public class DelimiterSplitStrategy implements BrushMatchingStrategy {

    private final String name;
    private final List<DelimiterClass> delimiterClasses;
    private final BrushSplitter splitter;
    private final HandleMatcher handleMatcher;
    private final KnotMatcher knotMatcher;
    private final CuratedSplitTable curatedSplits;
    private final ResultComposer composer;
    private final MetricsService metricsService;

    public DelimiterSplitStrategy(String name, List<DelimiterClass> delimiterClasses, BrushSplitter splitter,
                                  HandleMatcher handleMatcher, KnotMatcher knotMatcher,
                                  CuratedSplitTable curatedSplits, ResultComposer composer,
                                  MetricsService metricsService) {
        this.name = name;
        this.delimiterClasses = List.copyOf(delimiterClasses);
        this.splitter = splitter;
        this.handleMatcher = handleMatcher;
        this.knotMatcher = knotMatcher;
        this.curatedSplits = curatedSplits;
        this.composer = composer;
        this.metricsService = metricsService;
    }

    /**
     * Splits at {@code w/}, {@code with} and then {@code in}.
     */
    public static DelimiterSplitStrategy highPriority(BrushSplitter splitter, HandleMatcher handleMatcher,
                                                      KnotMatcher knotMatcher, CuratedSplitTable curatedSplits,
                                                      ResultComposer composer, MetricsService metricsService) {
        return new DelimiterSplitStrategy("high_priority_split",
                List.of(DelimiterClass.KNOT_AMBIGUOUS, DelimiterClass.HANDLE_PRIMARY),
                splitter, handleMatcher, knotMatcher, curatedSplits, composer, metricsService);
    }

    /**
     * Splits at {@code /}, {@code -} and {@code +}.
     */
    public static DelimiterSplitStrategy neutral(BrushSplitter splitter, HandleMatcher handleMatcher,
                                                 KnotMatcher knotMatcher, CuratedSplitTable curatedSplits,
                                                 ResultComposer composer, MetricsService metricsService) {
        return new DelimiterSplitStrategy("neutral_split", List.of(DelimiterClass.NEUTRAL),
                splitter, handleMatcher, knotMatcher, curatedSplits, composer, metricsService);
    }

    @Override
    public Optional<MatchResult> match(String text) {
        if (curatedSplits.shouldNotSplit(text)) {
            return Optional.empty();
        }
        for (DelimiterClass delimiterClass : delimiterClasses) {
            Optional<SplitCandidate> candidate = splitter.trySplit(text, delimiterClass);
            if (candidate.isEmpty()) {
                continue;
            }
            SplitCandidate split = candidate.get();
            HandleHit handle = handleMatcher.match(split.handleText()).orElse(null);
            CatalogHit knot = knotMatcher.match(split.knotText()).orElse(null);
            if (handle == null && knot == null) {
                continue;
            }
            metricsService.incrementSplit(delimiterClass);
            return Optional.of(composer.composeComponents(text, handle, knot, SplitParts.of(split),
                    ResultComposer.componentMatchType(knot), name));
        }
        return Optional.empty();
    }

    @Override
    public String getName() {
        return name;
    }
}
