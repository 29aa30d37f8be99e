package com.brush.matching.compose;

import com.brush.matching.catalog.CatalogEntry;
import com.brush.matching.component.CatalogHit;
import com.brush.matching.component.HandleHit;
import com.brush.matching.component.HandleMatcher;
import com.brush.matching.core.model.BrushMatch;
import com.brush.matching.core.model.ComponentMatch;
import com.brush.matching.core.model.MatchProvenance;
import com.brush.matching.core.model.MatchResult;
import com.brush.matching.core.model.MatchType;
import com.brush.matching.core.model.MatchedFrom;
import com.brush.matching.rules.FiberDetector;
import com.brush.matching.rules.KnotSizeParser;

import java.util.Map;
import java.util.Optional;

/**
 * Turns a winning hit into the final {@link MatchResult}.
 *
 * <p>Every field declared on the catalog entry is copied into the result.
 * Fiber is reconciled with the user's text by {@link FiberResolver}; a knot size
 * the catalog does not declare is taken from the text. Provenance records the
 * strategy, the pattern and, for splits, the verbatim handle and knot substrings.</p>
 */
public class ResultComposer {

    private final HandleMatcher handleMatcher;

    public ResultComposer(HandleMatcher handleMatcher) {
        this.handleMatcher = handleMatcher;
    }

    /**
     * Composes a complete brush matched from the whole string.
     */
    public MatchResult composeComplete(String text, CatalogHit hit, String strategyName) {
        FiberResolution fiber = FiberResolver.resolve(hit.fiber(), hit.fiberOverridable(), FiberDetector.detect(text));
        Double knotSize = hit.knotSizeMm() != null ? hit.knotSizeMm() : KnotSizeParser.parse(text).orElse(null);
        CatalogEntry entry = hit.entry();

        String handleMaker = hit.brand();
        String handleModel = null;
        String handlePattern = null;
        String handleSection = null;
        if (entry != null && entry.isHandleMatching()) {
            Optional<HandleHit> handle = handleMatcher.match(text);
            if (handle.isPresent()) {
                handleMaker = handle.get().maker();
                handleModel = handle.get().model();
                handlePattern = handle.get().pattern();
                handleSection = handle.get().section();
            }
        } else if (entry != null && entry.getHandleMaker() != null) {
            handleMaker = entry.getHandleMaker();
        }
        String knotMaker = entry != null && entry.getKnotMaker() != null ? entry.getKnotMaker() : hit.brand();

        BrushMatch matched = BrushMatch.builder()
                .brand(hit.brand())
                .model(hit.model())
                .fiber(fiber.fiber())
                .knotSizeMm(knotSize)
                .handleMaker(handleMaker)
                .handleModel(handleModel)
                .knotMaker(knotMaker)
                .fiberStrategy(fiber.strategy())
                .fiberConflict(fiber.conflict())
                .specification(hit.specification())
                .handle(ComponentMatch.handle(handleMaker, handleModel, text, handlePattern, handleSection))
                .knot(ComponentMatch.knot(knotMaker, hit.model(), fiber.fiber(), knotSize, text,
                        hit.pattern(), hit.section()))
                .provenance(MatchProvenance.fullString(strategyName, hit.pattern(), text))
                .build();
        return MatchResult.of(text, matched, hit.matchType(), hit.pattern());
    }

    /**
     * Composes a result from separately matched handle and knot components.
     * The top-level brand, model, fiber and knot size come from the knot; the
     * handle maker comes from the handle.
     *
     * @param text          the whole input string
     * @param handle        handle hit, or {@code null}
     * @param knot          knot hit, or {@code null}
     * @param parts         split substrings, or {@code null} when both components
     *                      were matched against the whole string
     * @param matchType     match type to report
     * @param strategyName  strategy to record in provenance
     */
    public MatchResult composeComponents(String text, HandleHit handle, CatalogHit knot, SplitParts parts,
                                         MatchType matchType, String strategyName) {
        if (handle == null && knot == null) {
            throw new IllegalArgumentException("at least one component must be matched");
        }
        String handleSource = parts != null ? parts.handleText() : text;
        String knotSource = parts != null ? parts.knotText() : text;

        FiberResolution fiber;
        Double knotSize;
        if (knot != null) {
            fiber = FiberResolver.resolve(knot.fiber(), knot.fiberOverridable(), FiberDetector.detect(knotSource));
            knotSize = knot.knotSizeMm() != null ? knot.knotSizeMm() : KnotSizeParser.parse(knotSource).orElse(null);
        } else {
            fiber = FiberResolver.resolve(null, false, FiberDetector.detect(knotSource));
            knotSize = KnotSizeParser.parse(knotSource).orElse(null);
        }

        String knotMaker = null;
        if (knot != null) {
            CatalogEntry entry = knot.entry();
            knotMaker = entry != null && entry.getKnotMaker() != null ? entry.getKnotMaker() : knot.brand();
        }
        String pattern = knot != null ? knot.pattern() : handle.pattern();

        MatchedFrom matchedFrom;
        if (parts == null) {
            matchedFrom = MatchedFrom.FULL_STRING;
        } else {
            matchedFrom = knot != null ? MatchedFrom.KNOT_PART : MatchedFrom.HANDLE_PART;
        }
        MatchProvenance provenance = new MatchProvenance(
                strategyName,
                pattern,
                knot != null ? knotSource : handleSource,
                matchedFrom,
                parts != null ? parts.handleText() : null,
                parts != null ? parts.knotText() : null,
                parts != null ? parts.delimiter() : null);

        ComponentMatch handleComponent = null;
        if (handle != null) {
            handleComponent = ComponentMatch.handle(handle.maker(), handle.model(), handleSource,
                    handle.pattern(), handle.section());
        } else if (handleSource != null && parts != null) {
            handleComponent = ComponentMatch.handle(null, null, handleSource, null, null);
        }
        ComponentMatch knotComponent = null;
        if (knot != null) {
            knotComponent = ComponentMatch.knot(knotMaker, knot.model(), fiber.fiber(), knotSize, knotSource,
                    knot.pattern(), knot.section());
        } else if (knotSource != null && parts != null) {
            knotComponent = ComponentMatch.knot(null, null, fiber.fiber(), knotSize, knotSource, null, null);
        }

        BrushMatch matched = BrushMatch.builder()
                .brand(knot != null ? knot.brand() : null)
                .model(knot != null ? knot.model() : null)
                .fiber(fiber.fiber())
                .knotSizeMm(knotSize)
                .handleMaker(handle != null ? handle.maker() : null)
                .handleModel(handle != null ? handle.model() : null)
                .knotMaker(knotMaker)
                .fiberStrategy(fiber.strategy())
                .fiberConflict(fiber.conflict())
                .specification(knot != null ? knot.specification() : Map.of())
                .handle(handleComponent)
                .knot(knotComponent)
                .provenance(provenance)
                .build();
        return MatchResult.of(text, matched, matchType, pattern);
    }

    /**
     * Match type for a result built from separately matched components: the
     * knot hit's own type, so a brand-level knot reports {@link MatchType#BRAND}.
     * A handle matched without a knot reports {@link MatchType#REGEX}.
     */
    public static MatchType componentMatchType(CatalogHit knot) {
        return knot != null ? knot.matchType() : MatchType.REGEX;
    }
}
