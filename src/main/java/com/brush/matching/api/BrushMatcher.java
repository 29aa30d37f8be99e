package com.brush.matching.api;

import com.brush.matching.cache.CacheStats;
import com.brush.matching.cache.CaffeineMatchCache;
import com.brush.matching.cache.MatchCache;
import com.brush.matching.cache.NoOpMatchCache;
import com.brush.matching.catalog.BrushCatalog;
import com.brush.matching.catalog.CatalogLoader;
import com.brush.matching.catalog.CatalogPaths;
import com.brush.matching.component.CatalogHitSource;
import com.brush.matching.component.HandleMatcher;
import com.brush.matching.component.KnotMatcher;
import com.brush.matching.compose.ResultComposer;
import com.brush.matching.core.model.BrushInput;
import com.brush.matching.core.model.MatchResult;
import com.brush.matching.correct.CorrectMatchResolver;
import com.brush.matching.correct.CorrectMatchTable;
import com.brush.matching.correct.CuratedSplitTable;
import com.brush.matching.logging.LogContext;
import com.brush.matching.metrics.MetricsService;
import com.brush.matching.metrics.NoOpMetricsService;
import com.brush.matching.rules.TextNormalizer;
import com.brush.matching.split.BrushSplitter;
import com.brush.matching.split.SpecificationSlashDetector;
import com.brush.matching.split.SplitScorer;
import com.brush.matching.strategy.BrushMatchingStrategy;
import com.brush.matching.strategy.ChiselAndHoundVersionStrategy;
import com.brush.matching.strategy.CompleteBrushStrategy;
import com.brush.matching.strategy.CorrectMatchStrategy;
import com.brush.matching.strategy.CuratedSplitStrategy;
import com.brush.matching.strategy.DeclarationGroomingStrategy;
import com.brush.matching.strategy.DelimiterSplitStrategy;
import com.brush.matching.strategy.DualComponentStrategy;
import com.brush.matching.strategy.KnownBrushStrategy;
import com.brush.matching.strategy.OmegaSemogueStrategy;
import com.brush.matching.strategy.OtherBrushStrategy;
import com.brush.matching.strategy.SingleComponentStrategy;
import com.brush.matching.strategy.StrategyChain;
import com.brush.matching.strategy.ZenithStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Main entry point: classifies brush descriptions against compiled catalogs.
 *
 * <p>A matcher is immutable after {@link Builder#build()} and may be shared by
 * any number of threads. Only building can fail; matching never throws for
 * unrecognised input, it returns {@link MatchResult#noMatch(String)}.</p>
 *
 * <h2>Example usage:</h2>
 * <pre>
 * BrushMatcher matcher = BrushMatcher.builder()
 *     .catalogPaths(CatalogPaths.inDirectory(Path.of("data")))
 *     .build();
 *
 * MatchResult result = matcher.match(new BrushInput("Elite handle w/ DG B15", "Elite handle w/ DG B15"));
 * </pre>
 */
public class BrushMatcher {
    private static final Logger log = LoggerFactory.getLogger(BrushMatcher.class);

    private final BrushCatalog catalog;
    private final StrategyChain chain;
    private final StrategyChain bypassChain;
    private final MatchCache cache;
    private final MetricsService metricsService;

    private BrushMatcher(BrushCatalog catalog, StrategyChain chain, StrategyChain bypassChain, MatchCache cache,
                         MetricsService metricsService) {
        this.catalog = catalog;
        this.chain = chain;
        this.bypassChain = bypassChain;
        this.cache = cache;
        this.metricsService = metricsService;
    }

    /**
     * Matches one input. Only {@link BrushInput#normalized()} is used for
     * matching; the result carries {@link BrushInput#original()} unchanged.
     */
    public MatchResult match(BrushInput input) {
        return match(input, false);
    }

    /**
     * Matches one input, optionally ignoring the curated overrides.
     *
     * <p>With {@code bypassCorrectMatches} set, the {@code correct_matches}
     * strategy is skipped and {@code should_not_split} flags are ignored, so the
     * result is what the catalogs alone produce. This is how override entries
     * are re-validated. Bypassed results are not cached.</p>
     */
    public MatchResult match(BrushInput input, boolean bypassCorrectMatches) {
        String key = TextNormalizer.normalize(input.normalized());
        if (key.isEmpty()) {
            metricsService.incrementNoMatch();
            return MatchResult.noMatch(input.original());
        }
        if (bypassCorrectMatches) {
            return runChain(bypassChain, key).withOriginal(input.original());
        }

        Optional<MatchResult> cached = cache.get(key);
        if (cached.isPresent()) {
            metricsService.recordCacheHit();
            return cached.get().withOriginal(input.original());
        }
        metricsService.recordCacheMiss();

        MatchResult result = runChain(chain, key);
        cache.put(key, result);
        return result.withOriginal(input.original());
    }

    private MatchResult runChain(StrategyChain strategies, String key) {
        if (!log.isDebugEnabled()) {
            return timed(strategies, key);
        }
        try (LogContext ctx = LogContext.forMatch(LogContext.nextMatchId())) {
            MatchResult result = timed(strategies, key);
            log.debug("match.completed matchType={} text='{}'", result.matchType(), key);
            return result;
        }
    }

    private MatchResult timed(StrategyChain strategies, String key) {
        long start = System.nanoTime();
        MatchResult result = strategies.match(key);
        metricsService.recordMatchDuration(result.matchType(), Duration.ofNanos(System.nanoTime() - start));
        return result;
    }

    /**
     * Matches text that needs no separate original.
     */
    public MatchResult match(String text) {
        return match(BrushInput.of(text));
    }

    public MatchResult match(String text, boolean bypassCorrectMatches) {
        return match(BrushInput.of(text), bypassCorrectMatches);
    }

    /**
     * Matches each input in order.
     */
    public List<MatchResult> matchAll(List<BrushInput> inputs) {
        metricsService.recordBatchSize(inputs.size());
        List<MatchResult> results = new ArrayList<>(inputs.size());
        for (BrushInput input : inputs) {
            results.add(match(input));
        }
        return results;
    }

    /**
     * Names of the chain's strategies in evaluation order.
     */
    public List<String> strategyNames() {
        return chain.strategyNames();
    }

    public BrushCatalog getCatalog() {
        return catalog;
    }

    public CacheStats getCacheStats() {
        return cache.getStats();
    }

    /**
     * Builds a matcher from the standard file names in one directory. The two
     * override files are optional there.
     */
    public static BrushMatcher fromDirectory(Path directory) {
        CatalogPaths all = CatalogPaths.inDirectory(directory);
        CatalogPaths paths = new CatalogPaths(all.brushes(), all.knots(), all.handles(),
                Files.isRegularFile(all.correctMatches()) ? all.correctMatches() : null,
                Files.isRegularFile(all.brushSplits()) ? all.brushSplits() : null);
        return builder().catalogPaths(paths).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link BrushMatcher}. Either {@link #catalogPaths(CatalogPaths)} or
     * {@link #catalog(BrushCatalog)} is required.
     */
    public static class Builder {
        private CatalogPaths catalogPaths;
        private BrushCatalog catalog;
        private CorrectMatchTable correctMatches = CorrectMatchTable.empty();
        private CuratedSplitTable curatedSplits = CuratedSplitTable.empty();
        private MatcherOptions options = MatcherOptions.defaults();
        private CatalogLoader catalogLoader;
        private MatchCache cache;
        private MetricsService metricsService;

        /**
         * Loads catalogs and override files from the given paths on {@link #build()}.
         */
        public Builder catalogPaths(CatalogPaths paths) {
            this.catalogPaths = paths;
            return this;
        }

        /**
         * Uses an already compiled catalog.
         */
        public Builder catalog(BrushCatalog catalog) {
            this.catalog = catalog;
            return this;
        }

        public Builder correctMatches(CorrectMatchTable correctMatches) {
            this.correctMatches = correctMatches;
            return this;
        }

        public Builder curatedSplits(CuratedSplitTable curatedSplits) {
            this.curatedSplits = curatedSplits;
            return this;
        }

        public Builder options(MatcherOptions options) {
            this.options = options;
            return this;
        }

        public Builder catalogLoader(CatalogLoader catalogLoader) {
            this.catalogLoader = catalogLoader;
            return this;
        }

        /**
         * Sets the result cache. Without one, the cache is created from
         * {@link MatcherOptions#getCacheConfig()}.
         */
        public Builder cache(MatchCache cache) {
            this.cache = cache;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        /**
         * Loads, compiles and validates everything.
         *
         * @throws com.brush.matching.catalog.CatalogException if a catalog or override file is invalid
         */
        public BrushMatcher build() {
            if (catalogPaths == null && catalog == null) {
                throw new IllegalStateException("catalogPaths or catalog is required");
            }
            if (catalogPaths != null && catalog != null) {
                throw new IllegalStateException("set either catalogPaths or catalog, not both");
            }
            BrushCatalog resolvedCatalog = catalog;
            CorrectMatchTable resolvedCorrectMatches = correctMatches;
            CuratedSplitTable resolvedSplits = curatedSplits;
            if (catalogPaths != null) {
                CatalogLoader loader = catalogLoader != null ? catalogLoader : new CatalogLoader();
                try (LogContext ctx = LogContext.forCatalogLoad(catalogPaths.brushes().toString())) {
                    resolvedCatalog = loader.loadCatalog(catalogPaths);
                    resolvedCorrectMatches = CorrectMatchTable.fromMapping(
                            loader.readOptionalMapping(catalogPaths.correctMatches()));
                    resolvedSplits = CuratedSplitTable.fromMapping(
                            loader.readOptionalMapping(catalogPaths.brushSplits()));
                }
            }
            MatchCache resolvedCache = cache;
            if (resolvedCache == null) {
                resolvedCache = options.getCacheConfig().enabled()
                        ? new CaffeineMatchCache(options.getCacheConfig())
                        : new NoOpMatchCache();
            }
            MetricsService metrics = metricsService != null ? metricsService : new NoOpMetricsService();

            StrategyChain chain = new StrategyChain(
                    buildStrategies(resolvedCatalog, resolvedCorrectMatches, resolvedSplits, metrics, false), metrics);
            StrategyChain bypassChain = new StrategyChain(
                    buildStrategies(resolvedCatalog, resolvedCorrectMatches, resolvedSplits, metrics, true), metrics);
            log.info("matcher.built catalogEntries={} correctMatches={} curatedSplits={} strategies={}",
                    resolvedCatalog.size(), resolvedCorrectMatches.size(), resolvedSplits.size(),
                    chain.strategyNames());
            return new BrushMatcher(resolvedCatalog, chain, bypassChain, resolvedCache, metrics);
        }

        private List<BrushMatchingStrategy> buildStrategies(BrushCatalog catalog, CorrectMatchTable correctMatches,
                                                            CuratedSplitTable curatedSplits,
                                                            MetricsService metrics,
                                                            boolean bypassCorrectMatches) {
            HandleMatcher handleMatcher = new HandleMatcher(catalog);
            ResultComposer composer = new ResultComposer(handleMatcher);

            CatalogHitSource knownBrush = new KnownBrushStrategy(catalog);
            CatalogHitSource declaration = new DeclarationGroomingStrategy(catalog, options.getHomeBrand(),
                    options.getHomeBrandTokens(), options.getCompetingBrandTokens());
            CatalogHitSource chiselAndHound = new ChiselAndHoundVersionStrategy(
                    options.getMinChiselAndHoundVersion(), options.getMaxChiselAndHoundVersion());
            CatalogHitSource omegaSemogue = new OmegaSemogueStrategy();
            CatalogHitSource zenith = new ZenithStrategy();
            CatalogHitSource otherBrush = new OtherBrushStrategy(catalog);
            List<CatalogHitSource> modelSources = List.of(knownBrush, declaration, chiselAndHound,
                    omegaSemogue, zenith);

            KnotMatcher knotMatcher = new KnotMatcher(catalog, modelSources, otherBrush);
            BrushSplitter splitter = new BrushSplitter(
                    new SplitScorer(options.getScoringWeights(), handleMatcher, knotMatcher),
                    new SpecificationSlashDetector(catalog.slashNames()));
            List<BrushMatchingStrategy> strategies = new ArrayList<>();
            if (!bypassCorrectMatches) {
                strategies.add(new CorrectMatchStrategy(new CorrectMatchResolver(correctMatches, catalog,
                        handleMatcher, knotMatcher, composer)));
            }
            // should_not_split flags only apply while overrides are honoured
            CuratedSplitTable splitGuards = bypassCorrectMatches ? CuratedSplitTable.empty() : curatedSplits;
            strategies.add(new CuratedSplitStrategy(curatedSplits, handleMatcher, knotMatcher, composer));
            strategies.add(DelimiterSplitStrategy.highPriority(splitter, handleMatcher, knotMatcher,
                    splitGuards, composer, metrics));
            for (CatalogHitSource source : modelSources) {
                strategies.add(new CompleteBrushStrategy(source, composer));
            }
            strategies.add(new CompleteBrushStrategy(otherBrush, composer));
            strategies.add(new DualComponentStrategy(handleMatcher, knotMatcher, composer));
            strategies.add(DelimiterSplitStrategy.neutral(splitter, handleMatcher, knotMatcher,
                    splitGuards, composer, metrics));
            strategies.add(new SingleComponentStrategy(handleMatcher, knotMatcher, composer));
            return strategies;
        }
    }
}
