package com.brush.matching.api;

import com.brush.matching.TestCatalogs;
import com.brush.matching.cache.CacheConfig;
import com.brush.matching.cache.CaffeineMatchCache;
import com.brush.matching.catalog.BrushCatalog;
import com.brush.matching.catalog.CatalogException;
import com.brush.matching.catalog.CatalogPaths;
import com.brush.matching.core.model.BrushInput;
import com.brush.matching.core.model.MatchResult;
import com.brush.matching.core.model.MatchType;
import com.brush.matching.correct.CorrectMatchTable;
import com.brush.matching.metrics.MicrometerMetricsService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BrushMatcherTest {

    @Nested
    @DisplayName("Builder")
    class BuilderTests {

        @Test
        @DisplayName("Requires a catalog source")
        void requiresCatalog() {
            assertThrows(IllegalStateException.class, () -> BrushMatcher.builder().build());
        }

        @Test
        @DisplayName("Rejects both a catalog and catalog paths")
        void rejectsBothSources() {
            BrushMatcher.Builder builder = BrushMatcher.builder()
                    .catalog(BrushCatalog.empty())
                    .catalogPaths(CatalogPaths.inDirectory(TestCatalogs.directory()));

            assertThrows(IllegalStateException.class, builder::build);
        }

        @Test
        @DisplayName("Strategies run in the documented order")
        void strategyOrder() {
            BrushMatcher matcher = BrushMatcher.builder().catalog(TestCatalogs.catalog()).build();

            assertEquals(List.of(
                    "correct_matches",
                    "curated_split",
                    "high_priority_split",
                    "known_brush",
                    "declaration_grooming",
                    "chisel_and_hound",
                    "omega_semogue",
                    "zenith",
                    "other_brush",
                    "dual_component",
                    "neutral_split",
                    "single_component"
            ), matcher.strategyNames());
        }

        @Test
        @DisplayName("A curated split whose texts resolve to nothing fails the build")
        void unresolvableCorrectMatchSplit() {
            CorrectMatchTable table = CorrectMatchTable.fromMapping(Map.of(
                    "split_brush", Map.of("mystery / thing", Map.of("handle", "zzz", "knot", "yyy"))));

            CatalogException ex = assertThrows(CatalogException.class, () -> BrushMatcher.builder()
                    .catalog(TestCatalogs.catalog())
                    .correctMatches(table)
                    .build());
            assertTrue(ex.getMessage().contains("zzz"));
        }

        @Test
        @DisplayName("Missing catalog file fails the build")
        void missingCatalogFile(@TempDir Path dir) {
            assertThrows(CatalogException.class, () -> BrushMatcher.builder()
                    .catalogPaths(CatalogPaths.catalogsOnly(dir))
                    .build());
        }

        @Test
        @DisplayName("fromDirectory treats override files as optional")
        void fromDirectoryWithoutOverrides(@TempDir Path dir) throws IOException {
            for (String name : List.of(CatalogPaths.BRUSHES_FILE, CatalogPaths.KNOTS_FILE, CatalogPaths.HANDLES_FILE)) {
                Files.copy(TestCatalogs.directory().resolve(name), dir.resolve(name));
            }

            BrushMatcher matcher = BrushMatcher.fromDirectory(dir);

            assertEquals("Chubby 2", matcher.match("Simpson Chubby 2").matched().getModel());
            assertNotEquals(MatchType.EXACT, matcher.match("Elite Zebra / DG B15").matchType());
        }
    }

    @Nested
    @DisplayName("Matching")
    class Matching {

        @Test
        @DisplayName("Blank input is a no-match carrying the original")
        void blankInput() {
            BrushMatcher matcher = BrushMatcher.builder().catalog(TestCatalogs.catalog()).build();

            MatchResult result = matcher.match(new BrushInput("   ", "   "));

            assertFalse(result.hasMatch());
            assertEquals("   ", result.original());
        }

        @Test
        @DisplayName("matchAll preserves input order")
        void matchAllOrder() {
            BrushMatcher matcher = BrushMatcher.builder().catalog(TestCatalogs.catalog()).build();

            List<MatchResult> results = matcher.matchAll(List.of(
                    BrushInput.of("Zenith B26"),
                    BrushInput.of("qwxyz"),
                    BrushInput.of("Simpson Chubby 2")));

            assertEquals(3, results.size());
            assertEquals("Zenith", results.get(0).matched().getBrand());
            assertFalse(results.get(1).hasMatch());
            assertEquals("Simpson", results.get(2).matched().getBrand());
        }

        @Test
        @DisplayName("Cached results are re-stamped with each caller's original text")
        void cacheRestampsOriginal() {
            SimpleMeterRegistry registry = new SimpleMeterRegistry();
            BrushMatcher matcher = BrushMatcher.builder()
                    .catalog(TestCatalogs.catalog())
                    .cache(new CaffeineMatchCache(CacheConfig.defaults()))
                    .metricsService(new MicrometerMetricsService(registry))
                    .build();

            MatchResult first = matcher.match("Simpson Chubby 2");
            MatchResult second = matcher.match("SIMPSON CHUBBY 2");

            assertEquals("Simpson Chubby 2", first.original());
            assertEquals("SIMPSON CHUBBY 2", second.original());
            assertEquals(first.matched(), second.matched());
            assertEquals(1, matcher.getCacheStats().hitCount());
            assertEquals(1.0, registry.counter("brush.cache.hit").count());
            assertEquals(1.0, registry.counter("brush.strategy.matched", "strategy", "known_brush").count());
        }

        @Test
        @DisplayName("Cache configured through options")
        void cacheFromOptions() {
            BrushMatcher matcher = BrushMatcher.builder()
                    .catalog(TestCatalogs.catalog())
                    .options(MatcherOptions.builder().cacheConfig(CacheConfig.defaults()).build())
                    .build();

            matcher.match("Zenith B26");
            matcher.match("zenith b26");

            assertEquals(1, matcher.getCacheStats().hitCount());
            assertEquals(1, matcher.getCacheStats().missCount());
        }

        @Test
        @DisplayName("Narrower version range rejects versions the default accepts")
        void customVersionRange() {
            BrushMatcher matcher = BrushMatcher.builder()
                    .catalog(TestCatalogs.catalog())
                    .options(MatcherOptions.builder().chiselAndHoundVersions(15, 20).build())
                    .build();

            assertEquals("other_brush", matcher.match("Chisel & Hound V10").matched().getProvenance().strategy());
            assertEquals("V15", matcher.match("Chisel & Hound V15").matched().getModel());
        }
    }

    @Nested
    @DisplayName("Bypassing correct matches")
    class BypassCorrectMatches {

        @Test
        @DisplayName("A brush override is skipped and the catalogs decide")
        void brushOverrideBypassed() {
            BrushMatcher matcher = TestCatalogs.matcher();

            MatchResult curated = matcher.match("Simpson Chubby 2 Manchurian");
            MatchResult bypassed = matcher.match("Simpson Chubby 2 Manchurian", true);

            assertEquals("correct_matches", curated.matched().getProvenance().strategy());
            assertEquals("known_brush", bypassed.matched().getProvenance().strategy());
            assertEquals(MatchType.REGEX, bypassed.matchType());
            assertEquals("Chubby 2", bypassed.matched().getModel());
            assertEquals("Simpson Chubby 2 Manchurian", bypassed.original());
        }

        @Test
        @DisplayName("should_not_split flags are ignored")
        void shouldNotSplitIgnored() {
            BrushMatcher matcher = TestCatalogs.matcher();

            MatchResult flagged = matcher.match("Stirling w/ Maggard SYN22");
            MatchResult bypassed = matcher.match("Stirling w/ Maggard SYN22", true);

            assertEquals("dual_component", flagged.matched().getProvenance().strategy());
            assertEquals("high_priority_split", bypassed.matched().getProvenance().strategy());
        }

        @Test
        @DisplayName("Bypassed results neither read nor fill the cache")
        void bypassSkipsCache() {
            BrushMatcher matcher = BrushMatcher.builder()
                    .catalogPaths(CatalogPaths.inDirectory(TestCatalogs.directory()))
                    .cache(new CaffeineMatchCache(CacheConfig.defaults()))
                    .build();

            matcher.match("Simpson Chubby 2 Manchurian", true);
            MatchResult curated = matcher.match("Simpson Chubby 2 Manchurian");

            assertEquals(MatchType.EXACT, curated.matchType());
            assertEquals(0, matcher.getCacheStats().hitCount());
            assertEquals(1, matcher.getCacheStats().missCount());
        }
    }
}
