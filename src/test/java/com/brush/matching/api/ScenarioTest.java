package com.brush.matching.api;

import com.brush.matching.TestCatalogs;
import com.brush.matching.core.model.BrushMatch;
import com.brush.matching.core.model.Fiber;
import com.brush.matching.core.model.FiberStrategy;
import com.brush.matching.core.model.MatchResult;
import com.brush.matching.core.model.MatchType;
import com.brush.matching.core.model.MatchedFrom;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end matching of typical user descriptions against the fixture catalogs.
 */
class ScenarioTest {

    private static BrushMatcher matcher;

    @BeforeAll
    static void setUp() {
        matcher = TestCatalogs.matcher();
    }

    @Nested
    @DisplayName("Complete brushes")
    class CompleteBrushes {

        @Test
        @DisplayName("Simpson Chubby 2 matches the known brush with its catalog fiber")
        void simpsonChubby2() {
            MatchResult result = matcher.match("Simpson Chubby 2");

            assertEquals(MatchType.REGEX, result.matchType());
            BrushMatch m = result.matched();
            assertEquals("Simpson", m.getBrand());
            assertEquals("Chubby 2", m.getModel());
            assertEquals(Fiber.BADGER, m.getFiber());
            assertEquals(27.0, m.getKnotSizeMm());
            assertEquals(FiberStrategy.DEFAULT, m.getFiberStrategy());
            assertEquals("known_brush", m.getProvenance().strategy());
            assertEquals(MatchedFrom.FULL_STRING, m.getProvenance().matchedFrom());
        }

        @Test
        @DisplayName("Declaration B2 applies the home-brand default")
        void declarationB2() {
            MatchResult result = matcher.match("Declaration B2");

            assertEquals("Declaration Grooming", result.matched().getBrand());
            assertEquals("B2", result.matched().getModel());
            assertEquals(Fiber.BADGER, result.matched().getFiber());
            assertEquals(28.0, result.matched().getKnotSizeMm());
            assertEquals(MatchType.REGEX, result.matchType());
        }

        @Test
        @DisplayName("A bare model code is an alias of the home brand")
        void bareModelCodeIsAlias() {
            MatchResult result = matcher.match("B2");

            assertEquals("Declaration Grooming", result.matched().getBrand());
            assertEquals(MatchType.ALIAS, result.matchType());
        }

        @Test
        @DisplayName("Zenith B2 is a Zenith; the brand token suppresses the home-brand default")
        void zenithB2() {
            MatchResult result = matcher.match("Zenith B2");

            assertEquals("Zenith", result.matched().getBrand());
            assertEquals("B2", result.matched().getModel());
            assertEquals(Fiber.BOAR, result.matched().getFiber());
            assertEquals("zenith", result.matched().getProvenance().strategy());
        }

        @Test
        @DisplayName("User fiber that contradicts an authoritative catalog fiber is recorded as a conflict")
        void fiberConflict() {
            BrushMatch m = matcher.match("Simpson Chubby 2 synthetic").matched();

            assertEquals(Fiber.BADGER, m.getFiber());
            assertEquals(FiberStrategy.YAML, m.getFiberStrategy());
            assertEquals("Synthetic", m.getFiberConflict());
        }

        @Test
        @DisplayName("User fiber replaces an overridable default")
        void overridableDefault() {
            BrushMatch m = matcher.match("Wolf Whiskers Mini synthetic").matched();

            assertEquals(Fiber.SYNTHETIC, m.getFiber());
            assertEquals(FiberStrategy.USER_INPUT, m.getFiberStrategy());
            assertNull(m.getFiberConflict());
        }

        @Test
        @DisplayName("handle_matching entries take the handle maker from the handle catalog")
        void handleMatchingEntry() {
            BrushMatch withHandle = matcher.match("Elite Wolf Whiskers Mini").matched();
            BrushMatch withoutHandle = matcher.match("Wolf Whiskers Mini").matched();

            assertEquals("Elite", withHandle.getHandleMaker());
            assertEquals("Wolf Whiskers", withoutHandle.getHandleMaker());
        }

        @Test
        @DisplayName("Knot size missing from the catalog is taken from the text")
        void knotSizeFromText() {
            BrushMatch m = matcher.match("Omega 10077 26mm").matched();

            assertEquals("Omega", m.getBrand());
            assertEquals("10077", m.getModel());
            assertEquals(26.0, m.getKnotSizeMm());
        }
    }

    @Nested
    @DisplayName("Brand-specific strategies")
    class BrandSpecific {

        @ParameterizedTest(name = "{0} -> V{1}")
        @CsvSource({
                "Chisel & Hound V10, 10",
                "Chisel and Hound v27, 27",
                "C&H V20 badger, 20"
        })
        @DisplayName("Chisel & Hound versions within range match the versioned knot")
        void chiselAndHoundInRange(String text, int version) {
            MatchResult result = matcher.match(text);

            assertEquals("Chisel & Hound", result.matched().getBrand());
            assertEquals("V" + version, result.matched().getModel());
            assertEquals(26.0, result.matched().getKnotSizeMm());
            assertEquals("chisel_and_hound", result.matched().getProvenance().strategy());
        }

        @Test
        @DisplayName("Chisel & Hound V28 falls through to the brand fallback")
        void chiselAndHoundOutOfRange() {
            MatchResult result = matcher.match("Chisel & Hound V28");

            assertEquals(MatchType.BRAND, result.matchType());
            assertEquals("Chisel & Hound", result.matched().getBrand());
            assertEquals("Badger", result.matched().getModel());
            assertEquals("other_brush", result.matched().getProvenance().strategy());
        }

        @ParameterizedTest(name = "{0} -> {1} {2}")
        @CsvSource({
                "Omega 10077, Omega, 10077",
                "Omega Pro 48, Omega, 48",
                "Semogue c3, Semogue, C3",
                "Zenith B26, Zenith, B26",
                "Zenith 506U, Zenith, 506U"
        })
        @DisplayName("Omega, Semogue and Zenith model numbers")
        void boarMakers(String text, String brand, String model) {
            BrushMatch m = matcher.match(text).matched();

            assertEquals(brand, m.getBrand());
            assertEquals(model, m.getModel());
            assertEquals(Fiber.BOAR, m.getFiber());
        }

        @Test
        @DisplayName("A model number the catalog knows wins over the generic Omega rule")
        void catalogOmegaFirst() {
            MatchResult result = matcher.match("Omega 10049");

            assertEquals("known_brush", result.matched().getProvenance().strategy());
            assertEquals(24.0, result.matched().getKnotSizeMm());
            assertEquals("Omega", result.matched().getHandleMaker());
        }
    }

    @Nested
    @DisplayName("Handle and knot combinations")
    class Combinations {

        @Test
        @DisplayName("Elite handle w/ Declaration B15 knot splits into handle and knot")
        void eliteWithDeclarationB15() {
            MatchResult result = matcher.match("Elite handle w/ Declaration B15 knot");

            BrushMatch m = result.matched();
            assertEquals("Elite", m.getHandleMaker());
            assertEquals("Declaration Grooming", m.getBrand());
            assertEquals("B15", m.getModel());
            assertEquals("high_priority_split", m.getProvenance().strategy());
            assertEquals("elite handle", m.getProvenance().originalHandleText());
            assertEquals("declaration b15 knot", m.getProvenance().originalKnotText());
            assertEquals("w/", m.getProvenance().delimiter());
            assertEquals(MatchedFrom.KNOT_PART, m.getProvenance().matchedFrom());
        }

        @Test
        @DisplayName("'in' puts the handle on the right")
        void inDelimiter() {
            BrushMatch m = matcher.match("Maggard SYN22 in Stirling handle").matched();

            assertEquals("Maggard", m.getBrand());
            assertEquals("SYN22", m.getModel());
            assertEquals("Stirling", m.getHandleMaker());
            assertEquals("in", m.getProvenance().delimiter());
        }

        @Test
        @DisplayName("Handle and knot in one unsplit string match as dual component")
        void dualComponent() {
            MatchResult result = matcher.match("Rad Dinosaur Maggard SYN22");

            BrushMatch m = result.matched();
            assertEquals("dual_component", m.getProvenance().strategy());
            assertEquals("Rad Dinosaur", m.getHandleMaker());
            assertEquals("Maggard", m.getBrand());
            assertEquals(Fiber.SYNTHETIC, m.getFiber());
            assertEquals(MatchedFrom.FULL_STRING, m.getProvenance().matchedFrom());
        }

        @Test
        @DisplayName("A split whose knot is only known at brand level reports a brand match")
        void splitWithBrandLevelKnot() {
            MatchResult result = matcher.match("Chisel & Hound V28 with Elite handle");

            assertEquals(MatchType.BRAND, result.matchType());
            assertEquals("high_priority_split", result.matched().getProvenance().strategy());
            assertEquals("Chisel & Hound", result.matched().getBrand());
            assertEquals("Badger", result.matched().getModel());
            assertEquals("Elite", result.matched().getHandleMaker());
        }

        @Test
        @DisplayName("Dual component with a brand-level knot reports a brand match")
        void dualComponentWithBrandLevelKnot() {
            MatchResult result = matcher.match("Elite / Maggard");

            assertEquals(MatchType.BRAND, result.matchType());
            assertEquals("dual_component", result.matched().getProvenance().strategy());
            assertEquals("Maggard", result.matched().getBrand());
            assertEquals("Elite", result.matched().getHandleMaker());
        }

        @Test
        @DisplayName("Neutral slash splits when nothing matches the full string")
        void neutralSplit() {
            MatchResult result = matcher.match("Custom turned resin / Maggard SYN22");

            BrushMatch m = result.matched();
            assertEquals("neutral_split", m.getProvenance().strategy());
            assertEquals("Maggard", m.getBrand());
            assertNull(m.getHandleMaker());
            assertEquals("custom turned resin", m.getHandle().sourceText());
            assertEquals("/", m.getProvenance().delimiter());
        }

        @Test
        @DisplayName("A handle alone is a brand-level single component")
        void handleOnly() {
            MatchResult result = matcher.match("Jayaruh 441");

            assertEquals(MatchType.BRAND, result.matchType());
            assertEquals("Jayaruh", result.matched().getHandleMaker());
            assertNull(result.matched().getBrand());
            assertEquals("single_component", result.matched().getProvenance().strategy());
        }

        @Test
        @DisplayName("A knot alone is a single component")
        void knotOnly() {
            MatchResult result = matcher.match("Yaqi Sagrada Familia/Tuxedo");

            assertEquals("Yaqi", result.matched().getBrand());
            assertEquals("Sagrada Familia/Tuxedo", result.matched().getModel());
            assertEquals("single_component", result.matched().getProvenance().strategy());
            assertNull(result.matched().getProvenance().delimiter());
        }
    }

    @Nested
    @DisplayName("Curated data")
    class Curated {

        @Test
        @DisplayName("Correct-match brush override wins with exact match type")
        void brushOverride() {
            MatchResult result = matcher.match("Simpson Chubby 2 Manchurian");

            assertEquals(MatchType.EXACT, result.matchType());
            assertEquals("correct_matches", result.matched().getProvenance().strategy());
            assertEquals("Chubby 2", result.matched().getModel());
            assertEquals(27.0, result.matched().getKnotSizeMm());
        }

        @Test
        @DisplayName("Correct-match knot override carries its explicit size")
        void knotOverride() {
            BrushMatch m = matcher.match("DG B15 Fanchurian").matched();

            assertEquals("Declaration Grooming", m.getBrand());
            assertEquals(26.0, m.getKnotSizeMm());
        }

        @Test
        @DisplayName("Correct-match handle override has a handle maker and no brand")
        void handleOverride() {
            BrushMatch m = matcher.match("Elite Zebra").matched();

            assertEquals("Elite", m.getHandleMaker());
            assertEquals("Zebra", m.getHandleModel());
            assertNull(m.getBrand());
        }

        @Test
        @DisplayName("A string listed under both handle and knot overrides yields both components")
        void handleAndKnotOverride() {
            MatchResult result = matcher.match("Elite Zebra DG Fanchurian");

            BrushMatch m = result.matched();
            assertEquals(MatchType.EXACT, result.matchType());
            assertEquals("correct_matches", m.getProvenance().strategy());
            assertEquals("Elite", m.getHandleMaker());
            assertEquals("Zebra", m.getHandleModel());
            assertEquals("Declaration Grooming", m.getBrand());
            assertEquals("B15", m.getModel());
            assertEquals(Fiber.BADGER, m.getFiber());
            assertEquals(26.0, m.getKnotSizeMm());
        }

        @Test
        @DisplayName("Correct-match split resolves both curated texts")
        void splitOverride() {
            MatchResult result = matcher.match("Elite Zebra / DG B15");

            assertEquals(MatchType.EXACT, result.matchType());
            assertEquals("Elite", result.matched().getHandleMaker());
            assertEquals("Zebra", result.matched().getHandleModel());
            assertEquals("B15", result.matched().getModel());
            assertEquals("Elite Zebra", result.matched().getProvenance().originalHandleText());
            assertEquals("DG B15", result.matched().getProvenance().originalKnotText());
        }

        @Test
        @DisplayName("Validated curated split is used before delimiter splitting")
        void curatedSplit() {
            MatchResult result = matcher.match("Jayaruh #441 w/ AP Shave Co G5C");

            assertEquals("curated_split", result.matched().getProvenance().strategy());
            assertEquals("Jayaruh", result.matched().getHandleMaker());
            assertEquals("AP Shave Co", result.matched().getBrand());
            assertEquals("G5C", result.matched().getModel());
        }

        @Test
        @DisplayName("should_not_split suppresses delimiter splitting for that input only")
        void shouldNotSplit() {
            MatchResult flagged = matcher.match("Stirling w/ Maggard SYN22");
            MatchResult unflagged = matcher.match("Stirling with Maggard SYN22");

            assertEquals("dual_component", flagged.matched().getProvenance().strategy());
            assertEquals("high_priority_split", unflagged.matched().getProvenance().strategy());
        }

        @Test
        @DisplayName("Unvalidated curated splits are ignored")
        void unvalidatedIgnored() {
            MatchResult result = matcher.match("Rad Dinosaur + Omega 10049");

            assertEquals("known_brush", result.matched().getProvenance().strategy());
        }
    }

    @Test
    @DisplayName("Unknown text yields a no-match result")
    void noMatch() {
        MatchResult result = matcher.match("qwxyz not a real brush");

        assertFalse(result.hasMatch());
        assertNull(result.matched());
        assertEquals(MatchType.NONE, result.matchType());
        assertNull(result.pattern());
        assertEquals("qwxyz not a real brush", result.original());
    }
}
