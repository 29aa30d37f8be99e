package com.brush.matching.split;

import com.brush.matching.TestCatalogs;
import com.brush.matching.catalog.BrushCatalog;
import com.brush.matching.component.HandleMatcher;
import com.brush.matching.component.KnotMatcher;
import com.brush.matching.core.model.DelimiterClass;
import com.brush.matching.core.model.SplitCandidate;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BrushSplitterTest {

    private static BrushSplitter splitter;

    @BeforeAll
    static void setUp() {
        BrushCatalog catalog = TestCatalogs.catalog();
        HandleMatcher handles = new HandleMatcher(catalog);
        KnotMatcher knots = new KnotMatcher(catalog, List.of(), null);
        splitter = new BrushSplitter(new SplitScorer(ScoringWeights.defaults(), handles, knots),
                new SpecificationSlashDetector(catalog.slashNames()));
    }

    @Nested
    @DisplayName("w/ and with")
    class KnotAmbiguous {

        @Test
        void knotOnTheRight() {
            SplitCandidate split = splitter.trySplit("elite zebra w/ dg b15", DelimiterClass.KNOT_AMBIGUOUS)
                    .orElseThrow();

            assertEquals("elite zebra", split.handleText());
            assertEquals("dg b15", split.knotText());
            assertEquals("w/", split.delimiter());
            assertEquals(DelimiterClass.KNOT_AMBIGUOUS, split.delimiterClass());
        }

        @Test
        void knotOnTheLeft() {
            SplitCandidate split = splitter.trySplit("dg b15 with elite zebra handle",
                    DelimiterClass.KNOT_AMBIGUOUS).orElseThrow();

            assertEquals("elite zebra handle", split.handleText());
            assertEquals("dg b15", split.knotText());
            assertEquals("with", split.delimiter());
        }

        @Test
        @DisplayName("Equal evidence keeps the left side as handle")
        void tieKeepsLeftAsHandle() {
            SplitCandidate split = splitter.trySplit("foo w/ bar", DelimiterClass.KNOT_AMBIGUOUS).orElseThrow();

            assertEquals("foo", split.handleText());
            assertEquals("bar", split.knotText());
        }
    }

    @Nested
    @DisplayName("in")
    class HandlePrimary {

        @Test
        void knotBeforeHandle() {
            SplitCandidate split = splitter.trySplit("declaration grooming in stirling handle",
                    DelimiterClass.HANDLE_PRIMARY).orElseThrow();

            assertEquals("declaration grooming", split.knotText());
            assertEquals("stirling handle", split.handleText());
        }

        @ParameterizedTest
        @ValueSource(strings = {"simpson made in england", "stirling in r/wetshaving colors"})
        void phrasesThatAreNotDelimiters(String text) {
            assertTrue(splitter.trySplit(text, DelimiterClass.HANDLE_PRIMARY).isEmpty());
        }
    }

    @Nested
    @DisplayName("/, - and +")
    class Neutral {

        @Test
        void hyphenSplit() {
            SplitCandidate split = splitter.trySplit("rad dinosaur - maggard syn22", DelimiterClass.NEUTRAL)
                    .orElseThrow();

            assertEquals("rad dinosaur", split.handleText());
            assertEquals("maggard syn22", split.knotText());
        }

        @Test
        void slashSplit() {
            SplitCandidate split = splitter.trySplit("dg b15 / jayaruh", DelimiterClass.NEUTRAL).orElseThrow();

            assertEquals("jayaruh", split.handleText());
            assertEquals("dg b15", split.knotText());
            assertEquals("/", split.delimiter());
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "simpson badger/boar",
                "zenith 50/50 horse",
                "yaqi sagrada familia/tuxedo",
                "stirling r/wetshaving"
        })
        void specificationSlashesDoNotSplit(String text) {
            assertTrue(splitter.trySplit(text, DelimiterClass.NEUTRAL).isEmpty());
        }

        @Test
        void neutralIgnoresWithSlash() {
            assertTrue(splitter.trySplit("elite w/ dg b15", DelimiterClass.NEUTRAL).isEmpty());
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {"elite badger", "chisel & hound sakura", "simpson chubby 2 x 24mm", ""})
    @DisplayName("Texts without a delimiter are never split")
    void noDelimiter(String text) {
        for (DelimiterClass delimiterClass : DelimiterClass.values()) {
            assertTrue(splitter.trySplit(text, delimiterClass).isEmpty(), delimiterClass.name());
        }
    }

    @Test
    void delimiterAtTheEdgeIsIgnored() {
        assertTrue(splitter.trySplit("w/ dg b15", DelimiterClass.KNOT_AMBIGUOUS).isEmpty());
    }
}
