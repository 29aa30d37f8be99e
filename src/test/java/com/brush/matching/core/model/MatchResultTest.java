package com.brush.matching.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MatchResultTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private static BrushMatch splitMatch() {
        return BrushMatch.builder()
                .brand("Declaration Grooming")
                .model("B15")
                .fiber(Fiber.BADGER)
                .knotSizeMm(26.0)
                .handleMaker("Elite")
                .handleModel("Zebra")
                .knotMaker("Declaration Grooming")
                .fiberStrategy(FiberStrategy.DEFAULT)
                .specification(Map.of("loft_mm", 52))
                .handle(ComponentMatch.handle("Elite", "Zebra", "elite zebra", "elite.*zebra", "artisan_handles"))
                .knot(ComponentMatch.knot("Declaration Grooming", "B15", Fiber.BADGER, 26.0, "dg b15",
                        "(declaration|\\bdg\\b).*\\bb15\\b", "known_knots"))
                .provenance(new MatchProvenance("high_priority_split", "(declaration|\\bdg\\b).*\\bb15\\b",
                        "dg b15", MatchedFrom.KNOT_PART, "elite zebra", "dg b15", "w/"))
                .build();
    }

    @Test
    void serializesWireFormat() throws Exception {
        MatchResult result = MatchResult.of("Elite Zebra w/ DG B15", splitMatch(), MatchType.REGEX, "x");

        JsonNode json = mapper.valueToTree(result);

        assertEquals("Elite Zebra w/ DG B15", json.get("original").asText());
        assertEquals("regex", json.get("match_type").asText());
        JsonNode matched = json.get("matched");
        assertEquals("Badger", matched.get("fiber").asText());
        assertEquals(26.0, matched.get("knot_size_mm").asDouble());
        assertEquals("default", matched.get("fiber_strategy").asText());
        assertEquals(52, matched.get("loft_mm").asInt());
        assertEquals("Zebra", matched.get("handle").get("model").asText());
        assertEquals("knot_part", matched.get("_matched_from").asText());
        assertEquals("high_priority_split", matched.get("_matched_by_strategy").asText());
        assertEquals("w/", matched.get("_delimiter").asText());
        assertFalse(matched.has("fiber_conflict"));
        assertFalse(matched.get("handle").has("fiber"));
    }

    @Test
    void derivedProvenanceFlagsAreNotSerialized() {
        MatchResult result = MatchResult.of("Elite Zebra w/ DG B15", splitMatch(), MatchType.REGEX, "x");

        JsonNode matched = mapper.valueToTree(result).get("matched");

        assertTrue(result.matched().getProvenance().isSplit());
        assertFalse(matched.has("split"));
        assertFalse(matched.has("_split"));
    }

    @Test
    void requiredFieldsAreAlwaysWritten() {
        BrushMatch bare = BrushMatch.builder()
                .brand("Elite")
                .provenance(MatchProvenance.fullString("single_component", "\\belite\\b", "elite"))
                .build();

        JsonNode matched = mapper.valueToTree(MatchResult.of("Elite", bare, MatchType.BRAND, "\\belite\\b"))
                .get("matched");

        assertTrue(matched.has("model"));
        assertTrue(matched.get("model").isNull());
        assertTrue(matched.get("fiber").isNull());
        assertTrue(matched.get("knot_size_mm").isNull());
        assertTrue(matched.get("handle_maker").isNull());
    }

    @Test
    void noMatchWritesNulls() {
        JsonNode json = mapper.valueToTree(MatchResult.noMatch("qwxyz"));

        assertEquals("qwxyz", json.get("original").asText());
        assertTrue(json.get("matched").isNull());
        assertTrue(json.get("match_type").isNull());
        assertFalse(MatchResult.noMatch("qwxyz").hasMatch());
    }

    @Test
    void rejectsInconsistentMatchType() {
        assertThrows(IllegalArgumentException.class, () -> new MatchResult("x", null, MatchType.REGEX, null));
        assertThrows(IllegalArgumentException.class,
                () -> new MatchResult("x", splitMatch(), MatchType.NONE, null));
    }

    @Test
    void withOriginalKeepsTheMatch() {
        MatchResult result = MatchResult.of("dg b15", splitMatch(), MatchType.REGEX, "p");

        MatchResult restamped = result.withOriginal("DG  B15");

        assertEquals("DG  B15", restamped.original());
        assertSame(result.matched(), restamped.matched());
        assertSame(result, result.withOriginal("dg b15"));
    }

    @Test
    void brushInputDefaultsOriginal() {
        assertEquals("dg b15", new BrushInput(null, "dg b15").original());
        assertEquals("DG B15", BrushInput.of("  DG B15 ").normalized());
        assertThrows(NullPointerException.class, () -> new BrushInput("x", null));
    }
}
