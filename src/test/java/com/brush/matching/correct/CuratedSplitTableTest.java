package com.brush.matching.correct;

import com.brush.matching.catalog.CatalogException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CuratedSplitTableTest {

    @Test
    @DisplayName("Only validated entries are kept")
    void validatedOnly() {
        CuratedSplitTable table = CuratedSplitTable.fromMapping(Map.of("brush_splits", List.of(
                Map.of("original", "A w/ B", "handle", "A", "knot", "B", "validated", true),
                Map.of("original", "C w/ D", "handle", "C", "knot", "D", "validated", false),
                Map.of("original", "E w/ F", "handle", "E", "knot", "F"))));

        assertEquals(1, table.size());
        assertTrue(table.find("a w/ b").isPresent());
        assertTrue(table.find("C w/ D").isEmpty());
    }

    @Test
    @DisplayName("Lookup ignores case and extra whitespace")
    void lookupNormalized() {
        CuratedSplitTable table = CuratedSplitTable.fromMapping(Map.of("brush_splits", List.of(
                Map.of("original", "Elite  Zebra / DG B15", "handle", "Elite Zebra", "knot", "DG B15",
                        "validated", true))));

        CuratedSplit split = table.find("ELITE ZEBRA / dg b15").orElseThrow();
        assertEquals("Elite Zebra", split.handle());
        assertEquals("DG B15", split.knot());
        assertFalse(split.shouldNotSplit());
    }

    @Test
    @DisplayName("should_not_split entries need no handle or knot")
    void shouldNotSplit() {
        CuratedSplitTable table = CuratedSplitTable.fromMapping(Map.of("brush_splits", List.of(
                Map.of("original", "Summer Break w/ Love", "validated", true, "should_not_split", true))));

        assertTrue(table.shouldNotSplit("summer break w/ love"));
        assertFalse(table.shouldNotSplit("something else"));
    }

    @Test
    @DisplayName("Missing original is rejected")
    void missingOriginal() {
        Map<String, Object> raw = Map.of("brush_splits", List.of(Map.of("handle", "A", "validated", true)));

        assertThrows(CatalogException.class, () -> CuratedSplitTable.fromMapping(raw));
    }

    @Test
    @DisplayName("Validated split without handle or knot is rejected")
    void validatedWithoutSides() {
        Map<String, Object> raw = Map.of("brush_splits", List.of(Map.of("original", "A", "validated", true)));

        assertThrows(CatalogException.class, () -> CuratedSplitTable.fromMapping(raw));
    }

    @Test
    @DisplayName("Two validated entries for the same original are rejected with the key named")
    void duplicateOriginal() {
        Map<String, Object> raw = Map.of("brush_splits", List.of(
                Map.of("original", "A w/ B", "handle", "A", "knot", "B", "validated", true),
                Map.of("original", "a  W/ b", "handle", "B", "knot", "A", "validated", true)));

        CatalogException ex = assertThrows(CatalogException.class, () -> CuratedSplitTable.fromMapping(raw));
        assertTrue(ex.getMessage().contains("a w/ b"));
    }

    @Test
    @DisplayName("Absent root yields an empty table; a non-list root is rejected")
    void rootShape() {
        assertEquals(0, CuratedSplitTable.fromMapping(Map.of()).size());
        assertThrows(CatalogException.class,
                () -> CuratedSplitTable.fromMapping(Map.of("brush_splits", "oops")));
    }
}
