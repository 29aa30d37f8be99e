package com.brush.matching.core.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class FiberTest {

    @ParameterizedTest
    @CsvSource({
            "Badger, BADGER",
            "badger, BADGER",
            "' Boar ', BOAR",
            "SYNTHETIC, SYNTHETIC",
            "Horse, HORSE",
            "Mixed Badger/Boar, MIXED",
            "Unknown, UNKNOWN"
    })
    void parsesCatalogValues(String value, Fiber expected) {
        assertEquals(expected, Fiber.fromCatalog(value));
    }

    @Test
    void rejectsUnknownAndBlank() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> Fiber.fromCatalog("Silk"));
        assertTrue(ex.getMessage().contains("Silk"));
        assertThrows(IllegalArgumentException.class, () -> Fiber.fromCatalog(" "));
        assertThrows(IllegalArgumentException.class, () -> Fiber.fromCatalog(null));
    }

    @Test
    void displayNameIsCapitalised() {
        assertEquals("Synthetic", Fiber.SYNTHETIC.displayName());
    }
}
