package com.brush.matching.rules;

import com.brush.matching.core.model.Fiber;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class FiberDetectorTest {

    @ParameterizedTest
    @CsvSource({
            "Simpson Chubby 2 Best Badger, BADGER",
            "two band silvertip, BADGER",
            "Manchurian, BADGER",
            "HMW 26mm, BADGER",
            "Omega 10049 boar, BOAR",
            "Semogue shoat, BOAR",
            "AP Shave Co synthetic, SYNTHETIC",
            "Maggard syn 24mm, SYNTHETIC",
            "Plissoft knot, SYNTHETIC",
            "horsehair brush, HORSE",
            "badger/boar mix, MIXED",
            "Zenith boar / badger, MIXED"
    })
    void detectsFiber(String text, Fiber expected) {
        assertEquals(expected, FiberDetector.detect(text).orElseThrow());
    }

    @ParameterizedTest
    @ValueSource(strings = {"Elite Zebra", "Declaration B2", "synonym", "Simpson Chubby 2"})
    void noFiberNamed(String text) {
        assertTrue(FiberDetector.detect(text).isEmpty());
        assertFalse(FiberDetector.mentionsFiber(text));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   "})
    void blankInput(String text) {
        assertTrue(FiberDetector.detect(text).isEmpty());
    }
}
