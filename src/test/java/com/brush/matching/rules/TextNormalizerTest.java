package com.brush.matching.rules;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TextNormalizerTest {

    @Test
    void lowercasesTrimsAndCollapses() {
        assertEquals("simpson chubby 2", TextNormalizer.normalize("  Simpson\tChubby   2 \n"));
    }

    @Test
    void keepsPunctuation() {
        assertEquals("elite zebra / dg b15", TextNormalizer.normalize("Elite Zebra / DG B15"));
        assertEquals("chisel & hound v20", TextNormalizer.normalize("Chisel & Hound V20"));
    }

    @Test
    void blankBecomesEmpty() {
        assertEquals("", TextNormalizer.normalize(null));
        assertEquals("", TextNormalizer.normalize(" \t "));
    }

    @Test
    void idempotent() {
        String once = TextNormalizer.normalize("Mühle  STF");
        assertEquals(once, TextNormalizer.normalize(once));
        assertEquals("mühle stf", once);
    }
}
