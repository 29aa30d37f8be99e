package com.brush.matching.rules;

import com.brush.matching.core.model.Fiber;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Detects a fiber named in user text.
 * Rules are checked in order; the first rule that matches wins, so mixed-fiber
 * phrases are recognised before the single fibers they contain.
 */
public final class FiberDetector {

    private static final List<FiberPattern> RULES = List.of(
            new FiberPattern(Fiber.MIXED, Pattern.compile(
                    "\\bmixed\\b|\\bmix\\b|\\b(badger|boar)\\s*/\\s*(badger|boar)\\b",
                    Pattern.CASE_INSENSITIVE)),
            new FiberPattern(Fiber.SYNTHETIC, Pattern.compile(
                    "synth(etic)?|\\bsyn\\b|\\bnylon\\b|plissoft|timber\\s*wolf",
                    Pattern.CASE_INSENSITIVE)),
            new FiberPattern(Fiber.HORSE, Pattern.compile(
                    "\\bhorse(hair)?\\b", Pattern.CASE_INSENSITIVE)),
            new FiberPattern(Fiber.BOAR, Pattern.compile(
                    "\\bboar\\b|\\bshoat\\b", Pattern.CASE_INSENSITIVE)),
            new FiberPattern(Fiber.BADGER, Pattern.compile(
                    "badger|silver\\s*tip|\\b(two|2|three|3)\\s*band\\b|\\bhmw\\b|high\\s*mountain|\\bmanchurian\\b|\\bshd\\b",
                    Pattern.CASE_INSENSITIVE))
    );

    private FiberDetector() {
    }

    /**
     * Returns the fiber the text names, if any.
     */
    public static Optional<Fiber> detect(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        for (FiberPattern rule : RULES) {
            if (rule.pattern().matcher(text).find()) {
                return Optional.of(rule.fiber());
            }
        }
        return Optional.empty();
    }

    public static boolean mentionsFiber(String text) {
        return detect(text).isPresent();
    }

    private record FiberPattern(Fiber fiber, Pattern pattern) {}
}
