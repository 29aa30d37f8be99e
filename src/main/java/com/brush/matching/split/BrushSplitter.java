package com.brush.matching.split;

import com.brush.matching.core.model.DelimiterClass;
import com.brush.matching.core.model.SplitCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a brush description into handle and knot at an explicit delimiter.
 *
 * <p>Only a delimiter of the requested class can trigger a split. For scored
 * classes every occurrence of every delimiter is tried and the split with the
 * highest combined score wins; the earliest split wins ties. Within a split the
 * side with the higher net knot score (knot score minus handle score) becomes the
 * knot, and on a tie the left side is the handle.</p>
 *
 * <p>For {@code in} the left side is the knot and the right side the handle,
 * except in phrases such as {@code "made in"} or {@code "in r/..."}.</p>
 */
public class BrushSplitter {
    private static final Logger log = LoggerFactory.getLogger(BrushSplitter.class);

    private static final Pattern COMMUNITY_PREFIX = Pattern.compile("^[ru]/", Pattern.CASE_INSENSITIVE);

    private final SplitScorer scorer;
    private final SpecificationSlashDetector slashDetector;

    public BrushSplitter(SplitScorer scorer, SpecificationSlashDetector slashDetector) {
        this.scorer = scorer;
        this.slashDetector = slashDetector;
    }

    public Optional<SplitCandidate> trySplit(String text, DelimiterClass delimiterClass) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        SplitCandidate best = null;
        for (Pattern delimiter : delimiterClass.delimiters()) {
            Matcher matcher = delimiter.matcher(text);
            while (matcher.find()) {
                String left = text.substring(0, matcher.start()).strip();
                String right = text.substring(matcher.end()).strip();
                if (left.isEmpty() || right.isEmpty()) {
                    continue;
                }
                String delimiterText = matcher.group().strip();
                if (delimiterText.equals("/") && slashDetector.isSpecification(text, text.indexOf('/', matcher.start()))) {
                    continue;
                }
                SplitCandidate candidate;
                if (delimiterClass.isScored()) {
                    candidate = scoredSplit(left, right, delimiterText, delimiterClass);
                } else {
                    if (isNonDelimitingIn(left, right)) {
                        continue;
                    }
                    return Optional.of(new SplitCandidate(right, left, delimiterText, delimiterClass, 0, 0));
                }
                if (best == null || candidate.totalScore() > best.totalScore()) {
                    best = candidate;
                }
            }
        }
        if (best != null) {
            log.debug("split.selected class={} handle='{}' knot='{}' handleScore={} knotScore={}",
                    delimiterClass, best.handleText(), best.knotText(), best.handleScore(), best.knotScore());
        }
        return Optional.ofNullable(best);
    }

    private SplitCandidate scoredSplit(String left, String right, String delimiter, DelimiterClass delimiterClass) {
        int leftKnot = scorer.scoreAsKnot(left);
        int leftHandle = scorer.scoreAsHandle(left);
        int rightKnot = scorer.scoreAsKnot(right);
        int rightHandle = scorer.scoreAsHandle(right);

        int leftNet = leftKnot - leftHandle;
        int rightNet = rightKnot - rightHandle;
        if (leftNet > rightNet) {
            return new SplitCandidate(right, left, delimiter, delimiterClass, rightHandle, leftKnot);
        }
        return new SplitCandidate(left, right, delimiter, delimiterClass, leftHandle, rightKnot);
    }

    private static boolean isNonDelimitingIn(String left, String right) {
        return left.toLowerCase(Locale.ROOT).endsWith("made") || COMMUNITY_PREFIX.matcher(right).find();
    }
}
