package com.brush.matching.split;

import com.brush.matching.component.HandleHit;
import com.brush.matching.component.HandleMatcher;
import com.brush.matching.component.KnotMatcher;
import com.brush.matching.rules.FiberDetector;
import com.brush.matching.rules.KnotSizeParser;
import com.brush.matching.rules.VersionTokens;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Additive handle and knot likelihood scores for one side of a split.
 * Scores only decide which side is which; they never decide whether to split.
 */
public class SplitScorer {

    private static final Pattern HANDLE_WORD = Pattern.compile("\\bhandle\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern KNOT_WORD = Pattern.compile("\\bknot\\b", Pattern.CASE_INSENSITIVE);
    private static final List<Pattern> HANDLE_VOCABULARY = List.of(
            Pattern.compile("\\bstock\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bcustom\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bartisan\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bturned\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bwood\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bresin\\b", Pattern.CASE_INSENSITIVE)
    );

    private final ScoringWeights weights;
    private final HandleMatcher handleMatcher;
    private final KnotMatcher knotMatcher;

    public SplitScorer(ScoringWeights weights, HandleMatcher handleMatcher, KnotMatcher knotMatcher) {
        this.weights = weights;
        this.handleMatcher = handleMatcher;
        this.knotMatcher = knotMatcher;
    }

    public int scoreAsKnot(String text) {
        int score = 0;
        if (FiberDetector.mentionsFiber(text)) {
            score += weights.fiberWord();
        }
        if (KnotSizeParser.containsSize(text)) {
            score += weights.knotSize();
        }
        if (VersionTokens.containsVersionToken(text)) {
            score += weights.versionToken();
        }
        if (KNOT_WORD.matcher(text).find()) {
            score += weights.knotWord();
        }
        int catalogHits = knotMatcher.countMatchingSources(text);
        score += Math.min(catalogHits * weights.catalogMatch(), weights.catalogMatchCap());
        return score;
    }

    public int scoreAsHandle(String text) {
        int score = 0;
        if (HANDLE_WORD.matcher(text).find()) {
            score += weights.handleWord();
        }
        Optional<HandleHit> handle = handleMatcher.match(text);
        if (handle.isPresent()) {
            score += weights.handleCatalogBase() + weights.handleCatalogStep() * handle.get().priority();
        }
        for (Pattern word : HANDLE_VOCABULARY) {
            if (word.matcher(text).find()) {
                score += weights.handleVocabulary();
            }
        }
        return score;
    }
}
