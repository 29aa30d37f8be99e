package com.brush.matching.split;

/**
 * Additive weights used to decide which side of a split is the knot.
 *
 * @param fiberWord          knot signal: a fiber word is present
 * @param knotSize           knot signal: a size such as {@code 26mm} is present
 * @param versionToken       knot signal: a model token such as {@code V20} or {@code B15}
 * @param knotWord           knot signal: the literal word {@code knot}
 * @param catalogMatch       knot signal: per catalog lookup that recognises the text
 * @param catalogMatchCap    ceiling for the summed catalog signal
 * @param handleWord         handle signal: the literal word {@code handle}
 * @param handleCatalogBase  handle signal: handle catalog match in the lowest-priority section
 * @param handleCatalogStep  handle signal: added per level of section priority
 * @param handleVocabulary   handle signal: per handle vocabulary word
 */
public record ScoringWeights(
        int fiberWord,
        int knotSize,
        int versionToken,
        int knotWord,
        int catalogMatch,
        int catalogMatchCap,
        int handleWord,
        int handleCatalogBase,
        int handleCatalogStep,
        int handleVocabulary
) {
    public ScoringWeights {
        if (fiberWord < 0 || knotSize < 0 || versionToken < 0 || knotWord < 0 || catalogMatch < 0
                || catalogMatchCap < 0 || handleWord < 0 || handleCatalogBase < 0
                || handleCatalogStep < 0 || handleVocabulary < 0) {
            throw new IllegalArgumentException("Weights must be non-negative");
        }
        if (catalogMatchCap < catalogMatch) {
            throw new IllegalArgumentException("catalogMatchCap must be >= catalogMatch");
        }
    }

    /**
     * Default weights: fiber +8, size +6, version +6, "knot" +10, catalog +4 each up to +8;
     * "handle" +10, handle catalog +6 to +12 by section priority, vocabulary +2 each.
     */
    public static ScoringWeights defaults() {
        return new ScoringWeights(8, 6, 6, 10, 4, 8, 10, 6, 2, 2);
    }
}
