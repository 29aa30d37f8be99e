package com.brush.matching.api;

import com.brush.matching.cache.CacheConfig;
import com.brush.matching.split.ScoringWeights;

import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Tuning options for a {@link BrushMatcher}. Immutable; use {@link #builder()}.
 */
public class MatcherOptions {

    public static final int DEFAULT_MIN_CHISEL_AND_HOUND_VERSION = 10;
    public static final int DEFAULT_MAX_CHISEL_AND_HOUND_VERSION = 27;
    public static final String DEFAULT_HOME_BRAND = "Declaration Grooming";

    static final List<String> DEFAULT_HOME_BRAND_TOKENS = List.of("declaration", "\\bdg\\b");

    static final List<String> DEFAULT_COMPETING_BRAND_TOKENS = List.of(
            "\\bzenith\\b",
            "\\bomega\\b",
            "\\bsemogue\\b",
            "\\bsimpsons?\\b",
            "\\bchisel\\b",
            "\\bc\\s*&\\s*h\\b",
            "\\bc(?:and|\\+)h\\b",
            "wolf\\s*whiskers?",
            "\\bdogwood\\b",
            "\\bmaggard\\b",
            "m[uü]hle",
            "\\byaqi\\b",
            "\\bap\\s*shave\\b",
            "\\balpha\\b",
            "\\bstirling\\b",
            "\\bpaladin\\b");

    private final int minChiselAndHoundVersion;
    private final int maxChiselAndHoundVersion;
    private final String homeBrand;
    private final List<Pattern> homeBrandTokens;
    private final List<Pattern> competingBrandTokens;
    private final ScoringWeights scoringWeights;
    private final CacheConfig cacheConfig;

    private MatcherOptions(Builder builder) {
        this.minChiselAndHoundVersion = builder.minChiselAndHoundVersion;
        this.maxChiselAndHoundVersion = builder.maxChiselAndHoundVersion;
        this.homeBrand = builder.homeBrand;
        this.homeBrandTokens = compileAll(builder.homeBrandTokens);
        this.competingBrandTokens = compileAll(builder.competingBrandTokens);
        this.scoringWeights = builder.scoringWeights;
        this.cacheConfig = builder.cacheConfig;
    }

    public int getMinChiselAndHoundVersion() {
        return minChiselAndHoundVersion;
    }

    public int getMaxChiselAndHoundVersion() {
        return maxChiselAndHoundVersion;
    }

    public String getHomeBrand() {
        return homeBrand;
    }

    /**
     * Tokens that name the home brand; a bare model code without one is reported as an alias match.
     */
    public List<Pattern> getHomeBrandTokens() {
        return homeBrandTokens;
    }

    /**
     * Tokens that name another brand and so suppress the home-brand default.
     */
    public List<Pattern> getCompetingBrandTokens() {
        return competingBrandTokens;
    }

    public ScoringWeights getScoringWeights() {
        return scoringWeights;
    }

    public CacheConfig getCacheConfig() {
        return cacheConfig;
    }

    public static MatcherOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static List<Pattern> compileAll(List<String> sources) {
        return sources.stream()
                .map(source -> Pattern.compile(source, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE))
                .toList();
    }

    public static class Builder {
        private int minChiselAndHoundVersion = DEFAULT_MIN_CHISEL_AND_HOUND_VERSION;
        private int maxChiselAndHoundVersion = DEFAULT_MAX_CHISEL_AND_HOUND_VERSION;
        private String homeBrand = DEFAULT_HOME_BRAND;
        private List<String> homeBrandTokens = DEFAULT_HOME_BRAND_TOKENS;
        private List<String> competingBrandTokens = DEFAULT_COMPETING_BRAND_TOKENS;
        private ScoringWeights scoringWeights = ScoringWeights.defaults();
        private CacheConfig cacheConfig = CacheConfig.disabled();

        /**
         * Inclusive range of accepted Chisel &amp; Hound version numbers.
         */
        public Builder chiselAndHoundVersions(int min, int max) {
            if (min < 0 || max < min) {
                throw new IllegalArgumentException("version range must satisfy 0 <= min <= max");
            }
            this.minChiselAndHoundVersion = min;
            this.maxChiselAndHoundVersion = max;
            return this;
        }

        public Builder homeBrand(String homeBrand) {
            if (homeBrand == null || homeBrand.isBlank()) {
                throw new IllegalArgumentException("homeBrand must not be blank");
            }
            this.homeBrand = homeBrand;
            return this;
        }

        public Builder homeBrandTokens(List<String> tokens) {
            this.homeBrandTokens = validatePatterns(tokens, "homeBrandTokens");
            return this;
        }

        public Builder competingBrandTokens(List<String> tokens) {
            this.competingBrandTokens = validatePatterns(tokens, "competingBrandTokens");
            return this;
        }

        public Builder scoringWeights(ScoringWeights scoringWeights) {
            if (scoringWeights == null) {
                throw new IllegalArgumentException("scoringWeights must not be null");
            }
            this.scoringWeights = scoringWeights;
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            if (cacheConfig == null) {
                throw new IllegalArgumentException("cacheConfig must not be null");
            }
            this.cacheConfig = cacheConfig;
            return this;
        }

        public MatcherOptions build() {
            return new MatcherOptions(this);
        }

        private static List<String> validatePatterns(List<String> tokens, String name) {
            if (tokens == null) {
                throw new IllegalArgumentException(name + " must not be null");
            }
            for (String token : tokens) {
                try {
                    Pattern.compile(token);
                } catch (PatternSyntaxException e) {
                    throw new IllegalArgumentException(name + " contains an invalid pattern: " + token, e);
                }
            }
            return List.copyOf(tokens);
        }
    }

    @Override
    public String toString() {
        return "MatcherOptions{" +
                "chiselAndHoundVersions=" + minChiselAndHoundVersion + ".." + maxChiselAndHoundVersion +
                ", homeBrand='" + homeBrand + '\'' +
                ", homeBrandTokens=" + homeBrandTokens.size() +
                ", competingBrandTokens=" + competingBrandTokens.size() +
                ", scoringWeights=" + scoringWeights +
                ", cacheConfig=" + cacheConfig +
                '}';
    }
}
