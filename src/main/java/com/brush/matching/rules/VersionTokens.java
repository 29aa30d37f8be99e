package com.brush.matching.rules;

import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Model-version tokens used by knot makers, such as {@code V20} or {@code B15}.
 */
public final class VersionTokens {
    private static final Pattern V_VERSION = Pattern.compile("\\bv(\\d{1,2})\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern B_MODEL = Pattern.compile("\\bb\\d{1,2}[a-z]?\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern TWO_DIGIT_V = Pattern.compile("\\bv\\d{2}\\b", Pattern.CASE_INSENSITIVE);

    private VersionTokens() {
    }

    /**
     * Returns true if the text carries a {@code Vnn} or {@code Bn} model token.
     */
    public static boolean containsVersionToken(String text) {
        if (text == null) {
            return false;
        }
        return TWO_DIGIT_V.matcher(text).find() || B_MODEL.matcher(text).find();
    }

    /**
     * Returns the number of the first {@code Vn} token, if present.
     */
    public static OptionalInt versionNumber(String text) {
        if (text == null) {
            return OptionalInt.empty();
        }
        Matcher matcher = V_VERSION.matcher(text);
        if (matcher.find()) {
            return OptionalInt.of(Integer.parseInt(matcher.group(1)));
        }
        return OptionalInt.empty();
    }
}
