package com.singkhmer.service;

import org.apache.commons.text.similarity.LevenshteinDistance;

/**
 * Levenshtein distance between romanized keys.
 * Unit cost for insertion, deletion and substitution; null is treated as "".
 */
public final class EditDistance {

    private static final LevenshteinDistance UNBOUNDED = LevenshteinDistance.getDefaultInstance();

    // LevenshteinDistance is immutable, so small thresholds share one instance each
    private static final int CACHED_THRESHOLDS = 8;
    private static final LevenshteinDistance[] BOUNDED = new LevenshteinDistance[CACHED_THRESHOLDS + 1];
    static {
        for (int i = 0; i <= CACHED_THRESHOLDS; i++) {
            BOUNDED[i] = new LevenshteinDistance(i);
        }
    }

    private EditDistance() {}

    /**
     * Full edit distance between {@code a} and {@code b}.
     * {@code distance("", s) == s.length()}, symmetric, zero only for equal sequences.
     */
    public static int distance(String a, String b) {
        return UNBOUNDED.apply(nullToEmpty(a), nullToEmpty(b));
    }

    /**
     * Bounded edit distance. Returns the distance when it is at most {@code maxDistance},
     * otherwise -1. Negative thresholds never match.
     */
    public static int within(String a, String b, int maxDistance) {
        if (maxDistance < 0) return -1;
        return calculator(maxDistance).apply(nullToEmpty(a), nullToEmpty(b));
    }

    static LevenshteinDistance calculator(int maxDistance) {
        return maxDistance <= CACHED_THRESHOLDS ? BOUNDED[maxDistance] : new LevenshteinDistance(maxDistance);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
