package com.partnerlink.model;

/**
 * How a candidate was found.
 */
public enum MatchKind {
    IDENTIFIER_EXACT,  // corporate number lookup hit
    NAME_EXACT,        // best name score >= 0.95
    NAME_PARTIAL,      // best name score in [0.7, 0.95)
    NAME_SIMILAR;      // anything lower that still passed min score

    private static final double EXACT_FLOOR = 0.95;
    private static final double PARTIAL_FLOOR = 0.7;

    /**
     * Derives the kind of a name-based match from its score. Independent of the configured minimum score.
     */
    public static MatchKind fromNameScore(double score) {
        if (score >= EXACT_FLOOR) {
            return NAME_EXACT;
        }
        if (score >= PARTIAL_FLOOR) {
            return NAME_PARTIAL;
        }
        return NAME_SIMILAR;
    }
}
