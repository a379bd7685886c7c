package com.partnerlink.model;

import java.util.Objects;

/**
 * A partner paired with its similarity score against one query.
 *
 * @param partner      reference into the directory snapshot the index was built from
 * @param score        similarity score in [0.0, 1.0]
 * @param matchKind    how the candidate was found
 * @param matchedField the name field that produced the winning score
 */
public record MatchCandidate(PartnerRecord partner, double score, MatchKind matchKind, String matchedField) {

    public static final String IDENTIFIER_FIELD = "corporate_number";

    public MatchCandidate {
        Objects.requireNonNull(partner, "partner");
        Objects.requireNonNull(matchKind, "matchKind");
        if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("score must be within [0, 1]: " + score);
        }
    }

    public static MatchCandidate identifierHit(PartnerRecord partner) {
        return new MatchCandidate(partner, 1.0, MatchKind.IDENTIFIER_EXACT, IDENTIFIER_FIELD);
    }
}
