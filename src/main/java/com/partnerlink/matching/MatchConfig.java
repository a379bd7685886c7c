package com.partnerlink.matching;

import com.partnerlink.exception.ConfigurationException;

import java.util.Locale;

/**
 * Ranking configuration. Use {@link #defaults()} for the standard settings or
 * {@link #builder()} to customize; invalid values are rejected when building.
 */
public final class MatchConfig {

    public static final double DEFAULT_MIN_SCORE = 0.6;
    public static final int DEFAULT_MAX_CANDIDATES = 5;
    public static final double DEFAULT_EXACT_MATCH_BOOST = 0.3;

    private final double minScore;
    private final int maxCandidates;
    private final double exactMatchBoost;

    private MatchConfig(double minScore, int maxCandidates, double exactMatchBoost) {
        this.minScore = minScore;
        this.maxCandidates = maxCandidates;
        this.exactMatchBoost = exactMatchBoost;
    }

    public static MatchConfig defaults() {
        return new MatchConfig(DEFAULT_MIN_SCORE, DEFAULT_MAX_CANDIDATES, DEFAULT_EXACT_MATCH_BOOST);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Candidates scoring below this value are dropped.
     */
    public double getMinScore() {
        return minScore;
    }

    /**
     * Upper bound on the length of a ranked list.
     */
    public int getMaxCandidates() {
        return maxCandidates;
    }

    /**
     * Added to a field score when the normalized field equals the normalized query.
     */
    public double getExactMatchBoost() {
        return exactMatchBoost;
    }

    public Builder toBuilder() {
        return new Builder()
                .minScore(minScore)
                .maxCandidates(maxCandidates)
                .exactMatchBoost(exactMatchBoost);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "MatchConfig{minScore=%.2f, maxCandidates=%d, exactMatchBoost=%.2f}",
                minScore, maxCandidates, exactMatchBoost);
    }

    public static class Builder {
        private double minScore = DEFAULT_MIN_SCORE;
        private int maxCandidates = DEFAULT_MAX_CANDIDATES;
        private double exactMatchBoost = DEFAULT_EXACT_MATCH_BOOST;

        public Builder minScore(double minScore) {
            this.minScore = minScore;
            return this;
        }

        public Builder maxCandidates(int maxCandidates) {
            this.maxCandidates = maxCandidates;
            return this;
        }

        public Builder exactMatchBoost(double exactMatchBoost) {
            this.exactMatchBoost = exactMatchBoost;
            return this;
        }

        public MatchConfig build() {
            if (Double.isNaN(minScore) || minScore < 0.0 || minScore > 1.0) {
                throw new ConfigurationException("minScore must be within [0, 1]", String.valueOf(minScore));
            }
            if (maxCandidates <= 0) {
                throw new ConfigurationException("maxCandidates must be positive", String.valueOf(maxCandidates));
            }
            if (!Double.isFinite(exactMatchBoost) || exactMatchBoost < 0.0) {
                throw new ConfigurationException("exactMatchBoost must be a non-negative number", String.valueOf(exactMatchBoost));
            }
            return new MatchConfig(minScore, maxCandidates, exactMatchBoost);
        }
    }
}
