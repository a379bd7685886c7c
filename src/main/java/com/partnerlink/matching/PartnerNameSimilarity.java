package com.partnerlink.matching;

import com.partnerlink.util.names.JaroWinkler;
import org.apache.commons.text.similarity.LevenshteinDistance;

/**
 * Similarity metrics between partner names. Every method normalizes both inputs
 * with {@link NameNormalizer} before comparing.
 */
public class PartnerNameSimilarity {

    private static final double CONTAINMENT_BASE = 0.7;
    private static final double CONTAINMENT_RANGE = 0.3;

    private final LevenshteinDistance levenshtein;

    public PartnerNameSimilarity() {
        this.levenshtein = LevenshteinDistance.getDefaultInstance();
    }

    /**
     * Edit-distance similarity: {@code 1 - distance / max(len)}, floored at 0.
     * Empty on either side yields 0.0, equal strings yield exactly 1.0.
     */
    public double editDistanceSimilarity(String name1, String name2) {
        return editDistance(NameNormalizer.normalize(name1), NameNormalizer.normalize(name2));
    }

    /**
     * Prefix-weighted (Jaro-Winkler) similarity of the normalized names.
     */
    public double jaroWinkler(String name1, String name2) {
        return JaroWinkler.similarity(NameNormalizer.normalize(name1), NameNormalizer.normalize(name2));
    }

    /**
     * General-purpose similarity used for final scoring and by the reporting path.
     * If one normalized name contains the other, returns {@code 0.7 + 0.3 * shorter / longer}
     * in place of the edit-distance similarity.
     */
    public double generalSimilarity(String name1, String name2) {
        return general(NameNormalizer.normalize(name1), NameNormalizer.normalize(name2));
    }

    /**
     * Plain mean of edit-distance and Jaro-Winkler similarity, without the containment rule.
     * Kept separate from {@link #generalSimilarity(String, String)}: the two are not interchangeable.
     */
    public double blendedSimilarity(String name1, String name2) {
        String norm1 = NameNormalizer.normalize(name1);
        String norm2 = NameNormalizer.normalize(name2);
        return (editDistance(norm1, norm2) + JaroWinkler.similarity(norm1, norm2)) / 2.0;
    }

    /**
     * Score of one partner name field against a query: the mean of the general similarity and
     * Jaro-Winkler, plus {@code exactMatchBoost} when the normalized values are equal, capped at 1.0.
     */
    public double fieldScore(String query, String fieldValue, double exactMatchBoost) {
        return normalizedFieldScore(NameNormalizer.normalize(query), NameNormalizer.normalize(fieldValue), exactMatchBoost);
    }

    /**
     * Same as {@link #fieldScore(String, String, double)} for inputs that are already normalized.
     */
    double normalizedFieldScore(String normalizedQuery, String normalizedField, double exactMatchBoost) {
        double score = (general(normalizedQuery, normalizedField)
                + JaroWinkler.similarity(normalizedQuery, normalizedField)) / 2.0;
        if (!normalizedField.isEmpty() && normalizedField.equals(normalizedQuery)) {
            score = Math.min(1.0, score + exactMatchBoost);
        }
        return score;
    }

    private double general(String norm1, String norm2) {
        if (norm1.isEmpty() || norm2.isEmpty()) {
            return 0.0;
        }
        if (norm1.equals(norm2)) {
            return 1.0;
        }
        if (norm1.contains(norm2) || norm2.contains(norm1)) {
            int shorter = Math.min(norm1.length(), norm2.length());
            int longer = Math.max(norm1.length(), norm2.length());
            return CONTAINMENT_BASE + CONTAINMENT_RANGE * ((double) shorter / longer);
        }
        return editDistance(norm1, norm2);
    }

    private double editDistance(String norm1, String norm2) {
        if (norm1.isEmpty() || norm2.isEmpty()) {
            return 0.0;
        }
        if (norm1.equals(norm2)) {
            return 1.0;
        }
        int distance = levenshtein.apply(norm1, norm2);
        int maxLength = Math.max(norm1.length(), norm2.length());
        return Math.max(0.0, 1.0 - ((double) distance / maxLength));
    }
}
