package com.partnerlink.util.names;

/**
 * Jaro-Winkler similarity with a plain prefix boost.
 *
 * <p>Unlike the library comparators this variant always applies the prefix boost
 * (no 0.7 boost threshold) and uses a match window of {@code max(len) / 2 - 1}.
 * Inputs are compared as given; callers normalize first.
 */
public final class JaroWinkler {

    private static final int MAX_PREFIX = 4;
    private static final double PREFIX_SCALE = 0.1;

    private JaroWinkler() {
    }

    /**
     * @return similarity in [0.0, 1.0]; 0.0 if either side is empty or nothing matches, 1.0 if equal
     */
    public static double similarity(String s1, String s2) {
        if (s1 == null || s2 == null || s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }

        int len1 = s1.length();
        int len2 = s2.length();
        int matchDistance = Math.max(0, Math.max(len1, len2) / 2 - 1);

        boolean[] s1Matches = new boolean[len1];
        boolean[] s2Matches = new boolean[len2];

        int matches = 0;
        for (int i = 0; i < len1; i++) {
            int start = Math.max(0, i - matchDistance);
            int end = Math.min(i + matchDistance + 1, len2);
            for (int j = start; j < end; j++) {
                if (s2Matches[j] || s1.charAt(i) != s2.charAt(j)) {
                    continue;
                }
                s1Matches[i] = true;
                s2Matches[j] = true;
                matches++;
                break;
            }
        }

        if (matches == 0) {
            return 0.0;
        }

        int transpositions = 0;
        int k = 0;
        for (int i = 0; i < len1; i++) {
            if (!s1Matches[i]) {
                continue;
            }
            while (!s2Matches[k]) {
                k++;
            }
            if (s1.charAt(i) != s2.charAt(k)) {
                transpositions++;
            }
            k++;
        }

        double m = matches;
        double jaro = (m / len1 + m / len2 + (m - transpositions / 2.0) / m) / 3.0;

        int prefix = 0;
        int prefixLimit = Math.min(MAX_PREFIX, Math.min(len1, len2));
        while (prefix < prefixLimit && s1.charAt(prefix) == s2.charAt(prefix)) {
            prefix++;
        }

        return Math.min(1.0, jaro + prefix * PREFIX_SCALE * (1.0 - jaro));
    }
}
