package com.partnerlink.utils;

import java.util.Locale;

public class Utils {

    private static final char FULL_WIDTH_DIGIT_ZERO = '０';
    private static final char FULL_WIDTH_DIGIT_NINE = '９';
    private static final char FULL_WIDTH_UPPER_A = 'Ａ';
    private static final char FULL_WIDTH_UPPER_Z = 'Ｚ';
    private static final char FULL_WIDTH_LOWER_A = 'ａ';
    private static final char FULL_WIDTH_LOWER_Z = 'ｚ';
    private static final int FULL_WIDTH_OFFSET = 0xFEE0;

    private Utils() {
    }

    /**
     * Folds full-width Latin letters and digits (e.g. "ＡＢＣ１２３") to their
     * half-width ASCII equivalents. Every other character is left untouched,
     * including full-width punctuation and half-width katakana.
     *
     * @param input the text to fold, may be null
     * @return the folded text, or an empty string for null input
     */
    public static String foldFullWidth(String input) {
        if (input == null || input.isEmpty()) {
            return "";
        }
        StringBuilder folded = null;
        for (int i = 0; i < input.length(); i++) {
            char c = input.charAt(i);
            if (isFullWidthAlphanumeric(c)) {
                if (folded == null) {
                    folded = new StringBuilder(input.length());
                    folded.append(input, 0, i);
                }
                folded.append((char) (c - FULL_WIDTH_OFFSET));
            } else if (folded != null) {
                folded.append(c);
            }
        }
        return folded == null ? input : folded.toString();
    }

    /**
     * Lower-cases Latin letters without depending on the default locale.
     */
    public static String lowerLatin(String input) {
        return input == null ? "" : input.toLowerCase(Locale.ROOT);
    }

    public static boolean isBlank(String input) {
        return input == null || input.trim().isEmpty();
    }

    private static boolean isFullWidthAlphanumeric(char c) {
        return (c >= FULL_WIDTH_DIGIT_ZERO && c <= FULL_WIDTH_DIGIT_NINE)
                || (c >= FULL_WIDTH_UPPER_A && c <= FULL_WIDTH_UPPER_Z)
                || (c >= FULL_WIDTH_LOWER_A && c <= FULL_WIDTH_LOWER_Z);
    }
}
