package com.partnerlink.matching;

import com.partnerlink.utils.Utils;

import java.util.regex.Pattern;

/**
 * Canonicalizes raw partner names into a comparison-ready form.
 *
 * <ol>
 *     <li>full-width Latin letters and digits are folded to half-width</li>
 *     <li>Latin letters are lower-cased</li>
 *     <li>whitespace, hyphens, middle dots, periods, commas, parentheses and brackets are stripped</li>
 *     <li>legal-entity forms are removed wherever they occur</li>
 * </ol>
 *
 * The result is idempotent: {@code normalize(normalize(x)).equals(normalize(x))}.
 */
public final class NameNormalizer {

    private static final Pattern SEPARATORS =
            Pattern.compile("[\\s\\u3000\\-－‐・･．.。、,，（）()「」【】\\[\\]［］]+");

    private NameNormalizer() {
    }

    /**
     * @param text raw name, may be null
     * @return normalized name; empty for null or empty input
     */
    public static String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String folded = Utils.foldFullWidth(text);
        String lowered = Utils.lowerLatin(folded);
        String compacted = stripSeparators(lowered);
        return LegalFormCleaner.removeLegalForms(compacted);
    }

    static String stripSeparators(String text) {
        return SEPARATORS.matcher(text).replaceAll("");
    }
}
