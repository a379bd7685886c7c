package com.partnerlink.matching;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.partnerlink.utils.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Removes legal-entity-form tokens (株式会社, ㈱, "limited", ...) from compacted names.
 * Loads the token list once from {@code legal_forms.json} and {@code addition_legal_forms.txt}.
 *
 * <p>Tokens are stored in the same compacted form {@link NameNormalizer} produces
 * (folded, lower-cased, separators stripped) and are matched anywhere in the string,
 * not only as prefix or suffix.
 */
public class LegalFormCleaner {

    private static final Logger logger = LoggerFactory.getLogger(LegalFormCleaner.class);

    private static final String LEGAL_FORMS_JSON = "legal_forms.json";
    private static final String ADDITIONAL_LEGAL_FORMS = "addition_legal_forms.txt";

    // longest first, so that 株式会社 is removed before 株
    private static final List<String> legalForms;

    static {
        Set<String> loaded = new LinkedHashSet<>();
        loadFromJsonFile(loaded);
        loadFromTextFile(loaded);
        List<String> sorted = new ArrayList<>(loaded);
        sorted.sort(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()));
        legalForms = List.copyOf(sorted);
        logger.info("Loaded {} legal forms from resource files", legalForms.size());
    }

    private LegalFormCleaner() {
    }

    private static void loadFromJsonFile(Set<String> target) {
        try (InputStream is = LegalFormCleaner.class.getClassLoader().getResourceAsStream(LEGAL_FORMS_JSON)) {
            if (is == null) {
                logger.warn("{} not found in resources", LEGAL_FORMS_JSON);
                return;
            }

            JsonNode rootNode = new ObjectMapper().readTree(is);
            int jsonEntries = 0;
            for (JsonNode node : rootNode) {
                jsonEntries += addForm(target, node.path("short_name").asText(null));
                jsonEntries += addForm(target, node.path("long_name").asText(null));
            }
            logger.debug("Loaded {} entries from {}", jsonEntries, LEGAL_FORMS_JSON);

        } catch (IOException e) {
            throw new RuntimeException("Failed to load " + LEGAL_FORMS_JSON, e);
        }
    }

    private static void loadFromTextFile(Set<String> target) {
        InputStream is = LegalFormCleaner.class.getClassLoader().getResourceAsStream(ADDITIONAL_LEGAL_FORMS);
        if (is == null) {
            logger.warn("{} not found in resources", ADDITIONAL_LEGAL_FORMS);
            return;
        }

        try (BufferedReader reader = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
            String line;
            int textEntries = 0;
            while ((line = reader.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty() || line.startsWith("#")) {
                    continue;
                }
                textEntries += addForm(target, line);
            }
            logger.debug("Loaded {} entries from {}", textEntries, ADDITIONAL_LEGAL_FORMS);

        } catch (IOException e) {
            throw new RuntimeException("Failed to load " + ADDITIONAL_LEGAL_FORMS, e);
        }
    }

    private static int addForm(Set<String> target, String raw) {
        if (raw == null || raw.equalsIgnoreCase("null")) {
            return 0;
        }
        String compacted = NameNormalizer.stripSeparators(Utils.lowerLatin(Utils.foldFullWidth(raw.trim())));
        if (compacted.isEmpty()) {
            return 0;
        }
        return target.add(compacted) ? 1 : 0;
    }

    /**
     * Removes every legal form occurrence from an already compacted name. After each removal the
     * scan restarts from the longest form, so a form exposed by a removal is removed whole.
     *
     * @param compactedName folded, lower-cased name without separators
     * @return the name without legal forms, or an empty string for null input
     */
    public static String removeLegalForms(String compactedName) {
        if (compactedName == null || compactedName.isEmpty()) {
            return "";
        }

        String result = compactedName;
        boolean removed;
        do {
            removed = false;
            for (String legalForm : legalForms) {
                if (result.contains(legalForm)) {
                    result = result.replace(legalForm, "");
                    removed = true;
                    break;
                }
            }
        } while (removed && !result.isEmpty());

        return result;
    }

    static int getLegalFormsCount() {
        return legalForms.size();
    }

    /**
     * Whether {@code form}, compacted like a name, is one of the loaded forms.
     */
    static boolean isLegalForm(String form) {
        if (form == null) {
            return false;
        }
        String compacted = NameNormalizer.stripSeparators(Utils.lowerLatin(Utils.foldFullWidth(form.trim())));
        return legalForms.contains(compacted);
    }
}
