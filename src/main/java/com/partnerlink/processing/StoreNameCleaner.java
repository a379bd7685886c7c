package com.partnerlink.processing;

import com.partnerlink.matching.NameNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns a store or branch name from a statement into a search key for the operating company,
 * e.g. "トイザラス熊本店" to "トイザラス熊本".
 *
 * <p>The name is normalized, digits are dropped, and the text is cut before the first
 * store keyword found (keywords are tried in file order, see {@code store_keywords.txt}).
 */
public class StoreNameCleaner {

    private static final Logger logger = LoggerFactory.getLogger(StoreNameCleaner.class);

    private static final String STORE_KEYWORDS = "/store_keywords.txt";

    private final List<String> keywords;

    public StoreNameCleaner() {
        this(loadKeywords(STORE_KEYWORDS));
    }

    public StoreNameCleaner(List<String> keywords) {
        List<String> normalized = new ArrayList<>();
        for (String keyword : keywords) {
            String value = NameNormalizer.normalize(keyword);
            if (!value.isEmpty()) {
                normalized.add(value);
            }
        }
        this.keywords = List.copyOf(normalized);
    }

    private static List<String> loadKeywords(String resourcePath) {
        List<String> loaded = new ArrayList<>();
        InputStream is = StoreNameCleaner.class.getResourceAsStream(resourcePath);
        if (is == null) {
            logger.warn("Store keyword file not found: {}", resourcePath);
            return loaded;
        }

        try (BufferedReader reader = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty() || line.startsWith("#")) {
                    continue;
                }
                loaded.add(line);
            }
            logger.info("Loaded {} store keywords from {}", loaded.size(), resourcePath);

        } catch (IOException e) {
            throw new RuntimeException("Failed to load store keywords from " + resourcePath, e);
        }
        return loaded;
    }

    /**
     * @param storeName raw name from a statement, may be null
     * @return the cleaned search key; empty when nothing usable is left
     */
    public String clean(String storeName) {
        String cleaned = NameNormalizer.normalize(storeName).replaceAll("\\d+", "");

        for (String keyword : keywords) {
            int position = cleaned.indexOf(keyword);
            if (position > 0) {
                cleaned = cleaned.substring(0, position);
                break;
            }
        }
        return cleaned;
    }

    public List<String> getKeywords() {
        return keywords;
    }
}
