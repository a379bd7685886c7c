package com.partnerlink.config;

import com.partnerlink.exception.ConfigurationException;
import com.partnerlink.linking.LinkConfig;
import com.partnerlink.matching.MatchConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

/**
 * Matching and linking configuration read from {@code partner-link.properties} on the classpath.
 * Keys that are absent keep their defaults.
 */
public final class PartnerLinkSettings {

    private static final Logger logger = LoggerFactory.getLogger(PartnerLinkSettings.class);

    public static final String DEFAULT_RESOURCE = "/partner-link.properties";

    static final String MIN_SCORE = "matching.min-score";
    static final String MAX_CANDIDATES = "matching.max-candidates";
    static final String EXACT_MATCH_BOOST = "matching.exact-match-boost";
    static final String AUTO_LINK_THRESHOLD = "linking.auto-link-threshold";
    static final String SUGGEST_THRESHOLD = "linking.suggest-threshold";
    static final String CREATE_NEW_IF_NO_MATCH = "linking.create-new-if-no-match";

    private final MatchConfig matchConfig;
    private final LinkConfig linkConfig;

    private PartnerLinkSettings(MatchConfig matchConfig, LinkConfig linkConfig) {
        this.matchConfig = matchConfig;
        this.linkConfig = linkConfig;
    }

    public static PartnerLinkSettings load() {
        return load(DEFAULT_RESOURCE);
    }

    public static PartnerLinkSettings load(String resourcePath) {
        Properties properties = new Properties();
        InputStream is = PartnerLinkSettings.class.getResourceAsStream(resourcePath);
        if (is == null) {
            logger.debug("No {} on classpath, using defaults", resourcePath);
            return fromProperties(properties);
        }

        try (InputStreamReader reader = new InputStreamReader(is, StandardCharsets.UTF_8)) {
            properties.load(reader);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read settings", resourcePath, e);
        }
        logger.info("Loaded {} settings from {}", properties.size(), resourcePath);
        return fromProperties(properties);
    }

    public static PartnerLinkSettings fromProperties(Properties properties) {
        MatchConfig.Builder match = MatchConfig.builder();
        String value;
        if ((value = properties.getProperty(MIN_SCORE)) != null) {
            match.minScore(parseDouble(MIN_SCORE, value));
        }
        if ((value = properties.getProperty(MAX_CANDIDATES)) != null) {
            match.maxCandidates(parseInt(MAX_CANDIDATES, value));
        }
        if ((value = properties.getProperty(EXACT_MATCH_BOOST)) != null) {
            match.exactMatchBoost(parseDouble(EXACT_MATCH_BOOST, value));
        }

        LinkConfig.Builder link = LinkConfig.builder();
        if ((value = properties.getProperty(AUTO_LINK_THRESHOLD)) != null) {
            link.autoLinkThreshold(parseDouble(AUTO_LINK_THRESHOLD, value));
        }
        if ((value = properties.getProperty(SUGGEST_THRESHOLD)) != null) {
            link.suggestThreshold(parseDouble(SUGGEST_THRESHOLD, value));
        }
        if ((value = properties.getProperty(CREATE_NEW_IF_NO_MATCH)) != null) {
            link.createNewIfNoMatch(parseBoolean(CREATE_NEW_IF_NO_MATCH, value));
        }

        return new PartnerLinkSettings(match.build(), link.build());
    }

    public MatchConfig getMatchConfig() {
        return matchConfig;
    }

    public LinkConfig getLinkConfig() {
        return linkConfig;
    }

    private static double parseDouble(String key, String value) {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid number for " + key, value, e);
        }
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid integer for " + key, value, e);
        }
    }

    private static boolean parseBoolean(String key, String value) {
        String trimmed = value.trim();
        if (trimmed.equalsIgnoreCase("true")) {
            return true;
        }
        if (trimmed.equalsIgnoreCase("false")) {
            return false;
        }
        throw new ConfigurationException("Invalid boolean for " + key, value);
    }
}
