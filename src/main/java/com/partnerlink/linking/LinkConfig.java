package com.partnerlink.linking;

import com.partnerlink.exception.ConfigurationException;

import java.util.Locale;

/**
 * Thresholds and policy for turning ranked candidates into a proposal.
 * Invariant: {@code autoLinkThreshold >= suggestThreshold}, both within [0, 1].
 */
public final class LinkConfig {

    public static final double DEFAULT_AUTO_LINK_THRESHOLD = 0.9;
    public static final double DEFAULT_SUGGEST_THRESHOLD = 0.6;

    private final double autoLinkThreshold;
    private final double suggestThreshold;
    private final boolean createNewIfNoMatch;

    private LinkConfig(double autoLinkThreshold, double suggestThreshold, boolean createNewIfNoMatch) {
        this.autoLinkThreshold = autoLinkThreshold;
        this.suggestThreshold = suggestThreshold;
        this.createNewIfNoMatch = createNewIfNoMatch;
    }

    public static LinkConfig defaults() {
        return new LinkConfig(DEFAULT_AUTO_LINK_THRESHOLD, DEFAULT_SUGGEST_THRESHOLD, true);
    }

    public static Builder builder() {
        return new Builder();
    }

    public double getAutoLinkThreshold() {
        return autoLinkThreshold;
    }

    public double getSuggestThreshold() {
        return suggestThreshold;
    }

    public boolean isCreateNewIfNoMatch() {
        return createNewIfNoMatch;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "LinkConfig{autoLink=%.2f, suggest=%.2f, createNewIfNoMatch=%s}",
                autoLinkThreshold, suggestThreshold, createNewIfNoMatch);
    }

    public static class Builder {
        private double autoLinkThreshold = DEFAULT_AUTO_LINK_THRESHOLD;
        private double suggestThreshold = DEFAULT_SUGGEST_THRESHOLD;
        private boolean createNewIfNoMatch = true;

        public Builder autoLinkThreshold(double autoLinkThreshold) {
            this.autoLinkThreshold = autoLinkThreshold;
            return this;
        }

        public Builder suggestThreshold(double suggestThreshold) {
            this.suggestThreshold = suggestThreshold;
            return this;
        }

        public Builder createNewIfNoMatch(boolean createNewIfNoMatch) {
            this.createNewIfNoMatch = createNewIfNoMatch;
            return this;
        }

        public LinkConfig build() {
            checkUnitInterval("autoLinkThreshold", autoLinkThreshold);
            checkUnitInterval("suggestThreshold", suggestThreshold);
            if (autoLinkThreshold < suggestThreshold) {
                throw new ConfigurationException("autoLinkThreshold must not be below suggestThreshold",
                        autoLinkThreshold + " < " + suggestThreshold);
            }
            return new LinkConfig(autoLinkThreshold, suggestThreshold, createNewIfNoMatch);
        }

        private static void checkUnitInterval(String name, double value) {
            if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
                throw new ConfigurationException(name + " must be within [0, 1]", String.valueOf(value));
            }
        }
    }
}
