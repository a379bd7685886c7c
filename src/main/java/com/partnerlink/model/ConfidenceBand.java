package com.partnerlink.model;

import java.util.Locale;

/**
 * Coarse label summarizing how trustworthy a proposal or a name resolution is.
 */
public enum ConfidenceBand {
    HIGH,
    MEDIUM,
    LOW,
    UNKNOWN;

    /**
     * Parses a label such as {@code "high"}; anything unrecognized maps to {@link #UNKNOWN}.
     */
    public static ConfidenceBand fromLabel(String label) {
        if (label == null) {
            return UNKNOWN;
        }
        try {
            return valueOf(label.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
