package com.partnerlink.model;

import java.util.Objects;

/**
 * One name-bearing attribute of a partner.
 *
 * @param field the source attribute name, e.g. {@code name}, {@code long_name} or {@code shortcut1}
 * @param value the raw name value as it appears in the directory
 */
public record NameField(String field, String value) {

    public static final String CANONICAL = "name";
    public static final String LONG_NAME = "long_name";
    public static final String SHORTCUT1 = "shortcut1";
    public static final String SHORTCUT2 = "shortcut2";

    public NameField {
        Objects.requireNonNull(field, "field");
    }

    public boolean isBlank() {
        return value == null || value.trim().isEmpty();
    }
}
