package com.partnerlink.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A canonical directory entry (a registered counterparty).
 *
 * <p>Instances are immutable. The alias list keeps the order in which the fields
 * should be searched after the canonical name; duplicate values across fields are kept.
 */
public final class PartnerRecord {

    private final String id;
    private final String canonicalName;
    private final List<NameField> aliases;
    private final String externalIdentifier;

    public PartnerRecord(String id, String canonicalName, List<NameField> aliases, String externalIdentifier) {
        this.id = Objects.requireNonNull(id, "id");
        this.canonicalName = canonicalName;
        this.aliases = aliases == null ? List.of() : List.copyOf(aliases);
        this.externalIdentifier = externalIdentifier == null || externalIdentifier.trim().isEmpty()
                ? null
                : externalIdentifier.trim();
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public String getId() {
        return id;
    }

    public String getCanonicalName() {
        return canonicalName;
    }

    public List<NameField> getAliases() {
        return aliases;
    }

    public Optional<String> getExternalIdentifier() {
        return Optional.ofNullable(externalIdentifier);
    }

    /**
     * Returns the populated name fields in search priority order: the canonical name first,
     * then the aliases as declared.
     */
    public List<NameField> nameFields() {
        List<NameField> fields = new ArrayList<>(aliases.size() + 1);
        NameField canonical = new NameField(NameField.CANONICAL, canonicalName);
        if (!canonical.isBlank()) {
            fields.add(canonical);
        }
        for (NameField alias : aliases) {
            if (!alias.isBlank()) {
                fields.add(alias);
            }
        }
        return Collections.unmodifiableList(fields);
    }

    public boolean hasAnyName() {
        return !nameFields().isEmpty();
    }

    /**
     * Name to show in reports; falls back to the first alias when the canonical name is blank.
     */
    public String displayName() {
        List<NameField> fields = nameFields();
        return fields.isEmpty() ? "" : fields.get(0).value();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PartnerRecord)) return false;
        PartnerRecord that = (PartnerRecord) o;
        return id.equals(that.id)
                && Objects.equals(canonicalName, that.canonicalName)
                && aliases.equals(that.aliases)
                && Objects.equals(externalIdentifier, that.externalIdentifier);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, canonicalName, aliases, externalIdentifier);
    }

    @Override
    public String toString() {
        return "PartnerRecord{id=" + id + ", name=" + canonicalName
                + ", aliases=" + aliases.size()
                + (externalIdentifier != null ? ", corporateNumber=" + externalIdentifier : "") + "}";
    }

    public static class Builder {
        private final String id;
        private String canonicalName;
        private final List<NameField> aliases = new ArrayList<>();
        private String externalIdentifier;

        private Builder(String id) {
            this.id = id;
        }

        public Builder canonicalName(String canonicalName) {
            this.canonicalName = canonicalName;
            return this;
        }

        /**
         * Appends an alias; blank values are ignored.
         */
        public Builder alias(String field, String value) {
            NameField alias = new NameField(field, value);
            if (!alias.isBlank()) {
                this.aliases.add(alias);
            }
            return this;
        }

        public Builder longName(String longName) {
            return alias(NameField.LONG_NAME, longName);
        }

        public Builder shortcut1(String shortcut) {
            return alias(NameField.SHORTCUT1, shortcut);
        }

        public Builder shortcut2(String shortcut) {
            return alias(NameField.SHORTCUT2, shortcut);
        }

        public Builder externalIdentifier(String externalIdentifier) {
            this.externalIdentifier = externalIdentifier;
            return this;
        }

        public PartnerRecord build() {
            return new PartnerRecord(id, canonicalName, aliases, externalIdentifier);
        }
    }
}
