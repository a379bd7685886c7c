package com.partnerlink.matching;

import com.partnerlink.model.NameField;
import com.partnerlink.model.PartnerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only lookup structures over one directory snapshot.
 *
 * <p>The index only references the records it was built from and never observes later
 * changes; rebuild it whenever the snapshot changes. Once built it is safe for
 * concurrent reads without locking.
 */
public final class PartnerIndex {

    private static final Logger logger = LoggerFactory.getLogger(PartnerIndex.class);

    private final List<PartnerRecord> partners;
    private final Map<String, List<PartnerRecord>> nameIndex;
    private final Map<String, PartnerRecord> identifierIndex;
    private final Map<String, List<NormalizedField>> normalizedFields;
    private final IndexStats stats;

    /**
     * A name field paired with its normalized value, computed once at build time.
     */
    record NormalizedField(String field, String value, String normalized) {
    }

    private PartnerIndex(List<PartnerRecord> partners,
                         Map<String, List<PartnerRecord>> nameIndex,
                         Map<String, PartnerRecord> identifierIndex,
                         Map<String, List<NormalizedField>> normalizedFields,
                         int excluded) {
        this.partners = partners;
        this.nameIndex = nameIndex;
        this.identifierIndex = identifierIndex;
        this.normalizedFields = normalizedFields;

        int withIdentifier = (int) partners.stream().filter(p -> p.getExternalIdentifier().isPresent()).count();
        this.stats = new IndexStats(partners.size(), withIdentifier, partners.size() - withIdentifier, excluded);
    }

    /**
     * Builds the index in a single pass over all name fields.
     * Records without any name, and records repeating an earlier id, are excluded with a warning.
     */
    public static PartnerIndex build(Collection<PartnerRecord> snapshot) {
        List<PartnerRecord> kept = new ArrayList<>();
        Map<String, List<PartnerRecord>> nameIndex = new HashMap<>();
        Map<String, PartnerRecord> identifierIndex = new HashMap<>();
        Map<String, List<NormalizedField>> normalizedFields = new LinkedHashMap<>();
        Set<String> seenIds = new HashSet<>();
        int excluded = 0;

        if (snapshot == null) {
            snapshot = List.of();
        }

        for (PartnerRecord partner : snapshot) {
            if (partner == null) {
                excluded++;
                continue;
            }
            if (!partner.hasAnyName()) {
                logger.warn("Excluding partner {} from index: no name field populated", partner.getId());
                excluded++;
                continue;
            }
            if (!seenIds.add(partner.getId())) {
                logger.warn("Excluding partner {} from index: duplicate id", partner.getId());
                excluded++;
                continue;
            }

            List<NormalizedField> fields = new ArrayList<>();
            Set<String> indexedNames = new HashSet<>();
            for (NameField field : partner.nameFields()) {
                String normalized = NameNormalizer.normalize(field.value());
                fields.add(new NormalizedField(field.field(), field.value(), normalized));
                // once per partner, even when several fields normalize alike
                if (!normalized.isEmpty() && indexedNames.add(normalized)) {
                    nameIndex.computeIfAbsent(normalized, k -> new ArrayList<>()).add(partner);
                }
            }

            partner.getExternalIdentifier().ifPresent(identifier -> {
                PartnerRecord previous = identifierIndex.putIfAbsent(identifier, partner);
                if (previous != null) {
                    logger.warn("Corporate number {} shared by partners {} and {}; keeping {}",
                            identifier, previous.getId(), partner.getId(), previous.getId());
                }
            });

            normalizedFields.put(partner.getId(), List.copyOf(fields));
            kept.add(partner);
        }

        Map<String, List<PartnerRecord>> frozenNames = new HashMap<>();
        nameIndex.forEach((key, value) -> frozenNames.put(key, List.copyOf(value)));

        PartnerIndex index = new PartnerIndex(
                Collections.unmodifiableList(kept),
                Collections.unmodifiableMap(frozenNames),
                Collections.unmodifiableMap(identifierIndex),
                Collections.unmodifiableMap(normalizedFields),
                excluded);

        logger.info("Built partner index: {} partners ({} with corporate number), {} normalized names, {} excluded",
                index.stats.totalPartners(), index.stats.withIdentifier(), frozenNames.size(), excluded);
        return index;
    }

    /**
     * Partners in snapshot order; this order is the tie-break for equal ranking scores.
     */
    public List<PartnerRecord> partners() {
        return partners;
    }

    public Optional<PartnerRecord> findByIdentifier(String identifier) {
        if (identifier == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(identifierIndex.get(identifier.trim()));
    }

    /**
     * Partners having any name field that normalizes to the same text as {@code name}.
     */
    public List<PartnerRecord> findByNormalizedName(String name) {
        return nameIndex.getOrDefault(NameNormalizer.normalize(name), List.of());
    }

    public IndexStats stats() {
        return stats;
    }

    public int size() {
        return partners.size();
    }

    List<NormalizedField> normalizedFields(PartnerRecord partner) {
        return normalizedFields.getOrDefault(partner.getId(), List.of());
    }
}
