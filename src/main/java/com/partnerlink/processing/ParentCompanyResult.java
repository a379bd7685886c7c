package com.partnerlink.processing;

import com.partnerlink.model.ConfidenceBand;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of resolving a transaction name to the legal entity operating it,
 * e.g. "トイザラス熊本店" to "日本トイザらス株式会社".
 *
 * @param originalName  the name as it appeared on the transaction
 * @param parentCompany the resolved legal entity name, empty when it could not be determined
 * @param confidence    how sure the resolver is
 * @param reasoning     why the resolver decided so
 * @param individual    whether the counterparty is likely a sole proprietor
 * @param notes         free-form additional information
 */
public record ParentCompanyResult(String originalName,
                                  Optional<String> parentCompany,
                                  ConfidenceBand confidence,
                                  String reasoning,
                                  boolean individual,
                                  String notes) {

    public ParentCompanyResult {
        Objects.requireNonNull(parentCompany, "parentCompany");
        Objects.requireNonNull(confidence, "confidence");
        reasoning = reasoning == null ? "" : reasoning;
        notes = notes == null ? "" : notes;
    }

    public static ParentCompanyResult resolved(String originalName, String parentCompany,
                                               ConfidenceBand confidence, String reasoning) {
        return new ParentCompanyResult(originalName, Optional.of(parentCompany), confidence, reasoning, false, "");
    }

    public static ParentCompanyResult unresolved(String originalName, String reasoning) {
        return new ParentCompanyResult(originalName, Optional.empty(), ConfidenceBand.UNKNOWN, reasoning, false, "");
    }

    public boolean isResolved() {
        return parentCompany.filter(name -> !name.isBlank()).isPresent();
    }
}
