package com.partnerlink.linking;

import com.partnerlink.model.ConfidenceBand;
import com.partnerlink.model.PartnerRecord;

import java.util.Objects;
import java.util.Optional;

/**
 * The action recommended for one query. Immutable; consumers may only collect it.
 *
 * @param queryName          the name as it appeared on the transaction
 * @param resolvedName       canonical name found by name resolution, if any
 * @param externalIdentifier corporate number supplied with the query, if any
 * @param action             what to do
 * @param targetPartner      partner to link to; present exactly when {@code action == LINK}
 * @param score              score of the decisive candidate, 0.0 when there was none
 * @param confidenceBand     how trustworthy the proposal is
 * @param rationale          human-readable reason for the decision
 */
public record LinkProposal(String queryName,
                           Optional<String> resolvedName,
                           Optional<String> externalIdentifier,
                           LinkAction action,
                           Optional<PartnerRecord> targetPartner,
                           double score,
                           ConfidenceBand confidenceBand,
                           String rationale) {

    public LinkProposal {
        Objects.requireNonNull(resolvedName, "resolvedName");
        Objects.requireNonNull(externalIdentifier, "externalIdentifier");
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(targetPartner, "targetPartner");
        Objects.requireNonNull(confidenceBand, "confidenceBand");
        if ((action == LinkAction.LINK) != targetPartner.isPresent()) {
            throw new IllegalArgumentException("targetPartner must be present exactly for LINK proposals, action=" + action);
        }
    }

    /**
     * Medium-confidence links are suggestions that a person should confirm before committing.
     */
    public boolean requiresConfirmation() {
        return action == LinkAction.LINK && confidenceBand != ConfidenceBand.HIGH;
    }
}
