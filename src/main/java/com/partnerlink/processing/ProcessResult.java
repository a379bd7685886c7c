package com.partnerlink.processing;

import com.partnerlink.linking.LinkAction;
import com.partnerlink.linking.LinkProposal;

/**
 * Everything that happened to one transaction.
 */
public record ProcessResult(TransactionInput transaction, ParentCompanyResult resolution, LinkProposal proposal) {

    public LinkAction action() {
        return proposal.action();
    }
}
