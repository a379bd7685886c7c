package com.partnerlink.processing;

import com.partnerlink.matching.CandidateRanker;
import com.partnerlink.model.ConfidenceBand;
import com.partnerlink.model.MatchCandidate;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Offline resolver that looks the cleaned store name up in the partner directory itself.
 *
 * <p>The first ranked candidate is taken as the parent company. This is a heuristic:
 * the top candidate for a shortened store name is not guaranteed to be the operating company.
 */
public class DirectoryParentCompanyResolver implements ParentCompanyResolver {

    private final CandidateRanker ranker;
    private final StoreNameCleaner storeNameCleaner;

    public DirectoryParentCompanyResolver(CandidateRanker ranker) {
        this(ranker, new StoreNameCleaner());
    }

    public DirectoryParentCompanyResolver(CandidateRanker ranker, StoreNameCleaner storeNameCleaner) {
        this.ranker = Objects.requireNonNull(ranker, "ranker");
        this.storeNameCleaner = Objects.requireNonNull(storeNameCleaner, "storeNameCleaner");
    }

    @Override
    public ParentCompanyResult resolve(String transactionName) {
        String searchKey = storeNameCleaner.clean(transactionName);
        if (searchKey.isEmpty()) {
            return ParentCompanyResult.unresolved(transactionName, "nothing left to search after cleaning");
        }

        List<MatchCandidate> candidates = ranker.rank(searchKey, Optional.empty());
        if (candidates.isEmpty()) {
            return ParentCompanyResult.unresolved(transactionName, "no directory partner resembles '" + searchKey + "'");
        }

        MatchCandidate first = candidates.get(0);
        return ParentCompanyResult.resolved(transactionName, first.partner().displayName(),
                confidenceOf(first), "directory " + first.matchedField() + " matched '" + searchKey + "'");
    }

    private static ConfidenceBand confidenceOf(MatchCandidate candidate) {
        switch (candidate.matchKind()) {
            case IDENTIFIER_EXACT:
            case NAME_EXACT:
                return ConfidenceBand.HIGH;
            case NAME_PARTIAL:
                return ConfidenceBand.MEDIUM;
            default:
                return ConfidenceBand.LOW;
        }
    }
}
