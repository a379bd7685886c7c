package com.partnerlink.processing;

import java.util.Optional;

/**
 * Key-value store for name resolution results, passed explicitly to
 * {@link CachingParentCompanyResolver}.
 */
public interface ResolutionCache {

    /**
     * @return the cached result on a hit, empty on a miss
     */
    Optional<ParentCompanyResult> get(String transactionName);

    /**
     * Inserts or replaces the result for a name.
     */
    void put(String transactionName, ParentCompanyResult result);

    /**
     * Removes every entry and returns how many were removed.
     */
    int invalidateAll();

    int size();
}
