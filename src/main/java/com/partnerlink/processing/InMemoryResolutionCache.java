package com.partnerlink.processing;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe in-process {@link ResolutionCache}. Entries live until invalidated.
 */
public class InMemoryResolutionCache implements ResolutionCache {

    private final Map<String, ParentCompanyResult> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<ParentCompanyResult> get(String transactionName) {
        if (transactionName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(entries.get(transactionName));
    }

    @Override
    public void put(String transactionName, ParentCompanyResult result) {
        entries.put(Objects.requireNonNull(transactionName, "transactionName"),
                Objects.requireNonNull(result, "result"));
    }

    @Override
    public int invalidateAll() {
        int removed = entries.size();
        entries.clear();
        return removed;
    }

    @Override
    public int size() {
        return entries.size();
    }
}
