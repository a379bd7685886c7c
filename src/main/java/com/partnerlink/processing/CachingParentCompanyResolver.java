package com.partnerlink.processing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Decorates a resolver with a {@link ResolutionCache}. Only resolved results are
 * stored; a delegate that throws leaves the cache untouched.
 */
public class CachingParentCompanyResolver implements ParentCompanyResolver {

    private static final Logger logger = LoggerFactory.getLogger(CachingParentCompanyResolver.class);

    private final ParentCompanyResolver delegate;
    private final ResolutionCache cache;

    public CachingParentCompanyResolver(ParentCompanyResolver delegate, ResolutionCache cache) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.cache = Objects.requireNonNull(cache, "cache");
    }

    @Override
    public ParentCompanyResult resolve(String transactionName) {
        Optional<ParentCompanyResult> cached = cache.get(transactionName);
        if (cached.isPresent()) {
            logger.trace("Resolution cache hit for '{}'", transactionName);
            return cached.get();
        }

        ParentCompanyResult result = delegate.resolve(transactionName);
        if (result != null && result.isResolved()) {
            cache.put(transactionName, result);
        }
        return result;
    }

    public ResolutionCache getCache() {
        return cache;
    }
}
