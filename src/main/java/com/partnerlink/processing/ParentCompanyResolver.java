package com.partnerlink.processing;

/**
 * Port to whatever determines the legal entity behind a transaction name
 * (an LLM lookup, a registry search, the directory itself, ...).
 *
 * <p>Implementations own their retry and timeout behavior. They may throw on
 * failure; {@link TransactionProcessor} turns such failures into unresolved results.
 */
public interface ParentCompanyResolver {

    ParentCompanyResult resolve(String transactionName);
}
