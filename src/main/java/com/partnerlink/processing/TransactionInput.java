package com.partnerlink.processing;

/**
 * One bank or card statement line to reconcile.
 *
 * @param id     transaction id from the statement
 * @param name   counterparty name as printed on the statement
 * @param amount amount, may be null
 * @param date   booking date as text, may be null
 */
public record TransactionInput(String id, String name, Long amount, String date) {

    public static TransactionInput of(String id, String name) {
        return new TransactionInput(id, name, null, null);
    }
}
