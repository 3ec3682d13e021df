package com.icodici.names.services;

/**
 * Creates the token ledger of a newly deployed namespace.
 */
@FunctionalInterface
public interface TokenLedgerProvider {
    TokenLedger create(String name, String symbol);
}
