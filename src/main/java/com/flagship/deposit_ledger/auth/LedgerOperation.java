package com.flagship.deposit_ledger.auth;

/**
 * Privileged operations checked against the {@link AuthorizationPolicy}.
 */
public enum LedgerOperation {
    INITIALIZE_MARKET,
    SET_INTEREST_RATE,
    CREDIT_CUSTODY,
    MINT_SHARES,
    BURN_SHARES
}
