package com.flagship.deposit_ledger.auth;

/**
 * Capability check consulted before administrative operations and before the
 * coordinator-restricted mint and burn calls into a ledger.
 */
public interface AuthorizationPolicy {

    /**
     * @param caller identity of the caller, may be null for anonymous requests
     * @param operation the operation being attempted
     * @return true if the caller holds the capability
     */
    boolean isAuthorized(String caller, LedgerOperation operation);
}
