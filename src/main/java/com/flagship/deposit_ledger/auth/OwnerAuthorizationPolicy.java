package com.flagship.deposit_ledger.auth;

import java.util.Objects;

/**
 * Single-owner policy.
 *
 * Administrative operations belong to the configured owner. Share minting and
 * burning belong to the pool coordinator identity alone, so holders can only
 * change their principal through deposit and withdraw.
 */
public class OwnerAuthorizationPolicy implements AuthorizationPolicy {

    private final String ownerId;
    private final String coordinatorId;

    public OwnerAuthorizationPolicy(String ownerId, String coordinatorId) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("Owner ID is required");
        }
        if (coordinatorId == null || coordinatorId.isBlank()) {
            throw new IllegalArgumentException("Coordinator ID is required");
        }
        this.ownerId = ownerId;
        this.coordinatorId = coordinatorId;
    }

    @Override
    public boolean isAuthorized(String caller, LedgerOperation operation) {
        if (caller == null || operation == null) {
            return false;
        }
        return switch (operation) {
            case INITIALIZE_MARKET, SET_INTEREST_RATE, CREDIT_CUSTODY -> Objects.equals(ownerId, caller);
            case MINT_SHARES, BURN_SHARES -> Objects.equals(coordinatorId, caller);
        };
    }
}
