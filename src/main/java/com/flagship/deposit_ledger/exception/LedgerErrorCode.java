package com.flagship.deposit_ledger.exception;

/**
 * Failure taxonomy for ledger operations.
 * Every rejected operation aborts without partial state mutation.
 */
public enum LedgerErrorCode {
    MARKET_ALREADY_EXISTS,
    MARKET_NOT_FOUND,
    /**
     * Zero, negative, or too small to convert into at least one share.
     */
    INVALID_AMOUNT,
    INVALID_INTEREST_RATE,
    /**
     * Value-with-interest check failed.
     */
    INSUFFICIENT_BALANCE,
    /**
     * Raw principal share check failed.
     */
    INSUFFICIENT_SHARES,
    UNAUTHORIZED,
    CUSTODY_TRANSFER_FAILED,
    /**
     * A state-changing entry point was re-entered while another was in flight.
     */
    REENTRANT_CALL
}
