package com.flagship.deposit_ledger.exception;

import lombok.Getter;

/**
 * Raised when a ledger or pool operation is rejected.
 *
 * The error code identifies the rule that was violated; the message carries
 * the operands for logs and API responses.
 */
@Getter
public class LedgerException extends RuntimeException {

    private final LedgerErrorCode errorCode;

    public LedgerException(LedgerErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public LedgerException(LedgerErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public static LedgerException marketAlreadyExists(String assetId) {
        return new LedgerException(LedgerErrorCode.MARKET_ALREADY_EXISTS,
                "Market already exists: " + assetId);
    }

    public static LedgerException marketNotFound(String assetId) {
        return new LedgerException(LedgerErrorCode.MARKET_NOT_FOUND,
                "Market not found: " + assetId);
    }

    public static LedgerException invalidAmount(String message) {
        return new LedgerException(LedgerErrorCode.INVALID_AMOUNT, message);
    }

    public static LedgerException unauthorized(String caller, Object operation) {
        return new LedgerException(LedgerErrorCode.UNAUTHORIZED,
                String.format("Caller %s is not authorized for %s", caller, operation));
    }
}
