package com.flagship.deposit_ledger.pool;

import com.flagship.deposit_ledger.exception.LedgerErrorCode;
import com.flagship.deposit_ledger.exception.LedgerException;

/**
 * Mutual-exclusion flag around the pool's state-changing entry points.
 *
 * Set before any external custody call and cleared on every exit path. A call
 * that arrives while the flag is set is rejected, not queued. Administrative
 * operations never set the flag but are refused while it is held, so a
 * custody callback cannot change a market that the outer call may still roll
 * back.
 */
final class ReentrancyGuard {

    private boolean entered;

    void enter(String operation) {
        requireIdle(operation);
        entered = true;
    }

    void requireIdle(String operation) {
        if (entered) {
            throw new LedgerException(LedgerErrorCode.REENTRANT_CALL,
                    "Reentrant call rejected: " + operation);
        }
    }

    void exit() {
        entered = false;
    }
}
