package com.flagship.currency_gateway.transaction;

/**
 * States of one ledger transaction.
 *
 * INITIATED → LOGGED → COMMITTED           (success)
 * INITIATED → LOGGED → ROLLED_BACK         (commit failed, audit entry removed)
 * INITIATED → LOGGED → COMPENSATION_FAILED (commit failed, audit entry left behind)
 * INITIATED → FAILED                       (audit entry could not be written)
 */
public enum TransactionState {
    /**
     * Command validated, nothing written yet.
     */
    INITIATED,

    /**
     * Audit entry written; its id is held for compensation.
     */
    LOGGED,

    /**
     * Remote balance updated. Terminal.
     */
    COMMITTED,

    /**
     * Remote commit failed and the audit entry was deleted. Terminal.
     */
    ROLLED_BACK,

    /**
     * Remote commit failed and the audit entry could not be deleted.
     * Terminal; the audit log needs manual reconciliation.
     */
    COMPENSATION_FAILED,

    /**
     * Failed before anything was logged. Terminal.
     */
    FAILED;

    public boolean isTerminal() {
        return this != INITIATED && this != LOGGED;
    }
}
