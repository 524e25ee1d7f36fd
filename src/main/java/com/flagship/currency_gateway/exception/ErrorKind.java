package com.flagship.currency_gateway.exception;

/**
 * Failure taxonomy of the gateway. Every {@link CurrencyLedgerException}
 * reports exactly one kind; the API layer maps kinds to HTTP statuses.
 */
public enum ErrorKind {
    /** Caller input malformed; no side effects happened. */
    VALIDATION,
    /** No version marker exists for the account. */
    NOT_FOUND,
    /** Transient network or remote service failure, including timeouts. */
    REMOTE_UNAVAILABLE,
    /** Optimistic concurrency check lost against another writer. */
    VERSION_CONFLICT,
    /** The delta would take the balance below zero. */
    INSUFFICIENT_FUNDS,
    /** The audit log rejected a write. */
    PERSISTENCE,
    /** Audit entry could not be removed after a failed commit; needs manual reconciliation. */
    COMPENSATION_FAILED
}
