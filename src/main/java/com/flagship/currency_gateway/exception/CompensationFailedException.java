package com.flagship.currency_gateway.exception;

import lombok.Getter;

/**
 * The audit entry of a failed commit could not be deleted, so the audit log
 * now records a transaction the remote store never applied.
 *
 * Supersedes the error that triggered the compensation. The cause is the
 * delete failure; the triggering error is kept separately.
 */
@Getter
public class CompensationFailedException extends CurrencyLedgerException {

    private final long ledgerEntryId;
    private Throwable triggeringError;

    public CompensationFailedException(long ledgerEntryId, Throwable cause) {
        super("Failed to rollback transaction log entry " + ledgerEntryId, cause);
        this.ledgerEntryId = ledgerEntryId;
    }

    public CompensationFailedException withTriggeringError(Throwable triggeringError) {
        this.triggeringError = triggeringError;
        return this;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.COMPENSATION_FAILED;
    }
}
