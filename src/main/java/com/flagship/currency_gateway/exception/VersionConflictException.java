package com.flagship.currency_gateway.exception;

/**
 * The remote entry changed between read and conditional write.
 * The caller may resubmit the whole transaction.
 */
public class VersionConflictException extends CurrencyLedgerException {

    public VersionConflictException(String userId, String dataKey) {
        super(String.format("Data has been modified by another process: userId=%s, dataKey=%s", userId, dataKey));
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.VERSION_CONFLICT;
    }
}
