package com.flagship.currency_gateway.exception;

public class AuditLogPersistenceException extends CurrencyLedgerException {

    public AuditLogPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.PERSISTENCE;
    }
}
