package com.flagship.currency_gateway.exception;

/**
 * Base class for all failures surfaced by the transaction protocol.
 * None of them is retried by the gateway.
 */
public abstract class CurrencyLedgerException extends RuntimeException {

    protected CurrencyLedgerException(String message) {
        super(message);
    }

    protected CurrencyLedgerException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind getKind();
}
