package com.flagship.currency_gateway.exception;

public class TransactionValidationException extends CurrencyLedgerException {

    public TransactionValidationException(String message) {
        super(message);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.VALIDATION;
    }
}
