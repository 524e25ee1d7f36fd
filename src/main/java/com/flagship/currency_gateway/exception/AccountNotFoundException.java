package com.flagship.currency_gateway.exception;

/**
 * Thrown when the ordered index holds no version marker for the account.
 * Brand-new accounts must be provisioned outside the gateway.
 */
public class AccountNotFoundException extends CurrencyLedgerException {

    public AccountNotFoundException(String userId) {
        super("No entries found in the version index for user " + userId);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.NOT_FOUND;
    }
}
