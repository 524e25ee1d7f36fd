package com.flagship.currency_gateway.exception;

public class RemoteStoreUnavailableException extends CurrencyLedgerException {

    public RemoteStoreUnavailableException(String message) {
        super(message);
    }

    public RemoteStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.REMOTE_UNAVAILABLE;
    }
}
