package com.flagship.currency_gateway.exception;

import lombok.Getter;

import java.math.BigDecimal;

@Getter
public class InsufficientFundsException extends CurrencyLedgerException {

    private final BigDecimal balance;
    private final BigDecimal delta;

    public InsufficientFundsException(BigDecimal balance, BigDecimal delta) {
        super(String.format("Insufficient funds to perform this transaction: balance=%s, delta=%s",
                balance.toPlainString(), delta.toPlainString()));
        this.balance = balance;
        this.delta = delta;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.INSUFFICIENT_FUNDS;
    }
}
