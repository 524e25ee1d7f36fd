package com.flagship.currency_gateway.transaction;

import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;

/**
 * Direction of a transaction. The requested amount is a magnitude; the type gives its sign.
 */
public enum TransactionType {
    DEBIT("debit"),
    CREDIT("credit");

    private final String value;

    TransactionType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Debits take money out of the balance, credits put it in.
     */
    public BigDecimal signedDelta(BigDecimal amount) {
        return this == DEBIT ? amount.negate() : amount;
    }

    /**
     * Parses the wire value; a missing value means a debit.
     */
    public static TransactionType fromValue(String value) {
        if (value == null) {
            return DEBIT;
        }
        for (TransactionType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown transaction type: " + value);
    }
}
