package com.flagship.currency_gateway.ledger;

import lombok.Value;

/**
 * A ledger balance, identified by the user and the bank (ledger partition)
 * the transaction is booked under.
 *
 * The balance itself lives only in the remote store; this type carries no state.
 */
@Value
public class LedgerAccount {

    private static final String DATA_STORE_PREFIX = "DATA/";

    String userId;
    String bankName;

    private LedgerAccount(String userId, String bankName) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        if (bankName == null || bankName.isBlank()) {
            throw new IllegalArgumentException("bankName is required");
        }
        this.userId = userId;
        this.bankName = bankName;
    }

    public static LedgerAccount of(String userId, String bankName) {
        return new LedgerAccount(userId, bankName);
    }

    /**
     * Name of the remote data store holding this user's balance documents.
     */
    public String dataStoreName() {
        return DATA_STORE_PREFIX + userId;
    }
}
