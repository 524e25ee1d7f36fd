package com.flagship.currency_gateway.audit;

import com.flagship.currency_gateway.ledger.LedgerAccount;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Domain model for one audit log row: an attempted transaction.
 *
 * {@code id} and {@code timestamp} are assigned by the audit log on insert and
 * are null on an entry that has not been appended yet.
 *
 * Sign convention: {@code amount} is the signed delta, negative for debits.
 */
@Value
public class LedgerEntry {
    Long id;
    String userId;
    BigDecimal amount;
    String bankName;
    Instant timestamp;
    String discordId;

    /**
     * Creates an entry ready to be appended.
     */
    public static LedgerEntry pending(LedgerAccount account, BigDecimal amount, String discordId) {
        if (amount == null || amount.signum() == 0) {
            throw new IllegalArgumentException("Ledger entry amount must be non-zero");
        }
        return new LedgerEntry(null, account.getUserId(), amount, account.getBankName(), null, discordId);
    }
}
