package com.flagship.currency_gateway.ledger;

import com.flagship.currency_gateway.exception.InsufficientFundsException;
import com.flagship.currency_gateway.store.BalanceRecord;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Applies a signed delta to a balance record.
 *
 * Enforces the ledger's only domain invariant: a balance never goes below zero.
 * The check happens before a new record is built, and the input record is
 * immutable, so a rejected delta leaves nothing observable behind.
 */
@Component
public class BalanceMutator {

    /**
     * @param record the balance read from the store
     * @param delta  signed amount; negative for debits, positive for credits
     * @return before/after snapshots and the record to write
     * @throws InsufficientFundsException if {@code before + delta < 0}
     */
    public BalanceMutation applyDelta(BalanceRecord record, BigDecimal delta) {
        Objects.requireNonNull(record, "record");
        Objects.requireNonNull(delta, "delta");

        BigDecimal before = record.getBalance();
        BigDecimal after = before.add(delta);

        if (after.signum() < 0) {
            throw new InsufficientFundsException(before, delta);
        }

        return new BalanceMutation(before, after, record.withBalance(after));
    }
}
