package com.flagship.currency_gateway.ledger;

import com.flagship.currency_gateway.store.BalanceRecord;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Outcome of applying a delta: the balance snapshots and the record to write back.
 */
@Value
public class BalanceMutation {
    BigDecimal before;
    BigDecimal after;
    BalanceRecord newRecord;
}
