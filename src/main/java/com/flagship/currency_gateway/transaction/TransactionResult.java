package com.flagship.currency_gateway.transaction;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Balance snapshots around a committed transaction. Not persisted.
 */
@Value
public class TransactionResult {
    BigDecimal before;
    BigDecimal after;
}
