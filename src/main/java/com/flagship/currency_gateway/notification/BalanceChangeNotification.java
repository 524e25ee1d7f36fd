package com.flagship.currency_gateway.notification;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.currency_gateway.transaction.TransactionType;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Message sent downstream after a committed transaction.
 *
 * {@code amount} is the magnitude as requested; consumers derive the sign from
 * {@code transactionType}.
 */
@Value
public class BalanceChangeNotification {

    @JsonProperty("userId")
    String userId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("bankName")
    String bankName;

    @JsonProperty("transactionType")
    TransactionType transactionType;
}
