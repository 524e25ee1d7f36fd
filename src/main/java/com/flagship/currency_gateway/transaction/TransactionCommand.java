package com.flagship.currency_gateway.transaction;

import com.flagship.currency_gateway.exception.TransactionValidationException;
import com.flagship.currency_gateway.ledger.LedgerAccount;
import lombok.Value;

import java.math.BigDecimal;

/**
 * A validated request to move money on one account.
 *
 * {@code amount} is kept as requested; {@link #signedDelta()} applies the sign
 * of the transaction type.
 */
@Value
public class TransactionCommand {

    /** Digits the audit log column holds on each side of the decimal point. */
    public static final int MAX_INTEGER_DIGITS = 15;
    public static final int MAX_FRACTION_DIGITS = 4;

    LedgerAccount account;
    BigDecimal amount;
    TransactionType transactionType;
    String discordId;

    /**
     * @throws TransactionValidationException if the amount is zero, does not fit the audit log column,
     *                                        or the account is incomplete
     */
    public static TransactionCommand of(String userId, String bankName, BigDecimal amount,
                                        TransactionType transactionType, String discordId) {
        if (amount == null || amount.signum() == 0) {
            throw new TransactionValidationException("Amount cannot be zero");
        }
        BigDecimal normalized = amount.stripTrailingZeros();
        int fractionDigits = Math.max(normalized.scale(), 0);
        int integerDigits = normalized.precision() - normalized.scale();
        if (fractionDigits > MAX_FRACTION_DIGITS || integerDigits > MAX_INTEGER_DIGITS) {
            throw new TransactionValidationException("Amount must have at most " + MAX_INTEGER_DIGITS
                    + " integer digits and " + MAX_FRACTION_DIGITS + " decimal places");
        }
        LedgerAccount account;
        try {
            account = LedgerAccount.of(userId, bankName);
        } catch (IllegalArgumentException e) {
            throw new TransactionValidationException(e.getMessage());
        }
        return new TransactionCommand(
            account,
            amount,
            transactionType != null ? transactionType : TransactionType.DEBIT,
            discordId
        );
    }

    public BigDecimal signedDelta() {
        return transactionType.signedDelta(amount);
    }
}
