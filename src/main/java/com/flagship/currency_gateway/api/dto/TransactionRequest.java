package com.flagship.currency_gateway.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Request DTO for a debit or credit.
 *
 * {@code amount} is a magnitude; {@code transactionType} decides its sign and
 * defaults to debit. {@code bankName} defaults to the bank of the caller's API key.
 */
@Value
public class TransactionRequest {

    @NotNull(message = "Amount is required")
    @Digits(integer = 15, fraction = 4,
            message = "Amount must have at most 15 integer digits and 4 decimal places")
    @JsonProperty("amount")
    BigDecimal amount;

    @NotBlank(message = "userId is required")
    @JsonProperty("userId")
    String userId;

    @JsonProperty("discordId")
    String discordId;

    @Pattern(regexp = "debit|credit", message = "transactionType must be 'debit' or 'credit'")
    @JsonProperty("transactionType")
    String transactionType;

    @Size(min = 1, message = "bankName cannot be empty")
    @JsonProperty("bankName")
    String bankName;

    @JsonIgnore
    @AssertTrue(message = "Amount cannot be zero")
    public boolean isAmountNonZero() {
        return amount == null || amount.signum() != 0;
    }
}
