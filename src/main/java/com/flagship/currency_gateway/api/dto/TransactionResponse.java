package com.flagship.currency_gateway.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.currency_gateway.transaction.TransactionCommand;
import com.flagship.currency_gateway.transaction.TransactionResult;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Response DTO for a committed transaction.
 */
@Value
@Builder
public class TransactionResponse {

    @JsonProperty("success")
    boolean success;

    @JsonProperty("result")
    Result result;

    @JsonProperty("bankName")
    String bankName;

    @JsonProperty("transactionType")
    String transactionType;

    @JsonProperty("metadata")
    Metadata metadata;

    @Value
    public static class Result {
        @JsonProperty("before")
        BigDecimal before;

        @JsonProperty("after")
        BigDecimal after;
    }

    @Value
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Metadata {
        @JsonProperty("discordId")
        String discordId;
    }

    public static TransactionResponse from(TransactionCommand command, TransactionResult result) {
        return TransactionResponse.builder()
            .success(true)
            .result(new Result(result.getBefore(), result.getAfter()))
            .bankName(command.getAccount().getBankName())
            .transactionType(command.getTransactionType().getValue())
            .metadata(new Metadata(command.getDiscordId()))
            .build();
    }
}
