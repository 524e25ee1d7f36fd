package com.flagship.currency_gateway.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.currency_gateway.audit.LedgerEntry;
import com.flagship.currency_gateway.history.TransactionHistory;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Response DTO for the history of one account, most recent first.
 */
@Value
public class TransactionHistoryResponse {

    @JsonProperty("transactions")
    List<Item> transactions;

    @JsonProperty("metadata")
    Metadata metadata;

    @Value
    public static class Item {
        @JsonProperty("id")
        Long id;

        @JsonProperty("amount")
        BigDecimal amount;

        @JsonProperty("timestamp")
        Instant timestamp;

        static Item from(LedgerEntry entry) {
            return new Item(entry.getId(), entry.getAmount(), entry.getTimestamp());
        }
    }

    @Value
    public static class Metadata {
        @JsonProperty("discordId")
        String discordId;

        @JsonProperty("bankName")
        String bankName;
    }

    public static TransactionHistoryResponse from(TransactionHistory history, String bankName) {
        return new TransactionHistoryResponse(
            history.getEntries().stream().map(Item::from).toList(),
            new Metadata(history.getDiscordId().orElse(null), bankName));
    }
}
