package com.flagship.currency_gateway.history;

import com.flagship.currency_gateway.audit.LedgerEntry;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Audit history of one account, most recent first, with the external identity
 * last associated with it.
 */
@Value
public class TransactionHistory {
    List<LedgerEntry> entries;
    String discordId;

    public Optional<String> getDiscordId() {
        return Optional.ofNullable(discordId);
    }
}
