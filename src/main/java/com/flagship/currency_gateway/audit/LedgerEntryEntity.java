package com.flagship.currency_gateway.audit;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * JPA Entity for the audit log table.
 *
 * Rows are append-only: no setters, every column is updatable = false.
 * The only other operation is the compensating delete.
 */
@Entity
@Table(
    name = "transactions",
    indexes = {
        @Index(name = "idx_transactions_user_bank_timestamp", columnList = "user_id, bank_name, timestamp")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LedgerEntryEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(nullable = false, updatable = false)
    private Long id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private String userId;

    @Column(nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal amount;

    @Column(name = "bank_name", nullable = false, updatable = false)
    private String bankName;

    @Column(nullable = false, updatable = false)
    private Instant timestamp;

    @Column(name = "discord_id", updatable = false)
    private String discordId;

    @PrePersist
    void onCreate() {
        this.timestamp = Instant.now();
    }

    static LedgerEntryEntity fromDomain(LedgerEntry entry) {
        return new LedgerEntryEntity(
            null, // id - assigned by the database identity column
            entry.getUserId(),
            entry.getAmount(),
            entry.getBankName(),
            null, // timestamp - set by @PrePersist
            entry.getDiscordId()
        );
    }

    public LedgerEntry toDomain() {
        return new LedgerEntry(id, userId, amount, bankName, timestamp, discordId);
    }
}
