package com.flagship.currency_gateway.audit;

import com.flagship.currency_gateway.exception.AuditLogPersistenceException;
import com.flagship.currency_gateway.exception.CompensationFailedException;
import com.flagship.currency_gateway.ledger.LedgerAccount;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Optional;

/**
 * Durable, append-only record of attempted transactions.
 *
 * An entry is written before the remote commit and removed again by a
 * compensating delete when that commit fails. Both writes run in their own
 * committed database transaction: the entry must be durable before the remote
 * call starts, and a delete must not depend on any caller's transaction.
 *
 * Write failures are translated here, including failures at commit time,
 * which is why the writes use a {@link TransactionTemplate} instead of
 * {@code @Transactional}.
 */
@Service
@Slf4j
public class LedgerAuditLog {

    private final LedgerEntryRepository repository;
    private final TransactionTemplate writeTemplate;

    public LedgerAuditLog(LedgerEntryRepository repository, PlatformTransactionManager transactionManager) {
        this.repository = repository;
        this.writeTemplate = new TransactionTemplate(transactionManager);
        this.writeTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * Inserts the entry with a generated timestamp.
     *
     * @return the id assigned to the entry
     * @throws AuditLogPersistenceException if the store rejects the write
     */
    public long append(LedgerEntry entry) {
        if (entry.getId() != null) {
            throw new IllegalArgumentException("Entry already appended: id=" + entry.getId());
        }
        try {
            LedgerEntryEntity saved = writeTemplate.execute(status ->
                    repository.saveAndFlush(LedgerEntryEntity.fromDomain(entry)));
            if (saved == null || saved.getId() == null) {
                throw new AuditLogPersistenceException("Failed to log transaction: no id assigned", null);
            }
            log.debug("Appended ledger entry: id={}, amount={}", saved.getId(), entry.getAmount());
            return saved.getId();
        } catch (DataAccessException | TransactionException e) {
            log.error("Failed to log transaction: userId={}, bankName={}, error={}",
                    entry.getUserId(), entry.getBankName(), e.getMessage());
            throw new AuditLogPersistenceException("Failed to log transaction", e);
        }
    }

    /**
     * Removes an entry whose transaction never committed.
     *
     * An id that is already gone counts as removed.
     *
     * @throws CompensationFailedException if the delete could not be carried out
     */
    public void compensatingDelete(long id) {
        Integer deleted;
        try {
            deleted = writeTemplate.execute(status -> repository.deleteEntryById(id));
        } catch (DataAccessException | TransactionException e) {
            throw new CompensationFailedException(id, e);
        }
        if (deleted == null || deleted == 0) {
            log.warn("Compensating delete found no ledger entry: id={}", id);
            return;
        }
        log.debug("Compensating delete removed ledger entry: id={}", id);
    }

    /**
     * History of one account, most recent first.
     */
    @Transactional(readOnly = true)
    public List<LedgerEntry> query(LedgerAccount account) {
        return repository.findByUserIdAndBankNameOrderByTimestampDescIdDesc(account.getUserId(), account.getBankName())
                .stream()
                .map(LedgerEntryEntity::toDomain)
                .toList();
    }

    /**
     * The newest non-null external identity recorded for the account.
     */
    @Transactional(readOnly = true)
    public Optional<String> mostRecentExternalIdentity(LedgerAccount account) {
        return repository
                .findFirstByUserIdAndBankNameAndDiscordIdIsNotNullOrderByTimestampDescIdDesc(
                        account.getUserId(), account.getBankName())
                .map(LedgerEntryEntity::getDiscordId);
    }
}
