package com.flagship.currency_gateway.transaction;

import com.flagship.currency_gateway.audit.LedgerAuditLog;
import com.flagship.currency_gateway.audit.LedgerEntry;
import com.flagship.currency_gateway.exception.CompensationFailedException;
import com.flagship.currency_gateway.ledger.BalanceMutation;
import com.flagship.currency_gateway.ledger.BalanceMutator;
import com.flagship.currency_gateway.ledger.LedgerAccount;
import com.flagship.currency_gateway.notification.BalanceChangeNotification;
import com.flagship.currency_gateway.notification.BalanceChangeNotifier;
import com.flagship.currency_gateway.observability.CorrelationContext;
import com.flagship.currency_gateway.observability.TransactionMetrics;
import com.flagship.currency_gateway.store.BalanceRecord;
import com.flagship.currency_gateway.store.VersionMarker;
import com.flagship.currency_gateway.store.VersionedStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

/**
 * Runs a debit or credit against the remote balance as one logical transaction.
 *
 * Two phases:
 * 1. Log: append an audit entry for the signed delta (INITIATED → LOGGED, or FAILED)
 * 2. Commit: read version and balance, apply the delta, conditional write
 *    (LOGGED → COMMITTED); on any failure delete the audit entry again
 *    (→ ROLLED_BACK, or COMPENSATION_FAILED when the delete fails)
 *
 * A committed transaction triggers a best-effort downstream notification that
 * can never change its outcome.
 *
 * Deliberately absent:
 * - Retries. A version conflict goes back to the caller, who may resubmit
 * - Account locks. Concurrent writers on one account are separated only by the
 *   remote store's version check
 * - Caching. Every execution reads the balance fresh from the store
 *
 * Not {@code @Transactional}: the audit entry must be committed before the
 * remote call, and the remote call cannot join a database transaction anyway.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CurrencyTransactionService {

    private final LedgerAuditLog auditLog;
    private final VersionedStore versionedStore;
    private final BalanceMutator balanceMutator;
    private final BalanceChangeNotifier notifier;
    private final TransactionMetrics metrics;

    /**
     * Executes the command.
     *
     * @return balance before and after the delta
     * @throws com.flagship.currency_gateway.exception.CurrencyLedgerException the error that ended the
     *         transaction; {@link CompensationFailedException} when the audit entry could not be removed
     */
    public TransactionResult execute(TransactionCommand command) {
        long startTime = System.currentTimeMillis();
        LedgerAccount account = command.getAccount();

        MDC.put(CorrelationContext.USER_ID_MDC_KEY, account.getUserId());
        MDC.put(CorrelationContext.BANK_NAME_MDC_KEY, account.getBankName());

        log.info("Received transaction: type={}, amount={}, delta={}",
                command.getTransactionType().getValue(), command.getAmount(), command.signedDelta());

        try {
            LedgerTransaction transaction = recordIntent(LedgerTransaction.initiate(command));

            if (transaction.getState() == TransactionState.LOGGED) {
                transaction = commitToStore(transaction);
            }

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordTransaction(command.getTransactionType().getValue(),
                    transaction.getState().name().toLowerCase(), duration);

            if (transaction.getState() != TransactionState.COMMITTED) {
                log.warn("Transaction ended in {}: error={}, duration={}ms",
                        transaction.getState(), transaction.getFailure().getMessage(), duration);
                throw transaction.getFailure();
            }

            log.info("Transaction committed: before={}, after={}, duration={}ms",
                    transaction.getBefore(), transaction.getAfter(), duration);

            notifyDownstream(command);
            return transaction.toResult();

        } finally {
            MDC.remove(CorrelationContext.USER_ID_MDC_KEY);
            MDC.remove(CorrelationContext.BANK_NAME_MDC_KEY);
            MDC.remove(CorrelationContext.LEDGER_ENTRY_ID_MDC_KEY);
        }
    }

    /**
     * Phase 1: write the audit entry for the raw signed delta.
     */
    private LedgerTransaction recordIntent(LedgerTransaction transaction) {
        TransactionCommand command = transaction.getCommand();
        try {
            long entryId = auditLog.append(LedgerEntry.pending(
                    command.getAccount(), command.signedDelta(), command.getDiscordId()));
            MDC.put(CorrelationContext.LEDGER_ENTRY_ID_MDC_KEY, String.valueOf(entryId));
            return transaction.logged(entryId);
        } catch (RuntimeException e) {
            return transaction.fail(e);
        }
    }

    /**
     * Phase 2: read, mutate and conditionally write the remote balance.
     * Nothing but the in-memory mutation runs between read and write.
     */
    private LedgerTransaction commitToStore(LedgerTransaction transaction) {
        TransactionCommand command = transaction.getCommand();
        LedgerAccount account = command.getAccount();
        try {
            VersionMarker version = versionedStore.fetchLatestVersion(account);
            BalanceRecord current = versionedStore.readBalance(account, version);
            BalanceMutation mutation = balanceMutator.applyDelta(current, command.signedDelta());
            versionedStore.conditionalWrite(account, version, mutation.getNewRecord());
            return transaction.commit(mutation);
        } catch (RuntimeException e) {
            log.warn("Commit failed, removing audit entry: ledgerEntryId={}, error={}",
                    transaction.getLedgerEntryId(), e.getMessage());
            return compensate(transaction, e);
        }
    }

    /**
     * Deletes the audit entry of a transaction whose commit failed.
     */
    private LedgerTransaction compensate(LedgerTransaction transaction, RuntimeException cause) {
        long entryId = transaction.getLedgerEntryId();
        try {
            auditLog.compensatingDelete(entryId);
            return transaction.rollBack(cause);
        } catch (RuntimeException e) {
            CompensationFailedException failure = e instanceof CompensationFailedException compensationFailed
                    ? compensationFailed
                    : new CompensationFailedException(entryId, e);
            failure.withTriggeringError(cause);

            metrics.incrementCompensationFailures();
            log.error("LEDGER DRIFT: audit entry {} remains for a transaction that never committed; "
                            + "manual reconciliation required. triggeringError={}, deleteError={}",
                    entryId, cause.getMessage(), e.getMessage(), e);
            return transaction.compensationFailed(failure);
        }
    }

    private void notifyDownstream(TransactionCommand command) {
        LedgerAccount account = command.getAccount();
        try {
            notifier.notifyBalanceChanged(new BalanceChangeNotification(
                    account.getUserId(),
                    command.getAmount(),
                    account.getBankName(),
                    command.getTransactionType()));
        } catch (RuntimeException e) {
            log.error("Failed to send in-game update: error={}", e.getMessage());
            metrics.incrementNotificationFailures("unknown");
        }
    }
}
