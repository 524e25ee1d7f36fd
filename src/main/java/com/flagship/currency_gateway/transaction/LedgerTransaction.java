package com.flagship.currency_gateway.transaction;

import com.flagship.currency_gateway.exception.CompensationFailedException;
import com.flagship.currency_gateway.ledger.BalanceMutation;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One execution of the transaction protocol as an explicit state machine.
 *
 * Key principles:
 * - Every transition is a method that validates the current state
 * - Instances are immutable; a transition returns a new instance
 * - Failed terminal states carry the error that ended them
 */
@Value
public class LedgerTransaction {
    TransactionCommand command;
    TransactionState state;
    Long ledgerEntryId;
    BigDecimal before;
    BigDecimal after;
    RuntimeException failure;

    public static LedgerTransaction initiate(TransactionCommand command) {
        if (command == null) {
            throw new IllegalArgumentException("Command cannot be null");
        }
        return new LedgerTransaction(command, TransactionState.INITIATED, null, null, null, null);
    }

    /**
     * The audit entry was written. Only valid from INITIATED.
     */
    public LedgerTransaction logged(long entryId) {
        requireState(TransactionState.INITIATED, TransactionState.LOGGED);
        return new LedgerTransaction(command, TransactionState.LOGGED, entryId, null, null, null);
    }

    /**
     * The remote write succeeded. Only valid from LOGGED.
     */
    public LedgerTransaction commit(BalanceMutation mutation) {
        requireState(TransactionState.LOGGED, TransactionState.COMMITTED);
        return new LedgerTransaction(command, TransactionState.COMMITTED, ledgerEntryId,
                mutation.getBefore(), mutation.getAfter(), null);
    }

    /**
     * The remote commit failed and the audit entry was removed. Only valid from LOGGED.
     */
    public LedgerTransaction rollBack(RuntimeException cause) {
        requireState(TransactionState.LOGGED, TransactionState.ROLLED_BACK);
        return new LedgerTransaction(command, TransactionState.ROLLED_BACK, ledgerEntryId, null, null, cause);
    }

    /**
     * The remote commit failed and so did the compensating delete. Only valid from LOGGED.
     */
    public LedgerTransaction compensationFailed(CompensationFailedException cause) {
        requireState(TransactionState.LOGGED, TransactionState.COMPENSATION_FAILED);
        return new LedgerTransaction(command, TransactionState.COMPENSATION_FAILED, ledgerEntryId, null, null, cause);
    }

    /**
     * Nothing could be logged. Only valid from INITIATED.
     */
    public LedgerTransaction fail(RuntimeException cause) {
        requireState(TransactionState.INITIATED, TransactionState.FAILED);
        return new LedgerTransaction(command, TransactionState.FAILED, null, null, null, cause);
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }

    /**
     * Balance snapshots of a committed transaction.
     *
     * @throws IllegalStateException if the transaction did not commit
     */
    public TransactionResult toResult() {
        if (state != TransactionState.COMMITTED) {
            throw new IllegalStateException("Only COMMITTED transactions have a result, current state: " + state);
        }
        return new TransactionResult(before, after);
    }

    /**
     * Checks if a transition from the current state to the target state is allowed.
     */
    public boolean canTransitionTo(TransactionState target) {
        return switch (state) {
            case INITIATED -> target == TransactionState.LOGGED || target == TransactionState.FAILED;
            case LOGGED -> target == TransactionState.COMMITTED
                    || target == TransactionState.ROLLED_BACK
                    || target == TransactionState.COMPENSATION_FAILED;
            case COMMITTED, ROLLED_BACK, COMPENSATION_FAILED, FAILED -> false;
        };
    }

    private void requireState(TransactionState expected, TransactionState target) {
        if (state != expected) {
            throw new IllegalStateException(
                String.format("Cannot move transaction from %s to %s. Only %s transactions can.",
                    state, target, expected));
        }
    }
}
