package com.flagship.currency_gateway.support;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flagship.currency_gateway.exception.AccountNotFoundException;
import com.flagship.currency_gateway.exception.RemoteStoreUnavailableException;
import com.flagship.currency_gateway.exception.VersionConflictException;
import com.flagship.currency_gateway.ledger.LedgerAccount;
import com.flagship.currency_gateway.store.BalanceRecord;
import com.flagship.currency_gateway.store.VersionMarker;
import com.flagship.currency_gateway.store.VersionedStore;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Consumer;

/**
 * {@link VersionedStore} kept in memory, with hooks to inject conflicts and outages.
 */
public class InMemoryVersionedStore implements VersionedStore {

    public static final String BALANCE_FIELD = "bandar_ringgit";

    private final Map<String, ObjectNode> documents = new HashMap<>();
    private final Map<String, Integer> revisions = new HashMap<>();

    private RuntimeException readFailure;
    private RuntimeException writeFailure;
    private Consumer<LedgerAccount> beforeWrite = account -> { };
    private int writes;

    public synchronized void seed(String userId, String balance) {
        ObjectNode document = JsonNodeFactory.instance.objectNode();
        document.put(BALANCE_FIELD, new BigDecimal(balance));
        documents.put(userId, document);
        revisions.put(userId, 1);
    }

    public synchronized BigDecimal balanceOf(String userId) {
        ObjectNode document = documents.get(userId);
        return BalanceRecord.of(document, BALANCE_FIELD, null).getBalance();
    }

    public synchronized int writes() {
        return writes;
    }

    public synchronized void failReadsWith(RuntimeException failure) {
        this.readFailure = failure;
    }

    public synchronized void failWritesWith(RuntimeException failure) {
        this.writeFailure = failure;
    }

    /**
     * Runs between the mutation and the conditional write, e.g. to simulate a competing writer.
     */
    public synchronized void beforeWrite(Consumer<LedgerAccount> hook) {
        this.beforeWrite = hook;
    }

    /**
     * Bumps the revision as if another process had written the document.
     */
    public synchronized void touch(String userId) {
        revisions.merge(userId, 1, Integer::sum);
    }

    @Override
    public synchronized VersionMarker fetchLatestVersion(LedgerAccount account) {
        if (!documents.containsKey(account.getUserId())) {
            throw new AccountNotFoundException(account.getUserId());
        }
        return VersionMarker.of("key-" + account.getUserId());
    }

    @Override
    public synchronized BalanceRecord readBalance(LedgerAccount account, VersionMarker version) {
        if (readFailure != null) {
            throw readFailure;
        }
        return BalanceRecord.of(documents.get(account.getUserId()), BALANCE_FIELD,
                String.valueOf(revisions.get(account.getUserId())));
    }

    @Override
    public void conditionalWrite(LedgerAccount account, VersionMarker version, BalanceRecord newRecord) {
        Consumer<LedgerAccount> hook;
        synchronized (this) {
            hook = beforeWrite;
        }
        hook.accept(account);

        synchronized (this) {
            if (writeFailure != null) {
                throw writeFailure;
            }
            String current = String.valueOf(revisions.get(account.getUserId()));
            if (!current.equals(newRecord.getRevision())) {
                throw new VersionConflictException(account.getUserId(), version.getDataKey());
            }
            documents.put(account.getUserId(), newRecord.getDocument());
            revisions.merge(account.getUserId(), 1, Integer::sum);
            writes++;
        }
    }

    public static RemoteStoreUnavailableException outage() {
        return new RemoteStoreUnavailableException("Failed to save data to data store: status=500");
    }
}
