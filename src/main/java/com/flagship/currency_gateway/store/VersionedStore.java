package com.flagship.currency_gateway.store;

import com.flagship.currency_gateway.ledger.LedgerAccount;

/**
 * Remote key-value store offering versioned reads and conditional writes.
 *
 * Implementations hold no account state between calls. Every method is a
 * blocking network round trip bounded by a timeout.
 */
public interface VersionedStore {

    /**
     * Reads the key of the latest balance document from the ordered index.
     *
     * @throws com.flagship.currency_gateway.exception.AccountNotFoundException if the index is empty
     * @throws com.flagship.currency_gateway.exception.RemoteStoreUnavailableException on transport failure or non-2xx
     */
    VersionMarker fetchLatestVersion(LedgerAccount account);

    /**
     * Reads the balance document stored under the given version, paired with its revision.
     *
     * @throws com.flagship.currency_gateway.exception.RemoteStoreUnavailableException on transport failure or non-2xx
     */
    BalanceRecord readBalance(LedgerAccount account, VersionMarker version);

    /**
     * Writes the record under the given version only if the remote revision is
     * still the one {@code newRecord} was read at.
     *
     * @throws com.flagship.currency_gateway.exception.VersionConflictException if another writer got there first
     * @throws com.flagship.currency_gateway.exception.RemoteStoreUnavailableException on transport failure or other non-2xx
     */
    void conditionalWrite(LedgerAccount account, VersionMarker version, BalanceRecord newRecord);
}
