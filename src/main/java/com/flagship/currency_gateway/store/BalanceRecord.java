package com.flagship.currency_gateway.store;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flagship.currency_gateway.exception.RemoteStoreUnavailableException;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Immutable view of a remote balance document.
 *
 * The document may hold fields other than the balance; they are written back
 * untouched. {@code revision} is the entry version returned together with the
 * document and is the compare-and-swap token for the next write.
 */
public final class BalanceRecord {

    private final ObjectNode document;
    private final String balanceField;
    private final String revision;

    private BalanceRecord(ObjectNode document, String balanceField, String revision) {
        this.document = Objects.requireNonNull(document, "document");
        this.balanceField = Objects.requireNonNull(balanceField, "balanceField");
        this.revision = revision;
    }

    public static BalanceRecord of(ObjectNode document, String balanceField, String revision) {
        return new BalanceRecord(document.deepCopy(), balanceField, revision);
    }

    /**
     * Current balance; a document without the balance field holds zero.
     *
     * @throws RemoteStoreUnavailableException if the balance field holds something other than a number
     */
    public BigDecimal getBalance() {
        var node = document.get(balanceField);
        if (node == null || node.isNull()) {
            return BigDecimal.ZERO;
        }
        if (!node.isNumber()) {
            throw new RemoteStoreUnavailableException("Data store entry balance is not numeric");
        }
        return node.decimalValue();
    }

    /**
     * Returns a copy of this record with the balance replaced, keeping the revision it was read at.
     */
    public BalanceRecord withBalance(BigDecimal balance) {
        ObjectNode copy = document.deepCopy();
        copy.put(balanceField, balance);
        return new BalanceRecord(copy, balanceField, revision);
    }

    public ObjectNode getDocument() {
        return document.deepCopy();
    }

    public String getBalanceField() {
        return balanceField;
    }

    public String getRevision() {
        return revision;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BalanceRecord that)) {
            return false;
        }
        return document.equals(that.document)
                && balanceField.equals(that.balanceField)
                && Objects.equals(revision, that.revision);
    }

    @Override
    public int hashCode() {
        return Objects.hash(document, balanceField, revision);
    }

    @Override
    public String toString() {
        return "BalanceRecord(balance=" + document.get(balanceField) + ", revision=" + revision + ")";
    }
}
