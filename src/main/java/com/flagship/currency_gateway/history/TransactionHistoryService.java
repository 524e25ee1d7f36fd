package com.flagship.currency_gateway.history;

import com.flagship.currency_gateway.audit.LedgerAuditLog;
import com.flagship.currency_gateway.ledger.LedgerAccount;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Read-only view over the audit log.
 */
@Service
@RequiredArgsConstructor
public class TransactionHistoryService {

    private final LedgerAuditLog auditLog;

    public TransactionHistory listTransactions(LedgerAccount account) {
        return new TransactionHistory(
                auditLog.query(account),
                auditLog.mostRecentExternalIdentity(account).orElse(null));
    }
}
