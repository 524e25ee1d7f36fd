package com.flagship.currency_gateway.audit;

import com.flagship.currency_gateway.exception.CompensationFailedException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.PlatformTransactionManager;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

/**
 * Compensating delete failures, with the repository mocked out.
 */
@ExtendWith(MockitoExtension.class)
class LedgerAuditLogFailureTest {

    @Mock
    private LedgerEntryRepository repository;

    @Mock
    private PlatformTransactionManager transactionManager;

    @Test
    @DisplayName("Delete failure raises CompensationFailed with the entry id")
    void testCompensatingDeleteFailure() {
        when(repository.deleteEntryById(5L)).thenThrow(new DataAccessResourceFailureException("connection refused"));
        LedgerAuditLog auditLog = new LedgerAuditLog(repository, transactionManager);

        CompensationFailedException e = assertThrows(CompensationFailedException.class,
                () -> auditLog.compensatingDelete(5L));

        assertEquals(5L, e.getLedgerEntryId());
        assertEquals("Failed to rollback transaction log entry 5", e.getMessage());
        assertInstanceOf(DataAccessResourceFailureException.class, e.getCause());
    }
}
