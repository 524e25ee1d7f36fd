package com.flagship.currency_gateway.api;

import com.flagship.currency_gateway.api.dto.TransactionHistoryResponse;
import com.flagship.currency_gateway.api.dto.TransactionRequest;
import com.flagship.currency_gateway.api.dto.TransactionResponse;
import com.flagship.currency_gateway.exception.TransactionValidationException;
import com.flagship.currency_gateway.history.TransactionHistory;
import com.flagship.currency_gateway.history.TransactionHistoryService;
import com.flagship.currency_gateway.ledger.LedgerAccount;
import com.flagship.currency_gateway.security.ApiKeyAuthenticationFilter;
import com.flagship.currency_gateway.transaction.CurrencyTransactionService;
import com.flagship.currency_gateway.transaction.TransactionCommand;
import com.flagship.currency_gateway.transaction.TransactionResult;
import com.flagship.currency_gateway.transaction.TransactionType;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for balance transactions and their history.
 *
 * Both endpoints sit behind {@link ApiKeyAuthenticationFilter}; the bank bound to
 * the caller's key is the default ledger partition when the request names none.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class TransactionController {

    private final CurrencyTransactionService transactionService;
    private final TransactionHistoryService historyService;

    /**
     * Applies a debit or credit to the user's remote balance.
     *
     * Errors are rendered by the exception handler with the status of their kind.
     */
    @PostMapping("/")
    public ResponseEntity<TransactionResponse> executeTransaction(
            @Valid @RequestBody TransactionRequest request,
            @RequestAttribute(ApiKeyAuthenticationFilter.BANK_NAME_ATTRIBUTE) String callerBank) {

        TransactionCommand command = TransactionCommand.of(
            request.getUserId(),
            request.getBankName() != null ? request.getBankName() : callerBank,
            request.getAmount(),
            TransactionType.fromValue(request.getTransactionType()),
            request.getDiscordId()
        );

        TransactionResult result = transactionService.execute(command);
        return ResponseEntity.ok(TransactionResponse.from(command, result));
    }

    /**
     * Lists the audit history of one account, most recent first.
     */
    @GetMapping("/transactions")
    public ResponseEntity<TransactionHistoryResponse> listTransactions(
            @RequestParam("userId") String userId,
            @RequestParam(value = "bankName", required = false) String bankName,
            @RequestAttribute(ApiKeyAuthenticationFilter.BANK_NAME_ATTRIBUTE) String callerBank) {

        String effectiveBank = bankName != null && !bankName.isBlank() ? bankName : callerBank;

        LedgerAccount account;
        try {
            account = LedgerAccount.of(userId, effectiveBank);
        } catch (IllegalArgumentException e) {
            throw new TransactionValidationException(e.getMessage());
        }

        TransactionHistory history = historyService.listTransactions(account);
        log.debug("Listed transactions: userId={}, bankName={}, count={}",
                userId, effectiveBank, history.getEntries().size());

        return ResponseEntity.ok(TransactionHistoryResponse.from(history, effectiveBank));
    }
}
