package com.securebank.api.controller;

import com.securebank.accounts.Account;
import com.securebank.accounts.AccountService;
import com.securebank.api.dto.AccountResponse;
import com.securebank.api.dto.AccountsSummaryResponse;
import com.securebank.api.dto.OpenAccountRequest;
import com.securebank.api.dto.TransactionResponse;
import com.securebank.api.interceptor.SessionInterceptor;
import com.securebank.session.AuthenticatedSession;
import com.securebank.transfers.TransferService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST API for the caller's own accounts.
 */
@RestController
@RequestMapping("/api/v1/accounts")
@RequiredArgsConstructor
@Tag(name = "Accounts", description = "Account management API")
public class AccountController {

    private final AccountService accountService;
    private final TransferService transferService;

    @PostMapping
    @Operation(summary = "Open a checking or savings account")
    public ResponseEntity<AccountResponse> openAccount(
            @RequestAttribute(SessionInterceptor.SESSION_ATTRIBUTE) AuthenticatedSession session,
            @Valid @RequestBody OpenAccountRequest request) {
        Account account = accountService.openAccount(session.getUserId(), request.getAccountType());
        return ResponseEntity.status(HttpStatus.CREATED).body(AccountResponse.from(account));
    }

    @GetMapping
    @Operation(summary = "List own accounts with the total balance")
    public ResponseEntity<AccountsSummaryResponse> listAccounts(
            @RequestAttribute(SessionInterceptor.SESSION_ATTRIBUTE) AuthenticatedSession session) {
        List<AccountResponse> accounts = accountService.getAccountsByOwner(session.getUserId()).stream()
            .map(AccountResponse::from)
            .collect(Collectors.toList());
        return ResponseEntity.ok(new AccountsSummaryResponse(accounts,
            accountService.getTotalBalance(session.getUserId()).getAmount()));
    }

    @GetMapping("/{accountId}")
    @Operation(summary = "Get account details")
    public ResponseEntity<AccountResponse> getAccount(
            @RequestAttribute(SessionInterceptor.SESSION_ATTRIBUTE) AuthenticatedSession session,
            @PathVariable String accountId) {
        return ResponseEntity.ok(AccountResponse.from(accountService.getOwnedAccount(accountId, session.getUserId())));
    }

    @GetMapping("/{accountId}/transactions")
    @Operation(summary = "Get the transaction history of an account")
    public ResponseEntity<List<TransactionResponse>> getAccountTransactions(
            @RequestAttribute(SessionInterceptor.SESSION_ATTRIBUTE) AuthenticatedSession session,
            @PathVariable String accountId) {
        List<TransactionResponse> history = transferService.getAccountHistory(accountId, session.getUserId()).stream()
            .map(TransactionResponse::from)
            .collect(Collectors.toList());
        return ResponseEntity.ok(history);
    }
}
