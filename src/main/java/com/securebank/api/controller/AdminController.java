package com.securebank.api.controller;

import com.securebank.accounts.AccountService;
import com.securebank.admin.AdminService;
import com.securebank.admin.SystemOverview;
import com.securebank.api.dto.AccountResponse;
import com.securebank.api.dto.AccountStatusRequest;
import com.securebank.api.dto.DepositRequest;
import com.securebank.api.dto.ResetPasswordRequest;
import com.securebank.api.dto.ReversalRequest;
import com.securebank.api.dto.TransactionResponse;
import com.securebank.api.dto.TransferResponse;
import com.securebank.api.dto.UserDetailResponse;
import com.securebank.api.dto.UserResponse;
import com.securebank.api.dto.UserStatusRequest;
import com.securebank.api.interceptor.ClientIpResolver;
import com.securebank.api.interceptor.SessionInterceptor;
import com.securebank.session.AuthenticatedSession;
import com.securebank.transfers.TransferService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;

/**
 * REST API for administrators. Every route is behind the admin guard.
 */
@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
@Tag(name = "Administration", description = "User, account and transaction administration API")
public class AdminController {

    private static final int MAX_PAGE_SIZE = 100;

    private final AdminService adminService;
    private final AccountService accountService;
    private final TransferService transferService;
    private final ClientIpResolver clientIpResolver;
    private final Clock clock;

    @GetMapping("/overview")
    @Operation(summary = "System statistics")
    public ResponseEntity<SystemOverview> overview() {
        return ResponseEntity.ok(adminService.getOverview());
    }

    @GetMapping("/users")
    @Operation(summary = "List users, optionally filtered by username, email or name")
    public ResponseEntity<Page<UserResponse>> listUsers(
            @RequestParam(required = false) String search,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size) {
        return ResponseEntity.ok(adminService.listUsers(search, pageOf(page, size)).map(UserResponse::from));
    }

    @GetMapping("/users/{userId}")
    @Operation(summary = "User detail with accounts and recent login attempts")
    public ResponseEntity<UserDetailResponse> getUser(@PathVariable String userId) {
        return ResponseEntity.ok(UserDetailResponse.from(adminService.getUserDetail(userId), clock.instant()));
    }

    @PostMapping("/users/{userId}/status")
    @Operation(summary = "Activate or deactivate a user")
    public ResponseEntity<UserResponse> setUserStatus(
            @RequestAttribute(SessionInterceptor.SESSION_ATTRIBUTE) AuthenticatedSession session,
            @PathVariable String userId,
            @Valid @RequestBody UserStatusRequest request) {
        return ResponseEntity.ok(UserResponse.from(
            adminService.setUserActive(userId, request.getActive(), session.getUserId())));
    }

    @PostMapping("/users/{userId}/unlock")
    @Operation(summary = "Lift a login lock")
    public ResponseEntity<Void> unlockUser(
            @RequestAttribute(SessionInterceptor.SESSION_ATTRIBUTE) AuthenticatedSession session,
            @PathVariable String userId) {
        adminService.unlockUser(userId, session.getUserId());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/users/{userId}/password")
    @Operation(summary = "Set a new password, unlock and end the user's sessions")
    public ResponseEntity<Void> resetPassword(
            @RequestAttribute(SessionInterceptor.SESSION_ATTRIBUTE) AuthenticatedSession session,
            @PathVariable String userId,
            @Valid @RequestBody ResetPasswordRequest request) {
        adminService.resetPassword(userId, request.getNewPassword(), session.getUserId());
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/accounts")
    @Operation(summary = "List accounts, optionally filtered by number or owner username")
    public ResponseEntity<Page<AccountResponse>> listAccounts(
            @RequestParam(required = false) String search,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size) {
        return ResponseEntity.ok(accountService.listAccounts(search, pageOf(page, size)).map(AccountResponse::from));
    }

    @PostMapping("/accounts/{accountId}/status")
    @Operation(summary = "Enable or disable an account")
    public ResponseEntity<AccountResponse> setAccountStatus(
            @RequestAttribute(SessionInterceptor.SESSION_ATTRIBUTE) AuthenticatedSession session,
            @PathVariable String accountId,
            @Valid @RequestBody AccountStatusRequest request) {
        return ResponseEntity.ok(AccountResponse.from(
            accountService.setStatus(accountId, request.getStatus(), session.getUserId())));
    }

    @PostMapping("/accounts/{accountId}/deposit")
    @Operation(summary = "Fund an account")
    public ResponseEntity<TransferResponse> deposit(
            @RequestAttribute(SessionInterceptor.SESSION_ATTRIBUTE) AuthenticatedSession session,
            @PathVariable String accountId,
            @Valid @RequestBody DepositRequest request,
            HttpServletRequest httpRequest) {
        return ResponseEntity.status(HttpStatus.CREATED).body(TransferResponse.from(
            transferService.deposit(accountId, request.getAmount(), request.getDescription(), session.getUserId(),
                clientIpResolver.resolve(httpRequest), httpRequest.getHeader(HttpHeaders.USER_AGENT))));
    }

    @GetMapping("/transactions")
    @Operation(summary = "List transactions, newest first")
    public ResponseEntity<Page<TransactionResponse>> listTransactions(
            @RequestParam(required = false) String search,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size) {
        return ResponseEntity.ok(transferService.listTransactions(search, pageOf(page, size))
            .map(TransactionResponse::from));
    }

    @PostMapping("/transactions/{transactionId}/reversal")
    @Operation(summary = "Reverse a completed transfer with a compensating transaction")
    public ResponseEntity<TransferResponse> reverse(
            @RequestAttribute(SessionInterceptor.SESSION_ATTRIBUTE) AuthenticatedSession session,
            @PathVariable String transactionId,
            @Valid @RequestBody ReversalRequest request,
            HttpServletRequest httpRequest) {
        return ResponseEntity.status(HttpStatus.CREATED).body(TransferResponse.from(
            transferService.reverse(transactionId, session.getUserId(), request.getReason(),
                clientIpResolver.resolve(httpRequest), httpRequest.getHeader(HttpHeaders.USER_AGENT))));
    }

    private static PageRequest pageOf(int page, int size) {
        return PageRequest.of(Math.max(page, 0), Math.min(Math.max(size, 1), MAX_PAGE_SIZE),
            Sort.by(Sort.Direction.DESC, "createdAt"));
    }
}
