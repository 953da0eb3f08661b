package com.securebank.api.controller;

import com.securebank.api.dto.TransactionResponse;
import com.securebank.api.dto.TransferRequest;
import com.securebank.api.dto.TransferResponse;
import com.securebank.api.interceptor.ClientIpResolver;
import com.securebank.api.interceptor.SessionInterceptor;
import com.securebank.session.AuthenticatedSession;
import com.securebank.transfers.TransferCommand;
import com.securebank.transfers.TransferResult;
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

/**
 * REST API for fund transfers.
 */
@RestController
@RequestMapping("/api/v1/transfers")
@RequiredArgsConstructor
@Tag(name = "Transfers", description = "Fund transfer API")
public class TransferController {

    private static final int MAX_PAGE_SIZE = 100;

    private final TransferService transferService;
    private final ClientIpResolver clientIpResolver;

    @PostMapping
    @Operation(summary = "Transfer funds from an own account to an account number")
    public ResponseEntity<TransferResponse> transfer(
            @RequestAttribute(SessionInterceptor.SESSION_ATTRIBUTE) AuthenticatedSession session,
            @Valid @RequestBody TransferRequest request,
            HttpServletRequest httpRequest) {
        TransferCommand command = TransferCommand.builder()
            .initiatorUserId(session.getUserId())
            .sourceAccountId(request.getSourceAccountId())
            .destinationAccountNumber(request.getDestinationAccountNumber())
            .amount(request.getAmount())
            .description(request.getDescription())
            .sourceIp(clientIpResolver.resolve(httpRequest))
            .userAgent(httpRequest.getHeader(HttpHeaders.USER_AGENT))
            .build();

        TransferResult result = transferService.transfer(command);
        return ResponseEntity.status(HttpStatus.CREATED).body(TransferResponse.from(result));
    }

    @GetMapping
    @Operation(summary = "Recent transactions across own accounts")
    public ResponseEntity<Page<TransactionResponse>> listTransactions(
            @RequestAttribute(SessionInterceptor.SESSION_ATTRIBUTE) AuthenticatedSession session,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size) {
        PageRequest pageable = PageRequest.of(Math.max(page, 0), Math.min(Math.max(size, 1), MAX_PAGE_SIZE),
            Sort.by(Sort.Direction.DESC, "createdAt"));
        return ResponseEntity.ok(transferService.getUserHistory(session.getUserId(), pageable)
            .map(TransactionResponse::from));
    }
}
