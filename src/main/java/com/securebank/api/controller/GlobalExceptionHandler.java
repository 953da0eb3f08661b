package com.securebank.api.controller;

import com.securebank.common.exception.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Global exception handler for REST APIs, including failures raised by the request pipeline
 * interceptors.
 *
 * Bodies are {@code {"error": code, "message": text, "status": n}} plus optional fields.
 * Unexpected failures are logged in full and reported without detail.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private static final String GENERIC_MESSAGE = "An unexpected error occurred";

    @ExceptionHandler(AuthenticationFailureException.class)
    public ResponseEntity<Map<String, Object>> handleAuthenticationFailure(AuthenticationFailureException e) {
        return buildErrorResponse(HttpStatus.UNAUTHORIZED, e);
    }

    @ExceptionHandler({SessionNotFoundException.class, SessionExpiredException.class})
    public ResponseEntity<Map<String, Object>> handleSession(SecureBankException e) {
        return buildErrorResponse(HttpStatus.UNAUTHORIZED, e);
    }

    @ExceptionHandler(AccountLockedException.class)
    public ResponseEntity<Map<String, Object>> handleAccountLocked(AccountLockedException e) {
        Map<String, Object> body = body(HttpStatus.LOCKED, e.getErrorCode(), e.getMessage());
        body.put("remainingLockSeconds", e.getRemainingLockSeconds());
        return ResponseEntity.status(HttpStatus.LOCKED)
            .header(HttpHeaders.RETRY_AFTER, String.valueOf(e.getRemainingLockSeconds()))
            .body(body);
    }

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<Map<String, Object>> handleRateLimit(RateLimitExceededException e) {
        Map<String, Object> body = body(HttpStatus.TOO_MANY_REQUESTS, e.getErrorCode(), e.getMessage());
        body.put("retryAfterSeconds", e.getRetryAfterSeconds());
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
            .header(HttpHeaders.RETRY_AFTER, String.valueOf(e.getRetryAfterSeconds()))
            .header("X-RateLimit-Limit", String.valueOf(e.getLimit()))
            .header("X-RateLimit-Remaining", "0")
            .body(body);
    }

    @ExceptionHandler({CsrfValidationException.class, AccessDeniedException.class})
    public ResponseEntity<Map<String, Object>> handleForbidden(SecureBankException e) {
        return buildErrorResponse(HttpStatus.FORBIDDEN, e);
    }

    @ExceptionHandler(TransferDeclinedException.class)
    public ResponseEntity<Map<String, Object>> handleTransferDeclined(TransferDeclinedException e) {
        Map<String, Object> body = body(HttpStatus.UNPROCESSABLE_ENTITY, e.getErrorCode(), e.getMessage());
        if (e.getTransactionId() != null) {
            body.put("transactionId", e.getTransactionId());
        }
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(body);
    }

    @ExceptionHandler({AccountNotFoundException.class, UserNotFoundException.class, TransactionNotFoundException.class})
    public ResponseEntity<Map<String, Object>> handleNotFound(SecureBankException e) {
        return buildErrorResponse(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler({DuplicateIdentityException.class, AccountTypeAlreadyOpenException.class,
        TransactionNotReversibleException.class})
    public ResponseEntity<Map<String, Object>> handleConflict(SecureBankException e) {
        return buildErrorResponse(HttpStatus.CONFLICT, e);
    }

    @ExceptionHandler(WeakPasswordException.class)
    public ResponseEntity<Map<String, Object>> handleWeakPassword(WeakPasswordException e) {
        Map<String, Object> body = body(HttpStatus.BAD_REQUEST, e.getErrorCode(), e.getMessage());
        body.put("rule", e.getRule());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(DecryptionException.class)
    public ResponseEntity<Map<String, Object>> handleDecryption(DecryptionException e) {
        log.error("Stored data failed to decrypt", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(body(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", GENERIC_MESSAGE));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationErrors(MethodArgumentNotValidException e) {
        Map<String, String> fields = new LinkedHashMap<>();
        e.getBindingResult().getFieldErrors().forEach(error ->
            fields.put(error.getField(), error.getDefaultMessage())
        );
        Map<String, Object> body = body(HttpStatus.BAD_REQUEST, "VALIDATION_FAILURE", "Request validation failed");
        body.put("fields", fields);
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest()
            .body(body(HttpStatus.BAD_REQUEST, "VALIDATION_FAILURE", "Malformed request body"));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException e) {
        return ResponseEntity.badRequest()
            .body(body(HttpStatus.BAD_REQUEST, "VALIDATION_FAILURE", e.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception e) {
        if (e instanceof ErrorResponse) {
            ErrorResponse errorResponse = (ErrorResponse) e;
            HttpStatusCode status = errorResponse.getStatusCode();
            return ResponseEntity.status(status)
                .body(body(status, "REQUEST_REJECTED", errorResponse.getBody().getDetail()));
        }
        log.error("Unexpected error", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(body(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", GENERIC_MESSAGE));
    }

    private ResponseEntity<Map<String, Object>> buildErrorResponse(HttpStatus status, SecureBankException e) {
        return ResponseEntity.status(status).body(body(status, e.getErrorCode(), e.getMessage()));
    }

    private static Map<String, Object> body(HttpStatusCode status, String code, String message) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("error", code);
        error.put("message", message);
        error.put("status", status.value());
        return error;
    }
}
