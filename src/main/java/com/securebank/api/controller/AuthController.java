package com.securebank.api.controller;

import com.securebank.api.dto.ChangePasswordRequest;
import com.securebank.api.dto.LoginRequest;
import com.securebank.api.dto.RegisterRequest;
import com.securebank.api.dto.SessionResponse;
import com.securebank.api.dto.UserResponse;
import com.securebank.api.interceptor.ClientIpResolver;
import com.securebank.api.interceptor.SessionCookies;
import com.securebank.api.interceptor.SessionInterceptor;
import com.securebank.auth.AuthenticationService;
import com.securebank.auth.LoginResult;
import com.securebank.session.AuthenticatedSession;
import com.securebank.users.CredentialStore;
import com.securebank.users.User;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for registration, login and session management.
 */
@RestController
@RequestMapping("/api/v1/auth")
@RequiredArgsConstructor
@Tag(name = "Authentication", description = "Registration, login and session API")
public class AuthController {

    private final CredentialStore credentialStore;
    private final AuthenticationService authenticationService;
    private final SessionCookies sessionCookies;
    private final ClientIpResolver clientIpResolver;

    @PostMapping("/register")
    @Operation(summary = "Register a new customer")
    public ResponseEntity<UserResponse> register(@Valid @RequestBody RegisterRequest request) {
        User user = credentialStore.register(request.getUsername(), request.getEmail(),
            request.getPassword(), request.getFullName(), request.getPhone());
        return ResponseEntity.status(HttpStatus.CREATED).body(UserResponse.from(user));
    }

    @PostMapping("/login")
    @Operation(summary = "Log in and receive a session cookie and CSRF token")
    public ResponseEntity<SessionResponse> login(@Valid @RequestBody LoginRequest request,
                                                 HttpServletRequest httpRequest) {
        LoginResult result = authenticationService.login(request.getUsername(), request.getPassword(),
            clientIpResolver.resolve(httpRequest), httpRequest.getHeader(HttpHeaders.USER_AGENT));

        return ResponseEntity.ok()
            .header(HttpHeaders.SET_COOKIE, sessionCookies.issue(result.getSession().getToken()).toString())
            .body(new SessionResponse(UserResponse.from(result.getUser()),
                result.getSession().getSession().getCsrfToken()));
    }

    @PostMapping("/logout")
    @Operation(summary = "End the current session")
    public ResponseEntity<Void> logout(HttpServletRequest httpRequest) {
        authenticationService.logout(sessionCookies.read(httpRequest));
        return ResponseEntity.noContent()
            .header(HttpHeaders.SET_COOKIE, sessionCookies.clear().toString())
            .build();
    }

    @PostMapping("/password")
    @Operation(summary = "Change own password; other sessions are ended")
    public ResponseEntity<Void> changePassword(
            @RequestAttribute(SessionInterceptor.SESSION_ATTRIBUTE) AuthenticatedSession session,
            @Valid @RequestBody ChangePasswordRequest request,
            HttpServletRequest httpRequest) {
        authenticationService.changePassword(session, request.getCurrentPassword(), request.getNewPassword(),
            clientIpResolver.resolve(httpRequest), httpRequest.getHeader(HttpHeaders.USER_AGENT));
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/session")
    @Operation(summary = "Current user and CSRF token")
    public ResponseEntity<SessionResponse> currentSession(
            @RequestAttribute(SessionInterceptor.SESSION_ATTRIBUTE) AuthenticatedSession session) {
        return ResponseEntity.ok(new SessionResponse(UserResponse.from(session.getUser()), session.getCsrfToken()));
    }
}
