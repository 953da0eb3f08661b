package com.securebank.api.interceptor;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Stamps browser security headers on every API response, including error responses.
 */
@Component
public class SecurityHeadersInterceptor implements HandlerInterceptor {

    private final String contentSecurityPolicy;
    private final String strictTransportSecurity;

    public SecurityHeadersInterceptor(
            @Value("${secure-bank.security-headers.content-security-policy:default-src 'self'; script-src 'self' 'unsafe-inline'; style-src 'self' 'unsafe-inline';}")
            String contentSecurityPolicy,
            @Value("${secure-bank.security-headers.strict-transport-security:max-age=31536000; includeSubDomains}")
            String strictTransportSecurity) {
        this.contentSecurityPolicy = contentSecurityPolicy;
        this.strictTransportSecurity = strictTransportSecurity;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        response.setHeader("X-Content-Type-Options", "nosniff");
        response.setHeader("X-Frame-Options", "DENY");
        response.setHeader("X-XSS-Protection", "1; mode=block");
        response.setHeader("Strict-Transport-Security", strictTransportSecurity);
        response.setHeader("Content-Security-Policy", contentSecurityPolicy);
        response.setHeader("Cache-Control", "no-store");
        return true;
    }
}
