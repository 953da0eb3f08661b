package com.securebank.api.interceptor;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Resolves the client address used for rate limiting and audit fields.
 *
 * {@code X-Forwarded-For} is honoured only when {@code secure-bank.http.trust-forwarded-for} is
 * enabled, i.e. when the service sits behind a proxy that overwrites the header.
 */
@Component
public class ClientIpResolver {

    private static final int MAX_LENGTH = 45;

    private final boolean trustForwardedFor;

    public ClientIpResolver(@Value("${secure-bank.http.trust-forwarded-for:false}") boolean trustForwardedFor) {
        this.trustForwardedFor = trustForwardedFor;
    }

    public String resolve(HttpServletRequest request) {
        if (trustForwardedFor) {
            String forwarded = request.getHeader("X-Forwarded-For");
            if (forwarded != null && !forwarded.isBlank()) {
                return truncate(forwarded.split(",")[0].trim());
            }
        }
        return truncate(request.getRemoteAddr());
    }

    private static String truncate(String ip) {
        return ip != null && ip.length() > MAX_LENGTH ? ip.substring(0, MAX_LENGTH) : ip;
    }
}
