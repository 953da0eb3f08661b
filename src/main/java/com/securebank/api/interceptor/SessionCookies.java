package com.securebank.api.interceptor;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Reads and writes the session cookie. The cookie is always HttpOnly with SameSite=Lax.
 */
@Component
public class SessionCookies {

    private final String cookieName;
    private final boolean secure;

    public SessionCookies(@Value("${secure-bank.session.cookie-name:SECURE_BANK_SESSION}") String cookieName,
                          @Value("${secure-bank.session.cookie-secure:true}") boolean secure) {
        this.cookieName = cookieName;
        this.secure = secure;
    }

    public String read(HttpServletRequest request) {
        Cookie[] cookies = request.getCookies();
        if (cookies == null) {
            return null;
        }
        for (Cookie cookie : cookies) {
            if (cookieName.equals(cookie.getName())) {
                return cookie.getValue();
            }
        }
        return null;
    }

    public ResponseCookie issue(String token) {
        return base(token).build();
    }

    public ResponseCookie clear() {
        return base("").maxAge(Duration.ZERO).build();
    }

    public String getCookieName() {
        return cookieName;
    }

    private ResponseCookie.ResponseCookieBuilder base(String value) {
        return ResponseCookie.from(cookieName, value)
            .httpOnly(true)
            .secure(secure)
            .sameSite("Lax")
            .path("/");
    }
}
