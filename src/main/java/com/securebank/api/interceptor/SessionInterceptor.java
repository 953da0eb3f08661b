package com.securebank.api.interceptor;

import com.securebank.session.AuthenticatedSession;
import com.securebank.session.SessionManager;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Requires a valid session on every non-public route and exposes it to controllers as the
 * {@value #SESSION_ATTRIBUTE} request attribute.
 */
@Component
@RequiredArgsConstructor
public class SessionInterceptor implements HandlerInterceptor {

    public static final String SESSION_ATTRIBUTE = "secureBank.session";

    private final SessionManager sessionManager;
    private final RouteClassifier routeClassifier;
    private final SessionCookies sessionCookies;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (routeClassifier.isPublic(request)) {
            return true;
        }
        AuthenticatedSession session = sessionManager.validate(sessionCookies.read(request));
        request.setAttribute(SESSION_ATTRIBUTE, session);
        return true;
    }
}
