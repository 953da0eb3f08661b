package com.securebank.api.interceptor;

import com.securebank.common.exception.CsrfValidationException;
import com.securebank.session.AuthenticatedSession;
import com.securebank.session.CsrfTokenManager;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Rejects state-changing requests on session routes unless the CSRF header matches the token
 * bound to the session. Runs after {@link SessionInterceptor}.
 */
@Component
@Slf4j
public class CsrfInterceptor implements HandlerInterceptor {

    private final CsrfTokenManager csrfTokenManager;
    private final RouteClassifier routeClassifier;
    private final String headerName;

    public CsrfInterceptor(CsrfTokenManager csrfTokenManager,
                           RouteClassifier routeClassifier,
                           @Value("${secure-bank.csrf.header-name:X-CSRFToken}") String headerName) {
        this.csrfTokenManager = csrfTokenManager;
        this.routeClassifier = routeClassifier;
        this.headerName = headerName;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!routeClassifier.isStateChanging(request) || routeClassifier.isPublic(request)) {
            return true;
        }
        AuthenticatedSession session = (AuthenticatedSession) request.getAttribute(SessionInterceptor.SESSION_ATTRIBUTE);
        if (!csrfTokenManager.validate(session, request.getHeader(headerName))) {
            log.warn("CSRF validation failed for {} {} (user {})", request.getMethod(), request.getRequestURI(),
                session != null ? session.getUserId() : "none");
            throw new CsrfValidationException();
        }
        return true;
    }
}
