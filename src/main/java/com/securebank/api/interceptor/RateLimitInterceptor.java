package com.securebank.api.interceptor;

import com.securebank.common.exception.RateLimitExceededException;
import com.securebank.guard.AuthorizationGuard;
import com.securebank.ratelimit.RateLimitDecision;
import com.securebank.ratelimit.RateLimiter;
import com.securebank.ratelimit.RouteClass;
import com.securebank.session.AuthenticatedSession;
import com.securebank.session.SessionManager;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.util.Optional;

/**
 * Applies the rate limiter before any other request processing.
 *
 * Requests carrying a live session are counted per user, all others per client address.
 * Sessions of active administrators are exempt.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RateLimitInterceptor implements HandlerInterceptor {

    private final RateLimiter rateLimiter;
    private final SessionManager sessionManager;
    private final AuthorizationGuard authorizationGuard;
    private final RouteClassifier routeClassifier;
    private final ClientIpResolver clientIpResolver;
    private final SessionCookies sessionCookies;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        Optional<AuthenticatedSession> session = sessionManager.peek(sessionCookies.read(request));
        if (authorizationGuard.isRateLimitExempt(session)) {
            log.debug("Rate limit skipped for administrator {}", session.get().getUserId());
            return true;
        }

        String identity = session.map(s -> "user:" + s.getUserId())
            .orElseGet(() -> "ip:" + clientIpResolver.resolve(request));
        RouteClass routeClass = routeClassifier.classify(request);
        RateLimitDecision decision = rateLimiter.allow(identity, routeClass);

        response.setHeader("X-RateLimit-Limit", String.valueOf(decision.getLimit()));
        response.setHeader("X-RateLimit-Remaining", String.valueOf(decision.getRemaining()));

        if (!decision.isAllowed()) {
            log.warn("Rate limit exceeded for {} on {} {}", identity, request.getMethod(), request.getRequestURI());
            throw new RateLimitExceededException(decision.getLimit(), decision.getRetryAfterSeconds());
        }
        return true;
    }
}
