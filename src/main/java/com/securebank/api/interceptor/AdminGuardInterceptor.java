package com.securebank.api.interceptor;

import com.securebank.api.controller.AdminController;
import com.securebank.common.exception.AccessDeniedException;
import com.securebank.guard.AuthorizationGuard;
import com.securebank.guard.Role;
import com.securebank.ratelimit.RouteClass;
import com.securebank.session.AuthenticatedSession;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Admits only administrators to admin routes.
 *
 * A request is treated as an admin request when its path is an admin route or when it resolved
 * to a handler on {@link AdminController}, whichever way the path was spelled.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AdminGuardInterceptor implements HandlerInterceptor {

    private final AuthorizationGuard authorizationGuard;
    private final RouteClassifier routeClassifier;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (routeClassifier.classify(request) != RouteClass.ADMIN && !isAdminHandler(handler)) {
            return true;
        }
        AuthenticatedSession session = (AuthenticatedSession) request.getAttribute(SessionInterceptor.SESSION_ATTRIBUTE);
        if (!authorizationGuard.requireRole(session, Role.ADMIN)) {
            log.warn("Admin route {} {} denied for user {}", request.getMethod(), request.getRequestURI(),
                session != null ? session.getUserId() : "none");
            throw new AccessDeniedException("Administrator access required");
        }
        return true;
    }

    private static boolean isAdminHandler(Object handler) {
        return handler instanceof HandlerMethod
            && AdminController.class.isAssignableFrom(((HandlerMethod) handler).getBeanType());
    }
}
