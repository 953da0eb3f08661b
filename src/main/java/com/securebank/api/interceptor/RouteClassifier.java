package com.securebank.api.interceptor;

import com.securebank.ratelimit.RouteClass;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UrlPathHelper;

import java.util.Set;

/**
 * Maps request paths to route classes and identifies the public routes that need no session.
 */
@Component
public class RouteClassifier {

    static final String AUTH_PREFIX = "/api/v1/auth/";
    static final String ADMIN_PREFIX = "/api/v1/admin/";

    private static final Set<String> PUBLIC_POST_PATHS = Set.of(
        AUTH_PREFIX + "login",
        AUTH_PREFIX + "register"
    );

    private static final Set<String> STATE_CHANGING_METHODS = Set.of("POST", "PUT", "PATCH", "DELETE");

    public RouteClass classify(HttpServletRequest request) {
        String path = pathOf(request);
        if (path.startsWith(AUTH_PREFIX)) {
            return RouteClass.AUTHENTICATION;
        }
        if (path.startsWith(ADMIN_PREFIX) || path.equals("/api/v1/admin")) {
            return RouteClass.ADMIN;
        }
        return RouteClass.STANDARD;
    }

    public boolean isPublic(HttpServletRequest request) {
        return "POST".equalsIgnoreCase(request.getMethod()) && PUBLIC_POST_PATHS.contains(pathOf(request));
    }

    public boolean isStateChanging(HttpServletRequest request) {
        return STATE_CHANGING_METHODS.contains(request.getMethod().toUpperCase());
    }

    /**
     * Decoded path within the application with {@code ;} parameters removed, the same form the
     * handler mappings match on.
     */
    static String pathOf(HttpServletRequest request) {
        String path = UrlPathHelper.defaultInstance.getPathWithinApplication(request);
        return path.length() > 1 && path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
    }
}
