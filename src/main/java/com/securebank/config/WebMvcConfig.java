package com.securebank.config;

import com.securebank.api.interceptor.AdminGuardInterceptor;
import com.securebank.api.interceptor.CsrfInterceptor;
import com.securebank.api.interceptor.RateLimitInterceptor;
import com.securebank.api.interceptor.SecurityHeadersInterceptor;
import com.securebank.api.interceptor.SessionInterceptor;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web MVC configuration for registering the request pipeline.
 *
 * Registration order is execution order: headers, rate limit, session, CSRF, admin guard.
 */
@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

    private static final String[] API_PATHS = {"/api/**"};
    private static final String[] DOC_PATHS = {"/api-docs/**", "/swagger-ui/**", "/swagger-ui.html"};

    private final SecurityHeadersInterceptor securityHeadersInterceptor;
    private final RateLimitInterceptor rateLimitInterceptor;
    private final SessionInterceptor sessionInterceptor;
    private final CsrfInterceptor csrfInterceptor;
    private final AdminGuardInterceptor adminGuardInterceptor;

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(securityHeadersInterceptor).addPathPatterns(API_PATHS);
        registry.addInterceptor(rateLimitInterceptor).addPathPatterns(API_PATHS).excludePathPatterns(DOC_PATHS);
        registry.addInterceptor(sessionInterceptor).addPathPatterns(API_PATHS).excludePathPatterns(DOC_PATHS);
        registry.addInterceptor(csrfInterceptor).addPathPatterns(API_PATHS).excludePathPatterns(DOC_PATHS);
        registry.addInterceptor(adminGuardInterceptor).addPathPatterns(API_PATHS).excludePathPatterns(DOC_PATHS);
    }
}
