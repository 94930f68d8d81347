package com.federation.infrastructure.filter;

import com.federation.infrastructure.context.RequestContext;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Set;
import java.util.UUID;

/**
 * Establishes the request id and the acting identity. Mutating API calls must name their identity
 * in {@code X-Site-Key}; reads may omit it.
 */
@Component
@Order(1)
public class SiteKeyFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(SiteKeyFilter.class);

    public static final String SITE_KEY_HEADER = "X-Site-Key";
    public static final String REQUEST_ID_HEADER = "X-Request-Id";

    private static final Set<String> PUBLIC_PATHS = Set.of(
        "/actuator",
        "/api-docs",
        "/v3/api-docs",
        "/swagger-ui",
        "/docs.html"
    );

    private static final Set<String> READ_METHODS = Set.of("GET", "HEAD", "OPTIONS");

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain) throws ServletException, IOException {

        String path = request.getRequestURI();
        String requestId = getOrGenerateRequestId(request);
        response.setHeader(REQUEST_ID_HEADER, requestId);

        String siteKey = request.getHeader(SITE_KEY_HEADER);
        boolean hasKey = siteKey != null && !siteKey.isBlank();

        if (!hasKey && !isPublicPath(path) && !isRead(request) && !isIndexQuery(request)) {
            log.warn("Missing {} header for {} {}", SITE_KEY_HEADER, request.getMethod(), path);
            response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
            response.setContentType("application/json");
            response.getWriter().write(
                "{\"error\":\"UNAUTHORIZED\",\"message\":\"Missing " + SITE_KEY_HEADER + " header\",\"requestId\":\"" + requestId + "\"}"
            );
            return;
        }

        RequestContext.set(hasKey ? siteKey.trim() : null, requestId);
        log.debug("Request accepted: actor={}, requestId={}, path={}", hasKey ? siteKey : "-", requestId, path);

        try {
            filterChain.doFilter(request, response);
        } finally {
            RequestContext.clear();
        }
    }

    private boolean isPublicPath(String path) {
        return PUBLIC_PATHS.stream().anyMatch(path::startsWith);
    }

    private static boolean isRead(HttpServletRequest request) {
        return READ_METHODS.contains(request.getMethod());
    }

    // The composite index query is a POST but does not mutate anything
    private static boolean isIndexQuery(HttpServletRequest request) {
        return "POST".equals(request.getMethod()) && request.getRequestURI().endsWith("/federation-index/query");
    }

    private String getOrGenerateRequestId(HttpServletRequest request) {
        String requestId = request.getHeader(REQUEST_ID_HEADER);
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString();
        }
        return requestId;
    }
}
