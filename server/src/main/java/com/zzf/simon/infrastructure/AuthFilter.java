package com.zzf.simon.infrastructure;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.simon.api.ErrorResponse;
import com.zzf.simon.config.SimonProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import javax.servlet.FilterChain;
import javax.servlet.ServletException;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Resolves the caller uid for {@code /v1/**}. Bearer tokens are looked up in the configured token map;
 * the {@code X-User-Id} header is honoured only when explicitly enabled.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
@RequiredArgsConstructor
public final class AuthFilter extends OncePerRequestFilter {
    public static final String USER_HEADER = "X-User-Id";

    private final SimonProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI();
        return path == null || !path.startsWith("/v1/");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String uid = resolveUid(request);
        if (uid == null) {
            log.info("auth.reject path={}", request.getRequestURI());
            response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
            response.setContentType("application/json;charset=UTF-8");
            response.getOutputStream().write(objectMapper.writeValueAsString(
                    new ErrorResponse("UNAUTHENTICATED", "missing or invalid credentials")).getBytes(StandardCharsets.UTF_8));
            return;
        }
        request.setAttribute(CallerContext.UID_ATTRIBUTE, uid);
        MDC.put(CallerContext.MDC_KEY, uid);
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(CallerContext.MDC_KEY);
        }
    }

    String resolveUid(HttpServletRequest request) {
        String authorization = request.getHeader("Authorization");
        if (authorization != null && !authorization.isBlank()) {
            String[] parts = authorization.trim().split("\\s+", 2);
            if (parts.length != 2 || !"bearer".equalsIgnoreCase(parts[0])) {
                return null;
            }
            String uid = properties.getAuth().getDevTokens().get(parts[1]);
            return uid == null || uid.isBlank() ? null : uid;
        }
        if (properties.getAuth().isAllowHeaderUid()) {
            String uid = request.getHeader(USER_HEADER);
            if (uid != null && !uid.isBlank()) {
                return uid.trim();
            }
        }
        return null;
    }
}
