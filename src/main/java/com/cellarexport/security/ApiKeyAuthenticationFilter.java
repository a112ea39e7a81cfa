package com.cellarexport.security;

import jakarta.annotation.PostConstruct;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;

/**
 * Authenticates the internal caller that triggers exports (the API layer) by its shared key.
 */
@Component
@Slf4j
public class ApiKeyAuthenticationFilter extends OncePerRequestFilter {

    public static final String API_KEY_HEADER = "X-API-Key";
    public static final String TRIGGER_ROLE = "EXPORT_TRIGGER";

    @Value("${api.key}")
    private String validApiKey;

    @PostConstruct
    void validateConfig() {
        if (validApiKey == null || validApiKey.isBlank()
                || validApiKey.equals("${API_KEY}")
                || validApiKey.contains("change-this")) {
            throw new IllegalStateException(
                    "API_KEY environment variable is not set. "
                    + "Set it before starting the application: export API_KEY=<your-secret-key>");
        }
        if (validApiKey.length() < 32) {
            log.warn("API key is shorter than 32 characters, use a stronger key in production");
        }
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI();
        return path.equals("/api/health") || path.equals("/api/ping");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String apiKey = request.getHeader(API_KEY_HEADER);

        if (apiKey != null && constantTimeEquals(apiKey, validApiKey)) {
            SecurityContextHolder.getContext().setAuthentication(new ApiKeyAuthenticationToken());
        } else if (apiKey != null) {
            log.warn("Rejected invalid API key from {}", request.getRemoteAddr());
        }

        filterChain.doFilter(request, response);
    }

    /**
     * Constant-time comparison to prevent timing attacks on the API key.
     */
    private boolean constantTimeEquals(String a, String b) {
        return MessageDigest.isEqual(a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Does not store the API key itself to avoid accidental exposure in logs/serialization.
     */
    private static class ApiKeyAuthenticationToken extends AbstractAuthenticationToken {

        ApiKeyAuthenticationToken() {
            super(List.of(new SimpleGrantedAuthority("ROLE_" + TRIGGER_ROLE)));
            setAuthenticated(true);
        }

        @Override
        public Object getCredentials() {
            return "[PROTECTED]";
        }

        @Override
        public Object getPrincipal() {
            return "export-trigger";
        }
    }
}
