package com.vidrecorder.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.preauth.PreAuthenticatedAuthenticationToken;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;

/**
 * Grants operator access (manual retention sweeps, storage configuration) to requests carrying the
 * configured {@code X-API-Key}.
 * <p>
 * Only a SHA-256 digest of the configured key is kept. Presented keys are digested and compared in
 * constant time, so the comparison does not leak the key length either.
 */
@Component
@Slf4j
public class ApiKeyAuthenticationFilter extends OncePerRequestFilter {

    static final String HEADER = "X-API-Key";
    static final String OPERATOR_PRINCIPAL = "operator";

    private static final List<SimpleGrantedAuthority> OPERATOR_AUTHORITIES =
            List.of(new SimpleGrantedAuthority("ROLE_OPERATOR"));

    private final byte[] operatorKeyDigest;

    public ApiKeyAuthenticationFilter(@Value("${api.key}") String operatorKey) {
        if (!StringUtils.hasText(operatorKey) || operatorKey.startsWith("${")) {
            throw new IllegalStateException(
                    "API_KEY environment variable is not set. "
                    + "Set the operator key before starting the service: export API_KEY=<operator-key>");
        }
        if (operatorKey.length() < 32) {
            log.warn("Operator API key is shorter than 32 characters, use a longer key outside development");
        }
        this.operatorKeyDigest = sha256(operatorKey);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String presented = request.getHeader(HEADER);
        if (StringUtils.hasText(presented)) {
            if (MessageDigest.isEqual(sha256(presented), operatorKeyDigest)) {
                PreAuthenticatedAuthenticationToken operator =
                        new PreAuthenticatedAuthenticationToken(OPERATOR_PRINCIPAL, null, OPERATOR_AUTHORITIES);
                SecurityContextHolder.getContext().setAuthentication(operator);
                log.debug("Operator API key accepted for {}", request.getRequestURI());
            } else {
                log.warn("Rejected operator API key from {} for {}", request.getRemoteAddr(), request.getRequestURI());
            }
        }

        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI();
        return path.equals("/api/health") || path.equals("/api/ping");
    }

    private static byte[] sha256(String value) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
