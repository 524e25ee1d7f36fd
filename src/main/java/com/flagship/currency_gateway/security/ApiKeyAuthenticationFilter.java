package com.flagship.currency_gateway.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Optional;

/**
 * Authenticates callers by the raw API key in the {@code Authorization} header.
 *
 * - No header: 401
 * - Key not registered: 403
 * - Registry unreachable: 503
 *
 * On success the bank bound to the key is stored in the {@link #BANK_NAME_ATTRIBUTE}
 * request attribute, where controllers pick it up as the default ledger partition.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
@RequiredArgsConstructor
@Slf4j
public class ApiKeyAuthenticationFilter extends OncePerRequestFilter {

    public static final String BANK_NAME_ATTRIBUTE = "gateway.bankName";

    private final ApiKeyRegistry apiKeyRegistry;

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain)
            throws ServletException, IOException {

        String apiKey = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (apiKey == null || apiKey.isBlank()) {
            reject(response, HttpStatus.UNAUTHORIZED);
            return;
        }

        Optional<String> bankName;
        try {
            bankName = apiKeyRegistry.resolveBankName(apiKey);
        } catch (DataAccessException e) {
            log.error("API key lookup failed: error={}", e.getMessage());
            reject(response, HttpStatus.SERVICE_UNAVAILABLE);
            return;
        }

        if (bankName.isEmpty()) {
            log.warn("Rejected request with unknown API key: path={}", request.getRequestURI());
            reject(response, HttpStatus.FORBIDDEN);
            return;
        }

        request.setAttribute(BANK_NAME_ATTRIBUTE, bankName.get());
        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI();
        return path.equals("/health") || path.startsWith("/actuator");
    }

    private void reject(HttpServletResponse response, HttpStatus status) throws IOException {
        response.setStatus(status.value());
        response.setContentType(MediaType.TEXT_PLAIN_VALUE);
        response.getWriter().write(status.getReasonPhrase());
    }
}
