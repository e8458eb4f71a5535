package com.buildflow.agencyapi.web;

import com.buildflow.agencyapi.config.ApiProperties;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Applies the CORS policy and answers every {@code OPTIONS} request with 204 before any other
 * work happens. An origin outside the policy gets no CORS headers, which makes the browser block
 * the call; the preflight itself still succeeds.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class CorsPreflightFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(CorsPreflightFilter.class);

    private final CorsConfiguration configuration;
    private final String allowedMethods;
    private final String allowedHeaders;
    private final String maxAge;

    public CorsPreflightFilter(ApiProperties properties) {
        ApiProperties.Cors cors = properties.cors();
        this.configuration = new CorsConfiguration();
        cors.allowedOrigins().forEach(configuration::addAllowedOriginPattern);
        configuration.setAllowCredentials(true);
        this.allowedMethods = String.join(", ", cors.allowedMethods());
        this.allowedHeaders = String.join(", ", cors.allowedHeaders());
        this.maxAge = Long.toString(cors.maxAge().toSeconds());
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String origin = request.getHeader(HttpHeaders.ORIGIN);
        boolean preflight = HttpMethod.OPTIONS.matches(request.getMethod());
        if (origin != null) {
            applyCorsHeaders(origin, preflight, response);
        }

        if (preflight) {
            response.setStatus(HttpServletResponse.SC_NO_CONTENT);
            return;
        }
        filterChain.doFilter(request, response);
    }

    private void applyCorsHeaders(String origin, boolean preflight, HttpServletResponse response) {
        String allowedOrigin;
        try {
            allowedOrigin = configuration.checkOrigin(origin);
        } catch (RuntimeException e) {
            log.warn("CORS check failed for origin {}: {}", origin, e.getMessage());
            return;
        }
        response.addHeader(HttpHeaders.VARY, HttpHeaders.ORIGIN);
        if (allowedOrigin == null) {
            log.debug("Origin {} is not allowed", origin);
            return;
        }
        response.setHeader(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, allowedOrigin);
        response.setHeader(HttpHeaders.ACCESS_CONTROL_ALLOW_CREDENTIALS, "true");
        response.setHeader(
                HttpHeaders.ACCESS_CONTROL_EXPOSE_HEADERS,
                CorrelationIdFilter.CORRELATION_ID_HEADER + ", " + RateLimitFilter.RETRY_AFTER_HEADER);
        if (preflight) {
            response.setHeader(HttpHeaders.ACCESS_CONTROL_ALLOW_METHODS, allowedMethods);
            response.setHeader(HttpHeaders.ACCESS_CONTROL_ALLOW_HEADERS, allowedHeaders);
            response.setHeader(HttpHeaders.ACCESS_CONTROL_MAX_AGE, maxAge);
        }
    }
}
