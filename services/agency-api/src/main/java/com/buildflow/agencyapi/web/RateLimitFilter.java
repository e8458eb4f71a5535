package com.buildflow.agencyapi.web;

import com.buildflow.agencyapi.config.ApiProperties;
import com.buildflow.security.ErrorCode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.ConsumptionProbe;
import io.github.bucket4j.Refill;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Per-client token bucket in front of the API. A client is identified by the first hop of
 * {@code X-Forwarded-For}, or the remote address when the header is absent. Buckets live in a
 * bounded Caffeine cache and expire once a client has been quiet for a full window.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 20)
public class RateLimitFilter extends OncePerRequestFilter {

    public static final String RETRY_AFTER_HEADER = "Retry-After";
    public static final String LIMIT_HEADER = "X-RateLimit-Limit";
    public static final String REMAINING_HEADER = "X-RateLimit-Remaining";

    static final Set<String> EXEMPT_PATHS = Set.of("/health", "/api/health", "/actuator/health");

    private static final Logger log = LoggerFactory.getLogger(RateLimitFilter.class);

    private final ApiProperties.RateLimit settings;
    private final ErrorResponseWriter errorWriter;
    private final Cache<String, Bucket> buckets;

    public RateLimitFilter(ApiProperties properties, ErrorResponseWriter errorWriter) {
        this.settings = properties.rateLimit();
        this.errorWriter = errorWriter;
        this.buckets =
                Caffeine.newBuilder()
                        .maximumSize(settings.maxTrackedClients())
                        .expireAfterAccess(settings.window())
                        .build();
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (!settings.enabled() || HttpMethod.OPTIONS.matches(request.getMethod())) {
            return true;
        }
        String path = request.getRequestURI();
        return EXEMPT_PATHS.contains(path) || path.startsWith("/actuator/health/");
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String client = clientKey(request);
        Bucket bucket = buckets.get(client, key -> newBucket());
        ConsumptionProbe probe = bucket.tryConsumeAndReturnRemaining(1);

        response.setHeader(LIMIT_HEADER, Long.toString(settings.capacity()));
        if (probe.isConsumed()) {
            response.setHeader(REMAINING_HEADER, Long.toString(probe.getRemainingTokens()));
            filterChain.doFilter(request, response);
            return;
        }

        long retryAfterSeconds =
                Math.max(1, TimeUnit.NANOSECONDS.toSeconds(probe.getNanosToWaitForRefill()));
        log.warn("Rate limit exceeded for client {} on {} {}", client, request.getMethod(), request.getRequestURI());
        response.setHeader(REMAINING_HEADER, "0");
        response.setHeader(RETRY_AFTER_HEADER, Long.toString(retryAfterSeconds));
        errorWriter.write(response, ErrorCode.RATE_LIMITED, Map.of("retryAfterSeconds", retryAfterSeconds));
    }

    static String clientKey(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            String first = forwarded.split(",", 2)[0].strip();
            if (!first.isEmpty()) {
                return first;
            }
        }
        return request.getRemoteAddr();
    }

    private Bucket newBucket() {
        return Bucket.builder()
                .addLimit(
                        Bandwidth.classic(
                                settings.capacity(),
                                Refill.intervally(settings.capacity(), settings.window())))
                .build();
    }
}
