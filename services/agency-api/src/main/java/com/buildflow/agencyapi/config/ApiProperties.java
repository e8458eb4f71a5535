package com.buildflow.agencyapi.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * HTTP edge settings, bound from {@code buildflow.api.*}.
 *
 * @param cors cross-origin settings
 * @param rateLimit per-client request budget
 */
@ConfigurationProperties(prefix = "buildflow.api")
@Validated
public record ApiProperties(@Valid Cors cors, @Valid RateLimit rateLimit) {

    public ApiProperties {
        if (cors == null) {
            cors = new Cors(null, null, null, null);
        }
        if (rateLimit == null) {
            rateLimit = new RateLimit(true, 0, null, 0);
        }
    }

    /**
     * @param allowedOrigins origins or origin patterns allowed to call the API
     * @param allowedMethods HTTP methods advertised in preflight responses
     * @param allowedHeaders request headers advertised in preflight responses
     * @param maxAge how long browsers may cache a preflight result
     */
    public record Cors(
            List<String> allowedOrigins,
            List<String> allowedMethods,
            List<String> allowedHeaders,
            Duration maxAge) {

        public Cors {
            if (allowedOrigins == null || allowedOrigins.isEmpty()) {
                allowedOrigins = List.of("http://localhost:3000", "http://localhost:5173");
            }
            if (allowedMethods == null || allowedMethods.isEmpty()) {
                allowedMethods = List.of("GET", "POST", "PUT", "PATCH", "DELETE", "OPTIONS");
            }
            if (allowedHeaders == null || allowedHeaders.isEmpty()) {
                allowedHeaders =
                        List.of(
                                "Content-Type",
                                "Authorization",
                                "X-Agency-Database",
                                "X-Requested-With",
                                "X-API-Key",
                                "X-Correlation-ID");
            }
            if (maxAge == null) {
                maxAge = Duration.ofHours(1);
            }
        }
    }

    /**
     * @param enabled switch for the limiter
     * @param capacity requests allowed per client per window
     * @param window length of the refill window
     * @param maxTrackedClients clients whose buckets are kept in memory
     */
    public record RateLimit(
            boolean enabled, @Min(1) long capacity, Duration window, @Min(1) long maxTrackedClients) {

        public RateLimit {
            if (capacity <= 0) {
                capacity = 1000;
            }
            if (window == null) {
                window = Duration.ofMinutes(15);
            }
            if (maxTrackedClients <= 0) {
                maxTrackedClients = 100_000;
            }
        }
    }
}
