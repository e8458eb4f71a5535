package com.buildflow.agencyapi.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Service identity, bound from {@code buildflow.service.*}.
 *
 * <pre>
 * buildflow:
 *   service:
 *     name: agency-api
 *     environment: production
 * </pre>
 *
 * @param name service name used in logs and metric tags
 * @param environment deployment environment; {@code production} hides error details
 * @param description optional text shown by the info endpoint
 */
@ConfigurationProperties(prefix = "buildflow.service")
@Validated
public record ServiceProperties(@NotBlank String name, String environment, String description) {

    public ServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
    }

    public boolean isProduction() {
        return "production".equalsIgnoreCase(environment);
    }
}
