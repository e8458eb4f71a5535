package com.buildflow.security.token;

import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Session token settings, bound from {@code buildflow.security.token.*}. The secret normally comes
 * from the {@code JWT_SECRET} environment variable.
 *
 * @param secret HMAC signing secret, at least 32 characters
 * @param issuer {@code iss} claim written and required
 * @param audience {@code aud} claim written and required
 * @param ttl lifetime of issued tokens
 * @param clockSkew tolerance applied to {@code exp} during verification
 */
@Validated
@ConfigurationProperties(prefix = "buildflow.security.token")
public record TokenProperties(
        @NotBlank String secret, String issuer, String audience, Duration ttl, Duration clockSkew) {

    public TokenProperties {
        if (issuer == null || issuer.isBlank()) {
            issuer = "buildflow";
        }
        if (audience == null || audience.isBlank()) {
            audience = "buildflow-api";
        }
        if (ttl == null) {
            ttl = Duration.ofHours(24);
        }
        if (clockSkew == null) {
            clockSkew = Duration.ZERO;
        }
    }

    public static TokenProperties withSecret(String secret) {
        return new TokenProperties(secret, null, null, null, null);
    }

    @Override
    public String toString() {
        return "TokenProperties[issuer=" + issuer + ", audience=" + audience + ", ttl=" + ttl + "]";
    }
}
