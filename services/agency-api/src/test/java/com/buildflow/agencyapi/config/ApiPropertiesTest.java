package com.buildflow.agencyapi.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Service configuration properties")
class ApiPropertiesTest {

    @Test
    @DisplayName("API defaults: 1000 requests per 15 minutes, local origins")
    void apiDefaults() {
        ApiProperties properties = new ApiProperties(null, null);

        assertThat(properties.rateLimit().enabled()).isTrue();
        assertThat(properties.rateLimit().capacity()).isEqualTo(1000);
        assertThat(properties.rateLimit().window()).isEqualTo(Duration.ofMinutes(15));
        assertThat(properties.cors().allowedOrigins()).contains("http://localhost:5173");
        assertThat(properties.cors().allowedHeaders())
                .contains("Content-Type", "Authorization", "X-Agency-Database", "X-Requested-With", "X-API-Key");
    }

    @Test
    @DisplayName("environment defaults to development")
    void serviceDefaults() {
        ServiceProperties properties = new ServiceProperties("agency-api", null, null);

        assertThat(properties.environment()).isEqualTo("development");
        assertThat(properties.isProduction()).isFalse();
        assertThat(new ServiceProperties("agency-api", "Production", null).isProduction()).isTrue();
    }
}
