package com.buildflow.agencyapi.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.buildflow.agencyapi.config.ServiceProperties;
import com.buildflow.database.agency.AgencyNotFoundException;
import com.buildflow.database.error.DatabaseErrorKind;
import com.buildflow.database.error.PoolExhaustedException;
import com.buildflow.database.error.TenantDatabaseException;
import com.buildflow.observability.CorrelationContext;
import com.buildflow.observability.CorrelationContextHolder;
import com.buildflow.security.AgencyMismatchException;
import com.buildflow.security.AuthenticationException;
import com.buildflow.security.ErrorCode;
import java.sql.SQLTransientConnectionException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;

@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler =
            new GlobalExceptionHandler(new ServiceProperties("agency-api", "development", null));
    private final GlobalExceptionHandler productionHandler =
            new GlobalExceptionHandler(new ServiceProperties("agency-api", "production", null));

    @BeforeEach
    void setContext() {
        CorrelationContextHolder.set(CorrelationContext.anonymous("corr-1", "req-1"));
    }

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Nested
    @DisplayName("security failures")
    class Security {

        @Test
        @DisplayName("missing token is a 401 with its code")
        void missingToken() {
            ResponseEntity<ErrorResponse> response =
                    handler.handleAuthentication(AuthenticationException.missingToken());

            assertThat(response.getStatusCode().value()).isEqualTo(401);
            assertThat(response.getBody().success()).isFalse();
            assertThat(response.getBody().error().code()).isEqualTo("AUTH_MISSING_TOKEN");
            assertThat(response.getBody().correlationId()).isEqualTo("corr-1");
        }

        @Test
        @DisplayName("agency mismatch is a 403 with details")
        void agencyMismatch() {
            ResponseEntity<ErrorResponse> response =
                    handler.handleAuthorization(new AgencyMismatchException("acme_db", "other_db"));

            assertThat(response.getStatusCode().value()).isEqualTo(403);
            assertThat(response.getBody().error().code()).isEqualTo("RBAC_AGENCY_MISMATCH");
            assertThat(response.getBody().error().details()).containsEntry("requestedDatabase", "other_db");
        }

        @Test
        @DisplayName("production hides details")
        void productionHidesDetails() {
            ResponseEntity<ErrorResponse> response =
                    productionHandler.handleAuthorization(new AgencyMismatchException("acme_db", "other_db"));

            assertThat(response.getBody().error().details()).isNull();
        }
    }

    @Nested
    @DisplayName("database failures")
    class Database {

        @Test
        @DisplayName("pool exhaustion is a retryable 503")
        void poolExhausted() {
            ResponseEntity<ErrorResponse> response =
                    handler.handleDatabase(
                            new PoolExhaustedException(
                                    "acme_db", new SQLTransientConnectionException("timeout")));

            assertThat(response.getStatusCode().value()).isEqualTo(503);
            assertThat(response.getHeaders().getFirst("Retry-After")).isEqualTo("5");
            assertThat(response.getBody().error().code()).isEqualTo("DB_POOL_EXHAUSTED");
        }

        @Test
        @DisplayName("a missing agency database is a 404")
        void tenantNotFound() {
            ResponseEntity<ErrorResponse> response =
                    handler.handleDatabase(
                            new TenantDatabaseException(
                                    DatabaseErrorKind.TENANT_NOT_FOUND, "gone_db", "database does not exist"));

            assertThat(response.getStatusCode().value()).isEqualTo(404);
            assertThat(response.getBody().error().code())
                    .isEqualTo(ErrorCode.AGENCY_DATABASE_NOT_FOUND.name());
        }

        @Test
        @DisplayName("an unknown agency is a 404")
        void agencyNotFound() {
            ResponseEntity<ErrorResponse> response =
                    handler.handleAgencyNotFound(new AgencyNotFoundException("acme_db"));

            assertThat(response.getStatusCode().value()).isEqualTo(404);
            assertThat(response.getBody().error().code()).isEqualTo("AGENCY_NOT_FOUND");
        }
    }

    @Test
    @DisplayName("bad input is a 400")
    void illegalArgument() {
        ResponseEntity<ErrorResponse> response =
                handler.handleIllegalArgument(new IllegalArgumentException("Invalid UUID string: x"));

        assertThat(response.getStatusCode().value()).isEqualTo(400);
        assertThat(response.getBody().message()).isEqualTo("Invalid UUID string: x");
        assertThat(productionHandler.handleIllegalArgument(new IllegalArgumentException("x")).getBody().message())
                .isEqualTo(ErrorCode.VALIDATION_FAILED.defaultMessage());
    }

    @Test
    @DisplayName("unexpected errors are a 500 without exception text in production")
    void generic() {
        ResponseEntity<ErrorResponse> response =
                productionHandler.handleGeneric(new RuntimeException("NullPointer in FooService"));

        assertThat(response.getStatusCode().value()).isEqualTo(500);
        assertThat(response.getBody().error().code()).isEqualTo("INTERNAL_ERROR");
        assertThat(response.getBody().message()).doesNotContain("FooService");
        assertThat(response.getBody().error().details()).isNull();
    }
}
