package com.buildflow.database.error;

import static org.assertj.core.api.Assertions.assertThat;

import java.net.ConnectException;
import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.sql.SQLTransientException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;

@DisplayName("DatabaseErrorClassifier")
class DatabaseErrorClassifierTest {

    @ParameterizedTest(name = "SQLState {0} -> {1}")
    @CsvSource({
        "3D000, TENANT_NOT_FOUND",
        "42P01, SCHEMA_MISMATCH",
        "42703, SCHEMA_MISMATCH",
        "42883, SCHEMA_MISMATCH",
        "42704, SCHEMA_MISMATCH",
        "08001, TRANSIENT_FAILURE",
        "08006, TRANSIENT_FAILURE",
        "57P01, TRANSIENT_FAILURE",
        "57P03, TRANSIENT_FAILURE",
        "53300, TRANSIENT_FAILURE",
        "57014, TRANSIENT_FAILURE",
        "23505, CONSTRAINT_VIOLATION",
        "23503, CONSTRAINT_VIOLATION",
        "22P02, UNKNOWN",
        "42601, UNKNOWN"
    })
    @DisplayName("maps SQLState to error kind")
    void mapsSqlState(String sqlState, DatabaseErrorKind expected) {
        assertThat(DatabaseErrorClassifier.classify(new SQLException("failure", sqlState)))
                .isEqualTo(expected);
    }

    @Nested
    @DisplayName("Exception types")
    class ExceptionTypes {

        @Test
        @DisplayName("acquisition timeout without a connection failure is POOL_EXHAUSTED")
        void acquisitionTimeoutIsPoolExhausted() {
            assertThat(DatabaseErrorClassifier.classify(acquisitionTimeout(null)))
                    .isEqualTo(DatabaseErrorKind.POOL_EXHAUSTED);
        }

        @Test
        @DisplayName("acquisition timeout caused by a missing database is TENANT_NOT_FOUND")
        void acquisitionTimeoutForMissingDatabase() {
            var failure = new SQLException("FATAL: database \"acme_db\" does not exist", "3D000");

            assertThat(DatabaseErrorClassifier.classify(acquisitionTimeout(failure)))
                    .isEqualTo(DatabaseErrorKind.TENANT_NOT_FOUND);
        }

        @Test
        @DisplayName("acquisition timeout caused by a refused connection is TRANSIENT_FAILURE")
        void acquisitionTimeoutForUnreachableServer() {
            var failure =
                    new SQLException(
                            "Connection to 127.0.0.1:1 refused",
                            "08001",
                            new ConnectException("Connection refused"));

            assertThat(DatabaseErrorClassifier.classify(acquisitionTimeout(failure)))
                    .isEqualTo(DatabaseErrorKind.TRANSIENT_FAILURE);
        }

        @Test
        @DisplayName("reads the SQLState from the next exception when the timeout has none")
        void readsNextException() {
            var timeout = new SQLTransientConnectionException("agency-acme_db - request timed out");
            timeout.setNextException(new SQLException("relation missing", "42P01"));

            assertThat(DatabaseErrorClassifier.classify(timeout))
                    .isEqualTo(DatabaseErrorKind.SCHEMA_MISMATCH);
        }

        @Test
        @DisplayName("acquisition timeout with a non-SQL cause is TRANSIENT_FAILURE")
        void acquisitionTimeoutWithIoCause() {
            var timeout =
                    new SQLTransientConnectionException(
                            "agency-acme_db - request timed out", new ConnectException("refused"));

            assertThat(DatabaseErrorClassifier.classify(timeout))
                    .isEqualTo(DatabaseErrorKind.TRANSIENT_FAILURE);
        }

        @Test
        @DisplayName("transient exception without SQLState is TRANSIENT_FAILURE")
        void transientWithoutState() {
            assertThat(DatabaseErrorClassifier.classify(new SQLTransientException("retry")))
                    .isEqualTo(DatabaseErrorKind.TRANSIENT_FAILURE);
        }

        @Test
        @DisplayName("non-SQL failures are UNKNOWN")
        void nonSqlFailure() {
            assertThat(DatabaseErrorClassifier.classify(new IllegalStateException("boom")))
                    .isEqualTo(DatabaseErrorKind.UNKNOWN);
            assertThat(DatabaseErrorClassifier.classify(null)).isEqualTo(DatabaseErrorKind.UNKNOWN);
        }
    }

    @Nested
    @DisplayName("Spring exceptions")
    class SpringExceptions {

        @Test
        @DisplayName("unwraps DataAccessException to the driver exception")
        void unwrapsDataAccessException() {
            var wrapped =
                    new DataAccessResourceFailureException(
                            "failed", new SQLException("database does not exist", "3D000"));

            assertThat(DatabaseErrorClassifier.classify(wrapped))
                    .isEqualTo(DatabaseErrorKind.TENANT_NOT_FOUND);
        }

        @Test
        @DisplayName("connection acquisition failure wrapped by Spring is POOL_EXHAUSTED")
        void cannotGetConnection() {
            var wrapped =
                    new CannotGetJdbcConnectionException(
                            "Failed to obtain JDBC Connection",
                            new SQLTransientConnectionException("timed out"));

            assertThat(DatabaseErrorClassifier.classify(wrapped))
                    .isEqualTo(DatabaseErrorKind.POOL_EXHAUSTED);
        }
    }

    /** Shaped like HikariPool#createTimeoutException: SQLState and next exception copied from the last failure. */
    static SQLTransientConnectionException acquisitionTimeout(SQLException lastFailure) {
        var timeout =
                new SQLTransientConnectionException(
                        "agency-acme_db - Connection is not available, request timed out after 10000ms.",
                        lastFailure == null ? null : lastFailure.getSQLState(),
                        lastFailure);
        if (lastFailure != null) {
            timeout.setNextException(lastFailure);
        }
        return timeout;
    }

    @Test
    @DisplayName("TenantDatabaseException.from returns PoolExhaustedException for exhaustion")
    void fromReturnsMostSpecificType() {
        TenantDatabaseException exhausted =
                TenantDatabaseException.from(new SQLTransientConnectionException("timed out"), "acme_db");
        TenantDatabaseException missing =
                TenantDatabaseException.from(new SQLException("gone", "3D000"), "acme_db");

        assertThat(exhausted).isInstanceOf(PoolExhaustedException.class);
        assertThat(exhausted.databaseName()).isEqualTo("acme_db");
        assertThat(missing).isNotInstanceOf(PoolExhaustedException.class);
        assertThat(missing.kind()).isEqualTo(DatabaseErrorKind.TENANT_NOT_FOUND);
    }
}
