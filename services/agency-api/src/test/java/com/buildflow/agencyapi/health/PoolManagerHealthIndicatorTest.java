package com.buildflow.agencyapi.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.buildflow.database.error.DatabaseErrorKind;
import com.buildflow.database.error.TenantDatabaseException;
import com.buildflow.database.pool.DatabasePool;
import com.buildflow.database.pool.PoolManagerStatistics;
import com.buildflow.database.pool.TenantPoolManager;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

@DisplayName("PoolManagerHealthIndicator")
class PoolManagerHealthIndicatorTest {

    private final TenantPoolManager poolManager = mock(TenantPoolManager.class);
    private final DatabasePool mainPool = mock(DatabasePool.class);
    private final PoolManagerHealthIndicator indicator = new PoolManagerHealthIndicator(poolManager);

    @BeforeEach
    void setUp() {
        when(poolManager.getMainPool()).thenReturn(mainPool);
        when(poolManager.mainDatabaseName()).thenReturn("buildflow");
        when(poolManager.statistics()).thenReturn(new PoolManagerStatistics(null, List.of(), 50, 5));
    }

    @Test
    @DisplayName("UP with pool details when the main database answers")
    void up() {
        when(mainPool.execute(any())).thenReturn(1);

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("mainDatabase", "buildflow")
                .containsEntry("agencyPools", 0)
                .containsEntry("maxAgencyPools", 50);
    }

    @Test
    @DisplayName("DOWN with the error kind when the main database fails")
    void down() {
        when(mainPool.execute(any()))
                .thenThrow(
                        new TenantDatabaseException(
                                DatabaseErrorKind.TRANSIENT_FAILURE, "buildflow", "connection refused"));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("error", "TRANSIENT_FAILURE");
    }

    @Test
    @DisplayName("OUT_OF_SERVICE once the manager is closed")
    void closed() {
        when(poolManager.isClosed()).thenReturn(true);

        assertThat(indicator.health().getStatus()).isEqualTo(Status.OUT_OF_SERVICE);
    }
}
