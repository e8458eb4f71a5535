package com.buildflow.database.config;

import com.buildflow.database.agency.AgencyProvisioningService;
import com.buildflow.database.agency.AgencyRepository;
import com.buildflow.database.agency.AgencyResolver;
import com.buildflow.database.migration.SchemaMigrationService;
import com.buildflow.database.migration.SchemaTarget;
import com.buildflow.database.pool.DatabasePool;
import com.buildflow.database.pool.HikariPoolFactory;
import com.buildflow.database.pool.PoolFactory;
import com.buildflow.database.pool.TenantPoolManager;
import com.buildflow.database.url.DatabaseUrl;
import java.time.Clock;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

/**
 * Spring wiring for tenant database routing.
 *
 * <p>Services import this configuration and exclude {@code DataSourceAutoConfiguration} and
 * {@code FlywayAutoConfiguration}: every pool, including the main one, is owned by the {@link
 * TenantPoolManager}.
 *
 * <pre>{@code
 * @SpringBootApplication(exclude = {DataSourceAutoConfiguration.class, FlywayAutoConfiguration.class})
 * @Import(TenantDatabaseConfiguration.class)
 * }</pre>
 */
@Configuration
@EnableConfigurationProperties(DatabaseProperties.class)
public class TenantDatabaseConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public PoolFactory poolFactory() {
        return new HikariPoolFactory();
    }

    /** Closed in parallel within {@code buildflow.database.shutdown-timeout} on shutdown. */
    @Bean(destroyMethod = "close")
    public TenantPoolManager tenantPoolManager(
            DatabaseProperties properties, PoolFactory poolFactory, Clock clock) {
        return new TenantPoolManager(properties, poolFactory, clock);
    }

    @Bean
    public AgencyRepository agencyRepository(TenantPoolManager poolManager) {
        return new AgencyRepository(poolManager);
    }

    @Bean
    public AgencyResolver agencyResolver(
            AgencyRepository agencyRepository, DatabaseProperties properties) {
        return new AgencyResolver(agencyRepository, properties);
    }

    @Bean
    public SchemaMigrationService schemaMigrationService() {
        return new SchemaMigrationService();
    }

    @Bean
    public AgencyProvisioningService agencyProvisioningService(
            TenantPoolManager poolManager,
            AgencyRepository agencyRepository,
            AgencyResolver agencyResolver,
            SchemaMigrationService schemaMigrationService,
            DatabaseProperties properties,
            Clock clock) {
        return new AgencyProvisioningService(
                poolManager,
                agencyRepository,
                agencyResolver,
                schemaMigrationService,
                () -> adminJdbcTemplate(poolManager.serverUrl(), properties.adminDatabase()),
                clock);
    }

    @Bean
    @ConditionalOnProperty(
            prefix = "buildflow.database",
            name = "migrate-main-on-startup",
            havingValue = "true")
    public ApplicationRunner mainSchemaMigration(
            TenantPoolManager poolManager, SchemaMigrationService schemaMigrationService) {
        return args -> {
            DatabasePool main = poolManager.getMainPool();
            schemaMigrationService.migrate(
                    main.dataSource(), SchemaTarget.MAIN, poolManager.mainDatabaseName());
        };
    }

    // short-lived and unpooled: only used for the occasional CREATE DATABASE
    private static JdbcTemplate adminJdbcTemplate(DatabaseUrl server, String adminDatabase) {
        DriverManagerDataSource dataSource =
                new DriverManagerDataSource(
                        server.toJdbcUrl(adminDatabase), server.user(), server.password());
        return new JdbcTemplate(dataSource);
    }
}
