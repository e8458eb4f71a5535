package com.buildflow.database.agency;

import com.buildflow.database.error.DatabaseErrorKind;
import com.buildflow.database.error.TenantDatabaseException;
import com.buildflow.database.migration.SchemaMigrationService;
import com.buildflow.database.migration.SchemaTarget;
import com.buildflow.database.pool.DatabaseNameValidator;
import com.buildflow.database.pool.DatabasePool;
import com.buildflow.database.pool.TenantPoolManager;
import java.time.Clock;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Creates and deactivates agencies.
 *
 * <p>Provisioning creates the agency's database on the shared server, applies the agency schema
 * through the new agency pool and finally registers the agency in the main database. Provisioning
 * the same domain twice returns the existing agency. A failure after the database was created
 * evicts its pool and drops the database again before the failure is rethrown.
 */
public class AgencyProvisioningService {

    private static final Logger log = LoggerFactory.getLogger(AgencyProvisioningService.class);

    private final TenantPoolManager poolManager;
    private final AgencyRepository repository;
    private final AgencyResolver resolver;
    private final SchemaMigrationService migrations;
    private final Supplier<JdbcTemplate> adminJdbc;
    private final Clock clock;

    /**
     * @param adminJdbc connections to the server's maintenance database, used for {@code CREATE
     *     DATABASE} and {@code DROP DATABASE}
     */
    public AgencyProvisioningService(
            TenantPoolManager poolManager,
            AgencyRepository repository,
            AgencyResolver resolver,
            SchemaMigrationService migrations,
            Supplier<JdbcTemplate> adminJdbc,
            Clock clock) {
        this.poolManager = poolManager;
        this.repository = repository;
        this.resolver = resolver;
        this.migrations = migrations;
        this.adminJdbc = adminJdbc;
        this.clock = clock;
    }

    public ProvisionedAgency provision(ProvisioningRequest request) {
        if (request.domain() != null) {
            Optional<AgencyRecord> existing = repository.findByDomain(request.domain());
            if (existing.isPresent()) {
                log.info(
                        "Domain {} already registered to agency {}, returning it",
                        request.domain(),
                        existing.get().id());
                return new ProvisionedAgency(existing.get(), true);
            }
        }

        String agencyId = UUID.randomUUID().toString();
        String databaseName =
                AgencyDatabaseNames.derive(
                        request.domain() != null ? request.domain() : request.name(), agencyId);

        createDatabase(databaseName);

        AgencyRecord agency;
        try {
            DatabasePool agencyPool = poolManager.getAgencyPool(databaseName);
            migrations.migrate(agencyPool.dataSource(), SchemaTarget.AGENCY, databaseName);

            agency =
                    new AgencyRecord(
                            agencyId,
                            request.name(),
                            request.domain(),
                            databaseName,
                            true,
                            request.subscriptionPlan(),
                            request.maxUsers(),
                            request.ownerUserId(),
                            clock.instant());
            repository.insert(agency);
        } catch (RuntimeException e) {
            log.error(
                    "Provisioning {} failed after its database was created, rolling back",
                    databaseName,
                    e);
            rollback(databaseName, e);
            throw e;
        }
        log.info("Provisioned agency {} ({}) with database {}", agency.id(), agency.name(), databaseName);
        return new ProvisionedAgency(agency, false);
    }

    /**
     * Marks the agency inactive and closes its pool. Tokens already issued for the agency keep
     * their database claim until they expire.
     *
     * @throws AgencyNotFoundException if the agency does not exist
     */
    public AgencyRecord deactivate(String agencyId) {
        AgencyRecord agency =
                repository.findById(agencyId).orElseThrow(() -> new AgencyNotFoundException(agencyId));
        if (repository.deactivate(agencyId)) {
            log.info("Deactivated agency {} ({})", agencyId, agency.databaseName());
        }
        resolver.invalidate(agencyId);
        poolManager.evictAgencyPool(agency.databaseName());
        return agency.deactivated();
    }

    void createDatabase(String databaseName) {
        String quoted = DatabaseNameValidator.quoteIdentifier(databaseName);
        JdbcTemplate jdbc = adminJdbc.get();
        try {
            Boolean exists =
                    jdbc.queryForObject(
                            "SELECT EXISTS(SELECT 1 FROM pg_database WHERE datname = ?)",
                            Boolean.class,
                            databaseName);
            if (Boolean.TRUE.equals(exists)) {
                throw new TenantDatabaseException(
                        DatabaseErrorKind.CONSTRAINT_VIOLATION,
                        databaseName,
                        "Database " + databaseName + " already exists");
            }
            jdbc.execute("CREATE DATABASE " + quoted);
        } catch (DataAccessException e) {
            throw TenantDatabaseException.from(e, databaseName);
        }
        log.info("Created database {}", databaseName);
    }

    private void rollback(String databaseName, RuntimeException failure) {
        poolManager.evictAgencyPool(databaseName);
        try {
            dropDatabase(databaseName);
        } catch (RuntimeException e) {
            log.warn(
                    "Could not drop {} after a failed provisioning, drop it manually: {}",
                    databaseName,
                    e.getMessage());
            failure.addSuppressed(e);
        }
    }

    void dropDatabase(String databaseName) {
        String quoted = DatabaseNameValidator.quoteIdentifier(databaseName);
        JdbcTemplate jdbc = adminJdbc.get();
        jdbc.queryForList(
                "SELECT pg_terminate_backend(pid) FROM pg_stat_activity"
                        + " WHERE datname = ? AND pid <> pg_backend_pid()",
                databaseName);
        jdbc.execute("DROP DATABASE IF EXISTS " + quoted);
        log.info("Dropped database {}", databaseName);
    }
}
