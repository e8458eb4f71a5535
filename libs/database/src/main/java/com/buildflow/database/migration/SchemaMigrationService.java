package com.buildflow.database.migration;

import java.util.EnumMap;
import java.util.Map;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.MigrationInfo;
import org.flywaydb.core.api.MigrationInfoService;
import org.flywaydb.core.api.output.MigrateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs Flyway migrations against the main database and against agency databases.
 *
 * <p>Spring Boot's Flyway auto-configuration only knows a single datasource, while agency
 * databases are created at runtime. Services therefore exclude {@code FlywayAutoConfiguration}
 * and call this service with the {@link DataSource} of the pool that targets the database.
 *
 * <p>This is a POJO (no Spring annotations), so it can be built in unit tests without a context.
 */
public class SchemaMigrationService {

    private static final Logger log = LoggerFactory.getLogger(SchemaMigrationService.class);

    /**
     * Outcome of a migration run.
     *
     * @param database database name
     * @param target schema that was migrated
     * @param migrationsExecuted number of migrations applied by this run
     * @param schemaVersion schema version after the run, null when nothing has ever been applied
     */
    public record MigrationResult(
            String database, SchemaTarget target, int migrationsExecuted, String schemaVersion) {}

    /**
     * Migration state of a database.
     *
     * @param database database name
     * @param appliedMigrations number of successfully applied migrations
     * @param pendingMigrations number of migrations waiting to be applied
     * @param currentVersion current schema version, null if no migrations have been applied
     */
    public record DatabaseStatus(
            String database, int appliedMigrations, int pendingMigrations, String currentVersion) {}

    private final Map<SchemaTarget, String> locations = new EnumMap<>(SchemaTarget.class);

    public SchemaMigrationService() {
        this(SchemaTarget.MAIN.defaultLocation(), SchemaTarget.AGENCY.defaultLocation());
    }

    public SchemaMigrationService(String mainLocation, String agencyLocation) {
        locations.put(SchemaTarget.MAIN, mainLocation);
        locations.put(SchemaTarget.AGENCY, agencyLocation);
    }

    public MigrationResult migrate(DataSource dataSource, SchemaTarget target, String database) {
        log.info("Migrating {} schema of database {}", target, database);
        MigrateResult result = flyway(dataSource, target).migrate();
        log.info(
                "Database {} at schema version {} ({} migrations applied)",
                database,
                result.targetSchemaVersion,
                result.migrationsExecuted);
        return new MigrationResult(
                database, target, result.migrationsExecuted, result.targetSchemaVersion);
    }

    public DatabaseStatus status(DataSource dataSource, SchemaTarget target, String database) {
        MigrationInfoService info = flyway(dataSource, target).info();
        MigrationInfo current = info.current();
        return new DatabaseStatus(
                database,
                info.applied().length,
                info.pending().length,
                current != null && current.getVersion() != null
                        ? current.getVersion().getVersion()
                        : null);
    }

    public String location(SchemaTarget target) {
        return locations.get(target);
    }

    /** Builds a Flyway instance. Loading does not connect to the database. */
    Flyway flyway(DataSource dataSource, SchemaTarget target) {
        return Flyway.configure()
                .dataSource(dataSource)
                .locations(locations.get(target))
                .baselineOnMigrate(true)
                .cleanDisabled(true)
                .load();
    }
}
