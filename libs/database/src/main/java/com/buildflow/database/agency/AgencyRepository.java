package com.buildflow.database.agency;

import com.buildflow.database.pool.TenantPoolManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.RowMapper;

/** Reads and writes the tenant registry through the main pool. */
public class AgencyRepository {

    static final String COLUMNS =
            "id::text AS id, name, domain, database_name, is_active, subscription_plan, max_users,"
                    + " owner_user_id::text AS owner_user_id, created_at";

    private static final RowMapper<AgencyRecord> ROW_MAPPER = AgencyRepository::mapRow;

    private final TenantPoolManager poolManager;

    public AgencyRepository(TenantPoolManager poolManager) {
        this.poolManager = poolManager;
    }

    public Optional<AgencyRecord> findById(String agencyId) {
        return queryOne("SELECT " + COLUMNS + " FROM public.agencies WHERE id = CAST(? AS uuid)", agencyId);
    }

    public Optional<AgencyRecord> findByDatabaseName(String databaseName) {
        return queryOne("SELECT " + COLUMNS + " FROM public.agencies WHERE database_name = ?", databaseName);
    }

    public Optional<AgencyRecord> findByDomain(String domain) {
        return queryOne("SELECT " + COLUMNS + " FROM public.agencies WHERE lower(domain) = lower(?)", domain);
    }

    public void insert(AgencyRecord agency) {
        poolManager
                .getMainPool()
                .execute(
                        jdbc ->
                                jdbc.update(
                                        "INSERT INTO public.agencies (id, name, domain, database_name,"
                                                + " is_active, subscription_plan, max_users,"
                                                + " owner_user_id) VALUES (CAST(? AS uuid), ?, ?, ?,"
                                                + " ?, ?, ?, CAST(? AS uuid))",
                                        agency.id(),
                                        agency.name(),
                                        agency.domain(),
                                        agency.databaseName(),
                                        agency.active(),
                                        agency.subscriptionPlan(),
                                        agency.maxUsers(),
                                        agency.ownerUserId()));
    }

    /**
     * Soft-deletes the agency. Rows are never removed while sessions may still reference them.
     *
     * @return true if an active agency was deactivated
     */
    public boolean deactivate(String agencyId) {
        int updated =
                poolManager
                        .getMainPool()
                        .execute(
                                jdbc ->
                                        jdbc.update(
                                                "UPDATE public.agencies SET is_active = false,"
                                                        + " updated_at = now() WHERE id = CAST(? AS"
                                                        + " uuid) AND is_active = true",
                                                agencyId));
        return updated > 0;
    }

    private Optional<AgencyRecord> queryOne(String sql, Object arg) {
        List<AgencyRecord> rows =
                poolManager.getMainPool().execute(jdbc -> jdbc.query(sql, ROW_MAPPER, arg));
        return rows.stream().findFirst();
    }

    static AgencyRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
        Timestamp createdAt = rs.getTimestamp("created_at");
        return new AgencyRecord(
                rs.getString("id"),
                rs.getString("name"),
                rs.getString("domain"),
                rs.getString("database_name"),
                rs.getBoolean("is_active"),
                rs.getString("subscription_plan"),
                rs.getInt("max_users"),
                rs.getString("owner_user_id"),
                createdAt != null ? createdAt.toInstant() : null);
    }
}
