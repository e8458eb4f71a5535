package com.buildflow.database.agency;

import com.buildflow.database.config.DatabaseProperties;
import com.buildflow.database.pool.DatabaseNameValidator;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps an authenticated request's tenant identity to the database it must be routed to.
 *
 * <p>The {@code agencyDatabase} claim of a verified token is trusted as is for the token's
 * lifetime. The registry is consulted only when a token carries an agency id but no database
 * name; those lookups are cached briefly and only for active agencies.
 */
public class AgencyResolver {

    private static final Logger log = LoggerFactory.getLogger(AgencyResolver.class);

    private final AgencyRepository repository;
    private final Cache<String, String> databaseNameByAgencyId;

    public AgencyResolver(AgencyRepository repository, DatabaseProperties properties) {
        this.repository = repository;
        this.databaseNameByAgencyId =
                Caffeine.newBuilder()
                        .maximumSize(properties.agencyCacheMaxSize())
                        .expireAfterWrite(properties.agencyCacheTtl())
                        .build();
    }

    /**
     * Resolves the database for a request.
     *
     * @param agencyDatabaseClaim database name carried by the token, may be null
     * @param agencyId agency id carried by the token, may be null
     * @return the database name, or empty when the request has no agency context
     */
    public Optional<String> resolveDatabaseName(String agencyDatabaseClaim, String agencyId) {
        if (agencyDatabaseClaim != null && !agencyDatabaseClaim.isBlank()) {
            if (!DatabaseNameValidator.isValid(agencyDatabaseClaim)) {
                log.warn("Ignoring invalid agency database claim for agency {}", agencyId);
                return Optional.empty();
            }
            return Optional.of(agencyDatabaseClaim.trim());
        }
        if (agencyId == null || agencyId.isBlank() || !isUuid(agencyId)) {
            return Optional.empty();
        }
        String cached = databaseNameByAgencyId.getIfPresent(agencyId);
        if (cached != null) {
            return Optional.of(cached);
        }
        Optional<String> resolved =
                repository
                        .findById(agencyId)
                        .filter(AgencyRecord::active)
                        .map(AgencyRecord::databaseName);
        resolved.ifPresent(name -> databaseNameByAgencyId.put(agencyId, name));
        if (resolved.isEmpty()) {
            log.debug("Agency {} is unknown or inactive", agencyId);
        }
        return resolved;
    }

    /**
     * Returns the registry record of the active agency owning {@code databaseName}.
     *
     * @throws AgencyNotFoundException if no active agency uses the database
     */
    public AgencyRecord requireActiveAgency(String databaseName) {
        return repository
                .findByDatabaseName(databaseName)
                .filter(AgencyRecord::active)
                .orElseThrow(() -> new AgencyNotFoundException(databaseName));
    }

    /** Drops any cached resolution for {@code agencyId}. */
    public void invalidate(String agencyId) {
        databaseNameByAgencyId.invalidate(agencyId);
    }

    private static boolean isUuid(String value) {
        try {
            UUID.fromString(value);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
