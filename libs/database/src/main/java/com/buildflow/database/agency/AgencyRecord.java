package com.buildflow.database.agency;

import java.time.Instant;

/**
 * Row of the tenant registry, {@code public.agencies} in the main database.
 *
 * @param id agency id (UUID text)
 * @param name display name
 * @param domain agency domain, unique
 * @param databaseName physical database holding the agency's data, unique
 * @param active false once the agency has been deactivated
 * @param subscriptionPlan plan name, {@code basic} by default
 * @param maxUsers seat limit
 * @param ownerUserId user that owns the agency, nullable
 * @param createdAt registration time
 */
public record AgencyRecord(
        String id,
        String name,
        String domain,
        String databaseName,
        boolean active,
        String subscriptionPlan,
        int maxUsers,
        String ownerUserId,
        Instant createdAt) {

    public AgencyRecord {
        if (subscriptionPlan == null || subscriptionPlan.isBlank()) {
            subscriptionPlan = "basic";
        }
        if (maxUsers <= 0) {
            maxUsers = 50;
        }
    }

    public AgencyRecord deactivated() {
        return new AgencyRecord(
                id, name, domain, databaseName, false, subscriptionPlan, maxUsers, ownerUserId,
                createdAt);
    }
}
