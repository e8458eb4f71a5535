package com.buildflow.database.agency;

import java.util.Locale;

/**
 * Input for creating a new agency.
 *
 * @param name display name, required
 * @param domain agency domain, used to derive the database name when present
 * @param subscriptionPlan plan name, defaults to {@code basic}
 * @param maxUsers seat limit, defaults to 50
 * @param ownerUserId owning user, nullable
 */
public record ProvisioningRequest(
        String name, String domain, String subscriptionPlan, int maxUsers, String ownerUserId) {

    public ProvisioningRequest {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        name = name.trim();
        domain = domain == null || domain.isBlank() ? null : domain.trim().toLowerCase(Locale.ROOT);
    }
}
