package com.buildflow.agencyapi.api;

import com.buildflow.database.agency.AgencyRecord;
import java.time.Instant;

/** Registry record as exposed over HTTP. */
public record AgencyView(
        String id,
        String name,
        String domain,
        String databaseName,
        boolean active,
        String subscriptionPlan,
        int maxUsers,
        Instant createdAt) {

    public static AgencyView from(AgencyRecord agency) {
        return new AgencyView(
                agency.id(),
                agency.name(),
                agency.domain(),
                agency.databaseName(),
                agency.active(),
                agency.subscriptionPlan(),
                agency.maxUsers(),
                agency.createdAt());
    }
}
