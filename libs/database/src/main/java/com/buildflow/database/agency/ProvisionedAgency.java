package com.buildflow.database.agency;

/**
 * Result of {@link AgencyProvisioningService#provision}.
 *
 * @param agency registry record of the agency
 * @param reusedExisting true when an agency with the same domain already existed and was returned
 *     instead of creating a new one
 */
public record ProvisionedAgency(AgencyRecord agency, boolean reusedExisting) {}
