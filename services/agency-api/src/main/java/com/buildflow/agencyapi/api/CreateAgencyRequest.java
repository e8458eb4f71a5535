package com.buildflow.agencyapi.api;

import com.buildflow.database.agency.ProvisioningRequest;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/** Body of {@code POST /api/system/agencies}. */
public record CreateAgencyRequest(
        @NotBlank @Size(max = 255) String name,
        @Size(max = 253) @Pattern(regexp = "^[A-Za-z0-9.-]*$", message = "must be a host name") String domain,
        @Size(max = 50) String subscriptionPlan,
        @Min(1) @Max(100_000) Integer maxUsers,
        @Pattern(
                        regexp = "^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$",
                        message = "must be a UUID")
                String ownerUserId) {

    public ProvisioningRequest toProvisioningRequest() {
        return new ProvisioningRequest(
                name, domain, subscriptionPlan, maxUsers != null ? maxUsers : 0, ownerUserId);
    }
}
