package com.buildflow.agencyapi.api;

import com.buildflow.agencyapi.security.RequireSuperAdmin;
import com.buildflow.agencyapi.web.ApiResponse;
import com.buildflow.database.agency.AgencyProvisioningService;
import com.buildflow.database.agency.ProvisionedAgency;
import com.buildflow.database.pool.PoolManagerStatistics;
import com.buildflow.database.pool.TenantPoolManager;
import jakarta.validation.Valid;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Platform administration: pool inspection and the agency lifecycle. */
@RestController
@RequestMapping("/api/system")
@RequireSuperAdmin
public class SystemController {

    /** @param reusedExisting true when an agency with the same domain already existed */
    public record ProvisionResult(AgencyView agency, boolean reusedExisting) {}

    private final TenantPoolManager poolManager;
    private final AgencyProvisioningService provisioningService;

    public SystemController(
            TenantPoolManager poolManager, AgencyProvisioningService provisioningService) {
        this.poolManager = poolManager;
        this.provisioningService = provisioningService;
    }

    @GetMapping("/pools")
    public ApiResponse<PoolManagerStatistics> pools() {
        return ApiResponse.ok(poolManager.statistics());
    }

    @PostMapping("/agencies")
    public ResponseEntity<ApiResponse<ProvisionResult>> createAgency(
            @Valid @RequestBody CreateAgencyRequest request) {
        ProvisionedAgency provisioned = provisioningService.provision(request.toProvisioningRequest());
        ProvisionResult result =
                new ProvisionResult(AgencyView.from(provisioned.agency()), provisioned.reusedExisting());
        return ResponseEntity.status(provisioned.reusedExisting() ? HttpStatus.OK : HttpStatus.CREATED)
                .body(ApiResponse.ok(result));
    }

    @DeleteMapping("/agencies/{agencyId}")
    public ApiResponse<AgencyView> deactivateAgency(@PathVariable String agencyId) {
        // rejects non-UUID ids with IllegalArgumentException (400)
        UUID.fromString(agencyId);
        return ApiResponse.ok(AgencyView.from(provisioningService.deactivate(agencyId)));
    }
}
