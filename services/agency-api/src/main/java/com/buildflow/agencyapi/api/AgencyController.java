package com.buildflow.agencyapi.api;

import com.buildflow.agencyapi.security.AccessControlInterceptor;
import com.buildflow.agencyapi.security.RequireAgencyContext;
import com.buildflow.agencyapi.security.RequireRole;
import com.buildflow.agencyapi.web.ApiResponse;
import com.buildflow.database.agency.AgencyResolver;
import com.buildflow.security.AuthenticatedUser;
import com.buildflow.security.rbac.RbacAuthorizer;
import com.buildflow.security.rbac.Role;
import com.buildflow.security.rbac.RoleScope;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Endpoints scoped to the caller's own agency. */
@RestController
@RequestMapping("/api/agencies")
@RequireAgencyContext
public class AgencyController {

    /**
     * @param agencyDatabase database the roles were read from
     * @param roles every role the caller holds there
     * @param effectiveRole highest of {@code roles}, null when there are none
     */
    public record RolesView(String agencyDatabase, List<String> roles, String effectiveRole) {}

    private final AgencyResolver agencyResolver;
    private final RbacAuthorizer authorizer;

    public AgencyController(AgencyResolver agencyResolver, RbacAuthorizer authorizer) {
        this.agencyResolver = agencyResolver;
        this.authorizer = authorizer;
    }

    @RequireRole(Role.EMPLOYEE)
    @GetMapping("/current")
    public ApiResponse<AgencyView> currentAgency(
            @RequestAttribute(AccessControlInterceptor.USER_ATTRIBUTE) AuthenticatedUser user) {
        return ApiResponse.ok(
                AgencyView.from(agencyResolver.requireActiveAgency(user.agencyDatabase())));
    }

    @GetMapping("/current/roles")
    public ApiResponse<RolesView> currentRoles(
            @RequestAttribute(AccessControlInterceptor.USER_ATTRIBUTE) AuthenticatedUser user) {
        List<Role> roles = authorizer.rolesOf(user, RoleScope.AGENCY);
        return ApiResponse.ok(
                new RolesView(
                        user.agencyDatabase(),
                        roles.stream().map(Role::value).toList(),
                        Role.effective(roles).map(Role::value).orElse(null)));
    }
}
