package com.buildflow.agencyapi.api;

import com.buildflow.agencyapi.security.AccessControlInterceptor;
import com.buildflow.agencyapi.security.Authenticated;
import com.buildflow.agencyapi.web.ApiResponse;
import com.buildflow.security.AuthenticatedUser;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/auth")
public class SessionController {

    /** Identity of the verified session, with the agency database it resolved to. */
    @Authenticated
    @GetMapping("/session")
    public ApiResponse<AuthenticatedUser> session(
            @RequestAttribute(AccessControlInterceptor.USER_ATTRIBUTE) AuthenticatedUser user) {
        return ApiResponse.ok(user);
    }
}
