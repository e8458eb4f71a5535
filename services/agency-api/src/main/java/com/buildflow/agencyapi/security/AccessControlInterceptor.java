package com.buildflow.agencyapi.security;

import com.buildflow.database.agency.AgencyResolver;
import com.buildflow.observability.CorrelationContextHolder;
import com.buildflow.security.AgencyContextEnforcer;
import com.buildflow.security.AuthenticatedUser;
import com.buildflow.security.AuthenticationException;
import com.buildflow.security.BearerTokenExtractor;
import com.buildflow.security.rbac.AuthorizationDecision;
import com.buildflow.security.rbac.RbacAuthorizer;
import com.buildflow.security.rbac.RoleRequirement;
import com.buildflow.security.token.SessionClaims;
import com.buildflow.security.token.SessionToken;
import com.buildflow.security.token.TokenCodec;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.lang.annotation.Annotation;
import java.util.Arrays;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Runs the route-specific checks declared on a handler, in order: session token, agency context,
 * role. The first failing check throws, and {@code GlobalExceptionHandler} renders the error.
 *
 * <p>On success the {@link AuthenticatedUser} is stored under {@link #USER_ATTRIBUTE} for
 * controllers ({@code @RequestAttribute}) and the user and agency database are added to the
 * logging context.
 */
@Component
public class AccessControlInterceptor implements HandlerInterceptor {

    public static final String USER_ATTRIBUTE = "buildflow.authenticatedUser";
    public static final String DECISION_ATTRIBUTE = "buildflow.authorizationDecision";

    private static final Logger log = LoggerFactory.getLogger(AccessControlInterceptor.class);

    private final TokenCodec tokenCodec;
    private final AgencyResolver agencyResolver;
    private final RbacAuthorizer authorizer;

    public AccessControlInterceptor(
            TokenCodec tokenCodec, AgencyResolver agencyResolver, RbacAuthorizer authorizer) {
        this.tokenCodec = tokenCodec;
        this.agencyResolver = agencyResolver;
        this.authorizer = authorizer;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!(handler instanceof HandlerMethod method)) {
            return true;
        }
        RequireRole requireRole = find(method, RequireRole.class);
        boolean superAdminOnly = find(method, RequireSuperAdmin.class) != null;
        boolean agencyContext = find(method, RequireAgencyContext.class) != null;
        boolean authenticated =
                find(method, Authenticated.class) != null
                        || agencyContext
                        || superAdminOnly
                        || requireRole != null;
        if (!authenticated) {
            return true;
        }

        AuthenticatedUser user = authenticate(request);
        request.setAttribute(USER_ATTRIBUTE, user);
        CorrelationContextHolder.update(ctx -> ctx.withPrincipal(user.userId(), user.agencyDatabase()));

        if (agencyContext) {
            AgencyContextEnforcer.enforce(
                    user, request.getHeader(AgencyContextEnforcer.AGENCY_DATABASE_HEADER));
        }

        String httpMethod = request.getMethod();
        String path = request.getRequestURI();
        if (superAdminOnly) {
            request.setAttribute(
                    DECISION_ATTRIBUTE, authorizer.requireSuperAdmin(user, httpMethod, path).orElseThrow());
        }
        if (requireRole != null) {
            RoleRequirement requirement =
                    new RoleRequirement(
                            Set.copyOf(Arrays.asList(requireRole.value())),
                            requireRole.allowHigherRoles());
            AuthorizationDecision decision =
                    authorizer.authorize(user, requirement, httpMethod, path).orElseThrow();
            request.setAttribute(DECISION_ATTRIBUTE, decision);
        }
        return true;
    }

    private AuthenticatedUser authenticate(HttpServletRequest request) {
        String token =
                BearerTokenExtractor.extract(request.getHeader(HttpHeaders.AUTHORIZATION))
                        .orElseThrow(AuthenticationException::missingToken);
        SessionToken session =
                tokenCodec.verify(token).orElseThrow(AuthenticationException::invalidToken);
        SessionClaims claims = session.claims();
        String agencyDatabase =
                agencyResolver
                        .resolveDatabaseName(claims.agencyDatabase(), claims.agencyId())
                        .orElse(null);
        if (agencyDatabase == null && (claims.agencyDatabase() != null || claims.agencyId() != null)) {
            log.debug("Session of user {} has no resolvable agency database", claims.userId());
        }
        return AuthenticatedUser.of(claims, agencyDatabase);
    }

    private static <A extends Annotation> A find(HandlerMethod method, Class<A> type) {
        A onMethod = AnnotatedElementUtils.findMergedAnnotation(method.getMethod(), type);
        return onMethod != null
                ? onMethod
                : AnnotatedElementUtils.findMergedAnnotation(method.getBeanType(), type);
    }
}
