package com.buildflow.agencyapi.security;

import com.buildflow.security.rbac.Role;
import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Roles allowed to call the handler. Implies {@link Authenticated}.
 *
 * <pre>
 * &#64;RequireRole(Role.HR)                                   // hr or any higher role
 * &#64;RequireRole(value = Role.HR, allowHigherRoles = false) // hr only
 * </pre>
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.METHOD, ElementType.TYPE})
public @interface RequireRole {

    Role[] value();

    boolean allowHigherRoles() default true;
}
