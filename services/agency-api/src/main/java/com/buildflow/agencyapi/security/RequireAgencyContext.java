package com.buildflow.agencyapi.security;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * The handler works on the caller's agency database. The session must carry one, and an
 * {@code X-Agency-Database} header, if sent, must name the same database. Implies
 * {@link Authenticated}.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.METHOD, ElementType.TYPE})
public @interface RequireAgencyContext {}
