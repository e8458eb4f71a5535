package com.buildflow.security.token;

import java.time.Instant;

/** A verified token: its claims plus validity window. */
public record SessionToken(SessionClaims claims, Instant issuedAt, Instant expiresAt) {}
