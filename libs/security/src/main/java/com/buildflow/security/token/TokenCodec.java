package com.buildflow.security.token;

import com.buildflow.observability.SensitiveDataRedactor;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues and verifies HS256-signed session tokens.
 *
 * <p>Verification checks signature, algorithm, issuer, audience and expiry in one pass and never
 * throws for bad input; any failure yields an empty result. Construction fails when the secret is
 * unusable, which stops the application from starting with a guessable key.
 */
public class TokenCodec {

    private static final Logger log = LoggerFactory.getLogger(TokenCodec.class);

    static final int MIN_SECRET_LENGTH = 32;

    static final Set<String> PLACEHOLDER_SECRETS =
            Set.of(
                    "admin",
                    "secret",
                    "changeme",
                    "change-this-in-production",
                    "your-super-secret-jwt-key-change-this-in-production");

    static final String CLAIM_USER_ID = "userId";
    static final String CLAIM_EMAIL = "email";
    static final String CLAIM_AGENCY_ID = "agencyId";
    static final String CLAIM_AGENCY_DATABASE = "agencyDatabase";

    private final TokenProperties properties;
    private final Clock clock;
    private final Key key;
    private final JwtParser parser;

    public TokenCodec(TokenProperties properties, Clock clock) {
        checkSecret(properties.secret());
        this.properties = properties;
        this.clock = clock;
        this.key = Keys.hmacShaKeyFor(properties.secret().getBytes(StandardCharsets.UTF_8));
        this.parser =
                Jwts.parserBuilder()
                        .setSigningKey(key)
                        .requireIssuer(properties.issuer())
                        .requireAudience(properties.audience())
                        .setAllowedClockSkewSeconds(properties.clockSkew().toSeconds())
                        .setClock(() -> Date.from(clock.instant()))
                        .build();
        log.info(
                "Token codec ready (issuer={}, audience={}, ttl={})",
                properties.issuer(),
                properties.audience(),
                properties.ttl());
    }

    /**
     * @throws IllegalArgumentException when userId or email is missing
     */
    public String issue(SessionClaims claims) {
        if (isBlank(claims.userId()) || isBlank(claims.email())) {
            throw new IllegalArgumentException("userId and email are required");
        }
        Instant now = clock.instant();
        return Jwts.builder()
                .setSubject(claims.userId())
                .claim(CLAIM_USER_ID, claims.userId())
                .claim(CLAIM_EMAIL, claims.email())
                .claim(CLAIM_AGENCY_ID, claims.agencyId())
                .claim(CLAIM_AGENCY_DATABASE, claims.agencyDatabase())
                .setIssuer(properties.issuer())
                .setAudience(properties.audience())
                .setIssuedAt(Date.from(now))
                .setExpiration(Date.from(now.plus(properties.ttl())))
                .signWith(key, SignatureAlgorithm.HS256)
                .compact();
    }

    public Optional<SessionToken> verify(String token) {
        if (isBlank(token)) {
            return Optional.empty();
        }
        try {
            Jws<Claims> jws = parser.parseClaimsJws(token);
            String algorithm = jws.getHeader().getAlgorithm();
            if (!SignatureAlgorithm.HS256.getValue().equals(algorithm)) {
                log.warn("Rejected token signed with {}", algorithm);
                return Optional.empty();
            }
            Claims body = jws.getBody();
            String userId = body.get(CLAIM_USER_ID, String.class);
            String email = body.get(CLAIM_EMAIL, String.class);
            if (isBlank(userId) || isBlank(email) || body.getExpiration() == null) {
                log.debug("Rejected token without userId, email or expiry");
                return Optional.empty();
            }
            SessionClaims claims =
                    new SessionClaims(
                            userId,
                            email,
                            body.get(CLAIM_AGENCY_ID, String.class),
                            body.get(CLAIM_AGENCY_DATABASE, String.class));
            return Optional.of(
                    new SessionToken(
                            claims,
                            body.getIssuedAt() != null ? body.getIssuedAt().toInstant() : null,
                            body.getExpiration().toInstant()));
        } catch (JwtException | IllegalArgumentException e) {
            log.debug(
                    "Token verification failed for {}: {}",
                    SensitiveDataRedactor.maskToken(token),
                    e.getMessage());
            return Optional.empty();
        }
    }

    static void checkSecret(String secret) {
        if (isBlank(secret)) {
            throw new WeakSecretException("buildflow.security.token.secret (JWT_SECRET) is not set");
        }
        if (secret.length() < MIN_SECRET_LENGTH) {
            throw new WeakSecretException(
                    "buildflow.security.token.secret must be at least "
                            + MIN_SECRET_LENGTH
                            + " characters");
        }
        if (PLACEHOLDER_SECRETS.contains(secret.strip().toLowerCase(Locale.ROOT))) {
            throw new WeakSecretException(
                    "buildflow.security.token.secret is a placeholder value, set a random secret");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
