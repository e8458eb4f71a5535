package com.buildflow.database.url;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses PostgreSQL connection strings whose password may contain raw {@code @}, {@code :} or
 * {@code /}.
 *
 * <p>Strict {@link URI} parsing is tried first. When it fails (or yields no host, which is what
 * happens for an unencoded {@code @} in the password), a literal extraction takes over in which the
 * userinfo ends at the <em>last</em> {@code @}. Both paths are pure and never throw for malformed
 * input.
 */
public final class DatabaseUrlParser {

    private static final Logger log = LoggerFactory.getLogger(DatabaseUrlParser.class);

    private static final Pattern LITERAL =
            Pattern.compile(
                    "^([a-zA-Z][a-zA-Z0-9+.-]*)://"
                            + "(?:([^:@/]*)(?::(.*))?@)?"
                            + "([^@:/?]+)(?::(\\d+))?"
                            + "(?:/([^/?]*))?"
                            + "(?:\\?(.*))?$");

    private DatabaseUrlParser() {
        // utility class
    }

    /**
     * Parses {@code raw}. Returns empty for null, blank or unparseable input.
     */
    public static Optional<DatabaseUrl> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String trimmed = raw.trim();
        Optional<DatabaseUrl> strict = parseStrict(trimmed);
        if (strict.isPresent()) {
            return strict;
        }
        Optional<DatabaseUrl> literal = parseLiteral(trimmed);
        if (literal.isEmpty()) {
            log.debug("Connection string could not be parsed by either strategy");
        }
        return literal;
    }

    /**
     * Re-encodes the credentials of {@code raw} into a canonical connection string. Returns
     * {@code raw} unchanged when it cannot be parsed, so a password is never silently dropped.
     */
    public static String normalize(String raw) {
        return parse(raw).map(DatabaseUrl::toCanonicalString).orElse(raw);
    }

    static Optional<DatabaseUrl> parseStrict(String raw) {
        URI uri;
        try {
            uri = new URI(raw);
        } catch (URISyntaxException e) {
            return Optional.empty();
        }
        if (uri.getScheme() == null || uri.getHost() == null) {
            return Optional.empty();
        }

        String user = null;
        String password = null;
        String rawUserInfo = uri.getRawUserInfo();
        if (rawUserInfo != null) {
            int colon = rawUserInfo.indexOf(':');
            if (colon >= 0) {
                user = decode(rawUserInfo.substring(0, colon));
                password = decode(rawUserInfo.substring(colon + 1));
            } else {
                user = decode(rawUserInfo);
            }
        }

        String path = uri.getRawPath();
        String database = null;
        if (path != null && path.length() > 1) {
            database = decode(path.substring(1));
            if (database.contains("/")) {
                return Optional.empty();
            }
        }

        return Optional.of(
                new DatabaseUrl(
                        uri.getScheme(),
                        user,
                        password,
                        uri.getHost(),
                        uri.getPort(),
                        database,
                        uri.getRawQuery()));
    }

    static Optional<DatabaseUrl> parseLiteral(String raw) {
        int schemeEnd = raw.indexOf("://");
        if (schemeEnd <= 0) {
            return Optional.empty();
        }
        String afterScheme = raw.substring(schemeEnd + 3);
        int lastAt = afterScheme.lastIndexOf('@');

        Matcher matcher;
        if (lastAt >= 0) {
            // split manually at the last '@' so the password may hold any character
            String userInfo = afterScheme.substring(0, lastAt);
            String hostPart = afterScheme.substring(lastAt + 1);
            matcher = LITERAL.matcher(raw.substring(0, schemeEnd + 3) + "u@" + hostPart);
            if (!matcher.matches()) {
                return Optional.empty();
            }
            int colon = userInfo.indexOf(':');
            String user = colon >= 0 ? userInfo.substring(0, colon) : userInfo;
            String password = colon >= 0 ? userInfo.substring(colon + 1) : null;
            return Optional.of(build(matcher, safeDecode(user), password));
        }

        matcher = LITERAL.matcher(raw);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return Optional.of(build(matcher, null, null));
    }

    private static DatabaseUrl build(Matcher matcher, String user, String password) {
        String port = matcher.group(5);
        String database = matcher.group(6);
        return new DatabaseUrl(
                matcher.group(1),
                user,
                password,
                matcher.group(4),
                port != null ? Integer.parseInt(port) : DatabaseUrl.DEFAULT_PORT,
                database != null && !database.isEmpty() ? database : null,
                matcher.group(7));
    }

    private static String decode(String value) {
        return URLDecoder.decode(value.replace("+", "%2B"), StandardCharsets.UTF_8);
    }

    // a literal user name may legitimately contain '%' without being encoded
    private static String safeDecode(String value) {
        try {
            return decode(value);
        } catch (IllegalArgumentException e) {
            return value;
        }
    }
}
