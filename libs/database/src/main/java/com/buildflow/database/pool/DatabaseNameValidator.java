package com.buildflow.database.pool;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Validates tenant database names before they reach a connection pool or a DDL statement.
 *
 * <p>A valid name is 1 to 63 characters (the PostgreSQL identifier limit), starts with a letter or
 * underscore, contains only letters, digits, underscores and hyphens, and is not a reserved
 * keyword. Surrounding whitespace is trimmed.
 */
public final class DatabaseNameValidator {

    public static final int MAX_LENGTH = 63;

    private static final Pattern VALID_NAME =
            Pattern.compile("^[a-z_][a-z0-9_-]*$", Pattern.CASE_INSENSITIVE);

    private static final Set<String> RESERVED_KEYWORDS =
            Set.of(
                    "all", "analyse", "analyze", "and", "any", "array", "as", "asc", "asymmetric",
                    "authorization", "binary", "both", "case", "cast", "check", "collate",
                    "column", "constraint", "create", "cross", "current_catalog", "current_date",
                    "current_role", "current_schema", "current_time", "current_timestamp",
                    "current_user", "default", "deferrable", "desc", "distinct", "do", "else",
                    "end", "except", "false", "fetch", "for", "foreign", "from", "grant", "group",
                    "having", "in", "initially", "intersect", "into", "lateral", "leading",
                    "left", "like", "limit", "localtime", "localtimestamp", "not", "null",
                    "offset", "on", "only", "or", "order", "outer", "over", "overlaps", "placing",
                    "primary", "references", "returning", "right", "select", "session_user",
                    "similar", "some", "symmetric", "table", "then", "to", "trailing", "true",
                    "union", "unique", "user", "using", "variadic", "verbose", "when", "where",
                    "window", "with");

    private DatabaseNameValidator() {
        // utility class
    }

    /**
     * Returns the trimmed name.
     *
     * @throws IllegalArgumentException if the name is not a valid database name
     */
    public static String validate(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Database name must be a non-empty string");
        }
        String trimmed = name.trim();
        if (trimmed.isEmpty() || trimmed.length() > MAX_LENGTH) {
            throw new IllegalArgumentException(
                    "Database name must be between 1 and " + MAX_LENGTH + " characters");
        }
        if (!VALID_NAME.matcher(trimmed).matches()) {
            throw new IllegalArgumentException(
                    "Database name may only contain letters, digits, underscores and hyphens,"
                            + " and must start with a letter or underscore");
        }
        if (RESERVED_KEYWORDS.contains(trimmed.toLowerCase(Locale.ROOT))) {
            throw new IllegalArgumentException(
                    "Database name cannot be a reserved PostgreSQL keyword: " + trimmed);
        }
        return trimmed;
    }

    public static boolean isValid(String name) {
        try {
            validate(name);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * Validates {@code name} and wraps it in double quotes for use in DDL.
     */
    public static String quoteIdentifier(String name) {
        return '"' + validate(name).replace("\"", "\"\"") + '"';
    }
}
