package com.buildflow.database.agency;

import com.buildflow.database.pool.DatabaseNameValidator;
import java.util.Locale;

/** Derives physical database names for new agencies. */
public final class AgencyDatabaseNames {

    static final String PREFIX = "agency_";
    static final int ID_SUFFIX_LENGTH = 8;

    private AgencyDatabaseNames() {
        // utility class
    }

    /**
     * Builds {@code agency_<label>_<first 8 chars of id>}, where the label is the first DNS label
     * of {@code domain} (or the agency name when there is no domain) reduced to {@code [a-z0-9_]}.
     * The label is truncated so the result never exceeds the identifier limit.
     */
    public static String derive(String domainOrName, String agencyId) {
        String label = domainOrName == null ? "" : domainOrName.trim();
        int dot = label.indexOf('.');
        if (dot > 0) {
            label = label.substring(0, dot);
        }
        String sanitized =
                label.toLowerCase(Locale.ROOT)
                        .replaceAll("[^a-z0-9]", "_")
                        .replaceAll("_+", "_")
                        .replaceAll("^_+|_+$", "");
        if (sanitized.isEmpty()) {
            sanitized = "agency";
        }

        String compactId = agencyId.replace("-", "").toLowerCase(Locale.ROOT);
        String suffix = "_" + compactId.substring(0, Math.min(ID_SUFFIX_LENGTH, compactId.length()));
        int maxLabel =
                Math.max(1, DatabaseNameValidator.MAX_LENGTH - PREFIX.length() - suffix.length());
        if (sanitized.length() > maxLabel) {
            sanitized = sanitized.substring(0, maxLabel);
        }
        return DatabaseNameValidator.validate(PREFIX + sanitized + suffix);
    }
}
