package com.buildflow.database.migration;

/** The two schemas this platform migrates. */
public enum SchemaTarget {

    /** Tenant registry and system users, applied to the main database. */
    MAIN("classpath:db/migration/main"),

    /** Per-agency users, profiles and roles, applied to every agency database. */
    AGENCY("classpath:db/migration/agency");

    private final String defaultLocation;

    SchemaTarget(String defaultLocation) {
        this.defaultLocation = defaultLocation;
    }

    public String defaultLocation() {
        return defaultLocation;
    }
}
