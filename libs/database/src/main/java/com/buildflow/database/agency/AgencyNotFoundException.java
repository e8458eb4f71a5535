package com.buildflow.database.agency;

/** No active agency matches the given id or database name. */
public class AgencyNotFoundException extends RuntimeException {

    private final String identifier;

    public AgencyNotFoundException(String identifier) {
        super("Agency not found: " + identifier);
        this.identifier = identifier;
    }

    public String identifier() {
        return identifier;
    }
}
