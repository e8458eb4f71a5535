package com.buildflow.security.rbac;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class RoleNames {

    private static final Logger log = LoggerFactory.getLogger(RoleNames.class);

    private static final Pattern USER_ID =
            Pattern.compile("^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");

    private RoleNames() {
        // utility class
    }

    /** Converts stored role names; names that are not platform roles become {@link Role#UNRECOGNIZED}. */
    static List<Role> toRoles(List<String> names, String userId, String database) {
        List<Role> roles = new ArrayList<>(names.size());
        for (String name : names) {
            Optional<Role> role = Role.fromString(name);
            if (role.isPresent()) {
                roles.add(role.get());
            } else {
                log.warn("Unknown role '{}' of user {} in database {}", name, userId, database);
                roles.add(Role.UNRECOGNIZED);
            }
        }
        return roles;
    }

    /** User ids are stored as {@code uuid}; anything else cannot hold roles. */
    static boolean isStoredUserId(String userId) {
        return userId != null && USER_ID.matcher(userId).matches();
    }
}
