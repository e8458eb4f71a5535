package com.buildflow.security.rbac;

import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Platform roles in a total order of authority. A lower rank carries more authority, so
 * {@link #SUPER_ADMIN} (rank 1) outranks every other role.
 */
public enum Role {
    SUPER_ADMIN("super_admin", 1),
    CEO("ceo", 2),
    CTO("cto", 3),
    CFO("cfo", 4),
    COO("coo", 5),
    ADMIN("admin", 6),
    OPERATIONS_MANAGER("operations_manager", 7),
    DEPARTMENT_HEAD("department_head", 8),
    TEAM_LEAD("team_lead", 9),
    PROJECT_MANAGER("project_manager", 10),
    HR("hr", 11),
    FINANCE_MANAGER("finance_manager", 12),
    SALES_MANAGER("sales_manager", 13),
    MARKETING_MANAGER("marketing_manager", 14),
    QUALITY_ASSURANCE("quality_assurance", 15),
    IT_SUPPORT("it_support", 16),
    LEGAL_COUNSEL("legal_counsel", 17),
    BUSINESS_ANALYST("business_analyst", 18),
    CUSTOMER_SUCCESS("customer_success", 19),
    EMPLOYEE("employee", 20),
    CONTRACTOR("contractor", 21),
    INTERN("intern", 22),

    /**
     * A stored role name this platform does not know. Counts as holding a role but carries no
     * authority, and is never accepted by a {@link RoleRequirement}.
     */
    UNRECOGNIZED("unrecognized", 99);

    /** Roles whose requirements are checked against the main database. */
    public static final Set<Role> SYSTEM_ROLES = EnumSet.of(SUPER_ADMIN, ADMIN, CEO);

    private final String value;
    private final int rank;

    Role(String value, int rank) {
        this.value = value;
        this.rank = rank;
    }

    /** Name as stored in {@code user_roles.role}, e.g. {@code "super_admin"}. */
    public String value() {
        return value;
    }

    public int rank() {
        return rank;
    }

    public boolean isSystemRole() {
        return SYSTEM_ROLES.contains(this);
    }

    /** True if this role carries at least the authority of {@code other}. */
    public boolean outranksOrEquals(Role other) {
        return rank <= other.rank;
    }

    /** Case-insensitive lookup by stored name. */
    public static Optional<Role> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.strip().toLowerCase(Locale.ROOT);
        for (Role role : values()) {
            if (role != UNRECOGNIZED && role.value.equals(normalized)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }

    /** The role with the most authority, or empty for no roles. */
    public static Optional<Role> effective(Collection<Role> roles) {
        return roles.stream().min(Comparator.comparingInt(Role::rank));
    }
}
