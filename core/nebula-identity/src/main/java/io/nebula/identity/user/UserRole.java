package io.nebula.identity.user;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Platform roles, in ascending order of privilege.
 *
 * GLOBAL_ADMIN &gt; COMPANY_ADMIN &gt; FACILITATOR &gt; USER. Declaration order is the
 * comparison basis, so new tiers must be inserted at the right position.
 */
public enum UserRole {

    USER("user"),
    FACILITATOR("facilitator"),
    COMPANY_ADMIN("company_admin"),
    GLOBAL_ADMIN("global_admin");

    private final String code;

    UserRole(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /**
     * True when this role is the same as or above the given minimum.
     */
    public boolean isAtLeast(UserRole minimum) {
        return this.ordinal() >= minimum.ordinal();
    }

    public static UserRole lowest() {
        return USER;
    }

    @JsonCreator
    public static UserRole fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("Role cannot be null");
        }
        for (UserRole role : values()) {
            if (role.code.equalsIgnoreCase(code) || role.name().equalsIgnoreCase(code)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown role: " + code);
    }
}
