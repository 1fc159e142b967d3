package com.example.clubservice.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Member roles inside an organization.
 *
 * Serialized in lowercase on the wire ("admin", "coach", "member"),
 * stored by enum name in the database.
 * Spring Security authorities are derived as ROLE_ADMIN, ROLE_COACH, ROLE_MEMBER.
 */
public enum Role {
    /**
     * Club administrator - full access inside the organization
     */
    ADMIN,

    /**
     * Coach - manages courses and attendance
     */
    COACH,

    /**
     * Member - regular club member
     */
    MEMBER;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Role fromValue(String value) {
        return Role.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    public String authority() {
        return "ROLE_" + name();
    }
}
