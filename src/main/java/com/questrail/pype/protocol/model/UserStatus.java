package com.questrail.pype.protocol.model;

import java.util.Objects;

/**
 * Availability of a directory user.
 */
public enum UserStatus {
    AVAILABLE("available"),
    IN_CALL("in call");

    private final String wireName;

    UserStatus(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static UserStatus fromWire(String value) {
        Objects.requireNonNull(value, "value");
        for (UserStatus s : values()) {
            if (s.wireName.equals(value)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown user status: " + value);
    }
}
