package com.questrail.pype.protocol.model;

import java.util.Objects;

/**
 * Wire {@code type = "user_update"}: presence change broadcast by the directory.
 */
public record UserUpdate(Kind kind, String name, UserStatus status) implements PypeMessage {

    public enum Kind {
        JOIN("join"),
        LEAVE("leave"),
        STATUS("status");

        private final String wireName;

        Kind(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }

        public static Kind fromWire(String value) {
            for (Kind k : values()) {
                if (k.wireName.equals(value)) {
                    return k;
                }
            }
            throw new IllegalArgumentException("Unknown user_update subtype: " + value);
        }
    }

    public UserUpdate {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(status, "status");
    }
}
