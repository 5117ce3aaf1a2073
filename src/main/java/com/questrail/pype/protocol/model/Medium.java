package com.questrail.pype.protocol.model;

import java.util.Objects;

/**
 * Media kinds carried by a call. Each medium has its own multicast group.
 */
public enum Medium {
    AUDIO("audio"),
    VIDEO("video"),
    CHAT("chat");

    private final String wireName;

    Medium(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Medium fromWire(String value) {
        Objects.requireNonNull(value, "value");
        for (Medium m : values()) {
            if (m.wireName.equals(value)) {
                return m;
            }
        }
        throw new IllegalArgumentException("Unknown medium: " + value);
    }
}
