package com.questrail.pype.protocol.model;

import java.util.Objects;

/**
 * Directory entry as published to clients: a name and its availability.
 */
public record UserInfo(String name, UserStatus status) {
    public UserInfo {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(status, "status");
    }
}
