package com.questrail.pype.directory;

import com.questrail.pype.protocol.model.UserInfo;
import com.questrail.pype.protocol.model.UserStatus;
import com.questrail.pype.transport.Connection;

import java.util.Objects;

/**
 * Registry-owned record of a connected user. The current call is referenced by
 * its key (the master's name), never by pointer.
 */
final class User
{
    private final String name;
    private final Connection connection;
    private final String host;

    private UserStatus status = UserStatus.AVAILABLE;
    private String callKey;

    User(String name, Connection connection, String host)
    {
        this.name = Objects.requireNonNull(name, "name");
        this.connection = Objects.requireNonNull(connection, "connection");
        this.host = Objects.requireNonNull(host, "host");
    }

    String name()
    {
        return name;
    }

    Connection connection()
    {
        return connection;
    }

    String host()
    {
        return host;
    }

    UserStatus status()
    {
        return status;
    }

    void status(UserStatus status)
    {
        this.status = Objects.requireNonNull(status, "status");
    }

    String callKey()
    {
        return callKey;
    }

    void callKey(String callKey)
    {
        this.callKey = callKey;
    }

    boolean inCall()
    {
        return callKey != null;
    }

    UserInfo toInfo()
    {
        return new UserInfo(name, status);
    }
}
