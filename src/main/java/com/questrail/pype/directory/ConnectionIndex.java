package com.questrail.pype.directory;

import com.questrail.pype.transport.Connection;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Bidirectional one-to-one index between connections and user names.
 */
public final class ConnectionIndex
{
    private final Map<Connection, String> byConnection = new HashMap<>();
    private final Map<String, Connection> byName = new HashMap<>();

    /**
     * Binds {@code connection} to {@code name}.
     *
     * @throws IllegalArgumentException if either side is already bound
     */
    public void put(Connection connection, String name)
    {
        Objects.requireNonNull(connection, "connection");
        Objects.requireNonNull(name, "name");
        if (byConnection.containsKey(connection) || byName.containsKey(name)) {
            throw new IllegalArgumentException("Already bound: " + connection.id() + " / " + name);
        }
        byConnection.put(connection, name);
        byName.put(name, connection);
    }

    public String nameOf(Connection connection)
    {
        return byConnection.get(connection);
    }

    public Connection connectionOf(String name)
    {
        return byName.get(name);
    }

    public boolean contains(Connection connection)
    {
        return byConnection.containsKey(connection);
    }

    public boolean containsName(String name)
    {
        return byName.containsKey(name);
    }

    /**
     * @return the name that was bound to {@code connection}, or {@code null}
     */
    public String removeConnection(Connection connection)
    {
        String name = byConnection.remove(connection);
        if (name != null) {
            byName.remove(name);
        }
        return name;
    }

    public int size()
    {
        return byConnection.size();
    }
}
