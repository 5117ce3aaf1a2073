package com.questrail.pype.directory;

import com.questrail.pype.transport.FakeConnection;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConnectionIndexTest {

    @Test
    void looksUpBothWays() {
        ConnectionIndex index = new ConnectionIndex();
        FakeConnection c = new FakeConnection("c1");

        index.put(c, "alice");

        assertEquals("alice", index.nameOf(c));
        assertSame(c, index.connectionOf("alice"));
        assertTrue(index.contains(c));
        assertTrue(index.containsName("alice"));
        assertEquals(1, index.size());
    }

    @Test
    void removeClearsBothSides() {
        ConnectionIndex index = new ConnectionIndex();
        FakeConnection c = new FakeConnection("c1");
        index.put(c, "alice");

        assertEquals("alice", index.removeConnection(c));

        assertNull(index.nameOf(c));
        assertNull(index.connectionOf("alice"));
        assertFalse(index.containsName("alice"));
        assertNull(index.removeConnection(c));
        assertEquals(0, index.size());
    }

    @Test
    void rejectsRebindingEitherSide() {
        ConnectionIndex index = new ConnectionIndex();
        FakeConnection c1 = new FakeConnection("c1");
        FakeConnection c2 = new FakeConnection("c2");
        index.put(c1, "alice");

        assertThrows(IllegalArgumentException.class, () -> index.put(c1, "bob"));
        assertThrows(IllegalArgumentException.class, () -> index.put(c2, "alice"));
    }
}
