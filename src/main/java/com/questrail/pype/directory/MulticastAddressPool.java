package com.questrail.pype.directory;

import com.questrail.pype.protocol.model.MediaAddresses;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * MulticastAddressPool
 * -----------------------------------------------------------------------------
 * Allocator for administratively scoped IPv4 multicast group addresses.
 *
 * <p>Addresses are {@code base + n} for a monotonic counter {@code n}. Released
 * addresses go to a FIFO free list that is consulted before the counter grows.
 * An address is never handed out twice while it is in use.</p>
 */
public final class MulticastAddressPool
{
    public static final String DEFAULT_BASE = "239.255.0.1";

    /** 239.255.255.255, the top of the administratively scoped range. */
    private static final long LIMIT = 0xEFFFFFFFL;

    private final long base;
    private long next;
    private final Deque<Long> free = new ArrayDeque<>();
    private final Set<Long> inUse = new HashSet<>();

    public MulticastAddressPool()
    {
        this(DEFAULT_BASE);
    }

    public MulticastAddressPool(String baseAddress)
    {
        Objects.requireNonNull(baseAddress, "baseAddress");
        this.base = toLong(baseAddress);
        if ((base >>> 24) != 239) {
            throw new IllegalArgumentException("Base address must be in 239.0.0.0/8: " + baseAddress);
        }
    }

    /**
     * Allocates one address per medium for a new call.
     *
     * @throws IllegalStateException if the range is exhausted
     */
    public MediaAddresses allocate()
    {
        return new MediaAddresses(allocateOne(), allocateOne(), allocateOne());
    }

    /**
     * Returns the addresses of a dissolved call to the free list.
     */
    public void release(MediaAddresses addresses)
    {
        Objects.requireNonNull(addresses, "addresses");
        releaseOne(addresses.audio());
        releaseOne(addresses.video());
        releaseOne(addresses.chat());
    }

    public int inUse()
    {
        return inUse.size();
    }

    String allocateOne()
    {
        long address;
        if (!free.isEmpty()) {
            address = free.removeFirst();
        } else {
            address = base + next;
            if (address > LIMIT) {
                throw new IllegalStateException("Multicast address pool exhausted");
            }
            next++;
        }
        inUse.add(address);
        return toDotted(address);
    }

    void releaseOne(String dotted)
    {
        long address = toLong(dotted);
        if (inUse.remove(address)) {
            free.addLast(address);
        }
    }

    private static long toLong(String dotted)
    {
        final byte[] octets;
        try {
            octets = InetAddress.getByName(dotted).getAddress();
        } catch (UnknownHostException e) {
            throw new IllegalArgumentException("Not an IPv4 address: " + dotted, e);
        }
        if (octets.length != 4) {
            throw new IllegalArgumentException("Not an IPv4 address: " + dotted);
        }
        long value = 0;
        for (byte b : octets) {
            value = (value << 8) | (b & 0xFF);
        }
        return value;
    }

    private static String toDotted(long value)
    {
        return ((value >>> 24) & 0xFF) + "." + ((value >>> 16) & 0xFF) + "."
                + ((value >>> 8) & 0xFF) + "." + (value & 0xFF);
    }
}
