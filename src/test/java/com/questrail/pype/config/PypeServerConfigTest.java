package com.questrail.pype.config;

import com.questrail.pype.directory.MulticastAddressPool;
import com.questrail.pype.loop.LoopTimingPolicy;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;

import static org.junit.jupiter.api.Assertions.*;

class PypeServerConfigTest {

    @Test
    void builderDefaults() {
        PypeServerConfig config = PypeServerConfig.builder().build();

        assertEquals(PypeServerConfig.DEFAULT_PORT, config.bindAddress().getPort());
        assertEquals(MulticastAddressPool.DEFAULT_BASE, config.multicastBase());
        assertEquals(LoopTimingPolicy.defaults(), config.loopTiming());
    }

    @Test
    void builderOverrides() {
        PypeServerConfig config = PypeServerConfig.builder()
                .withBindAddress(new InetSocketAddress("127.0.0.1", 0))
                .withMulticastBase("239.1.0.1")
                .build();

        assertEquals(0, config.bindAddress().getPort());
        assertEquals("239.1.0.1", config.multicastBase());
    }

    @Test
    void rejectsNulls() {
        assertThrows(NullPointerException.class, () -> PypeServerConfig.builder().withBindAddress(null).build());
        assertThrows(NullPointerException.class, () -> PypeServerConfig.builder().withMulticastBase(null).build());
        assertThrows(NullPointerException.class, () -> PypeServerConfig.builder().withLoopTiming(null).build());
    }
}
