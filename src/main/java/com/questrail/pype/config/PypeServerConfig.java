package com.questrail.pype.config;

import com.questrail.pype.directory.MulticastAddressPool;
import com.questrail.pype.loop.LoopTimingPolicy;

import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * Configuration of the directory server runtime.
 */
public record PypeServerConfig(
    InetSocketAddress bindAddress,
    String multicastBase,
    LoopTimingPolicy loopTiming
) {
    public static final int DEFAULT_PORT = 5000;

    public PypeServerConfig {
        Objects.requireNonNull(bindAddress, "bindAddress");
        Objects.requireNonNull(multicastBase, "multicastBase");
        Objects.requireNonNull(loopTiming, "loopTiming");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private InetSocketAddress bindAddress = new InetSocketAddress(DEFAULT_PORT);
        private String multicastBase = MulticastAddressPool.DEFAULT_BASE;
        private LoopTimingPolicy loopTiming = LoopTimingPolicy.defaults();

        public Builder withBindAddress(InetSocketAddress bindAddress) {
            this.bindAddress = bindAddress;
            return this;
        }

        public Builder withMulticastBase(String multicastBase) {
            this.multicastBase = multicastBase;
            return this;
        }

        public Builder withLoopTiming(LoopTimingPolicy loopTiming) {
            this.loopTiming = loopTiming;
            return this;
        }

        public PypeServerConfig build() {
            return new PypeServerConfig(bindAddress, multicastBase, loopTiming);
        }
    }
}
