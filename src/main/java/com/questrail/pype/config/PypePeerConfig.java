package com.questrail.pype.config;

import com.questrail.pype.loop.LoopTimingPolicy;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;

/**
 * PypePeerConfig
 * -----------------------------------------------------------------------------
 * Configuration of one peer process.
 *
 * <ul>
 *   <li><b>serverAddress</b>: directory server stream endpoint</li>
 *   <li><b>ingressBind</b>: local event-ingress datagram endpoint; port 0 picks an
 *       ephemeral port that the runtime advertises</li>
 *   <li><b>contentPort / controlPort</b>: multicast ports shared by every group;
 *       media content and control traffic are kept apart by port</li>
 *   <li><b>keyPort</b>: the master's key-distribution listener</li>
 *   <li><b>multicastInterface</b>: interface name for group membership, or
 *       {@code null} for the first multicast-capable one</li>
 *   <li><b>feedbackInterval / statisticsInterval</b>: cadence of rate feedback and
 *       of statistics callbacks</li>
 *   <li><b>handshakeRetryInterval</b>: pause before a participant without key
 *       material retries the handshake</li>
 *   <li><b>workerPollTimeout</b>: how long a media worker blocks on its socket
 *       before re-checking whether it should keep running</li>
 *   <li><b>rateConstant</b>: numerator of the tracker's optimal sending rate</li>
 *   <li><b>initialVideoRate / minVideoRate / maxVideoRate</b>: video frames per second</li>
 *   <li><b>mediaQueueDepth / playbackQueueDepth</b>: datagrams buffered per media
 *       socket and audio chunks buffered per remote participant</li>
 * </ul>
 */
public record PypePeerConfig(
    InetSocketAddress serverAddress,
    InetSocketAddress ingressBind,
    int contentPort,
    int controlPort,
    int keyPort,
    String multicastInterface,
    Duration feedbackInterval,
    Duration statisticsInterval,
    Duration handshakeRetryInterval,
    Duration workerPollTimeout,
    double rateConstant,
    int initialVideoRate,
    int minVideoRate,
    int maxVideoRate,
    int mediaQueueDepth,
    int playbackQueueDepth,
    LoopTimingPolicy loopTiming
) {
    public PypePeerConfig {
        Objects.requireNonNull(serverAddress, "serverAddress");
        Objects.requireNonNull(ingressBind, "ingressBind");
        Objects.requireNonNull(feedbackInterval, "feedbackInterval");
        Objects.requireNonNull(statisticsInterval, "statisticsInterval");
        Objects.requireNonNull(handshakeRetryInterval, "handshakeRetryInterval");
        Objects.requireNonNull(workerPollTimeout, "workerPollTimeout");
        Objects.requireNonNull(loopTiming, "loopTiming");

        requirePort(contentPort, "contentPort");
        requirePort(controlPort, "controlPort");
        requirePort(keyPort, "keyPort");
        if (contentPort == controlPort) {
            throw new IllegalArgumentException("contentPort and controlPort must differ");
        }
        requirePositive(feedbackInterval, "feedbackInterval");
        requirePositive(statisticsInterval, "statisticsInterval");
        requirePositive(handshakeRetryInterval, "handshakeRetryInterval");
        requirePositive(workerPollTimeout, "workerPollTimeout");
        if (!(rateConstant > 0)) {
            throw new IllegalArgumentException("rateConstant must be > 0");
        }
        if (minVideoRate < 1 || maxVideoRate < minVideoRate
                || initialVideoRate < minVideoRate || initialVideoRate > maxVideoRate) {
            throw new IllegalArgumentException("Require 1 <= minVideoRate <= initialVideoRate <= maxVideoRate");
        }
        if (mediaQueueDepth < 1 || playbackQueueDepth < 1) {
            throw new IllegalArgumentException("Queue depths must be >= 1");
        }
    }

    private static void requirePort(int port, String name) {
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException(name + " out of range: " + port);
        }
    }

    private static void requirePositive(Duration d, String name) {
        if (d.isNegative() || d.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private InetSocketAddress serverAddress =
                new InetSocketAddress(InetAddress.getLoopbackAddress(), PypeServerConfig.DEFAULT_PORT);
        private InetSocketAddress ingressBind = new InetSocketAddress(InetAddress.getLoopbackAddress(), 0);
        private int contentPort = 5100;
        private int controlPort = 5101;
        private int keyPort = 5102;
        private String multicastInterface;
        private Duration feedbackInterval = Duration.ofSeconds(1);
        private Duration statisticsInterval = Duration.ofSeconds(1);
        private Duration handshakeRetryInterval = Duration.ofSeconds(1);
        private Duration workerPollTimeout = Duration.ofSeconds(1);
        private double rateConstant = 1.0;
        private int initialVideoRate = 15;
        private int minVideoRate = 1;
        private int maxVideoRate = 30;
        private int mediaQueueDepth = 64;
        private int playbackQueueDepth = 16;
        private LoopTimingPolicy loopTiming = LoopTimingPolicy.defaults();

        public Builder withServerAddress(InetSocketAddress serverAddress) {
            this.serverAddress = serverAddress;
            return this;
        }

        public Builder withIngressBind(InetSocketAddress ingressBind) {
            this.ingressBind = ingressBind;
            return this;
        }

        public Builder withContentPort(int contentPort) {
            this.contentPort = contentPort;
            return this;
        }

        public Builder withControlPort(int controlPort) {
            this.controlPort = controlPort;
            return this;
        }

        public Builder withKeyPort(int keyPort) {
            this.keyPort = keyPort;
            return this;
        }

        public Builder withMulticastInterface(String multicastInterface) {
            this.multicastInterface = multicastInterface;
            return this;
        }

        public Builder withFeedbackInterval(Duration feedbackInterval) {
            this.feedbackInterval = feedbackInterval;
            return this;
        }

        public Builder withStatisticsInterval(Duration statisticsInterval) {
            this.statisticsInterval = statisticsInterval;
            return this;
        }

        public Builder withHandshakeRetryInterval(Duration handshakeRetryInterval) {
            this.handshakeRetryInterval = handshakeRetryInterval;
            return this;
        }

        public Builder withWorkerPollTimeout(Duration workerPollTimeout) {
            this.workerPollTimeout = workerPollTimeout;
            return this;
        }

        public Builder withRateConstant(double rateConstant) {
            this.rateConstant = rateConstant;
            return this;
        }

        public Builder withVideoRates(int initial, int min, int max) {
            this.initialVideoRate = initial;
            this.minVideoRate = min;
            this.maxVideoRate = max;
            return this;
        }

        public Builder withMediaQueueDepth(int mediaQueueDepth) {
            this.mediaQueueDepth = mediaQueueDepth;
            return this;
        }

        public Builder withPlaybackQueueDepth(int playbackQueueDepth) {
            this.playbackQueueDepth = playbackQueueDepth;
            return this;
        }

        public Builder withLoopTiming(LoopTimingPolicy loopTiming) {
            this.loopTiming = loopTiming;
            return this;
        }

        public PypePeerConfig build() {
            return new PypePeerConfig(serverAddress, ingressBind, contentPort, controlPort, keyPort,
                    multicastInterface, feedbackInterval, statisticsInterval, handshakeRetryInterval,
                    workerPollTimeout, rateConstant, initialVideoRate, minVideoRate, maxVideoRate,
                    mediaQueueDepth, playbackQueueDepth, loopTiming);
        }
    }
}
