package com.questrail.pype.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.pype.config.PypePeerConfig;
import com.questrail.pype.protocol.model.CallInfo;
import com.questrail.pype.protocol.model.Medium;
import com.questrail.pype.protocol.model.SessionMessage;
import com.questrail.pype.stats.Tracker;
import com.questrail.pype.stats.TrackerSnapshot;
import com.questrail.pype.time.MonotonicClock;
import com.questrail.pype.time.WallClock;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * CallSession
 * =============================================================================
 * One participant's local runtime view of an active call.
 *
 * <h2>State</h2>
 * <ul>
 *   <li>the call as last announced by the directory (participants, master, groups)</li>
 *   <li>key material, absent until generated (master) or received (handshake)</li>
 *   <li>one {@link Tracker} per remote participant and medium</li>
 *   <li>per-medium outbound sequence counters and send-enabled flags</li>
 *   <li>the CLR {@link RateController} for outbound video</li>
 *   <li>the shared keep-running flag observed by every media worker</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * Call roster and key changes happen on the event loop. Media workers read the
 * key, trackers, counters and flags concurrently, so those are volatile or
 * concurrent.
 */
public final class CallSession
{
    private final String self;
    private final ObjectMapper mapper;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final SecureRandom random;
    private final double rateConstant;
    private final RateController rateController;

    private final Map<String, Map<Medium, Tracker>> trackers = new ConcurrentHashMap<>();
    private final Map<Medium, AtomicLong> sequences = new EnumMap<>(Medium.class);
    private final Map<Medium, AtomicBoolean> sendEnabled = new EnumMap<>(Medium.class);
    private final AtomicBoolean keepRunning = new AtomicBoolean(true);

    private volatile CallInfo call;
    private volatile KeyMaterial keyMaterial;
    private volatile MediaFramer framer;

    public CallSession(String self,
                       CallInfo call,
                       PypePeerConfig config,
                       MonotonicClock clock,
                       WallClock wallClock,
                       SecureRandom random,
                       ObjectMapper mapper)
    {
        this.self = Objects.requireNonNull(self, "self");
        this.call = Objects.requireNonNull(call, "call");
        Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.random = Objects.requireNonNull(random, "random");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.rateConstant = config.rateConstant();
        this.rateController = new RateController(
                config.initialVideoRate(), config.minVideoRate(), config.maxVideoRate());

        if (!call.includes(self)) {
            throw new IllegalArgumentException(self + " is not a participant of " + call.master() + "'s call");
        }
        for (Medium m : Medium.values()) {
            sequences.put(m, new AtomicLong());
            sendEnabled.put(m, new AtomicBoolean(true));
        }
    }

    // ---------------------------------------------------------------------
    // Roster
    // ---------------------------------------------------------------------

    public String self()
    {
        return self;
    }

    public CallInfo call()
    {
        return call;
    }

    /**
     * Current directory key of the call: its master's name.
     */
    public String callKey()
    {
        return call.master();
    }

    public boolean isMaster()
    {
        return self.equals(call.master());
    }

    /**
     * Applies a roster update; state kept for departed participants is dropped.
     *
     * @return names of participants that departed
     */
    public List<String> update(CallInfo next)
    {
        Objects.requireNonNull(next, "next");
        List<String> departed = new ArrayList<>();
        for (String p : call.participants()) {
            if (!next.includes(p)) {
                departed.add(p);
            }
        }
        this.call = next;
        for (String p : departed) {
            trackers.remove(p);
            rateController.forget(p);
        }
        return departed;
    }

    public List<String> remoteParticipants()
    {
        List<String> remote = new ArrayList<>(call.participants());
        remote.remove(self);
        return remote;
    }

    // ---------------------------------------------------------------------
    // Keys
    // ---------------------------------------------------------------------

    /**
     * Master side: create and install fresh key material.
     */
    public KeyMaterial generateKeyMaterial()
    {
        KeyMaterial material = KeyMaterial.generate(random);
        installKey(material);
        return material;
    }

    public void installKey(KeyMaterial material)
    {
        Objects.requireNonNull(material, "material");
        this.framer = new MediaFramer(material, mapper);
        this.keyMaterial = material;
    }

    public boolean hasKey()
    {
        return keyMaterial != null;
    }

    public Optional<KeyMaterial> keyMaterial()
    {
        return Optional.ofNullable(keyMaterial);
    }

    public SecureRandom random()
    {
        return random;
    }

    // ---------------------------------------------------------------------
    // Media framing
    // ---------------------------------------------------------------------

    /**
     * Wraps {@code payload} as the next unit of {@code medium} and encrypts it.
     *
     * @throws IllegalStateException if no key material is installed
     */
    public SessionMessage.Content seal(Medium medium, byte[] payload)
    {
        MediaFramer f = framer;
        KeyMaterial material = keyMaterial;
        if (f == null || material == null) {
            throw new IllegalStateException("No key material for the call yet");
        }
        MediaUnit unit = new MediaUnit(
                medium,
                sequences.get(medium).getAndIncrement(),
                material.sessionNonce(),
                random.nextLong(),
                self,
                wallClock.epochSeconds(),
                payload);
        return f.seal(unit);
    }

    /**
     * Decrypts an envelope. Empty if there is no key yet or the unit failed the
     * decryption, medium or session nonce checks.
     */
    public Optional<MediaUnit> open(SessionMessage.Content content)
    {
        MediaFramer f = framer;
        if (f == null) {
            return Optional.empty();
        }
        return f.open(content);
    }

    /**
     * Runs a decrypted unit from a remote participant through its tracker.
     *
     * @return {@code false} if the tracker's integrity check rejected it
     */
    public boolean track(MediaUnit unit)
    {
        return tracker(unit.source(), unit.medium())
                .process(unit.sequence(), unit.packetNonce(), unit.timestamp(), unit.payload().length);
    }

    public Tracker tracker(String participant, Medium medium)
    {
        return trackers
                .computeIfAbsent(participant, p -> new ConcurrentHashMap<>())
                .computeIfAbsent(medium, m -> new Tracker(clock, wallClock, rateConstant));
    }

    public Map<String, Map<Medium, TrackerSnapshot>> statistics()
    {
        Map<String, Map<Medium, TrackerSnapshot>> out = new LinkedHashMap<>();
        trackers.forEach((participant, byMedium) -> {
            Map<Medium, TrackerSnapshot> snapshots = new EnumMap<>(Medium.class);
            byMedium.forEach((medium, tracker) -> snapshots.put(medium, tracker.snapshot()));
            out.put(participant, snapshots);
        });
        return out;
    }

    /**
     * One feedback report per remote participant whose video tracker has a rate
     * estimate.
     */
    public List<SessionMessage.Feedback> feedback()
    {
        List<SessionMessage.Feedback> reports = new ArrayList<>();
        for (String participant : remoteParticipants()) {
            Map<Medium, Tracker> byMedium = trackers.get(participant);
            Tracker video = byMedium == null ? null : byMedium.get(Medium.VIDEO);
            if (video == null) {
                continue;
            }
            OptionalInt rate = video.optimalSendingRate();
            if (rate.isPresent()) {
                reports.add(new SessionMessage.Feedback(self, rate.getAsInt()));
            }
        }
        return reports;
    }

    // ---------------------------------------------------------------------
    // Flags and rate
    // ---------------------------------------------------------------------

    public boolean isSendEnabled(Medium medium)
    {
        return sendEnabled.get(medium).get();
    }

    public void setSendEnabled(Medium medium, boolean enabled)
    {
        sendEnabled.get(medium).set(enabled);
    }

    public RateController rateController()
    {
        return rateController;
    }

    public double videoRate()
    {
        return rateController.currentRate();
    }

    public boolean keepRunning()
    {
        return keepRunning.get();
    }

    public void stop()
    {
        keepRunning.set(false);
    }
}
