package com.questrail.pype.session;

import com.questrail.pype.api.CaptureDevice;
import com.questrail.pype.api.LatestValueChannel;
import com.questrail.pype.api.PlaybackDevice;
import com.questrail.pype.api.PresentationListener;
import com.questrail.pype.loop.RateLimiter;
import com.questrail.pype.observability.NullObservabilitySink;
import com.questrail.pype.observability.PypeObservabilitySink;
import com.questrail.pype.observability.PypeProtocolEvent;
import com.questrail.pype.protocol.codec.PypeDecodeException;
import com.questrail.pype.protocol.codec.PypeMessageDecoder;
import com.questrail.pype.protocol.codec.PypeMessageEncoder;
import com.questrail.pype.protocol.model.Medium;
import com.questrail.pype.protocol.model.PypeMessage;
import com.questrail.pype.protocol.model.SessionMessage;
import com.questrail.pype.time.MonotonicClock;
import com.questrail.pype.time.SystemWallClock;
import com.questrail.pype.transport.MediaChannel;
import com.questrail.pype.transport.TransportException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * MediaWorkers
 * =============================================================================
 * The dedicated threads that move audio and video for one {@link CallSession}.
 *
 * <h2>Workers</h2>
 * <ul>
 *   <li><b>audio-send</b>: latest microphone chunk, sealed and multicast</li>
 *   <li><b>audio-receive</b>: opens units, tracks them and routes each remote
 *       participant's audio to that participant's own <b>playback</b> worker</li>
 *   <li><b>video-send</b>: latest camera frame, paced at the session's video rate</li>
 *   <li><b>video-receive</b>: opens and tracks units, hands frames to the
 *       presentation layer</li>
 * </ul>
 * Every worker loops while the session's keep-running flag is set, blocking on
 * its source for at most the configured poll timeout so it notices the flag
 * promptly. Units a participant receives from itself are skipped.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   start()  → opens capture devices and starts the workers (once key material exists)
 *   stop()   → clears keep-running, joins every worker, then releases sockets and devices
 * </pre>
 */
public final class MediaWorkers
{
    private static final Logger log = LoggerFactory.getLogger(MediaWorkers.class);

    private final CallSession session;
    private final MediaChannel audioChannel;
    private final MediaChannel videoChannel;
    private final CaptureDevice microphone;
    private final CaptureDevice camera;
    private final PlaybackDevice speaker;
    private final PresentationListener presentation;
    private final PypeMessageDecoder decoder;
    private final PypeMessageEncoder encoder;
    private final MonotonicClock clock;
    private final Duration pollTimeout;
    private final int playbackQueueDepth;
    private final PypeObservabilitySink observabilitySink;

    private final LatestValueChannel<byte[]> microphoneFrames = new LatestValueChannel<>();
    private final LatestValueChannel<byte[]> cameraFrames = new LatestValueChannel<>();
    private final Map<String, PlaybackWorker> playback = new ConcurrentHashMap<>();
    private final List<Thread> coreWorkers = new ArrayList<>();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    public MediaWorkers(CallSession session,
                        MediaChannel audioChannel,
                        MediaChannel videoChannel,
                        CaptureDevice microphone,
                        CaptureDevice camera,
                        PlaybackDevice speaker,
                        PresentationListener presentation,
                        PypeMessageDecoder decoder,
                        PypeMessageEncoder encoder,
                        MonotonicClock clock,
                        Duration pollTimeout,
                        int playbackQueueDepth,
                        PypeObservabilitySink observabilitySink)
    {
        this.session = Objects.requireNonNull(session, "session");
        this.audioChannel = Objects.requireNonNull(audioChannel, "audioChannel");
        this.videoChannel = Objects.requireNonNull(videoChannel, "videoChannel");
        this.microphone = Objects.requireNonNull(microphone, "microphone");
        this.camera = Objects.requireNonNull(camera, "camera");
        this.speaker = Objects.requireNonNull(speaker, "speaker");
        this.presentation = Objects.requireNonNull(presentation, "presentation");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.pollTimeout = Objects.requireNonNull(pollTimeout, "pollTimeout");
        this.playbackQueueDepth = playbackQueueDepth;
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    /**
     * Opens the capture devices and starts the four core workers. Idempotent.
     *
     * @throws IllegalStateException if the session has no key material yet, or a
     *         capture device cannot be opened
     */
    public void start()
    {
        if (!session.hasKey()) {
            throw new IllegalStateException("Media workers need key material");
        }
        if (stopped.get() || !started.compareAndSet(false, true)) {
            return;
        }

        microphone.open(microphoneFrames::offer);
        camera.open(cameraFrames::offer);

        coreWorkers.add(worker("audio-send", this::runAudioSend));
        coreWorkers.add(worker("audio-receive", this::runAudioReceive));
        coreWorkers.add(worker("video-send", this::runVideoSend));
        coreWorkers.add(worker("video-receive", this::runVideoReceive));
        coreWorkers.forEach(Thread::start);
    }

    public boolean isStarted()
    {
        return started.get();
    }

    /**
     * Stops playback for a participant that left; its worker exits on its next poll.
     */
    public void removeParticipant(String participant)
    {
        playback.remove(participant);
    }

    /**
     * Stops every worker and releases sockets and devices. Blocks until the
     * workers have finished. Idempotent.
     */
    public void stop()
    {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        session.stop();
        microphoneFrames.close();
        cameraFrames.close();

        long joinMillis = pollTimeout.toMillis() * 2 + 500;
        for (Thread t : coreWorkers) {
            join(t, joinMillis);
        }
        for (PlaybackWorker p : new ArrayList<>(playback.values())) {
            join(p.thread, joinMillis);
        }
        playback.clear();

        audioChannel.close();
        videoChannel.close();

        if (started.get()) {
            microphone.close();
            camera.close();
        }
        speaker.close();
    }

    // =========================================================================
    // Workers
    // =========================================================================

    private void runAudioSend()
    {
        while (session.keepRunning()) {
            Optional<byte[]> chunk = microphoneFrames.take(pollTimeout);
            if (chunk.isPresent() && session.isSendEnabled(Medium.AUDIO)) {
                send(audioChannel, Medium.AUDIO, chunk.get());
            }
        }
    }

    private void runVideoSend()
    {
        RateLimiter pacer = new RateLimiter(clock, session.videoRate());
        while (session.keepRunning()) {
            Optional<byte[]> frame = cameraFrames.take(pollTimeout);
            if (frame.isPresent()
                    && session.isSendEnabled(Medium.VIDEO)
                    && pacer.tryAcquire(session.videoRate())) {
                send(videoChannel, Medium.VIDEO, frame.get());
            }
        }
    }

    private void runAudioReceive()
    {
        receiveLoop(audioChannel, Medium.AUDIO, unit -> {
            PlaybackWorker worker = playback.computeIfAbsent(unit.source(), this::startPlayback);
            worker.offer(unit.payload());
        });
    }

    private void runVideoReceive()
    {
        receiveLoop(videoChannel, Medium.VIDEO,
                unit -> presentation.onRemoteVideoFrame(unit.source(), unit.payload()));
    }

    private void receiveLoop(MediaChannel channel, Medium medium, Consumer<MediaUnit> deliver)
    {
        while (session.keepRunning()) {
            Optional<byte[]> datagram = channel.receive(pollTimeout);
            if (datagram.isEmpty()) {
                continue;
            }

            final PypeMessage message;
            try {
                message = decoder.decode(datagram.get());
            } catch (PypeDecodeException e) {
                reportDrop(PypeProtocolEvent.Category.DECODE_DROP, medium, e.getMessage());
                continue;
            }
            // Groups share one port, so a socket may see another medium's traffic.
            if (!(message instanceof SessionMessage.Content content) || content.medium() != medium) {
                continue;
            }

            Optional<MediaUnit> unit = session.open(content);
            if (unit.isEmpty()) {
                reportDrop(PypeProtocolEvent.Category.INTEGRITY_DROP, medium, "undecryptable or foreign unit");
                continue;
            }
            if (unit.get().source().equals(session.self())) {
                continue;
            }
            if (!session.track(unit.get())) {
                reportDrop(PypeProtocolEvent.Category.INTEGRITY_DROP, medium,
                        "replayed or stale unit from " + unit.get().source());
                continue;
            }
            deliver.accept(unit.get());
        }
    }

    private void send(MediaChannel channel, Medium medium, byte[] payload)
    {
        try {
            channel.send(encoder.encode(session.seal(medium, payload)));
        } catch (TransportException e) {
            log.debug("Dropped outbound {} unit: {}", medium.wireName(), e.getMessage());
        }
    }

    private PlaybackWorker startPlayback(String source)
    {
        PlaybackWorker worker = new PlaybackWorker(source);
        worker.thread.start();
        return worker;
    }

    private Thread worker(String name, Runnable body)
    {
        Thread t = new Thread(() -> {
            try {
                body.run();
            } catch (RuntimeException e) {
                log.error("Media worker {} failed", Thread.currentThread().getName(), e);
            }
        }, "pype-" + name + "-" + session.self());
        t.setDaemon(true);
        return t;
    }

    private void reportDrop(PypeProtocolEvent.Category category, Medium medium, String description)
    {
        observabilitySink.onProtocolEvent(new PypeProtocolEvent(
                SystemWallClock.INSTANCE.now(), category, medium.wireName(), description));
    }

    private static void join(Thread t, long millis)
    {
        try {
            t.join(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (t.isAlive()) {
            log.warn("Media worker {} did not stop within {}ms", t.getName(), millis);
        }
    }

    /**
     * Plays one remote participant's audio. Exits when the session stops or the
     * participant's entry is removed.
     */
    private final class PlaybackWorker
    {
        private final String source;
        private final BlockingQueue<byte[]> chunks = new ArrayBlockingQueue<>(playbackQueueDepth);
        private final Thread thread;

        PlaybackWorker(String source)
        {
            this.source = source;
            this.thread = worker("playback-" + source, this::run);
        }

        void offer(byte[] chunk)
        {
            while (!chunks.offer(chunk)) {
                chunks.poll();
            }
        }

        private void run()
        {
            while (session.keepRunning() && playback.get(source) == this) {
                try {
                    byte[] chunk = chunks.poll(pollTimeout.toNanos(), TimeUnit.NANOSECONDS);
                    if (chunk != null) {
                        speaker.play(source, chunk);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
        }
    }
}
