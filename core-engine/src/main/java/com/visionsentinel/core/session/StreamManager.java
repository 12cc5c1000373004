package com.visionsentinel.core.session;

import com.visionsentinel.core.artifact.ArtifactLayout;
import com.visionsentinel.core.config.EngineConfig;
import com.visionsentinel.core.detector.Detector;
import com.visionsentinel.core.detector.ModelPool;
import com.visionsentinel.core.error.ErrorKind;
import com.visionsentinel.core.error.SentinelException;
import com.visionsentinel.core.model.DetectionResult;
import com.visionsentinel.core.postprocess.PostProcessors;
import com.visionsentinel.core.schedule.TimeWindowGate;
import com.visionsentinel.core.source.FrameSourceFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Registry and lifecycle owner of all sessions.
 *
 * <h3>Admission</h3>
 * <p>
 * At most {@code maxSessions} sessions may run at once. {@link #register}
 * also counts sessions that were registered but never started, so a burst
 * of registrations cannot overbook; a stopped session counts towards
 * neither, which is how stopping frees a slot.
 * </p>
 *
 * <h3>Threads</h3>
 * <p>
 * Each started session runs a {@link SessionWorker} on its own thread named
 * {@code session-<id>}. The session table is guarded by a single monitor;
 * model loading and thread joins happen outside it.
 * </p>
 *
 * <h3>Health monitor</h3>
 * <p>
 * {@link #runHealthCheck()} (scheduled by {@link #startHealthMonitor()})
 * flags {@code ACTIVE} sessions without activity for longer than the stall
 * timeout and {@code RECONNECTING} sessions older than the reconnect timeout
 * as {@code ERROR}. It never removes registrations.
 * </p>
 *
 * @since 1.0.0
 */
public class StreamManager implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(StreamManager.class);

    private final EngineConfig config;
    private final ModelPool models;
    private final FrameSourceFactory sources;
    private final TimeWindowGate gate;
    private final PostProcessors postProcessors;
    private final Consumer<DetectionResult> resultSink;
    private final ArtifactLayout artifacts;
    private final Clock clock;

    private final Map<String, SessionEntry> sessions = new LinkedHashMap<>();
    private final List<Consumer<String>> removalListeners = new CopyOnWriteArrayList<>();

    private ScheduledExecutorService healthMonitor;

    public StreamManager(EngineConfig config, ModelPool models, FrameSourceFactory sources, TimeWindowGate gate,
            PostProcessors postProcessors, Consumer<DetectionResult> resultSink, ArtifactLayout artifacts,
            Clock clock) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.models = Objects.requireNonNull(models, "models must not be null");
        this.sources = Objects.requireNonNull(sources, "sources must not be null");
        this.gate = Objects.requireNonNull(gate, "gate must not be null");
        this.postProcessors = Objects.requireNonNull(postProcessors, "postProcessors must not be null");
        this.resultSink = Objects.requireNonNull(resultSink, "resultSink must not be null");
        this.artifacts = Objects.requireNonNull(artifacts, "artifacts must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Register a callback invoked with the session id after a session is
     * unregistered.
     */
    public void addRemovalListener(Consumer<String> listener) {
        removalListeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    // ---------------------------------------------------------------
    // Lifecycle operations
    // ---------------------------------------------------------------

    /**
     * Register a session in state {@code INACTIVE}.
     *
     * @throws SentinelException {@code DUPLICATE_ID} if the id exists,
     *                           {@code CAPACITY_EXCEEDED} if running plus
     *                           pending sessions reach the limit
     */
    public void register(StreamConfig streamConfig) {
        Objects.requireNonNull(streamConfig, "streamConfig must not be null");
        String id = streamConfig.getId();
        synchronized (sessions) {
            if (sessions.containsKey(id)) {
                throw SentinelException.duplicateId(id);
            }
            int occupied = runningCount() + pendingCount();
            if (occupied >= config.getMaxSessions()) {
                throw SentinelException.capacityExceeded(config.getMaxSessions());
            }
            sessions.put(id, new SessionEntry(streamConfig, new SessionState(id, clock.instant())));
            gate.assign(id, streamConfig.getTimePolicy());
        }
        LOG.info("Session registered: {}", streamConfig);
    }

    /**
     * Start the worker of a registered session. The session moves to
     * {@code CONNECTING}; the worker moves it on to {@code ACTIVE} or
     * {@code ERROR}.
     *
     * @throws SentinelException {@code NOT_FOUND}, {@code ALREADY_ACTIVE},
     *                           {@code CAPACITY_EXCEEDED}, or
     *                           {@code MODEL_LOAD} (session left in
     *                           {@code ERROR})
     */
    public void start(String id) {
        SessionEntry entry;
        SessionHandle handle = new SessionHandle();
        synchronized (sessions) {
            entry = requireEntry(id);
            if (entry.handle != null || entry.stopping != null) {
                throw SentinelException.alreadyActive(id);
            }
            if (runningCount() >= config.getMaxSessions()) {
                throw SentinelException.capacityExceeded(config.getMaxSessions());
            }
            entry.handle = handle;
            entry.everStarted = true;
            Instant now = clock.instant();
            // a previous run that ended in ERROR is stopped before it restarts
            entry.state.markInactive(now);
            entry.state.transition(SessionStatus.CONNECTING, null, now);
        }

        Detector detector;
        try {
            detector = models.getDetector(entry.config.getModelId(), id);
        } catch (SentinelException e) {
            synchronized (sessions) {
                if (entry.handle == handle) {
                    entry.handle = null;
                }
            }
            entry.state.transition(SessionStatus.ERROR, e.getMessage(), clock.instant());
            throw e;
        }

        SessionWorker worker = new SessionWorker(entry.config, entry.state, handle, sources, detector, gate,
                postProcessors.forPolicy(entry.config.getPostProcessing()), resultSink, artifacts, config, clock,
                () -> onWorkerExit(id, handle));
        Thread thread = new Thread(worker, "session-" + id);
        thread.setDaemon(true);
        handle.attach(thread);
        thread.start();
        LOG.info("Session {} started", id);
    }

    /**
     * Signal the worker to stop, wait up to the stop timeout, and mark the
     * session {@code INACTIVE}. Stopping a session that is not running only
     * marks it inactive.
     *
     * <p>
     * Until the wait ends the session is stopping: {@link #start} refuses it
     * with {@code ALREADY_ACTIVE}.
     * </p>
     *
     * @throws SentinelException {@code NOT_FOUND} if not registered
     */
    public void stop(String id) {
        SessionEntry entry;
        SessionHandle handle;
        synchronized (sessions) {
            entry = requireEntry(id);
            handle = entry.handle;
            entry.handle = null;
            if (handle != null) {
                entry.stopping = handle;
            }
        }
        if (handle != null) {
            handle.requestStop();
            if (!handle.join(config.getStopTimeout())) {
                LOG.warn("Session {}: worker did not exit within {} ms; abandoning it",
                        id, config.getStopTimeout().toMillis());
            }
        }
        synchronized (sessions) {
            if (entry.handle != null || entry.stopping != handle) {
                // another stop owns the outcome, or a new run started meanwhile
                return;
            }
            entry.stopping = null;
            entry.state.markInactive(clock.instant());
        }
        LOG.info("Session {} stopped", id);
    }

    /**
     * Stop the session if running and remove all of its state.
     *
     * @throws SentinelException {@code NOT_FOUND} if not registered
     */
    public void unregister(String id) {
        stop(id);
        SessionEntry removed;
        synchronized (sessions) {
            removed = sessions.remove(id);
        }
        if (removed == null) {
            return;
        }
        gate.remove(id);
        postProcessors.clearSession(id);
        models.release(removed.config.getModelId(), id);
        for (Consumer<String> listener : removalListeners) {
            try {
                listener.accept(id);
            } catch (RuntimeException e) {
                LOG.error("Removal listener failed for session {}: {}", id, e.getMessage(), e);
            }
        }
        LOG.info("Session {} unregistered", id);
    }

    // ---------------------------------------------------------------
    // Health monitor
    // ---------------------------------------------------------------

    /**
     * Flag stalled and timed-out sessions.
     *
     * @return number of sessions moved to {@code ERROR}
     */
    public int runHealthCheck() {
        Instant now = clock.instant();
        List<SessionEntry> entries;
        synchronized (sessions) {
            entries = new ArrayList<>(sessions.values());
        }
        int flagged = 0;
        for (SessionEntry entry : entries) {
            SessionState state = entry.state;
            SessionStatus status = state.status();
            if (status == SessionStatus.ACTIVE
                    && Duration.between(state.lastActiveAt(), now).compareTo(config.getStallTimeout()) > 0) {
                if (state.transition(SessionStatus.ERROR, "stalled", now)) {
                    LOG.warn("Session {}: no activity for over {} s", entry.config.getId(),
                            config.getStallTimeout().toSeconds());
                    flagged++;
                }
            } else if (status == SessionStatus.RECONNECTING
                    && Duration.between(state.statusSince(), now).compareTo(config.getReconnectTimeout()) > 0) {
                if (state.transition(SessionStatus.ERROR, "reconnect timeout", now)) {
                    LOG.warn("Session {}: reconnecting for over {} s", entry.config.getId(),
                            config.getReconnectTimeout().toSeconds());
                    flagged++;
                }
            }
        }
        return flagged;
    }

    public synchronized void startHealthMonitor() {
        if (healthMonitor != null) {
            return;
        }
        healthMonitor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "stream-health-monitor");
            t.setDaemon(true);
            return t;
        });
        long interval = config.getHealthCheckInterval().toMillis();
        healthMonitor.scheduleWithFixedDelay(() -> {
            try {
                runHealthCheck();
            } catch (RuntimeException e) {
                LOG.error("Health check failed: {}", e.getMessage(), e);
            }
        }, interval, interval, TimeUnit.MILLISECONDS);
        LOG.info("Stream health monitor started (every {} ms)", interval);
    }

    // ---------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------

    public Optional<SessionSnapshot> status(String id) {
        synchronized (sessions) {
            SessionEntry entry = sessions.get(id);
            return entry != null ? Optional.of(entry.state.snapshot(entry.config)) : Optional.empty();
        }
    }

    public List<SessionSnapshot> sessions() {
        synchronized (sessions) {
            return sessions.values().stream().map(e -> e.state.snapshot(e.config)).toList();
        }
    }

    public Optional<StreamConfig> config(String id) {
        synchronized (sessions) {
            SessionEntry entry = sessions.get(id);
            return entry != null ? Optional.of(entry.config) : Optional.empty();
        }
    }

    public boolean contains(String id) {
        synchronized (sessions) {
            return sessions.containsKey(id);
        }
    }

    public boolean isRunning(String id) {
        synchronized (sessions) {
            SessionEntry entry = sessions.get(id);
            return entry != null && entry.handle != null;
        }
    }

    public StreamSummary summary() {
        synchronized (sessions) {
            Map<SessionStatus, Integer> byStatus = new EnumMap<>(SessionStatus.class);
            long frames = 0;
            long detections = 0;
            for (SessionEntry entry : sessions.values()) {
                SessionSnapshot s = entry.state.snapshot(entry.config);
                byStatus.merge(s.getStatus(), 1, Integer::sum);
                frames += s.getFrameCount();
                detections += s.getDetectionCount();
            }
            return new StreamSummary(sessions.size(), runningCount(), config.getMaxSessions(), byStatus,
                    frames, detections);
        }
    }

    // ---------------------------------------------------------------
    // Shutdown
    // ---------------------------------------------------------------

    /**
     * Stop the health monitor and every running session.
     */
    @Override
    public void close() {
        synchronized (this) {
            if (healthMonitor != null) {
                healthMonitor.shutdownNow();
                healthMonitor = null;
            }
        }
        List<String> ids;
        synchronized (sessions) {
            ids = new ArrayList<>(sessions.keySet());
        }
        for (String id : ids) {
            try {
                stop(id);
            } catch (SentinelException e) {
                if (e.getKind() != ErrorKind.NOT_FOUND) {
                    throw e;
                }
                LOG.debug("Session {} already gone during shutdown", id);
            }
        }
        LOG.info("Stream manager closed ({} session(s) stopped)", ids.size());
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void onWorkerExit(String id, SessionHandle handle) {
        synchronized (sessions) {
            SessionEntry entry = sessions.get(id);
            if (entry != null && entry.handle == handle) {
                entry.handle = null;
                LOG.info("Session {}: worker exited on its own in state {}", id, entry.state.status());
            }
        }
    }

    private SessionEntry requireEntry(String id) {
        SessionEntry entry = sessions.get(id);
        if (entry == null) {
            throw SentinelException.notFound("Session", id);
        }
        return entry;
    }

    private int runningCount() {
        int n = 0;
        for (SessionEntry e : sessions.values()) {
            if (e.handle != null || e.stopping != null) {
                n++;
            }
        }
        return n;
    }

    private int pendingCount() {
        int n = 0;
        for (SessionEntry e : sessions.values()) {
            if (!e.everStarted) {
                n++;
            }
        }
        return n;
    }

    private static final class SessionEntry {
        private final StreamConfig config;
        private final SessionState state;
        private SessionHandle handle;
        // worker whose stop is still being awaited
        private SessionHandle stopping;
        private boolean everStarted;

        private SessionEntry(StreamConfig config, SessionState state) {
            this.config = config;
            this.state = state;
        }
    }
}
