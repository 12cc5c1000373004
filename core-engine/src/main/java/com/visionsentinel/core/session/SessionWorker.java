package com.visionsentinel.core.session;

import com.visionsentinel.core.artifact.ArtifactLayout;
import com.visionsentinel.core.config.EngineConfig;
import com.visionsentinel.core.detector.CoordinateMapper;
import com.visionsentinel.core.detector.Detector;
import com.visionsentinel.core.error.FrameReadException;
import com.visionsentinel.core.model.Detection;
import com.visionsentinel.core.model.DetectionResult;
import com.visionsentinel.core.postprocess.PostProcessOutcome;
import com.visionsentinel.core.postprocess.PostProcessor;
import com.visionsentinel.core.schedule.TimeWindowGate;
import com.visionsentinel.core.source.Frame;
import com.visionsentinel.core.source.FrameSource;
import com.visionsentinel.core.source.FrameSourceFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.function.Consumer;

/**
 * Frame loop of one running session.
 *
 * <h3>Iteration</h3>
 * <ol>
 * <li>exit if stop was requested;</li>
 * <li>wait while the session's time window is closed;</li>
 * <li>read a frame; transient failures are retried, a lost connection (or
 * too many transient failures in a row) starts reconnecting;</li>
 * <li>skip empty or undersized frames;</li>
 * <li>skip frames arriving faster than the session's fps limit;</li>
 * <li>infer on a downscaled copy if the frame is large, map boxes back,
 * apply the class allow-list and detection regions;</li>
 * <li>run the post-processor and, if it lets the result through, hand it
 * to the result sink (the alarm engine).</li>
 * </ol>
 *
 * <h3>Reconnect</h3>
 * <p>
 * The session goes {@code ACTIVE -> ERROR -> RECONNECTING}, then reopens the
 * source up to {@code reconnectAttempts} times, waiting
 * {@code reconnectInterval} before each. Success returns it to
 * {@code ACTIVE}; exhaustion leaves it in {@code ERROR} and ends the worker.
 * </p>
 *
 * <p>
 * Faults inside an iteration are logged and counted on the session; they
 * never end the loop.
 * </p>
 */
final class SessionWorker implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(SessionWorker.class);

    private final StreamConfig config;
    private final SessionState state;
    private final SessionHandle handle;
    private final FrameSourceFactory sources;
    private final Detector detector;
    private final TimeWindowGate gate;
    private final PostProcessor postProcessor;
    private final Consumer<DetectionResult> resultSink;
    private final ArtifactLayout artifacts;
    private final EngineConfig engine;
    private final Clock clock;
    private final Runnable onExit;

    private final String sessionId;
    private final Duration minFrameInterval;
    private final int imageSize;

    private FrameSource source;
    private Instant lastProcessedAt;
    private long frameId;
    private int consecutiveReadFailures;
    private long corruptFrames;
    private boolean gated;

    SessionWorker(StreamConfig config, SessionState state, SessionHandle handle, FrameSourceFactory sources,
            Detector detector, TimeWindowGate gate, PostProcessor postProcessor,
            Consumer<DetectionResult> resultSink, ArtifactLayout artifacts, EngineConfig engine, Clock clock,
            Runnable onExit) {
        this.config = config;
        this.state = state;
        this.handle = handle;
        this.sources = sources;
        this.detector = detector;
        this.gate = gate;
        this.postProcessor = postProcessor;
        this.resultSink = resultSink;
        this.artifacts = artifacts;
        this.engine = engine;
        this.clock = clock;
        this.onExit = onExit;
        this.sessionId = config.getId();
        this.minFrameInterval = config.minFrameInterval();
        this.imageSize = config.getImageSize() > 0 ? config.getImageSize() : engine.getInferenceImageSize();
    }

    @Override
    public void run() {
        try {
            if (connect()) {
                while (!handle.isStopRequested()) {
                    if (!iterate()) {
                        break;
                    }
                }
            }
        } catch (RuntimeException e) {
            LOG.error("Session {}: worker failed: {}", sessionId, e.getMessage(), e);
            transition(SessionStatus.ERROR, "worker failure: " + e.getMessage());
        } finally {
            cleanup();
        }
    }

    // ---------------------------------------------------------------
    // Loop
    // ---------------------------------------------------------------

    private boolean connect() {
        try {
            source = openSource();
        } catch (FrameReadException | RuntimeException e) {
            LOG.error("Session {}: cannot open {}: {}", sessionId, config.getSourceLocator(), e.getMessage());
            transition(SessionStatus.ERROR, "open failed: " + e.getMessage());
            return false;
        }
        transition(SessionStatus.ACTIVE, null);
        return true;
    }

    /**
     * @return {@code false} when the worker must exit
     */
    private boolean iterate() {
        try {
            if (!gate.isPermitted(sessionId)) {
                if (!gated) {
                    LOG.info("Session {}: outside its time window, detection paused", sessionId);
                    gated = true;
                }
                state.touch(clock.instant());
                handle.awaitStop(engine.getGatePollInterval());
                return true;
            }
            if (gated) {
                LOG.info("Session {}: time window open, detection resumed", sessionId);
                gated = false;
            }

            Frame frame;
            try {
                frame = source.read();
            } catch (FrameReadException e) {
                if (handle.isStopRequested()) {
                    return false;
                }
                consecutiveReadFailures++;
                if (!e.isConnectionLost() && consecutiveReadFailures < engine.getMaxTransientReadFailures()) {
                    LOG.debug("Session {}: transient read failure {}: {}",
                            sessionId, consecutiveReadFailures, e.getMessage());
                    return true;
                }
                consecutiveReadFailures = 0;
                return reconnect(e.getMessage());
            }
            consecutiveReadFailures = 0;
            if (handle.isStopRequested()) {
                // the read outlived a stop; the session may already be gone
                return false;
            }

            Instant now = clock.instant();
            state.touch(now);

            if (isCorrupt(frame)) {
                corruptFrames++;
                LOG.debug("Session {}: skipping corrupt frame ({} so far)", sessionId, corruptFrames);
                return true;
            }

            if (lastProcessedAt != null && Duration.between(lastProcessedAt, now).compareTo(minFrameInterval) < 0) {
                return true;
            }
            Duration interval = lastProcessedAt != null ? Duration.between(lastProcessedAt, now) : Duration.ZERO;
            lastProcessedAt = now;

            process(frame, now, interval);
        } catch (RuntimeException e) {
            state.recordError("iteration failed: " + e.getMessage());
            LOG.error("Session {}: iteration failed: {}", sessionId, e.getMessage(), e);
        }
        return true;
    }

    private boolean isCorrupt(Frame frame) {
        return frame == null
                || frame.isEmpty()
                || frame.width() < engine.getMinFrameSize()
                || frame.height() < engine.getMinFrameSize();
    }

    private void process(Frame frame, Instant now, Duration interval) {
        long started = System.nanoTime();
        int width = frame.width();
        int height = frame.height();

        double scale = CoordinateMapper.scaleFor(width, height, engine.getMaxInferenceResolution());
        Frame input = scale < 1.0
                ? frame.resize(Math.max(1, (int) Math.round(width * scale)),
                        Math.max(1, (int) Math.round(height * scale)))
                : frame;

        List<Detection> raw;
        try {
            raw = detector.infer(input, config.getConfidenceThreshold(), config.getIouThreshold(), imageSize);
        } catch (RuntimeException e) {
            state.recordError("inference failed: " + e.getMessage());
            LOG.warn("Session {}: inference failed on frame {}: {}", sessionId, frameId + 1, e.getMessage());
            return;
        }

        List<Detection> detections = CoordinateMapper.toOriginal(raw != null ? raw : List.of(), scale, width, height);
        if (!config.getTargetClasses().isEmpty()) {
            detections = detections.stream().filter(d -> config.allowsClass(d.getClassName())).toList();
        }
        detections = config.getRegions().filter(detections);

        frameId++;
        Duration took = Duration.ofNanos(System.nanoTime() - started);
        DetectionResult result = DetectionResult.builder()
                .sessionId(sessionId)
                .timestamp(now)
                .frameId(frameId)
                .detections(detections)
                .processingTime(took)
                .mediaUrl(detections.isEmpty() ? null : artifacts.pictureUrl(sessionId, now, frameId))
                .target(config.getTarget())
                .build();

        if (handle.isStopRequested()) {
            return;
        }
        if (state.status() == SessionStatus.ERROR) {
            recover();
        }

        PostProcessOutcome outcome = postProcessor.apply(result);
        DetectionResult processed = outcome.getResult();
        state.recordFrame(outcome.shouldProceed() ? processed.getDetections().size() : 0, took, now);
        if (outcome.shouldProceed()) {
            try {
                resultSink.accept(processed);
            } catch (RuntimeException e) {
                LOG.error("Session {}: result handling failed for frame {}: {}",
                        sessionId, frameId, e.getMessage(), e);
                state.recordError("result handling: " + e.getMessage());
            }
        }

        if (frameId % engine.getProgressLogInterval() == 0) {
            LOG.info("Session {}: frame {} took {} ms, {} detection(s), interval {} ms",
                    sessionId, frameId, took.toMillis(), processed.getDetections().size(), interval.toMillis());
        }
    }

    // ---------------------------------------------------------------
    // Reconnect
    // ---------------------------------------------------------------

    private boolean reconnect(String reason) {
        LOG.warn("Session {}: connection lost: {}", sessionId, reason);
        transition(SessionStatus.ERROR, "connection lost: " + reason);
        closeSource();
        transition(SessionStatus.RECONNECTING, null);

        int attempts = engine.getReconnectAttempts();
        for (int attempt = 1; attempt <= attempts; attempt++) {
            if (handle.awaitStop(engine.getReconnectInterval())) {
                return false;
            }
            try {
                source = openSource();
                transition(SessionStatus.ACTIVE, null);
                lastProcessedAt = null;
                LOG.info("Session {}: reconnected on attempt {}/{}", sessionId, attempt, attempts);
                return true;
            } catch (FrameReadException | RuntimeException e) {
                LOG.warn("Session {}: reconnect attempt {}/{} failed: {}", sessionId, attempt, attempts, e.getMessage());
            }
        }
        LOG.error("Session {}: giving up after {} reconnect attempt(s)", sessionId, attempts);
        transition(SessionStatus.ERROR, "reconnect failed after " + attempts + " attempt(s)");
        return false;
    }

    /**
     * Frames are flowing again on a session the health monitor flagged.
     */
    private void recover() {
        if (transition(SessionStatus.RECONNECTING, null) && transition(SessionStatus.ACTIVE, null)) {
            LOG.info("Session {}: frames flowing again, recovered", sessionId);
        }
    }

    private FrameSource openSource() throws FrameReadException {
        FrameSource s = sources.create(config.getSourceLocator());
        try {
            s.open();
            return s;
        } catch (FrameReadException | RuntimeException e) {
            try {
                s.close();
            } catch (RuntimeException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private boolean transition(SessionStatus target, String error) {
        if (handle.isStopRequested()) {
            return false;
        }
        return state.transition(target, error, clock.instant());
    }

    private void closeSource() {
        if (source == null) {
            return;
        }
        try {
            source.close();
        } catch (RuntimeException e) {
            LOG.warn("Session {}: error closing source: {}", sessionId, e.getMessage());
        }
        source = null;
    }

    private void cleanup() {
        closeSource();
        state.resetRollingStats();
        LOG.info("Session {}: disconnected after {} processed frame(s), {} corrupt", sessionId, frameId, corruptFrames);
        lastProcessedAt = null;
        consecutiveReadFailures = 0;
        onExit.run();
    }
}
