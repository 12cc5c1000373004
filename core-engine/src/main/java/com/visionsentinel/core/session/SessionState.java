package com.visionsentinel.core.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/**
 * Mutable runtime state of one registered session.
 *
 * <p>
 * Mutated by the session's worker and the stream manager's health monitor,
 * read by status queries. All access is synchronized on the instance;
 * status changes only follow the edges of {@link SessionStatus}.
 * </p>
 */
final class SessionState {

    private static final Logger LOG = LoggerFactory.getLogger(SessionState.class);

    private final String sessionId;
    private final Instant createdAt;
    private final RollingStats stats = new RollingStats(RollingStats.DEFAULT_WINDOW);

    private SessionStatus status = SessionStatus.INACTIVE;
    private Instant statusSince;
    private Instant lastActiveAt;
    private long frameCount;
    private long detectionCount;
    private long errorCount;
    private String lastError;

    SessionState(String sessionId, Instant createdAt) {
        this.sessionId = sessionId;
        this.createdAt = createdAt;
        this.statusSince = createdAt;
        this.lastActiveAt = createdAt;
    }

    /**
     * Move to {@code target} if the edge is allowed.
     *
     * @param error message recorded as last error when moving to
     *              {@link SessionStatus#ERROR}; may be {@code null}
     * @return {@code true} if the status changed
     */
    synchronized boolean transition(SessionStatus target, String error, Instant now) {
        if (status == target) {
            return false;
        }
        if (!status.canTransitionTo(target)) {
            LOG.debug("Session {}: ignoring transition {} -> {}", sessionId, status, target);
            return false;
        }
        LOG.info("Session {}: {} -> {}{}", sessionId, status, target, error != null ? " (" + error + ")" : "");
        status = target;
        statusSince = now;
        if (target == SessionStatus.ACTIVE || target == SessionStatus.CONNECTING) {
            lastActiveAt = now;
        }
        if (target == SessionStatus.ERROR && error != null) {
            errorCount++;
            lastError = error;
        }
        return true;
    }

    /**
     * Unconditionally mark the session stopped.
     */
    synchronized void markInactive(Instant now) {
        if (status != SessionStatus.INACTIVE) {
            LOG.info("Session {}: {} -> {}", sessionId, status, SessionStatus.INACTIVE);
            status = SessionStatus.INACTIVE;
            statusSince = now;
        }
    }

    synchronized void recordFrame(int detections, Duration processingTime, Instant now) {
        frameCount++;
        detectionCount += detections;
        lastActiveAt = now;
        stats.record(processingTime, now);
    }

    synchronized void recordError(String error) {
        errorCount++;
        lastError = error;
    }

    synchronized void touch(Instant now) {
        lastActiveAt = now;
    }

    synchronized void resetRollingStats() {
        stats.clear();
    }

    synchronized SessionStatus status() {
        return status;
    }

    synchronized Instant lastActiveAt() {
        return lastActiveAt;
    }

    synchronized Instant statusSince() {
        return statusSince;
    }

    synchronized SessionSnapshot snapshot(StreamConfig config) {
        return new SessionSnapshot(sessionId, config.getSourceLocator(), config.getModelId(), status,
                createdAt, lastActiveAt, statusSince, frameCount, detectionCount, errorCount, lastError,
                stats.averageProcessingMillis(), stats.framesPerSecond());
    }
}
