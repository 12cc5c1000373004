package com.visionsentinel.core.session;

import java.time.Instant;

/**
 * Immutable point-in-time view of a session, returned by status queries.
 *
 * @since 1.0.0
 */
public final class SessionSnapshot {

    private final String sessionId;
    private final String sourceLocator;
    private final String modelId;
    private final SessionStatus status;
    private final Instant createdAt;
    private final Instant lastActiveAt;
    private final Instant statusSince;
    private final long frameCount;
    private final long detectionCount;
    private final long errorCount;
    private final String lastError;
    private final double averageProcessingMillis;
    private final double framesPerSecond;

    SessionSnapshot(String sessionId, String sourceLocator, String modelId, SessionStatus status,
            Instant createdAt, Instant lastActiveAt, Instant statusSince, long frameCount,
            long detectionCount, long errorCount, String lastError, double averageProcessingMillis,
            double framesPerSecond) {
        this.sessionId = sessionId;
        this.sourceLocator = sourceLocator;
        this.modelId = modelId;
        this.status = status;
        this.createdAt = createdAt;
        this.lastActiveAt = lastActiveAt;
        this.statusSince = statusSince;
        this.frameCount = frameCount;
        this.detectionCount = detectionCount;
        this.errorCount = errorCount;
        this.lastError = lastError;
        this.averageProcessingMillis = averageProcessingMillis;
        this.framesPerSecond = framesPerSecond;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getSourceLocator() {
        return sourceLocator;
    }

    public String getModelId() {
        return modelId;
    }

    public SessionStatus getStatus() {
        return status;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastActiveAt() {
        return lastActiveAt;
    }

    public Instant getStatusSince() {
        return statusSince;
    }

    public long getFrameCount() {
        return frameCount;
    }

    public long getDetectionCount() {
        return detectionCount;
    }

    public long getErrorCount() {
        return errorCount;
    }

    public String getLastError() {
        return lastError;
    }

    public double getAverageProcessingMillis() {
        return averageProcessingMillis;
    }

    public double getFramesPerSecond() {
        return framesPerSecond;
    }

    @Override
    public String toString() {
        return "SessionSnapshot{" +
                "sessionId='" + sessionId + '\'' +
                ", status=" + status +
                ", frames=" + frameCount +
                ", detections=" + detectionCount +
                ", errors=" + errorCount +
                ", lastError='" + lastError + '\'' +
                '}';
    }
}
